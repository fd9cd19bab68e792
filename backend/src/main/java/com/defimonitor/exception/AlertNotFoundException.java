package com.defimonitor.exception;

public class AlertNotFoundException extends RuntimeException {
    public AlertNotFoundException(String alertId) { super("Alert not found: " + alertId); }
}
