package com.defimonitor.exception;

/** Outbound notification was rejected or could not be delivered. */
public class NotificationException extends RuntimeException {
    public NotificationException(String message) { super(message); }
    public NotificationException(String message, Throwable cause) { super(message, cause); }
}
