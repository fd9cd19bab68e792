package com.defimonitor.exception;

/** Requested protocol is not part of the configured set. Not retried. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) { super(message); }
}
