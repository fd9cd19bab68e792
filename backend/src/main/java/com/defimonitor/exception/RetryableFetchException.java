package com.defimonitor.exception;

/** Marker exception indicating an upstream metrics call can be attempted again. */
public class RetryableFetchException extends RuntimeException {
    public RetryableFetchException(String message) { super(message); }
    public RetryableFetchException(String message, Throwable cause) { super(message, cause); }
}
