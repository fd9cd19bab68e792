package com.defimonitor.exception;

/** Snapshot or alert store is unreachable, or a query against it failed. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
