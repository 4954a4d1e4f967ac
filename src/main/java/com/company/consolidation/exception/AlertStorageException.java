package com.company.consolidation.exception;

/**
 * Failure of the alert store during fetch, create or status update.
 * Aborts the running consolidation batch.
 */
public class AlertStorageException extends RuntimeException {
    public AlertStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
