package com.webanalytics.funnel.store;

/**
 * A store operation failed at the database level.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
