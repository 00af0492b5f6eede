package com.talewright.core.persistence;

/**
 * Thrown when the artifact store cannot be reached or rejects an operation.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
