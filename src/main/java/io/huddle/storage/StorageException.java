package io.huddle.storage;

/**
 * Database file, directory or round-trip failure. Usually carries the underlying
 * {@link java.sql.SQLException} or {@link java.io.IOException} as its cause.
 */
public final class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
