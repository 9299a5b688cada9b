package org.rentalrepairs.engine.api;

/**
 * Thrown when a serialized booking snapshot cannot be read or written.
 */
public class SnapshotFormatException extends RuntimeException {

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
