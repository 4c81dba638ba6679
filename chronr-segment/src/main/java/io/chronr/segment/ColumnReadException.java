package io.chronr.segment;

/**
 * Thrown when stored column data can not be read, e.g. it is malformed or of a wrong type.
 */
public class ColumnReadException extends RuntimeException {
    public ColumnReadException(String message) {
        super(message);
    }

    public ColumnReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
