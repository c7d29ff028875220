package com.character.roster.source;

/**
 * Runtime exception thrown when a {@link RecordSource} cannot be consulted at all,
 * for example because its directory does not exist.
 */
public class RecordSourceException extends RuntimeException {

    public RecordSourceException(String message) {
        super(message);
    }

    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
