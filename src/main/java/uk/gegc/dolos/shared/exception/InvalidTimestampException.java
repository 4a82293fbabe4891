package uk.gegc.dolos.shared.exception;

/**
 * Thrown when a timestamp string matches none of the accepted formats.
 */
public class InvalidTimestampException extends InputValidationException {

    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
