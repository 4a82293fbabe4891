package uk.gegc.dolos.shared.exception;

/**
 * Input rejected before any file I/O takes place. Nothing is written when this is thrown.
 */
public class InputValidationException extends RuntimeException {

    public InputValidationException(String message) {
        super(message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
