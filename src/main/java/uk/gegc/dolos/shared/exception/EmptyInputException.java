package uk.gegc.dolos.shared.exception;

/**
 * Thrown when there is no sentence text to work with.
 */
public class EmptyInputException extends InputValidationException {

    public EmptyInputException(String message) {
        super(message);
    }

    public EmptyInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
