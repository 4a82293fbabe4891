package uk.gegc.dolos.features.timeline.domain;

import uk.gegc.dolos.shared.exception.InputValidationException;

/**
 * Thrown when interval bounds are negative or {@code min > max}.
 */
public class InvalidIntervalException extends InputValidationException {

    public InvalidIntervalException(String message) {
        super(message);
    }

    public InvalidIntervalException(String message, Throwable cause) {
        super(message, cause);
    }
}
