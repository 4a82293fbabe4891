package uk.gegc.dolos.features.revision.domain;

import uk.gegc.dolos.shared.exception.InputValidationException;

/**
 * Thrown for a rendering mode outside final, suggestions and clean.
 */
public class UnsupportedModeException extends InputValidationException {

    public UnsupportedModeException(String message) {
        super(message);
    }

    public UnsupportedModeException(String message, Throwable cause) {
        super(message, cause);
    }
}
