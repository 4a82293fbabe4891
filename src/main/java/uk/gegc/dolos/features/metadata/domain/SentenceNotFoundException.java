package uk.gegc.dolos.features.metadata.domain;

import uk.gegc.dolos.shared.exception.InputValidationException;

/**
 * Thrown when a document has no sentence at the requested position.
 */
public class SentenceNotFoundException extends InputValidationException {

    public SentenceNotFoundException(String message) {
        super(message);
    }

    public SentenceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
