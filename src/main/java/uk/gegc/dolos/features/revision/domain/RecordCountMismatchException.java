package uk.gegc.dolos.features.revision.domain;

import uk.gegc.dolos.shared.exception.InputValidationException;

/**
 * Thrown when the sentence records do not line up one-to-one with the baseline's body paragraphs.
 */
public class RecordCountMismatchException extends InputValidationException {

    public RecordCountMismatchException(String message) {
        super(message);
    }

    public RecordCountMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
