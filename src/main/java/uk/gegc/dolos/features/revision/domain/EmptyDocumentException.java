package uk.gegc.dolos.features.revision.domain;

import uk.gegc.dolos.shared.exception.InputValidationException;

/**
 * Thrown when a document would be built from zero sentences.
 */
public class EmptyDocumentException extends InputValidationException {

    public EmptyDocumentException(String message) {
        super(message);
    }

    public EmptyDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
