package uk.gegc.dolos.features.packaging.domain;

/**
 * The container lacks the body part or the core-properties part.
 */
public class MissingRequiredPartException extends PackageFormatException {

    public MissingRequiredPartException(String message) {
        super(message);
    }

    public MissingRequiredPartException(String message, Throwable cause) {
        super(message, cause);
    }
}
