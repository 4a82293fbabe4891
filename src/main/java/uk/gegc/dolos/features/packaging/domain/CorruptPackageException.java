package uk.gegc.dolos.features.packaging.domain;

/**
 * A part that must be transformed could not be parsed as well-formed XML.
 */
public class CorruptPackageException extends PackageFormatException {

    public CorruptPackageException(String message) {
        super(message);
    }

    public CorruptPackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
