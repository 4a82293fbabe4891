package uk.gegc.dolos.features.packaging.domain;

/**
 * The input bytes are not a readable zip container.
 */
public class NotAPackageException extends PackageFormatException {

    public NotAPackageException(String message) {
        super(message);
    }

    public NotAPackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
