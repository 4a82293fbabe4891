package uk.gegc.dolos.features.packaging.domain;

/**
 * Base type for packages that cannot be read: not a zip, a required part is missing, or a part is not well-formed XML.
 */
public class PackageFormatException extends RuntimeException {

    public PackageFormatException(String message) {
        super(message);
    }

    public PackageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
