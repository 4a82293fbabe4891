package uk.gegc.dolos.shared.exception;

/**
 * Exception thrown when reading or writing a package file fails
 */
public class DocumentStorageException extends RuntimeException {

    public DocumentStorageException(String message) {
        super(message);
    }

    public DocumentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
