package uk.gegc.dolos.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String message) {
        super(message);
    }

    public static DocumentNotFoundException forFilename(String filename) {
        return new DocumentNotFoundException("No metadata found for document: " + filename);
    }
}
