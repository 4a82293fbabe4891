package uk.gegc.dolos.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.dolos.features.packaging.domain.CorruptPackageException;
import uk.gegc.dolos.features.packaging.domain.MissingRequiredPartException;
import uk.gegc.dolos.features.packaging.domain.NotAPackageException;
import uk.gegc.dolos.features.revision.domain.EmptyDocumentException;
import uk.gegc.dolos.features.revision.domain.UnsupportedModeException;
import uk.gegc.dolos.features.timeline.domain.InvalidIntervalException;
import uk.gegc.dolos.shared.api.problem.ErrorTypes;
import uk.gegc.dolos.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.exception.DocumentStorageException;
import uk.gegc.dolos.shared.exception.EmptyInputException;
import uk.gegc.dolos.shared.exception.InputValidationException;
import uk.gegc.dolos.shared.exception.InvalidTimestampException;

import java.net.URI;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleDocumentNotFound(DocumentNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.DOCUMENT_NOT_FOUND,
                "Document Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(InvalidIntervalException.class)
    public ResponseEntity<ProblemDetail> handleInvalidInterval(InvalidIntervalException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.INVALID_INTERVAL, "Invalid Interval", ex, request);
    }

    @ExceptionHandler({EmptyInputException.class, EmptyDocumentException.class})
    public ResponseEntity<ProblemDetail> handleEmptyInput(InputValidationException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.EMPTY_INPUT, "Empty Input", ex, request);
    }

    @ExceptionHandler(InvalidTimestampException.class)
    public ResponseEntity<ProblemDetail> handleInvalidTimestamp(InvalidTimestampException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.INVALID_TIMESTAMP, "Invalid Timestamp", ex, request);
    }

    @ExceptionHandler(UnsupportedModeException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedMode(UnsupportedModeException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.UNSUPPORTED_MODE, "Unsupported Mode", ex, request);
    }

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ProblemDetail> handleInputValidation(InputValidationException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.VALIDATION_FAILED, "Validation Failed", ex, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return badRequest(ErrorTypes.INVALID_ARGUMENT, "Invalid Argument", ex, request);
    }

    @ExceptionHandler(NotAPackageException.class)
    public ResponseEntity<ProblemDetail> handleNotAPackage(NotAPackageException ex, HttpServletRequest request) {
        return unprocessable(ErrorTypes.NOT_A_PACKAGE, "Not A Package", ex, request);
    }

    @ExceptionHandler(MissingRequiredPartException.class)
    public ResponseEntity<ProblemDetail> handleMissingPart(MissingRequiredPartException ex, HttpServletRequest request) {
        return unprocessable(ErrorTypes.MISSING_REQUIRED_PART, "Missing Required Part", ex, request);
    }

    @ExceptionHandler(CorruptPackageException.class)
    public ResponseEntity<ProblemDetail> handleCorruptPackage(CorruptPackageException ex, HttpServletRequest request) {
        return unprocessable(ErrorTypes.CORRUPT_PACKAGE, "Corrupt Package", ex, request);
    }

    @ExceptionHandler(DocumentStorageException.class)
    public ResponseEntity<ProblemDetail> handleStorage(DocumentStorageException ex, HttpServletRequest request) {
        logger.error("Document storage failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.STORAGE_ERROR,
                "Storage Error",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.CONSTRAINT_VIOLATION,
                "Constraint Violation",
                "One or more validation constraints were violated",
                request
        );
        List<ViolationDetail> violations = ex.getConstraintViolations().stream()
                .map(this::toViolationDetail)
                .toList();
        problem.setProperty("violations", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    private ViolationDetail toViolationDetail(ConstraintViolation<?> violation) {
        return new ViolationDetail(
                violation.getPropertyPath().toString(),
                violation.getMessage(),
                violation.getInvalidValue()
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        problem.setProperty("providedValue", ex.getValue());
        return ResponseEntity.badRequest().body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        String msg = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                "Malformed JSON",
                "Request body is malformed or cannot be read",
                request
        );
        problem.setProperty("parseError", msg);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        List<FieldValidationError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new FieldValidationError(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ResponseEntity<ProblemDetail> badRequest(URI type, String title, RuntimeException ex,
                                                     HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, type, title, ex.getMessage(), request);
        return ResponseEntity.badRequest().body(problem);
    }

    private ResponseEntity<ProblemDetail> unprocessable(URI type, String title, RuntimeException ex,
                                                        HttpServletRequest request) {
        logger.warn("Rejected package: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.UNPROCESSABLE_ENTITY, type, title, ex.getMessage(), request);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    private record ViolationDetail(String field, String message, Object invalidValue) {
    }

    private record FieldValidationError(String field, String message, Object rejectedValue) {
    }
}
