package uk.gegc.dolos.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the REST surface.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://dolos.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI DOCUMENT_NOT_FOUND = URI.create(BASE_URL + "/document-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_INTERVAL = URI.create(BASE_URL + "/invalid-interval");
    public static final URI EMPTY_INPUT = URI.create(BASE_URL + "/empty-input");
    public static final URI INVALID_TIMESTAMP = URI.create(BASE_URL + "/invalid-timestamp");
    public static final URI UNSUPPORTED_MODE = URI.create(BASE_URL + "/unsupported-mode");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");

    // ==================== Package Errors ====================
    public static final URI NOT_A_PACKAGE = URI.create(BASE_URL + "/not-a-package");
    public static final URI MISSING_REQUIRED_PART = URI.create(BASE_URL + "/missing-required-part");
    public static final URI CORRUPT_PACKAGE = URI.create(BASE_URL + "/corrupt-package");

    // ==================== System Errors ====================
    public static final URI STORAGE_ERROR = URI.create(BASE_URL + "/storage-error");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
