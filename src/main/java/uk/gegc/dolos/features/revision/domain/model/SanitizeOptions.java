package uk.gegc.dolos.features.revision.domain.model;

/**
 * Caller choices for {@code DocumentSanitizer#sanitize}.
 *
 * @param neutralAuthor identity written to creator and last-modified-by
 * @param keepContent   false empties the body to a single blank paragraph
 * @param stripRsids    drop revision-session ids from settings and body
 */
public record SanitizeOptions(String neutralAuthor, boolean keepContent, boolean stripRsids) {

    public static final String DEFAULT_NEUTRAL_AUTHOR = "Anonymous";

    public SanitizeOptions {
        if (neutralAuthor == null || neutralAuthor.isBlank()) {
            neutralAuthor = DEFAULT_NEUTRAL_AUTHOR;
        }
    }

    public static SanitizeOptions defaults() {
        return new SanitizeOptions(DEFAULT_NEUTRAL_AUTHOR, true, true);
    }
}
