package uk.gegc.dolos.features.revision.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sentence of a document together with the revision metadata it is rendered with.
 *
 * @param position   0-based index in document order
 * @param text       sentence text, never empty
 * @param createdAt  instant the sentence was (nominally) typed
 * @param modifiedAt last edit instant, never before {@code createdAt}
 * @param author     revision author
 * @param revisionId revision id, unique within a document
 */
public record SentenceRecord(
        int position,
        String text,
        Instant createdAt,
        Instant modifiedAt,
        String author,
        int revisionId
) {
    public SentenceRecord {
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative");
        }
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(modifiedAt, "modifiedAt");
        if (modifiedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("modifiedAt must not precede createdAt");
        }
        if (revisionId <= 0) {
            throw new IllegalArgumentException("revisionId must be positive");
        }
        author = author == null ? "" : author;
    }

    public SentenceRecord withModifiedAt(Instant instant) {
        Instant created = instant.isBefore(createdAt) ? instant : createdAt;
        return new SentenceRecord(position, text, created, instant, author, revisionId);
    }
}
