package uk.gegc.dolos.features.revision.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * A document and its sentences in document order. The package on disk is a projection of this value.
 */
public record DocumentRecord(
        UUID id,
        String filename,
        Instant createdAt,
        Instant lastModified,
        String author,
        String lastModifiedBy,
        List<SentenceRecord> sentences
) {
    public DocumentRecord {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        for (int i = 0; i < sentences.size(); i++) {
            if (sentences.get(i).position() != i) {
                throw new IllegalArgumentException(
                        "Sentence positions must be contiguous from 0, found " + sentences.get(i).position() + " at index " + i);
            }
        }
    }

    /**
     * Latest {@code modifiedAt} across the sentences, or {@code createdAt} for an empty document.
     */
    public static Instant latestModification(List<SentenceRecord> sentences, Instant fallback) {
        return sentences.stream()
                .map(SentenceRecord::modifiedAt)
                .max(Comparator.naturalOrder())
                .orElse(fallback);
    }
}
