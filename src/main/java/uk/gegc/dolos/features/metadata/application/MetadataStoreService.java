package uk.gegc.dolos.features.metadata.application;

import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.revision.domain.model.DocumentRecord;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Source of truth for documents and their sentence timelines. Packages are always rebuilt from what
 * this store returns.
 */
public interface MetadataStoreService {

    /**
     * Creates the document and all of its sentences in one transaction. An existing record set with
     * the same filename is replaced.
     *
     * @param start {@code null} for the current time
     */
    DocumentRecord createDocument(String filename, List<String> sentences, Instant start,
                                  long minIntervalSeconds, long maxIntervalSeconds, String author);

    DocumentRecord getDocument(String filename);

    DocumentRecord getDocument(UUID id);

    boolean exists(String filename);

    /**
     * Moves one sentence's modification instant and recomputes the document's last-modified value.
     * Position, text and revision id stay as they are.
     */
    SentenceRecord updateSentenceTimestamp(String filename, int position, Instant timestamp);

    DocumentMetadataDto getDocumentMetadata(String filename);

    /**
     * Deletes the document and, by cascade, its sentences.
     *
     * @return false when no document has that filename
     */
    boolean deleteDocument(String filename);
}
