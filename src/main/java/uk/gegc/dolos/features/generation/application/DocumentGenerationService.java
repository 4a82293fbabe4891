package uk.gegc.dolos.features.generation.application;

import uk.gegc.dolos.features.generation.api.dto.CreateDocumentRequest;
import uk.gegc.dolos.features.generation.api.dto.SanitizeResultDto;
import uk.gegc.dolos.features.generation.api.dto.SanitizeStoredRequest;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.api.dto.SentenceMetadataDto;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;

import java.time.Instant;

/**
 * End-to-end flows over the metadata store and the package pipeline.
 */
public interface DocumentGenerationService {

    /**
     * Segments (or takes) the sentences, stores their timeline, then builds, injects and writes the package.
     */
    DocumentMetadataDto createDocument(CreateDocumentRequest request);

    /**
     * Moves one sentence's timestamp and rebuilds the stored package in place, keeping its rendering
     * mode and document properties.
     */
    SentenceMetadataDto editTimestamp(String filename, int position, Instant timestamp);

    /**
     * Sanitizes package bytes without touching storage.
     *
     * @param neutralTimestamp {@code null} for the configured neutral instant
     */
    byte[] sanitize(byte[] packageBytes, Instant neutralTimestamp, SanitizeOptions options);

    SanitizeResultDto sanitizeStored(String filename, SanitizeStoredRequest request);

    byte[] getPackage(String filename);

    DocumentMetadataDto getMetadata(String filename);

    /**
     * Removes the record set and the stored package.
     */
    void deleteDocument(String filename);

    SanitizeOptions sanitizeOptions(String author, Boolean keepContent, Boolean stripRsids);
}
