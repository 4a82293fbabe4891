package uk.gegc.dolos.features.metadata.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "DocumentMetadataDto", description = "Stored metadata of a generated document")
public record DocumentMetadataDto(
        @Schema(description = "Document id")
        UUID id,

        @Schema(description = "Package filename", example = "essay.docx")
        String filename,

        @Schema(description = "Creation instant (UTC)")
        Instant createdAt,

        @Schema(description = "Latest sentence modification (UTC)")
        Instant lastModified,

        @Schema(description = "Document author", example = "Dolos")
        String author,

        @Schema(description = "Last modifying author", example = "Dolos")
        String lastModifiedBy,

        @Schema(description = "Number of sentences", example = "3")
        int sentenceCount,

        @Schema(description = "Per-sentence metadata in document order")
        List<SentenceMetadataDto> sentences
) {
}
