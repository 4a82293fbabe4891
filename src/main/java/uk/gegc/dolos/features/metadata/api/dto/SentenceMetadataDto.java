package uk.gegc.dolos.features.metadata.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "SentenceMetadataDto", description = "Revision metadata of one sentence")
public record SentenceMetadataDto(
        @Schema(description = "0-based position in the document", example = "0")
        int position,

        @Schema(description = "Sentence text", example = "Alpha.")
        String text,

        @Schema(description = "Creation instant (UTC)", example = "2024-01-01T10:00:00Z")
        Instant created,

        @Schema(description = "Last modification instant (UTC)", example = "2024-01-01T10:00:00Z")
        Instant modified,

        @Schema(description = "Revision author", example = "Dolos")
        String author,

        @Schema(description = "Revision id written to w:ins", example = "1")
        int revisionId
) {
}
