package uk.gegc.dolos.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SanitizeResultDto", description = "Where a sanitized package was written")
public record SanitizeResultDto(
        @Schema(description = "Stored package that was sanitized", example = "essay.docx")
        String sourceFilename,

        @Schema(description = "Stored package holding the sanitized output", example = "essay-clean.docx")
        String outputFilename,

        @Schema(description = "Size of the sanitized package in bytes", example = "4821")
        long size
) {
}
