package uk.gegc.dolos.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "SanitizeStoredRequest", description = "Options for sanitizing a stored package")
public record SanitizeStoredRequest(
        @Schema(description = "Target filename; the source is overwritten when omitted", example = "essay-clean.docx")
        @Size(max = 255, message = "Filename must not exceed 255 characters")
        @Pattern(regexp = "[^/\\\\]+", message = "Filename must not contain path separators")
        String outputFilename,

        @Schema(description = "Neutral timestamp written to created/modified", example = "2000-01-01T00:00:00Z")
        String neutralTimestamp,

        @Schema(description = "Neutral identity written to creator/lastModifiedBy", example = "Anonymous")
        @Size(max = 255, message = "Author must not exceed 255 characters")
        String author,

        @Schema(description = "Keep the accepted body text", example = "true")
        Boolean keepContent,

        @Schema(description = "Remove revision-session ids", example = "true")
        Boolean stripRsids
) {
}
