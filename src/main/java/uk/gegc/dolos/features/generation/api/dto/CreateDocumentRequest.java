package uk.gegc.dolos.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import uk.gegc.dolos.features.segmentation.application.SegmentationMethod;

import java.util.List;

@Schema(name = "CreateDocumentRequest", description = "Text or sentences to turn into a package with a synthetic revision history")
public record CreateDocumentRequest(
        @Schema(description = "Name of the generated package", example = "essay.docx")
        @NotBlank(message = "Filename must not be blank")
        @Size(max = 255, message = "Filename must not exceed 255 characters")
        @Pattern(regexp = "[^/\\\\]+", message = "Filename must not contain path separators")
        String filename,

        @Schema(description = "Raw text, segmented into sentences server-side. Ignored when sentences are given",
                example = "The first sentence. The second one follows.")
        String text,

        @Schema(description = "Explicit sentence list, one entry per paragraph")
        List<String> sentences,

        @Schema(description = "Segmentation strategy for raw text", example = "REGEX")
        SegmentationMethod segmentation,

        @Schema(description = "Author attributed to every revision", example = "Jane Doe")
        @Size(max = 255, message = "Author must not exceed 255 characters")
        String author,

        @Schema(description = "Timestamp of the first sentence (ISO-8601 or yyyy-MM-dd HH:mm:ss, UTC)",
                example = "2025-01-01T09:00:00Z")
        String startDate,

        @Schema(description = "Lower bound of the gap between consecutive sentences", example = "30")
        @PositiveOrZero(message = "Minimum interval must not be negative")
        Long minIntervalSeconds,

        @Schema(description = "Upper bound of the gap between consecutive sentences", example = "300")
        @PositiveOrZero(message = "Maximum interval must not be negative")
        Long maxIntervalSeconds,

        @Schema(description = "Rendering mode: final, suggestions or clean", example = "suggestions")
        String mode,

        @Schema(description = "Core property title")
        String title,

        @Schema(description = "Core property subject")
        String subject,

        @Schema(description = "Core property keywords")
        String keywords,

        @Schema(description = "Core property description")
        String comments,

        @Schema(description = "Total editing time in minutes", example = "42")
        @PositiveOrZero(message = "Total edit time must not be negative")
        Integer totalEditTimeMinutes
) {
}
