package uk.gegc.dolos.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "EditTimestampRequest", description = "New modification instant for one sentence")
public record EditTimestampRequest(
        @Schema(description = "ISO-8601 instant or yyyy-MM-dd HH:mm:ss (UTC)", example = "2025-06-15T14:30:00Z")
        @NotBlank(message = "Timestamp must not be blank")
        String timestamp
) {
}
