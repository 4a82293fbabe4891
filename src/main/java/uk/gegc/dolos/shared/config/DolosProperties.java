package uk.gegc.dolos.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;

@Data
@Validated
@ConfigurationProperties(prefix = "dolos")
public class DolosProperties {

    @NotBlank(message = "Property dolos.default-author must be configured")
    private String defaultAuthor = "Dolos";

    @NotNull
    @Min(value = 0, message = "dolos.min-interval-seconds must not be negative")
    private Long minIntervalSeconds = 30L;

    @NotNull
    @Min(value = 0, message = "dolos.max-interval-seconds must not be negative")
    private Long maxIntervalSeconds = 300L;

    @NotBlank
    private String neutralAuthor = "Anonymous";

    @NotNull
    private Instant neutralTimestamp = Instant.parse("2000-01-01T00:00:00Z");

    /**
     * Written to app.xml {@code Application}; the sanitizer also falls back to it.
     */
    @NotBlank
    private String applicationName = "Microsoft Office Word";

    @NotBlank
    private String applicationVersion = "16.0000";

    @NotBlank(message = "Property dolos.storage-dir must be configured")
    private String storageDir = "data/documents";
}
