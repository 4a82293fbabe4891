package uk.gegc.dolos.features.revision.domain.model;

import uk.gegc.dolos.features.revision.domain.UnsupportedModeException;

import java.util.Locale;

/**
 * How sentences are rendered into the body part.
 */
public enum RenderMode {
    /**
     * Insertions carry per-sentence metadata but the default view hides revision markup.
     */
    FINAL,

    /**
     * Insertions are shown as live tracked changes and tracking is switched on.
     */
    SUGGESTIONS,

    /**
     * Plain runs, no per-sentence metadata.
     */
    CLEAN;

    public boolean wrapsInsertions() {
        return this != CLEAN;
    }

    public static RenderMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedModeException("Rendering mode is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (RenderMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new UnsupportedModeException("Unsupported rendering mode: " + value
                + " (expected final, suggestions or clean)");
    }
}
