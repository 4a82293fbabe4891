package uk.gegc.dolos.features.revision.domain.model;

/**
 * Document-level properties written to the core and app property parts. Only the package carries them.
 */
public record DocumentProperties(
        String title,
        String subject,
        String keywords,
        String comments,
        Integer totalEditTimeMinutes,
        RenderMode mode
) {
    public DocumentProperties {
        if (totalEditTimeMinutes != null && totalEditTimeMinutes < 0) {
            throw new IllegalArgumentException("totalEditTimeMinutes must not be negative");
        }
        if (mode == null) {
            mode = RenderMode.SUGGESTIONS;
        }
    }

    public static DocumentProperties of(RenderMode mode) {
        return new DocumentProperties(null, null, null, null, null, mode);
    }
}
