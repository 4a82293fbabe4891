package uk.gegc.dolos.features.segmentation.application;

/**
 * Sentence splitting strategies offered by {@link SentenceParser}.
 */
public enum SegmentationMethod {
    /**
     * Split after terminal punctuation followed by whitespace and a capital letter,
     * leaving common abbreviations ("Dr.", "e.g.") intact. Punctuation is kept.
     */
    REGEX,

    /**
     * Split on every run of {@code . ! ?}. Punctuation is dropped.
     */
    SIMPLE
}
