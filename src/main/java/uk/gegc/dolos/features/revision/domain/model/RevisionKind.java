package uk.gegc.dolos.features.revision.domain.model;

/**
 * Tracked-change constructs in a WordprocessingML body, with what the sanitizer does to each.
 */
public enum RevisionKind {
    INSERTION("ins", true),
    DELETION("del", false),
    MOVE_FROM("moveFrom", false),
    MOVE_TO("moveTo", true);

    private final String localName;
    private final boolean keepsContent;

    RevisionKind(String localName, boolean keepsContent) {
        this.localName = localName;
        this.keepsContent = keepsContent;
    }

    public String localName() {
        return localName;
    }

    /**
     * Whether sanitizing unwraps the construct (true) or removes it with its content (false).
     */
    public boolean keepsContent() {
        return keepsContent;
    }
}
