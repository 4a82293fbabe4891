package uk.gegc.dolos.features.packaging.domain;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Conventional part names, used when the package relationships do not say otherwise.
 */
public final class PartNames {

    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String ROOT_RELATIONSHIPS = "_rels/.rels";
    public static final String MAIN_DOCUMENT = "word/document.xml";
    public static final String SETTINGS = "word/settings.xml";
    public static final String CORE_PROPERTIES = "docProps/core.xml";
    public static final String EXTENDED_PROPERTIES = "docProps/app.xml";

    private PartNames() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Relationships part of a source part, e.g. {@code word/document.xml -> word/_rels/document.xml.rels}.
     */
    public static String relationshipsOf(String partName) {
        int slash = partName.lastIndexOf('/');
        String dir = slash < 0 ? "" : partName.substring(0, slash + 1);
        String file = partName.substring(slash + 1);
        return dir + "_rels/" + file + ".rels";
    }

    /**
     * Resolves a relationship target against the folder of its source part.
     */
    public static String resolveTarget(String sourcePart, String target) {
        if (target.startsWith("/")) {
            return target.substring(1);
        }
        int slash = sourcePart.lastIndexOf('/');
        String base = slash < 0 ? "" : sourcePart.substring(0, slash + 1);
        String[] segments = (base + target).split("/");
        Deque<String> stack = new ArrayDeque<>();
        for (String segment : segments) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                stack.pollLast();
            } else {
                stack.addLast(segment);
            }
        }
        return String.join("/", stack);
    }
}
