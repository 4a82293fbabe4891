package uk.gegc.dolos.shared.util;

/**
 * Text hygiene for values written into WordprocessingML parts.
 * Markup escaping is left to the XML serializer; this only removes what XML 1.0 cannot carry at all.
 */
public final class XmlText {

    public static final int MAX_AUTHOR_LENGTH = 255;

    private XmlText() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Drops code points that are not legal XML 1.0 characters. {@code null} becomes the empty string.
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            int width = Character.charCount(cp);
            if (!isXmlChar(cp)) {
                if (sb == null) {
                    sb = new StringBuilder(value.length());
                    sb.append(value, 0, i);
                }
            } else if (sb != null) {
                sb.appendCodePoint(cp);
            }
            i += width;
        }
        return sb == null ? value : sb.toString();
    }

    /**
     * Cleans an author string and truncates it to {@link #MAX_AUTHOR_LENGTH} characters
     * without splitting a surrogate pair.
     */
    public static String author(String value) {
        String cleaned = clean(value).strip();
        if (cleaned.length() <= MAX_AUTHOR_LENGTH) {
            return cleaned;
        }
        int end = MAX_AUTHOR_LENGTH;
        if (Character.isHighSurrogate(cleaned.charAt(end - 1))) {
            end--;
        }
        return cleaned.substring(0, end);
    }

    static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}
