package uk.gegc.dolos.features.packaging.infra;

import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.XmlOptions;
import uk.gegc.dolos.features.packaging.domain.CorruptPackageException;

import javax.xml.namespace.QName;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * XmlBeans parsing, cursor editing and serialization for package parts.
 * DOCTYPE declarations are refused, so external entities never resolve.
 * Saved parts carry every namespace declaration on the root element, which keeps
 * repeated load/save passes byte-stable.
 */
public final class XmlParts {

    private static final XmlOptions LOAD_OPTIONS = loadOptions();
    private static final XmlOptions SAVE_OPTIONS = saveOptions();

    private XmlParts() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static XmlObject parse(byte[] bytes, String partName) {
        try {
            return XmlObject.Factory.parse(new ByteArrayInputStream(bytes), LOAD_OPTIONS);
        } catch (XmlException | IOException e) {
            throw new CorruptPackageException("Part " + partName + " is not well-formed XML: " + e.getMessage(), e);
        }
    }

    /**
     * New document holding only a root element; the root's prefix, if any, is declared on it.
     */
    public static XmlObject newDocument(QName rootName) {
        XmlObject document = XmlObject.Factory.newInstance(LOAD_OPTIONS);
        try (XmlCursor cursor = document.newCursor()) {
            cursor.toNextToken();
            cursor.beginElement(rootName);
            cursor.insertNamespace(rootName.getPrefix(), rootName.getNamespaceURI());
        }
        return document;
    }

    /**
     * Serializes as UTF-8 with an XML declaration and no added indentation.
     */
    public static byte[] serialize(XmlObject document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            document.save(out, SAVE_OPTIONS);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize XML part", e);
        }
        return out.toByteArray();
    }

    public static XmlObject root(XmlObject document) {
        try (XmlCursor cursor = document.newCursor()) {
            return cursor.toFirstChild() ? cursor.getObject() : null;
        }
    }

    public static QName name(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.getName();
        }
    }

    public static boolean is(XmlObject element, QName name) {
        return element != null && name.equals(name(element));
    }

    public static XmlObject parent(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.toParent() && cursor.isStart() ? cursor.getObject() : null;
        }
    }

    /**
     * Descendant elements with the given name in document order, collected into a stable list.
     */
    public static List<XmlObject> descendants(XmlObject scope, QName name) {
        return collect(scope, element -> name.equals(name(element)), true);
    }

    public static List<XmlObject> descendants(XmlObject scope) {
        return collect(scope, element -> true, true);
    }

    /**
     * Matching descendants that have no matching ancestor, so every entry can be detached
     * without touching an already detached subtree.
     */
    public static List<XmlObject> outermost(XmlObject scope, Predicate<XmlObject> match) {
        return collect(scope, match, false);
    }

    public static List<XmlObject> outermost(XmlObject scope, QName name) {
        return outermost(scope, element -> name.equals(name(element)));
    }

    public static List<XmlObject> children(XmlObject parent) {
        List<XmlObject> result = new ArrayList<>();
        try (XmlCursor cursor = parent.newCursor()) {
            if (cursor.toFirstChild()) {
                do {
                    result.add(cursor.getObject());
                } while (cursor.toNextSibling());
            }
        }
        return result;
    }

    public static List<XmlObject> children(XmlObject parent, QName name) {
        List<XmlObject> result = new ArrayList<>();
        for (XmlObject child : children(parent)) {
            if (is(child, name)) {
                result.add(child);
            }
        }
        return result;
    }

    public static XmlObject firstChild(XmlObject parent, QName name) {
        if (parent == null) {
            return null;
        }
        try (XmlCursor cursor = parent.newCursor()) {
            return cursor.toChild(name) ? cursor.getObject() : null;
        }
    }

    public static XmlObject nextSibling(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.toNextSibling() ? cursor.getObject() : null;
        }
    }

    public static String text(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.getTextValue();
        }
    }

    public static void setText(XmlObject element, String value) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.setTextValue(value);
        }
    }

    /**
     * Attribute value, or null when the attribute is absent.
     */
    public static String attribute(XmlObject element, QName name) {
        try (XmlCursor cursor = element.newCursor()) {
            return cursor.getAttributeText(name);
        }
    }

    public static void setAttribute(XmlObject element, QName name, String value) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.setAttributeText(name, value);
        }
    }

    public static List<QName> attributeNames(XmlObject element) {
        List<QName> names = new ArrayList<>();
        try (XmlCursor cursor = element.newCursor()) {
            if (cursor.toFirstAttribute()) {
                do {
                    names.add(cursor.getName());
                } while (cursor.toNextAttribute());
            }
        }
        return names;
    }

    public static void removeAttribute(XmlObject element, QName name) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.removeAttribute(name);
        }
    }

    /**
     * Declares {@code prefix} on the element unless it is already bound in scope.
     */
    public static void declareNamespace(XmlObject element, String prefix, String namespace) {
        try (XmlCursor cursor = element.newCursor()) {
            if (cursor.namespaceForPrefix(prefix) != null) {
                return;
            }
            cursor.toNextToken();
            cursor.insertNamespace(prefix, namespace);
        }
    }

    public static XmlObject appendChild(XmlObject parent, QName name) {
        try (XmlCursor cursor = parent.newCursor()) {
            cursor.toEndToken();
            return begin(cursor, name);
        }
    }

    /**
     * Inserts an empty element directly before {@code sibling}.
     */
    public static XmlObject insertBefore(XmlObject sibling, QName name) {
        try (XmlCursor cursor = sibling.newCursor()) {
            return begin(cursor, name);
        }
    }

    /**
     * Moves the element, with its content, to the end of {@code parent}.
     */
    public static void moveToEnd(XmlObject element, XmlObject parent) {
        try (XmlCursor source = element.newCursor(); XmlCursor target = parent.newCursor()) {
            target.toEndToken();
            source.moveXml(target);
        }
    }

    /**
     * Moves the element, with its content, directly before {@code sibling}.
     */
    public static void moveBefore(XmlObject element, XmlObject sibling) {
        try (XmlCursor source = element.newCursor(); XmlCursor target = sibling.newCursor()) {
            source.moveXml(target);
        }
    }

    /**
     * Replaces the element with its content, in place.
     */
    public static void unwrap(XmlObject element) {
        while (true) {
            try (XmlCursor target = element.newCursor(); XmlCursor content = element.newCursor()) {
                content.toFirstContentToken();
                if (content.isEnd()) {
                    break;
                }
                if (content.isText()) {
                    String chars = content.getChars();
                    target.insertChars(chars);
                    content.removeChars(chars.length());
                } else {
                    content.moveXml(target);
                }
            }
        }
        detach(element);
    }

    public static void detach(XmlObject element) {
        try (XmlCursor cursor = element.newCursor()) {
            cursor.removeXml();
        }
    }

    private static XmlObject begin(XmlCursor cursor, QName name) {
        cursor.beginElement(name);
        cursor.toParent();
        return cursor.getObject();
    }

    private static List<XmlObject> collect(XmlObject scope, Predicate<XmlObject> match, boolean intoMatches) {
        List<XmlObject> found = new ArrayList<>();
        try (XmlCursor cursor = scope.newCursor()) {
            walk(cursor, match, intoMatches, found);
        }
        return found;
    }

    private static void walk(XmlCursor cursor, Predicate<XmlObject> match, boolean intoMatches, List<XmlObject> found) {
        if (!cursor.toFirstChild()) {
            return;
        }
        do {
            XmlObject element = cursor.getObject();
            boolean matched = match.test(element);
            if (matched) {
                found.add(element);
            }
            if (!matched || intoMatches) {
                walk(cursor, match, intoMatches, found);
            }
        } while (cursor.toNextSibling());
        cursor.toParent();
    }

    private static XmlOptions loadOptions() {
        XmlOptions options = new XmlOptions();
        options.setDisallowDocTypeDeclaration(true);
        return options;
    }

    private static XmlOptions saveOptions() {
        Map<String, String> prefixes = new HashMap<>();
        prefixes.put(OoxmlNamespaces.W, "w");
        prefixes.put(OoxmlNamespaces.R, "r");
        prefixes.put(OoxmlNamespaces.CP, "cp");
        prefixes.put(OoxmlNamespaces.DC, "dc");
        prefixes.put(OoxmlNamespaces.DCTERMS, "dcterms");
        prefixes.put(OoxmlNamespaces.XSI, "xsi");
        XmlOptions options = new XmlOptions();
        options.setCharacterEncoding(StandardCharsets.UTF_8.name());
        options.setSaveAggressiveNamespaces();
        options.setSaveSuggestedPrefixes(prefixes);
        return options;
    }
}
