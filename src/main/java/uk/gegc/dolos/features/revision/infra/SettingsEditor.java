package uk.gegc.dolos.features.revision.infra;

import org.apache.xmlbeans.XmlObject;
import uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces;
import uk.gegc.dolos.features.packaging.infra.XmlParts;

import javax.xml.namespace.QName;
import java.util.List;

/**
 * Edits revision-related children of {@code w:settings}, keeping the element order the schema requires.
 */
public final class SettingsEditor {

    public static final String TRACK_REVISIONS = "trackRevisions";
    public static final String REVISION_VIEW = "revisionView";
    public static final String RSIDS = "rsids";

    // CT_Settings sequence, up to the elements this class inserts
    private static final List<String> SETTINGS_ORDER = List.of(
            "writeProtection", "view", "zoom", "removePersonalInformation", "removeDateAndTime",
            "doNotDisplayPageBoundaries", "displayBackgroundShape", "printPostScriptOverText",
            "printFractionalCharacterWidth", "printFormsData", "embedTrueTypeFonts", "embedSystemFonts",
            "saveSubsetFonts", "saveFormsData", "mirrorMargins", "alignBordersAndEdges",
            "bordersDoNotSurroundHeader", "bordersDoNotSurroundFooter", "gutterAtTop",
            "hideSpellingErrors", "hideGrammaticalErrors", "activeWritingStyle", "proofState",
            "formsDesign", "attachedTemplate", "linkStyles", "stylePaneFormatFilter",
            "stylePaneSortMethod", "documentType", "mailMerge", REVISION_VIEW, TRACK_REVISIONS
    );

    private SettingsEditor() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static XmlObject newSettings() {
        return XmlParts.newDocument(OoxmlNamespaces.w("settings"));
    }

    public static boolean has(XmlObject settings, String localName) {
        return XmlParts.firstChild(XmlParts.root(settings), OoxmlNamespaces.w(localName)) != null;
    }

    public static void enableTracking(XmlObject settings) {
        ensure(settings, TRACK_REVISIONS);
    }

    /**
     * Hides insertion/deletion and formatting marks in the default view.
     */
    public static void hideRevisionMarkup(XmlObject settings) {
        XmlObject view = ensure(settings, REVISION_VIEW);
        XmlParts.setAttribute(view, OoxmlNamespaces.w("markup"), "0");
        XmlParts.setAttribute(view, OoxmlNamespaces.w("insDel"), "0");
        XmlParts.setAttribute(view, OoxmlNamespaces.w("formatting"), "0");
    }

    /**
     * Removes every child with the given local name. Returns whether anything was removed.
     */
    public static boolean remove(XmlObject settings, String localName) {
        List<XmlObject> found = XmlParts.children(XmlParts.root(settings), OoxmlNamespaces.w(localName));
        found.forEach(XmlParts::detach);
        return !found.isEmpty();
    }

    private static XmlObject ensure(XmlObject settings, String localName) {
        XmlObject root = XmlParts.root(settings);
        QName name = OoxmlNamespaces.w(localName);
        XmlObject existing = XmlParts.firstChild(root, name);
        if (existing != null) {
            return existing;
        }

        List<String> predecessors = SETTINGS_ORDER.subList(0, SETTINGS_ORDER.indexOf(localName));
        for (XmlObject child : XmlParts.children(root)) {
            QName childName = XmlParts.name(child);
            boolean precedes = OoxmlNamespaces.W.equals(childName.getNamespaceURI())
                    && predecessors.contains(childName.getLocalPart());
            if (!precedes) {
                return XmlParts.insertBefore(child, name);
            }
        }
        return XmlParts.appendChild(root, name);
    }
}
