package uk.gegc.dolos.features.revision.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.packaging.domain.CorruptPackageException;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.infra.PackageRelationships;
import uk.gegc.dolos.features.packaging.infra.XmlParts;
import uk.gegc.dolos.features.revision.domain.model.RevisionKind;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;
import uk.gegc.dolos.features.revision.infra.RevisionDates;
import uk.gegc.dolos.features.revision.infra.SettingsEditor;
import uk.gegc.dolos.shared.config.DolosProperties;
import uk.gegc.dolos.shared.util.XmlText;

import javax.xml.namespace.QName;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.CP;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.DC;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.DCTERMS;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.EXTENDED_PROPERTIES;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.W;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.w;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.XSI;

/**
 * Strips revision history and identifying metadata from a package.
 *
 * <p>Insertions and move destinations are unwrapped, deletions and move sources are removed with
 * their content, property-change records and move range markers are dropped, tracking settings are
 * removed, and core/app properties are reset to neutral values. Deleted table rows and cells go with
 * their content; a paragraph whose mark was deleted is joined to the paragraph after it.
 * Applying it to its own output changes nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentSanitizer {

    // Story parts that can carry tracked changes besides the main body
    private static final Pattern STORY_PART = Pattern.compile(
            "word/(header\\d*|footer\\d*|footnotes|endnotes|comments)\\.xml");

    private static final List<String> PROPERTY_CHANGES = List.of(
            "rPrChange", "pPrChange", "sectPrChange", "tblPrChange", "tblPrExChange", "tblGridChange",
            "trPrChange", "tcPrChange", "numberingChange");

    private static final List<String> MOVE_RANGE_MARKERS = List.of(
            "moveFromRangeStart", "moveFromRangeEnd", "moveToRangeStart", "moveToRangeEnd");

    // accepted cell insertions and merges leave the cell as it is
    private static final List<String> CELL_MARKERS = List.of("cellIns", "cellMerge");

    private static final List<String> CLEARED_CORE_FIELDS = List.of("title", "subject", "description");

    private static final QName P = w("p");
    private static final QName P_PR = w("pPr");
    private static final QName R_PR = w("rPr");
    private static final QName TBL = w("tbl");
    private static final QName TR = w("tr");
    private static final QName TR_PR = w("trPr");
    private static final QName TC = w("tc");
    private static final QName TC_PR = w("tcPr");

    private static final QName W3CDTF_TYPE = new QName(XSI, "type", "xsi");

    private final DolosProperties dolosProperties;

    /**
     * @throws CorruptPackageException when the body or settings part is not well-formed
     */
    public DocxPackage sanitize(DocxPackage pkg, Instant neutralInstant, SanitizeOptions options) {
        SanitizeOptions opts = options != null ? options : SanitizeOptions.defaults();
        Instant neutral = neutralInstant != null ? neutralInstant : dolosProperties.getNeutralTimestamp();

        Map<String, byte[]> replacements = new LinkedHashMap<>();

        String bodyPart = PackageRelationships.mainDocument(pkg);
        XmlObject body = XmlParts.parse(pkg.requirePart(bodyPart), bodyPart);
        stripRevisions(body, opts.stripRsids());
        if (!opts.keepContent()) {
            clearBody(body, bodyPart);
        }
        replacements.put(bodyPart, XmlParts.serialize(body));

        for (String partName : pkg.partNames()) {
            if (STORY_PART.matcher(partName).matches() && !partName.equals(bodyPart)) {
                XmlObject story = XmlParts.parse(pkg.requirePart(partName), partName);
                stripRevisions(story, opts.stripRsids());
                replacements.put(partName, XmlParts.serialize(story));
            }
        }

        String settingsPart = PackageRelationships.settings(pkg);
        if (pkg.hasPart(settingsPart)) {
            XmlObject settings = XmlParts.parse(pkg.requirePart(settingsPart), settingsPart);
            SettingsEditor.remove(settings, SettingsEditor.TRACK_REVISIONS);
            SettingsEditor.remove(settings, SettingsEditor.REVISION_VIEW);
            if (opts.stripRsids()) {
                SettingsEditor.remove(settings, SettingsEditor.RSIDS);
            }
            replacements.put(settingsPart, XmlParts.serialize(settings));
        }

        String corePart = PackageRelationships.coreProperties(pkg);
        XmlObject core = XmlParts.parse(pkg.requirePart(corePart), corePart);
        neutralizeCoreProperties(core, XmlText.author(opts.neutralAuthor()), neutral);
        replacements.put(corePart, XmlParts.serialize(core));

        String appPart = PackageRelationships.extendedProperties(pkg);
        if (pkg.hasPart(appPart)) {
            XmlObject app = XmlParts.parse(pkg.requirePart(appPart), appPart);
            neutralizeExtendedProperties(app);
            replacements.put(appPart, XmlParts.serialize(app));
        }

        log.debug("Sanitized {} parts", replacements.size());
        return pkg.withParts(replacements);
    }

    void stripRevisions(XmlObject document, boolean stripRsids) {
        // row, cell and paragraph-mark deletions are recorded as markers inside properties,
        // so they are resolved before the markers themselves are removed below
        removeDeletedRows(document);
        removeDeletedCells(document);
        joinDeletedParagraphMarks(document);

        // removals first, so insertions nested in deleted content disappear with it
        for (RevisionKind kind : RevisionKind.values()) {
            if (!kind.keepsContent()) {
                XmlParts.outermost(document, w(kind.localName())).forEach(XmlParts::detach);
            }
        }
        for (RevisionKind kind : RevisionKind.values()) {
            if (kind.keepsContent()) {
                XmlParts.descendants(document, w(kind.localName())).forEach(XmlParts::unwrap);
            }
        }
        for (String name : PROPERTY_CHANGES) {
            XmlParts.outermost(document, w(name)).forEach(XmlParts::detach);
        }
        for (String name : MOVE_RANGE_MARKERS) {
            XmlParts.outermost(document, w(name)).forEach(XmlParts::detach);
        }
        for (String name : CELL_MARKERS) {
            XmlParts.outermost(document, w(name)).forEach(XmlParts::detach);
        }
        if (stripRsids) {
            XmlParts.descendants(document).forEach(DocumentSanitizer::removeRsidAttributes);
        }
    }

    private static void removeDeletedRows(XmlObject document) {
        for (XmlObject row : XmlParts.outermost(document, e -> XmlParts.is(e, TR) && removedBy(e, TR_PR))) {
            XmlObject table = XmlParts.parent(row);
            XmlParts.detach(row);
            if (XmlParts.is(table, TBL) && XmlParts.children(table, TR).isEmpty()) {
                XmlObject cell = XmlParts.parent(table);
                XmlParts.detach(table);
                // a table cell must still end with a paragraph
                if (XmlParts.is(cell, TC) && XmlParts.children(cell, P).isEmpty()) {
                    XmlParts.appendChild(cell, P);
                }
            }
        }
    }

    private static void removeDeletedCells(XmlObject document) {
        for (XmlObject cell : XmlParts.outermost(document, e -> XmlParts.is(e, TC)
                && XmlParts.firstChild(XmlParts.firstChild(e, TC_PR), w("cellDel")) != null)) {
            XmlParts.detach(cell);
        }
    }

    /**
     * A deleted paragraph mark merges the paragraph's content into the start of the next paragraph,
     * which keeps its own properties. Without a following paragraph only the marker goes.
     */
    private static void joinDeletedParagraphMarks(XmlObject document) {
        for (XmlObject paragraph : XmlParts.descendants(document, P)) {
            if (!removedBy(XmlParts.firstChild(paragraph, P_PR), R_PR)) {
                continue;
            }
            XmlObject next = XmlParts.nextSibling(paragraph);
            if (!XmlParts.is(next, P)) {
                continue;
            }
            XmlObject anchor = null;
            for (XmlObject child : XmlParts.children(next)) {
                if (!XmlParts.is(child, P_PR)) {
                    anchor = child;
                    break;
                }
            }
            for (XmlObject child : XmlParts.children(paragraph)) {
                if (XmlParts.is(child, P_PR)) {
                    continue;
                }
                if (anchor != null) {
                    XmlParts.moveBefore(child, anchor);
                } else {
                    XmlParts.moveToEnd(child, next);
                }
            }
            XmlParts.detach(paragraph);
        }
    }

    // whether the properties child of the element carries a deletion or move-source marker
    private static boolean removedBy(XmlObject element, QName propertiesName) {
        if (element == null) {
            return false;
        }
        XmlObject properties = XmlParts.firstChild(element, propertiesName);
        return properties != null
                && (XmlParts.firstChild(properties, w(RevisionKind.DELETION.localName())) != null
                || XmlParts.firstChild(properties, w(RevisionKind.MOVE_FROM.localName())) != null);
    }

    private static void removeRsidAttributes(XmlObject element) {
        for (QName name : XmlParts.attributeNames(element)) {
            if (W.equals(name.getNamespaceURI()) && name.getLocalPart().startsWith("rsid")) {
                XmlParts.removeAttribute(element, name);
            }
        }
    }

    private static void clearBody(XmlObject document, String bodyPart) {
        XmlObject body = XmlParts.firstChild(XmlParts.root(document), w("body"));
        if (body == null) {
            throw new CorruptPackageException("Part " + bodyPart + " has no w:body element");
        }
        XmlObject sectPr = null;
        for (XmlObject child : XmlParts.children(body)) {
            if (XmlParts.is(child, w("sectPr"))) {
                sectPr = child;
            } else {
                XmlParts.detach(child);
            }
        }
        if (sectPr != null) {
            XmlParts.insertBefore(sectPr, P);
        } else {
            XmlParts.appendChild(body, P);
        }
    }

    private void neutralizeCoreProperties(XmlObject core, String author, Instant neutral) {
        XmlObject root = XmlParts.root(core);
        String timestamp = RevisionDates.format(neutral);

        // elements added below and the xsi:type value need their prefixes bound on the root
        XmlParts.declareNamespace(root, "dc", DC);
        XmlParts.declareNamespace(root, "cp", CP);
        XmlParts.declareNamespace(root, "dcterms", DCTERMS);
        XmlParts.declareNamespace(root, "xsi", XSI);

        setOrCreate(root, new QName(DC, "creator", "dc"), author);
        setOrCreate(root, new QName(CP, "lastModifiedBy", "cp"), author);
        setOrCreate(root, new QName(CP, "revision", "cp"), "1");
        for (String field : CLEARED_CORE_FIELDS) {
            clearText(XmlParts.firstChild(root, new QName(DC, field)));
        }
        clearText(XmlParts.firstChild(root, new QName(CP, "keywords")));
        XmlObject lastPrinted = XmlParts.firstChild(root, new QName(CP, "lastPrinted"));
        if (lastPrinted != null) {
            XmlParts.detach(lastPrinted);
        }

        XmlParts.setAttribute(setOrCreate(root, new QName(DCTERMS, "created", "dcterms"), timestamp),
                W3CDTF_TYPE, "dcterms:W3CDTF");
        XmlParts.setAttribute(setOrCreate(root, new QName(DCTERMS, "modified", "dcterms"), timestamp),
                W3CDTF_TYPE, "dcterms:W3CDTF");
    }

    private void neutralizeExtendedProperties(XmlObject app) {
        XmlObject root = XmlParts.root(app);
        for (String field : List.of("Company", "Manager", "HyperlinkBase")) {
            clearText(XmlParts.firstChild(root, new QName(EXTENDED_PROPERTIES, field)));
        }
        XmlObject appVersion = XmlParts.firstChild(root, new QName(EXTENDED_PROPERTIES, "AppVersion"));
        if (appVersion != null) {
            XmlParts.detach(appVersion);
        }
        XmlObject totalTime = XmlParts.firstChild(root, new QName(EXTENDED_PROPERTIES, "TotalTime"));
        if (totalTime != null) {
            XmlParts.setText(totalTime, "0");
        }
        XmlObject application = XmlParts.firstChild(root, new QName(EXTENDED_PROPERTIES, "Application"));
        if (application != null) {
            XmlParts.setText(application, dolosProperties.getApplicationName());
        }
    }

    private static void clearText(XmlObject element) {
        if (element != null) {
            XmlParts.setText(element, "");
        }
    }

    private static XmlObject setOrCreate(XmlObject root, QName name, String value) {
        XmlObject element = XmlParts.firstChild(root, name);
        if (element == null) {
            element = XmlParts.appendChild(root, name);
        }
        XmlParts.setText(element, value);
        return element;
    }
}
