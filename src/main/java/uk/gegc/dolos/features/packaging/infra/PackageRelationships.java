package uk.gegc.dolos.features.packaging.infra;

import org.apache.xmlbeans.XmlObject;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.domain.PartNames;

import javax.xml.namespace.QName;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and extends the relationship and content-type parts of a package.
 * The package root is addressed with an empty source part name.
 */
public final class PackageRelationships {

    private static final String ROOT = "";

    private static final QName RELATIONSHIPS = new QName(OoxmlNamespaces.PACKAGE_RELATIONSHIPS, "Relationships");
    private static final QName RELATIONSHIP = new QName(OoxmlNamespaces.PACKAGE_RELATIONSHIPS, "Relationship");
    private static final QName OVERRIDE = new QName(OoxmlNamespaces.CONTENT_TYPES, "Override");
    private static final QName ID = new QName("Id");
    private static final QName TYPE = new QName("Type");
    private static final QName TARGET = new QName("Target");
    private static final QName TARGET_MODE = new QName("TargetMode");
    private static final QName PART_NAME = new QName("PartName");
    private static final QName CONTENT_TYPE = new QName("ContentType");

    private PackageRelationships() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String mainDocument(DocxPackage pkg) {
        return findTarget(pkg, ROOT, OoxmlNamespaces.REL_OFFICE_DOCUMENT).orElse(PartNames.MAIN_DOCUMENT);
    }

    public static String coreProperties(DocxPackage pkg) {
        return findTarget(pkg, ROOT, OoxmlNamespaces.REL_CORE_PROPERTIES).orElse(PartNames.CORE_PROPERTIES);
    }

    public static String extendedProperties(DocxPackage pkg) {
        return findTarget(pkg, ROOT, OoxmlNamespaces.REL_EXTENDED_PROPERTIES).orElse(PartNames.EXTENDED_PROPERTIES);
    }

    public static String settings(DocxPackage pkg) {
        String mainDocument = mainDocument(pkg);
        return findTarget(pkg, mainDocument, OoxmlNamespaces.REL_SETTINGS)
                .orElseGet(() -> PartNames.resolveTarget(mainDocument, "settings.xml"));
    }

    /**
     * First internal relationship of the given type declared by {@code sourcePart}, resolved to a part name.
     */
    public static Optional<String> findTarget(DocxPackage pkg, String sourcePart, String relationshipType) {
        String relsPart = PartNames.relationshipsOf(sourcePart);
        Optional<byte[]> rels = pkg.part(relsPart);
        if (rels.isEmpty()) {
            return Optional.empty();
        }
        XmlObject document = XmlParts.parse(rels.get(), relsPart);
        for (XmlObject rel : XmlParts.descendants(document, RELATIONSHIP)) {
            if (relationshipType.equals(XmlParts.attribute(rel, TYPE))
                    && !"External".equals(XmlParts.attribute(rel, TARGET_MODE))) {
                String target = XmlParts.attribute(rel, TARGET);
                return Optional.of(PartNames.resolveTarget(sourcePart, target == null ? "" : target));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the relationships part with one more relationship, creating the part when {@code relsXml} is null.
     */
    public static byte[] addRelationship(byte[] relsXml, String relsPartName, String type, String target) {
        XmlObject document = relsXml == null
                ? XmlParts.newDocument(RELATIONSHIPS)
                : XmlParts.parse(relsXml, relsPartName);
        XmlObject root = XmlParts.root(document);

        Set<String> ids = new HashSet<>();
        for (XmlObject rel : XmlParts.descendants(document, RELATIONSHIP)) {
            ids.add(XmlParts.attribute(rel, ID));
        }
        int next = 1;
        while (ids.contains("rId" + next)) {
            next++;
        }

        XmlObject rel = XmlParts.appendChild(root, RELATIONSHIP);
        XmlParts.setAttribute(rel, ID, "rId" + next);
        XmlParts.setAttribute(rel, TYPE, type);
        XmlParts.setAttribute(rel, TARGET, target);
        return XmlParts.serialize(document);
    }

    /**
     * Returns {@code [Content_Types].xml} with an Override for the part, unless one is already declared.
     */
    public static byte[] addOverride(byte[] contentTypesXml, String partName, String contentType) {
        XmlObject document = XmlParts.parse(contentTypesXml, PartNames.CONTENT_TYPES);
        String partUri = "/" + partName;
        for (XmlObject override : XmlParts.descendants(document, OVERRIDE)) {
            if (partUri.equalsIgnoreCase(XmlParts.attribute(override, PART_NAME))) {
                return contentTypesXml.clone();
            }
        }
        XmlObject override = XmlParts.appendChild(XmlParts.root(document), OVERRIDE);
        XmlParts.setAttribute(override, PART_NAME, partUri);
        XmlParts.setAttribute(override, CONTENT_TYPE, contentType);
        return XmlParts.serialize(document);
    }
}
