package uk.gegc.dolos.features.revision.application;

import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.infra.PackageRelationships;
import uk.gegc.dolos.features.packaging.infra.XmlParts;
import uk.gegc.dolos.features.revision.domain.model.DocumentProperties;
import uk.gegc.dolos.features.revision.domain.model.RenderMode;
import uk.gegc.dolos.features.revision.domain.model.RevisionKind;
import uk.gegc.dolos.features.revision.infra.SettingsEditor;

import javax.xml.namespace.QName;

import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.CP;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.DC;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.EXTENDED_PROPERTIES;
import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.w;

/**
 * Read-only queries over a package: revision counts, tracking state, rendering mode and the
 * document-level properties a rebuild has to carry over.
 */
@Component
public class PackageInspector {

    public int countRevisions(DocxPackage pkg, RevisionKind kind) {
        String bodyPart = PackageRelationships.mainDocument(pkg);
        XmlObject body = XmlParts.parse(pkg.requirePart(bodyPart), bodyPart);
        return XmlParts.descendants(body, w(kind.localName())).size();
    }

    public boolean isTrackingEnabled(DocxPackage pkg) {
        return hasSetting(pkg, SettingsEditor.TRACK_REVISIONS);
    }

    public boolean hasSetting(DocxPackage pkg, String localName) {
        String settingsPart = PackageRelationships.settings(pkg);
        return pkg.part(settingsPart)
                .map(bytes -> SettingsEditor.has(XmlParts.parse(bytes, settingsPart), localName))
                .orElse(false);
    }

    /**
     * Insertions plus tracking means suggestions, insertions alone mean final, none means clean.
     */
    public RenderMode detectMode(DocxPackage pkg) {
        if (countRevisions(pkg, RevisionKind.INSERTION) == 0) {
            return RenderMode.CLEAN;
        }
        return isTrackingEnabled(pkg) ? RenderMode.SUGGESTIONS : RenderMode.FINAL;
    }

    public DocumentProperties readProperties(DocxPackage pkg) {
        String corePart = PackageRelationships.coreProperties(pkg);
        XmlObject core = XmlParts.root(XmlParts.parse(pkg.requirePart(corePart), corePart));

        Integer totalTime = null;
        String appPart = PackageRelationships.extendedProperties(pkg);
        if (pkg.hasPart(appPart)) {
            XmlObject app = XmlParts.root(XmlParts.parse(pkg.requirePart(appPart), appPart));
            String value = text(app, EXTENDED_PROPERTIES, "TotalTime");
            if (value != null && value.matches("\\d+")) {
                totalTime = Integer.valueOf(value);
            }
        }

        return new DocumentProperties(
                text(core, DC, "title"),
                text(core, DC, "subject"),
                text(core, CP, "keywords"),
                text(core, DC, "description"),
                totalTime,
                detectMode(pkg));
    }

    public String creator(DocxPackage pkg) {
        String corePart = PackageRelationships.coreProperties(pkg);
        return text(XmlParts.root(XmlParts.parse(pkg.requirePart(corePart), corePart)), DC, "creator");
    }

    private static String text(XmlObject root, String namespace, String localName) {
        XmlObject element = XmlParts.firstChild(root, new QName(namespace, localName));
        if (element == null) {
            return null;
        }
        String value = XmlParts.text(element).strip();
        return value.isEmpty() ? null : value;
    }
}
