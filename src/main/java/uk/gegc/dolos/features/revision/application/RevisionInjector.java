package uk.gegc.dolos.features.revision.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.packaging.domain.CorruptPackageException;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.packaging.domain.PartNames;
import uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces;
import uk.gegc.dolos.features.packaging.infra.PackageRelationships;
import uk.gegc.dolos.features.packaging.infra.XmlParts;
import uk.gegc.dolos.features.revision.domain.EmptyDocumentException;
import uk.gegc.dolos.features.revision.domain.RecordCountMismatchException;
import uk.gegc.dolos.features.revision.domain.UnsupportedModeException;
import uk.gegc.dolos.features.revision.domain.model.RenderMode;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.features.revision.infra.RevisionDates;
import uk.gegc.dolos.features.revision.infra.SettingsEditor;
import uk.gegc.dolos.shared.exception.InputValidationException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static uk.gegc.dolos.features.packaging.infra.OoxmlNamespaces.w;

/**
 * Rewrites the body paragraphs of a baseline package from the sentence records and applies the
 * rendering mode. Every mode goes through the same paragraph routine; the mode only decides whether
 * runs are wrapped in {@code w:ins} and which revision settings the package ends up with.
 *
 * <ul>
 *   <li>{@link RenderMode#SUGGESTIONS}: insertions, {@code w:trackRevisions} on.</li>
 *   <li>{@link RenderMode#FINAL}: insertions, tracking off, {@code w:revisionView} hiding markup.</li>
 *   <li>{@link RenderMode#CLEAN}: plain runs, neither setting.</li>
 * </ul>
 */
@Component
@Slf4j
public class RevisionInjector {

    public DocxPackage inject(DocxPackage baseline, List<SentenceRecord> records, RenderMode mode) {
        if (mode == null) {
            throw new UnsupportedModeException("Rendering mode is required");
        }
        if (records == null || records.isEmpty()) {
            throw new EmptyDocumentException("Cannot inject revisions for zero sentences");
        }
        requireUniqueRevisionIds(records);

        String bodyPart = PackageRelationships.mainDocument(baseline);
        XmlObject document = XmlParts.parse(baseline.requirePart(bodyPart), bodyPart);
        XmlObject body = XmlParts.firstChild(XmlParts.root(document), w("body"));
        if (body == null) {
            throw new CorruptPackageException("Part " + bodyPart + " has no w:body element");
        }

        List<XmlObject> paragraphs = XmlParts.children(body, w("p"));
        if (paragraphs.size() != records.size()) {
            throw new RecordCountMismatchException(String.format(
                    "Baseline has %d paragraphs but %d sentence records were supplied",
                    paragraphs.size(), records.size()));
        }

        for (int i = 0; i < records.size(); i++) {
            rewriteParagraph(paragraphs.get(i), records.get(i), i == records.size() - 1, mode);
        }

        Map<String, byte[]> replacements = new LinkedHashMap<>();
        replacements.put(bodyPart, XmlParts.serialize(document));
        applySettings(baseline, bodyPart, mode, replacements);

        log.debug("Injected {} sentences into {} using mode {}", records.size(), bodyPart, mode);
        return baseline.withParts(replacements);
    }

    private void rewriteParagraph(XmlObject paragraph, SentenceRecord record, boolean last, RenderMode mode) {
        for (XmlObject child : XmlParts.children(paragraph)) {
            if (!XmlParts.is(child, w("pPr"))) {
                XmlParts.detach(child);
            }
        }

        XmlObject container = paragraph;
        if (mode.wrapsInsertions()) {
            container = XmlParts.appendChild(paragraph, w("ins"));
            XmlParts.setAttribute(container, w("id"), Integer.toString(record.revisionId()));
            XmlParts.setAttribute(container, w("author"), record.author());
            XmlParts.setAttribute(container, w("date"), RevisionDates.format(record.modifiedAt()));
        }

        appendRun(container, record.text());
        if (!last) {
            appendRun(container, " ");
        }
    }

    private static void appendRun(XmlObject container, String text) {
        XmlObject run = XmlParts.appendChild(container, w("r"));
        XmlObject t = XmlParts.appendChild(run, w("t"));
        if (!text.equals(text.strip())) {
            XmlParts.setAttribute(t, OoxmlNamespaces.XML_SPACE, "preserve");
        }
        XmlParts.setText(t, text);
    }

    private void applySettings(DocxPackage baseline, String bodyPart, RenderMode mode,
                               Map<String, byte[]> replacements) {
        String settingsPart = PackageRelationships.settings(baseline);
        boolean exists = baseline.hasPart(settingsPart);
        if (!exists && mode == RenderMode.CLEAN) {
            return;
        }

        XmlObject settings = exists
                ? XmlParts.parse(baseline.requirePart(settingsPart), settingsPart)
                : SettingsEditor.newSettings();

        switch (mode) {
            case SUGGESTIONS -> {
                SettingsEditor.remove(settings, SettingsEditor.REVISION_VIEW);
                SettingsEditor.enableTracking(settings);
            }
            case FINAL -> {
                SettingsEditor.remove(settings, SettingsEditor.TRACK_REVISIONS);
                SettingsEditor.hideRevisionMarkup(settings);
            }
            case CLEAN -> {
                SettingsEditor.remove(settings, SettingsEditor.TRACK_REVISIONS);
                SettingsEditor.remove(settings, SettingsEditor.REVISION_VIEW);
            }
        }
        replacements.put(settingsPart, XmlParts.serialize(settings));

        if (!exists) {
            registerSettingsPart(baseline, bodyPart, settingsPart, replacements);
        }
    }

    private void registerSettingsPart(DocxPackage baseline, String bodyPart, String settingsPart,
                                      Map<String, byte[]> replacements) {
        String relsPart = PartNames.relationshipsOf(bodyPart);
        String target = settingsPart.substring(settingsPart.lastIndexOf('/') + 1);
        replacements.put(relsPart, PackageRelationships.addRelationship(
                baseline.part(relsPart).orElse(null), relsPart, OoxmlNamespaces.REL_SETTINGS, target));
        replacements.put(PartNames.CONTENT_TYPES, PackageRelationships.addOverride(
                baseline.requirePart(PartNames.CONTENT_TYPES), settingsPart, OoxmlNamespaces.SETTINGS_CONTENT_TYPE));
        log.debug("Created missing settings part {}", settingsPart);
    }

    private static void requireUniqueRevisionIds(List<SentenceRecord> records) {
        Set<Integer> seen = new HashSet<>();
        for (SentenceRecord record : records) {
            if (!seen.add(record.revisionId())) {
                throw new InputValidationException("Duplicate revision id " + record.revisionId()
                        + " at sentence " + record.position());
            }
        }
    }
}
