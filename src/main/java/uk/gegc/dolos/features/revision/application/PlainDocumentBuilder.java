package uk.gegc.dolos.features.revision.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.openxmlformats.schemas.officeDocument.x2006.extendedProperties.CTProperties;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.packaging.application.PackageIo;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.revision.domain.EmptyDocumentException;
import uk.gegc.dolos.features.revision.domain.model.DocumentProperties;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.shared.config.DolosProperties;
import uk.gegc.dolos.shared.util.XmlText;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Builds the baseline package: one plain paragraph per sentence plus core and app properties,
 * no revision markup. The result opens on its own and is what {@link RevisionInjector} rewrites.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlainDocumentBuilder {

    private final PackageIo packageIo;
    private final DolosProperties dolosProperties;

    public DocxPackage build(List<SentenceRecord> records, DocumentProperties properties, String author) {
        if (records == null || records.isEmpty()) {
            throw new EmptyDocumentException("Cannot build a document without sentences");
        }
        DocumentProperties props = properties != null ? properties : DocumentProperties.of(null);
        String documentAuthor = XmlText.author(author);

        try (XWPFDocument document = new XWPFDocument()) {
            applyCoreProperties(document.getProperties().getCoreProperties(), records, props, documentAuthor);
            applyExtendedProperties(document.getProperties().getExtendedProperties(), props);

            for (int i = 0; i < records.size(); i++) {
                XWPFParagraph paragraph = document.createParagraph();
                paragraph.createRun().setText(records.get(i).text());
                if (i < records.size() - 1) {
                    paragraph.createRun().setText(" ");
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.write(out);
            log.debug("Built baseline package with {} paragraphs", records.size());
            return packageIo.unpack(out.toByteArray());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build baseline document", e);
        }
    }

    private void applyCoreProperties(POIXMLProperties.CoreProperties core, List<SentenceRecord> records,
                                     DocumentProperties props, String author) {
        core.setCreator(author);
        core.setLastModifiedByUser(author);
        core.setRevision("1");
        if (hasText(props.title())) {
            core.setTitle(XmlText.clean(props.title()));
        }
        if (hasText(props.subject())) {
            core.setSubjectProperty(XmlText.clean(props.subject()));
        }
        if (hasText(props.keywords())) {
            core.setKeywords(XmlText.clean(props.keywords()));
        }
        if (hasText(props.comments())) {
            core.setDescription(XmlText.clean(props.comments()));
        }

        SentenceRecord first = records.get(0);
        core.setCreated(Optional.of(Date.from(first.createdAt())));
        core.setModified(Optional.of(Date.from(records.get(records.size() - 1).modifiedAt())));
    }

    private void applyExtendedProperties(POIXMLProperties.ExtendedProperties extended, DocumentProperties props) {
        CTProperties app = extended.getUnderlyingProperties();
        app.setApplication(dolosProperties.getApplicationName());
        app.setAppVersion(dolosProperties.getApplicationVersion());
        if (props.totalEditTimeMinutes() != null) {
            // TotalTime is expressed in minutes
            app.setTotalTime(props.totalEditTimeMinutes());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
