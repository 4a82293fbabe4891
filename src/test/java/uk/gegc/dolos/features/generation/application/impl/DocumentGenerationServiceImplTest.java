package uk.gegc.dolos.features.generation.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.dolos.BaseUnitTest;
import uk.gegc.dolos.features.generation.api.dto.CreateDocumentRequest;
import uk.gegc.dolos.features.generation.api.dto.SanitizeResultDto;
import uk.gegc.dolos.features.generation.api.dto.SanitizeStoredRequest;
import uk.gegc.dolos.features.generation.infra.DocumentFileStore;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.api.dto.SentenceMetadataDto;
import uk.gegc.dolos.features.metadata.application.MetadataStoreService;
import uk.gegc.dolos.features.metadata.infra.mapping.DocumentRecordMapper;
import uk.gegc.dolos.features.packaging.application.PackageIo;
import uk.gegc.dolos.features.packaging.domain.DocxPackage;
import uk.gegc.dolos.features.revision.application.DocumentSanitizer;
import uk.gegc.dolos.features.revision.application.PackageInspector;
import uk.gegc.dolos.features.revision.application.PlainDocumentBuilder;
import uk.gegc.dolos.features.revision.application.RevisionInjector;
import uk.gegc.dolos.features.revision.domain.UnsupportedModeException;
import uk.gegc.dolos.features.revision.domain.model.DocumentProperties;
import uk.gegc.dolos.features.revision.domain.model.DocumentRecord;
import uk.gegc.dolos.features.revision.domain.model.RenderMode;
import uk.gegc.dolos.features.revision.domain.model.RevisionKind;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.features.segmentation.application.SentenceParser;
import uk.gegc.dolos.shared.config.DolosProperties;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.exception.InvalidTimestampException;
import uk.gegc.dolos.testsupport.TestPackages;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("DocumentGenerationServiceImpl")
class DocumentGenerationServiceImplTest extends BaseUnitTest {

    private static final Instant START = Instant.parse("2025-01-01T09:00:00Z");
    private static final Instant EDITED = Instant.parse("2025-06-15T14:30:00Z");

    @Mock
    private MetadataStoreService metadataStore;

    @Mock
    private DocumentFileStore fileStore;

    private final DolosProperties properties = new DolosProperties();
    private final PackageIo packageIo = new PackageIo();
    private final PackageInspector inspector = new PackageInspector();
    private final PlainDocumentBuilder builder = new PlainDocumentBuilder(packageIo, properties);
    private final RevisionInjector injector = new RevisionInjector();

    private DocumentGenerationServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new DocumentGenerationServiceImpl(metadataStore, new SentenceParser(), builder, injector,
                new DocumentSanitizer(properties), inspector, packageIo, fileStore,
                new DocumentRecordMapper(), properties);
    }

    @Test
    @DisplayName("createDocument applies configured defaults and writes the rendered package")
    void createDocument_defaults() {
        DocumentRecord record = record(TestPackages.records(START, "Alpha.", "Beta."));
        when(metadataStore.createDocument(eq("essay.docx"), eq(List.of("Alpha.", "Beta.")), isNull(),
                eq(30L), eq(300L), eq("Dolos"))).thenReturn(record);

        DocumentMetadataDto result = service.createDocument(request(null, List.of("Alpha.", "Beta."), null, null));

        assertThat(result.filename()).isEqualTo("essay.docx");
        assertThat(result.sentenceCount()).isEqualTo(2);
        DocxPackage written = captureWrite("essay.docx");
        assertThat(inspector.detectMode(written)).isEqualTo(RenderMode.SUGGESTIONS);
        assertThat(inspector.countRevisions(written, RevisionKind.INSERTION)).isEqualTo(2);
    }

    @Test
    @DisplayName("createDocument segments raw text when no sentence list is given")
    void createDocument_segmentsText() {
        DocumentRecord record = record(TestPackages.records(START, "One sentence.", "Another one."));
        when(metadataStore.createDocument(eq("essay.docx"), eq(List.of("One sentence.", "Another one.")),
                eq(START), anyLong(), anyLong(), anyString())).thenReturn(record);

        service.createDocument(request("One sentence. Another one.", null, "2025-01-01T09:00:00Z", "final"));

        assertThat(inspector.detectMode(captureWrite("essay.docx"))).isEqualTo(RenderMode.FINAL);
    }

    @Test
    @DisplayName("createDocument rejects an unknown mode before storing anything")
    void createDocument_unknownMode() {
        assertThatThrownBy(() -> service.createDocument(request(null, List.of("A."), null, "redline")))
                .isInstanceOf(UnsupportedModeException.class);

        verifyNoInteractions(metadataStore, fileStore);
    }

    @Test
    @DisplayName("createDocument rejects an unparseable start date before storing anything")
    void createDocument_badStartDate() {
        assertThatThrownBy(() -> service.createDocument(request(null, List.of("A."), "yesterday", null)))
                .isInstanceOf(InvalidTimestampException.class);

        verifyNoInteractions(metadataStore, fileStore);
    }

    @Test
    @DisplayName("editTimestamp rebuilds the package in its stored mode with its stored properties")
    void editTimestamp_preservesModeAndProperties() {
        List<SentenceRecord> original = TestPackages.records(START, "A.", "B.", "C.");
        DocumentProperties stored = new DocumentProperties("Kept Title", null, null, null, 12, RenderMode.FINAL);
        byte[] existing = render(original, stored);

        SentenceRecord moved = original.get(1).withModifiedAt(EDITED);
        List<SentenceRecord> updated = new ArrayList<>(original);
        updated.set(1, moved);

        when(metadataStore.exists("essay.docx")).thenReturn(true);
        when(fileStore.exists("essay.docx")).thenReturn(true);
        when(fileStore.read("essay.docx")).thenReturn(existing);
        when(metadataStore.updateSentenceTimestamp("essay.docx", 1, EDITED)).thenReturn(moved);
        when(metadataStore.getDocument("essay.docx")).thenReturn(record(updated));

        SentenceMetadataDto result = service.editTimestamp("essay.docx", 1, EDITED);

        assertThat(result.modified()).isEqualTo(EDITED);
        DocxPackage written = captureWrite("essay.docx");
        assertThat(inspector.detectMode(written)).isEqualTo(RenderMode.FINAL);
        DocumentProperties rebuilt = inspector.readProperties(written);
        assertThat(rebuilt.title()).isEqualTo("Kept Title");
        assertThat(rebuilt.totalEditTimeMinutes()).isEqualTo(12);
        assertThat(TestPackages.body(written)).contains("w:date=\"2025-06-15T14:30:00Z\"");
    }

    @Test
    @DisplayName("editTimestamp falls back to suggestions when the stored package is gone")
    void editTimestamp_missingPackage_defaultsToSuggestions() {
        List<SentenceRecord> records = TestPackages.records(START, "A.");
        when(metadataStore.exists("essay.docx")).thenReturn(true);
        when(fileStore.exists("essay.docx")).thenReturn(false);
        when(metadataStore.updateSentenceTimestamp("essay.docx", 0, EDITED))
                .thenReturn(records.get(0).withModifiedAt(EDITED));
        when(metadataStore.getDocument("essay.docx")).thenReturn(record(records));

        service.editTimestamp("essay.docx", 0, EDITED);

        assertThat(inspector.detectMode(captureWrite("essay.docx"))).isEqualTo(RenderMode.SUGGESTIONS);
        verify(fileStore, never()).read(anyString());
    }

    @Test
    @DisplayName("editTimestamp on an unknown document writes nothing")
    void editTimestamp_unknownDocument() {
        when(metadataStore.exists("missing.docx")).thenReturn(false);

        assertThatThrownBy(() -> service.editTimestamp("missing.docx", 0, EDITED))
                .isInstanceOf(DocumentNotFoundException.class);

        verify(fileStore, never()).write(anyString(), any());
    }

    @Test
    @DisplayName("sanitizeStored overwrites the source when no output name is given")
    void sanitizeStored_inPlace() {
        byte[] existing = render(TestPackages.records(START, "A.", "B."), DocumentProperties.of(RenderMode.SUGGESTIONS));
        when(fileStore.read("essay.docx")).thenReturn(existing);

        SanitizeResultDto result = service.sanitizeStored("essay.docx", null);

        assertThat(result.outputFilename()).isEqualTo("essay.docx");
        byte[] bytes = captureBytes("essay.docx");
        assertThat(result.size()).isEqualTo(bytes.length);
        DocxPackage written = packageIo.unpack(bytes);
        assertThat(inspector.countRevisions(written, RevisionKind.INSERTION)).isZero();
        assertThat(inspector.isTrackingEnabled(written)).isFalse();
        assertThat(inspector.creator(written)).isEqualTo("Anonymous");
    }

    @Test
    @DisplayName("sanitizeStored writes under the requested output name")
    void sanitizeStored_newName() {
        byte[] existing = render(TestPackages.records(START, "A."), DocumentProperties.of(RenderMode.FINAL));
        when(fileStore.read("essay.docx")).thenReturn(existing);

        SanitizeResultDto result = service.sanitizeStored("essay.docx",
                new SanitizeStoredRequest("clean.docx", "2001-02-03T04:05:06Z", "Nobody", null, null));

        assertThat(result.sourceFilename()).isEqualTo("essay.docx");
        assertThat(result.outputFilename()).isEqualTo("clean.docx");
        assertThat(inspector.creator(captureWrite("clean.docx"))).isEqualTo("Nobody");
    }

    @Test
    @DisplayName("deleteDocument fails only when neither metadata nor package existed")
    void deleteDocument_results() {
        when(metadataStore.deleteDocument("essay.docx")).thenReturn(true);
        when(fileStore.delete("essay.docx")).thenReturn(false);
        when(metadataStore.deleteDocument("missing.docx")).thenReturn(false);
        when(fileStore.delete("missing.docx")).thenReturn(false);

        service.deleteDocument("essay.docx");
        assertThatThrownBy(() -> service.deleteDocument("missing.docx"))
                .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    @DisplayName("sanitizeOptions fills in configured defaults")
    void sanitizeOptions_defaults() {
        properties.setNeutralAuthor("Redacted");

        SanitizeOptions options = service.sanitizeOptions(" ", null, false);

        assertThat(options.neutralAuthor()).isEqualTo("Redacted");
        assertThat(options.keepContent()).isTrue();
        assertThat(options.stripRsids()).isFalse();
    }

    private DocxPackage captureWrite(String filename) {
        return packageIo.unpack(captureBytes(filename));
    }

    private byte[] captureBytes(String filename) {
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(fileStore).write(eq(filename), bytes.capture());
        return bytes.getValue();
    }

    private byte[] render(List<SentenceRecord> records, DocumentProperties props) {
        DocxPackage baseline = builder.build(records, props, "Tester");
        return packageIo.repack(injector.inject(baseline, records, props.mode()));
    }

    private static DocumentRecord record(List<SentenceRecord> sentences) {
        return new DocumentRecord(UUID.randomUUID(), "essay.docx", sentences.get(0).createdAt(),
                DocumentRecord.latestModification(sentences, START), "Tester", "Tester", sentences);
    }

    private static CreateDocumentRequest request(String text, List<String> sentences, String startDate, String mode) {
        return new CreateDocumentRequest("essay.docx", text, sentences, null, null, startDate,
                null, null, mode, null, null, null, null, null);
    }
}
