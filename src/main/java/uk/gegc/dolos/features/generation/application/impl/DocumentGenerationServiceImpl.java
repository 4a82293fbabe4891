package uk.gegc.dolos.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.dolos.features.generation.api.dto.CreateDocumentRequest;
import uk.gegc.dolos.features.generation.api.dto.SanitizeResultDto;
import uk.gegc.dolos.features.generation.api.dto.SanitizeStoredRequest;
import uk.gegc.dolos.features.generation.application.DocumentGenerationService;
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
import uk.gegc.dolos.features.revision.domain.model.DocumentProperties;
import uk.gegc.dolos.features.revision.domain.model.DocumentRecord;
import uk.gegc.dolos.features.revision.domain.model.RenderMode;
import uk.gegc.dolos.features.revision.domain.model.SanitizeOptions;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.features.segmentation.application.SegmentationMethod;
import uk.gegc.dolos.features.segmentation.application.SentenceParser;
import uk.gegc.dolos.shared.config.DolosProperties;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.util.TimestampParser;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentGenerationServiceImpl implements DocumentGenerationService {

    private final MetadataStoreService metadataStore;
    private final SentenceParser sentenceParser;
    private final PlainDocumentBuilder documentBuilder;
    private final RevisionInjector revisionInjector;
    private final DocumentSanitizer documentSanitizer;
    private final PackageInspector packageInspector;
    private final PackageIo packageIo;
    private final DocumentFileStore fileStore;
    private final DocumentRecordMapper mapper;
    private final DolosProperties dolosProperties;

    @Override
    @Transactional
    public DocumentMetadataDto createDocument(CreateDocumentRequest request) {
        // fail on a bad mode or start date before anything is stored
        RenderMode mode = request.mode() == null || request.mode().isBlank()
                ? RenderMode.SUGGESTIONS
                : RenderMode.fromValue(request.mode());
        Instant start = TimestampParser.parseOptional(request.startDate());
        List<String> sentences = resolveSentences(request);

        String author = request.author() == null || request.author().isBlank()
                ? dolosProperties.getDefaultAuthor()
                : request.author();
        long min = request.minIntervalSeconds() != null
                ? request.minIntervalSeconds()
                : dolosProperties.getMinIntervalSeconds();
        long max = request.maxIntervalSeconds() != null
                ? request.maxIntervalSeconds()
                : dolosProperties.getMaxIntervalSeconds();

        DocumentRecord record = metadataStore.createDocument(request.filename(), sentences, start, min, max, author);
        DocumentProperties properties = new DocumentProperties(
                request.title(),
                request.subject(),
                request.keywords(),
                request.comments(),
                request.totalEditTimeMinutes(),
                mode);

        fileStore.write(record.filename(), render(record, properties));
        log.info("Created {} with {} sentences in {} mode", record.filename(), record.sentences().size(), mode);
        return mapper.toDto(record);
    }

    @Override
    @Transactional
    public SentenceMetadataDto editTimestamp(String filename, int position, Instant timestamp) {
        if (!metadataStore.exists(filename)) {
            throw DocumentNotFoundException.forFilename(filename);
        }
        DocumentProperties properties = currentProperties(filename);
        SentenceRecord updated = metadataStore.updateSentenceTimestamp(filename, position, timestamp);
        DocumentRecord record = metadataStore.getDocument(filename);

        fileStore.write(filename, render(record, properties));
        log.info("Rebuilt {} after moving sentence {} to {}", filename, position, updated.modifiedAt());
        return mapper.toDto(updated);
    }

    @Override
    public byte[] sanitize(byte[] packageBytes, Instant neutralTimestamp, SanitizeOptions options) {
        byte[] sanitized = packageIo.transform(packageBytes,
                pkg -> documentSanitizer.sanitize(pkg, neutralTimestamp, options));
        log.info("Sanitized package ({} bytes in, {} bytes out)", packageBytes.length, sanitized.length);
        return sanitized;
    }

    @Override
    public SanitizeResultDto sanitizeStored(String filename, SanitizeStoredRequest request) {
        String output = request == null || request.outputFilename() == null || request.outputFilename().isBlank()
                ? filename
                : request.outputFilename();
        Instant neutral = request == null ? null : TimestampParser.parseOptional(request.neutralTimestamp());
        SanitizeOptions options = request == null
                ? sanitizeOptions(null, null, null)
                : sanitizeOptions(request.author(), request.keepContent(), request.stripRsids());

        byte[] sanitized = sanitize(fileStore.read(filename), neutral, options);
        fileStore.write(output, sanitized);
        log.info("Sanitized stored package {} into {}", filename, output);
        return new SanitizeResultDto(filename, output, sanitized.length);
    }

    @Override
    public byte[] getPackage(String filename) {
        return fileStore.read(filename);
    }

    @Override
    public DocumentMetadataDto getMetadata(String filename) {
        return metadataStore.getDocumentMetadata(filename);
    }

    @Override
    @Transactional
    public void deleteDocument(String filename) {
        boolean metadataDeleted = metadataStore.deleteDocument(filename);
        boolean fileDeleted = fileStore.delete(filename);
        if (!metadataDeleted && !fileDeleted) {
            throw DocumentNotFoundException.forFilename(filename);
        }
        log.info("Deleted {} (metadata={}, package={})", filename, metadataDeleted, fileDeleted);
    }

    @Override
    public SanitizeOptions sanitizeOptions(String author, Boolean keepContent, Boolean stripRsids) {
        return new SanitizeOptions(
                author == null || author.isBlank() ? dolosProperties.getNeutralAuthor() : author,
                keepContent == null || keepContent,
                stripRsids == null || stripRsids);
    }

    private List<String> resolveSentences(CreateDocumentRequest request) {
        if (request.sentences() != null && !request.sentences().isEmpty()) {
            return request.sentences();
        }
        SegmentationMethod method = request.segmentation() != null ? request.segmentation() : SegmentationMethod.REGEX;
        return sentenceParser.parse(request.text(), method);
    }

    private DocumentProperties currentProperties(String filename) {
        if (!fileStore.exists(filename)) {
            log.warn("No stored package for {}; rebuilding with default properties", filename);
            return DocumentProperties.of(RenderMode.SUGGESTIONS);
        }
        DocxPackage existing = packageIo.unpack(fileStore.read(filename));
        return packageInspector.readProperties(existing);
    }

    private byte[] render(DocumentRecord record, DocumentProperties properties) {
        DocxPackage baseline = documentBuilder.build(record.sentences(), properties, record.author());
        DocxPackage injected = revisionInjector.inject(baseline, record.sentences(), properties.mode());
        log.debug("Rendered {} in {} mode ({} parts)", record.filename(), properties.mode(), injected.size());
        return packageIo.repack(injected);
    }
}
