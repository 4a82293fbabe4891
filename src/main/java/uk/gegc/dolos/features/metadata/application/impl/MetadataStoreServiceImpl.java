package uk.gegc.dolos.features.metadata.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.application.MetadataStoreService;
import uk.gegc.dolos.features.metadata.domain.SentenceNotFoundException;
import uk.gegc.dolos.features.metadata.domain.model.Document;
import uk.gegc.dolos.features.metadata.domain.model.Sentence;
import uk.gegc.dolos.features.metadata.domain.repository.DocumentRepository;
import uk.gegc.dolos.features.metadata.domain.repository.SentenceRepository;
import uk.gegc.dolos.features.metadata.infra.mapping.DocumentRecordMapper;
import uk.gegc.dolos.features.revision.domain.model.DocumentRecord;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.features.timeline.application.TimelineGenerator;
import uk.gegc.dolos.shared.exception.DocumentNotFoundException;
import uk.gegc.dolos.shared.exception.InputValidationException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataStoreServiceImpl implements MetadataStoreService {

    private final DocumentRepository documentRepository;
    private final SentenceRepository sentenceRepository;
    private final TimelineGenerator timelineGenerator;
    private final DocumentRecordMapper mapper;

    @Override
    @Transactional
    public DocumentRecord createDocument(String filename, List<String> sentences, Instant start,
                                         long minIntervalSeconds, long maxIntervalSeconds, String author) {
        if (filename == null || filename.isBlank()) {
            throw new InputValidationException("Filename is required");
        }
        List<SentenceRecord> timeline = timelineGenerator.generate(
                sentences, start, minIntervalSeconds, maxIntervalSeconds, author);

        documentRepository.findByFilenameWithSentences(filename).ifPresent(existing -> {
            log.info("Replacing existing metadata for {}", filename);
            documentRepository.delete(existing);
            documentRepository.flush();
        });

        SentenceRecord first = timeline.get(0);
        Document document = new Document();
        document.setFilename(filename);
        document.setCreatedAt(first.createdAt());
        document.setLastModified(DocumentRecord.latestModification(timeline, first.createdAt()));
        document.setAuthor(first.author());
        document.setLastModifiedBy(first.author());
        timeline.forEach(record -> document.addSentence(mapper.toEntity(record)));

        Document saved = documentRepository.save(document);
        log.info("Stored metadata for {} ({} sentences)", filename, timeline.size());
        return mapper.toRecord(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentRecord getDocument(String filename) {
        return mapper.toRecord(loadDocument(filename));
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentRecord getDocument(UUID id) {
        return documentRepository.findByIdWithSentences(id)
                .map(mapper::toRecord)
                .orElseThrow(() -> new DocumentNotFoundException("No metadata found for document id " + id));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String filename) {
        return documentRepository.existsByFilename(filename);
    }

    @Override
    @Transactional
    public SentenceRecord updateSentenceTimestamp(String filename, int position, Instant timestamp) {
        if (timestamp == null) {
            throw new InputValidationException("Timestamp is required");
        }
        Document document = loadDocument(filename);
        Sentence sentence = sentenceRepository.findByDocumentAndPosition(document, position)
                .orElseThrow(() -> new SentenceNotFoundException(String.format(
                        "Document %s has no sentence at position %d (it has %d)",
                        filename, position, document.getSentences().size())));

        Instant instant = timestamp.truncatedTo(ChronoUnit.SECONDS);
        sentence.setModifiedTimestamp(instant);
        if (instant.isBefore(sentence.getCreatedTimestamp())) {
            sentence.setCreatedTimestamp(instant);
        }

        document.setLastModified(document.getSentences().stream()
                .map(Sentence::getModifiedTimestamp)
                .max(Comparator.naturalOrder())
                .orElse(instant));
        if (document.getCreatedAt().isAfter(sentence.getCreatedTimestamp())) {
            document.setCreatedAt(sentence.getCreatedTimestamp());
        }

        log.info("Sentence {} of {} moved to {}", position, filename, instant);
        return mapper.toRecord(sentence);
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentMetadataDto getDocumentMetadata(String filename) {
        return mapper.toDto(mapper.toRecord(loadDocument(filename)));
    }

    @Override
    @Transactional
    public boolean deleteDocument(String filename) {
        return documentRepository.findByFilenameWithSentences(filename)
                .map(document -> {
                    documentRepository.delete(document);
                    log.info("Deleted metadata for {}", filename);
                    return true;
                })
                .orElse(false);
    }

    private Document loadDocument(String filename) {
        return documentRepository.findByFilenameWithSentences(filename)
                .orElseThrow(() -> DocumentNotFoundException.forFilename(filename));
    }
}
