package uk.gegc.dolos.features.metadata.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.metadata.api.dto.DocumentMetadataDto;
import uk.gegc.dolos.features.metadata.api.dto.SentenceMetadataDto;
import uk.gegc.dolos.features.metadata.domain.model.Document;
import uk.gegc.dolos.features.metadata.domain.model.Sentence;
import uk.gegc.dolos.features.revision.domain.model.DocumentRecord;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;

import java.util.Comparator;
import java.util.List;

@Component
public class DocumentRecordMapper {

    public DocumentRecord toRecord(Document document) {
        if (document == null) {
            return null;
        }
        List<SentenceRecord> sentences = document.getSentences().stream()
                .sorted(Comparator.comparing(Sentence::getPosition))
                .map(this::toRecord)
                .toList();
        return new DocumentRecord(
                document.getId(),
                document.getFilename(),
                document.getCreatedAt(),
                document.getLastModified(),
                document.getAuthor(),
                document.getLastModifiedBy(),
                sentences);
    }

    public SentenceRecord toRecord(Sentence sentence) {
        if (sentence == null) {
            return null;
        }
        return new SentenceRecord(
                sentence.getPosition(),
                sentence.getText(),
                sentence.getCreatedTimestamp(),
                sentence.getModifiedTimestamp(),
                sentence.getAuthor(),
                sentence.getRevisionId());
    }

    public Sentence toEntity(SentenceRecord record) {
        Sentence sentence = new Sentence();
        sentence.setPosition(record.position());
        sentence.setText(record.text());
        sentence.setCreatedTimestamp(record.createdAt());
        sentence.setModifiedTimestamp(record.modifiedAt());
        sentence.setAuthor(record.author());
        sentence.setRevisionId(record.revisionId());
        return sentence;
    }

    public DocumentMetadataDto toDto(DocumentRecord record) {
        if (record == null) {
            return null;
        }
        return new DocumentMetadataDto(
                record.id(),
                record.filename(),
                record.createdAt(),
                record.lastModified(),
                record.author(),
                record.lastModifiedBy(),
                record.sentences().size(),
                record.sentences().stream().map(this::toDto).toList());
    }

    public SentenceMetadataDto toDto(SentenceRecord record) {
        if (record == null) {
            return null;
        }
        return new SentenceMetadataDto(
                record.position(),
                record.text(),
                record.createdAt(),
                record.modifiedAt(),
                record.author(),
                record.revisionId());
    }
}
