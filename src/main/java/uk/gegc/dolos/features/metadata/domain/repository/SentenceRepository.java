package uk.gegc.dolos.features.metadata.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.dolos.features.metadata.domain.model.Document;
import uk.gegc.dolos.features.metadata.domain.model.Sentence;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SentenceRepository extends JpaRepository<Sentence, UUID> {

    Optional<Sentence> findByDocumentAndPosition(Document document, Integer position);

    long countByDocument(Document document);
}
