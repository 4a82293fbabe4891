package uk.gegc.dolos.features.metadata.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.dolos.features.metadata.domain.model.Document;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    boolean existsByFilename(String filename);

    /**
     * Find document by filename with sentences eagerly loaded
     */
    @Query("SELECT d FROM Document d LEFT JOIN FETCH d.sentences WHERE d.filename = :filename")
    Optional<Document> findByFilenameWithSentences(@Param("filename") String filename);

    @Query("SELECT d FROM Document d LEFT JOIN FETCH d.sentences WHERE d.id = :id")
    Optional<Document> findByIdWithSentences(@Param("id") UUID id);
}
