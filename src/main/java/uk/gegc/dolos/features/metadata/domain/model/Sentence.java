package uk.gegc.dolos.features.metadata.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "sentences",
        uniqueConstraints = @UniqueConstraint(name = "uk_sentences_document_position",
                columnNames = {"document_id", "sentence_position"}))
@Data
@NoArgsConstructor
public class Sentence {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Document document;

    @Column(name = "sentence_text", nullable = false, length = 1000000)
    private String text;

    @Column(name = "sentence_position", nullable = false)
    private Integer position;

    @Column(nullable = false)
    private Instant createdTimestamp;

    @Column(nullable = false)
    private Instant modifiedTimestamp;

    @Column(length = 255)
    private String author;

    @Column(nullable = false)
    private Integer revisionId;
}
