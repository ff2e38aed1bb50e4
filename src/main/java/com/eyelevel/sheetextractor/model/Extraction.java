package com.eyelevel.sheetextractor.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.data.domain.Persistable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * The stored result of a COMPLETED job. Exactly one row exists per completed job; only {@code notes}
 * changes after creation.
 */
@Entity
@Table(name = "extraction", indexes = {
        @Index(name = "idx_extraction_job_id", columnList = "job_id", unique = true),
        @Index(name = "idx_extraction_document_id", columnList = "document_id")
})
@Data
public class Extraction implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true)
    private UUID jobId;

    @Column(nullable = false)
    private UUID documentId;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> extractedData;

    @Column(nullable = false)
    private double confidenceScore;

    @Column(length = 64)
    private String formatType;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> validationResults;

    @Column(nullable = false)
    private LocalDateTime extractedAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Transient
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private boolean newEntity = true;

    /**
     * Derives the extraction id from the job id, so a repeated insert for the same job collides on the
     * primary key instead of creating a second row.
     *
     * @param jobId The id of the completed job.
     * @return The deterministic extraction id.
     */
    public static UUID idForJob(final UUID jobId) {
        return UUID.nameUUIDFromBytes(("extraction:" + jobId).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
