package com.eyelevel.sheetextractor.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A single request to run the extraction pipeline over one document.
 * <p>
 * State changes after creation go through the compare-and-set updates of
 * {@link com.eyelevel.sheetextractor.repository.ExtractionJobRepository}; the entity setters are only
 * used to build new rows.
 */
@Entity
@Table(name = "extraction_job", indexes = {
        @Index(name = "idx_extraction_job_document_id", columnList = "document_id"),
        @Index(name = "idx_extraction_job_status", columnList = "status")
})
@Data
public class ExtractionJob {

    @Id
    private UUID id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Document document;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Column(nullable = false)
    private double progress;

    /**
     * Token of the current claim. Null while PENDING, after a watchdog revocation, and once terminal.
     */
    @Column
    private UUID attemptToken;

    /**
     * Equals {@code documentId} while the job is PENDING or PROCESSING and null once terminal. The unique
     * constraint allows at most one active job per document.
     */
    @Column(unique = true)
    private UUID activeDocumentId;

    @Column(nullable = false)
    private boolean cancelRequested;

    @Column(nullable = false)
    private int attempts;

    @Column(nullable = false)
    private int maxAttempts;

    @Column
    private LocalDateTime heartbeatAt;

    @Column(nullable = false)
    private int retryCount;

    @Column
    private String currentStage;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Column
    private LocalDateTime completedAt;

    @Column(columnDefinition = "TEXT")
    private String error;
}
