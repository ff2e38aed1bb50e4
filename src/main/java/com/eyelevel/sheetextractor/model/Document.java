package com.eyelevel.sheetextractor.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An uploaded spreadsheet. Rows are created by the upload collaborator; the engine only mirrors
 * job outcomes into {@code status} and {@code error}.
 */
@Entity
@Table(name = "document")
@Data
public class Document {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String filename;

    /**
     * The subtype used for pipeline lookup ({@code xlsx}, {@code csv}, ...). May be null, in which case
     * the filename extension is used.
     */
    @Column(length = 32)
    private String declaredType;

    @Column(nullable = false)
    private long fileSize;

    /**
     * Object-store key of the raw bytes.
     */
    @Column(nullable = false)
    private String storageRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DocumentStatus status = DocumentStatus.UPLOADED;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime uploadedAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Column(columnDefinition = "TEXT")
    private String error;
}
