package com.eyelevel.sheetextractor.model;

import java.util.Set;

/**
 * Defines the lifecycle states of an {@link ExtractionJob}.
 * <p>
 * Valid paths are PENDING → PROCESSING → {COMPLETED, FAILED, CANCELED} and PENDING → CANCELED.
 */
public enum JobStatus {
    /**
     * The job has been created and its id is waiting in the work queue.
     */
    PENDING,
    /**
     * A worker holds the claim token and is running the pipeline.
     */
    PROCESSING,
    /**
     * The pipeline finished and exactly one Extraction was stored.
     */
    COMPLETED,
    /**
     * An unrecoverable error ended the job. The error column holds the reason.
     */
    FAILED,
    /**
     * The job was canceled before or during processing.
     */
    CANCELED;

    public static final Set<JobStatus> ACTIVE = Set.of(PENDING, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
