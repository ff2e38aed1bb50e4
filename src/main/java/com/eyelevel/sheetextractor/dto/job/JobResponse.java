package com.eyelevel.sheetextractor.dto.job;

import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.model.JobStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read view of a job as returned to callers of the orchestrator. Engine columns such as the claim token are
 * not exposed.
 *
 * @param id             The job id.
 * @param documentId     The document being processed.
 * @param status         The job status.
 * @param progress       Percent complete, in [0, 100].
 * @param currentStage   Stage label of the latest recorded step.
 * @param cancelRequested Whether a cancellation is waiting to be observed.
 * @param attempts       Claim attempts consumed.
 * @param retryCount     AI call retries performed by the finishing attempt.
 * @param createdAt      Creation time.
 * @param updatedAt      Last change.
 * @param completedAt    Time the job reached a terminal status.
 * @param error          The failure reason, set only for FAILED jobs.
 */
public record JobResponse(UUID id, UUID documentId, JobStatus status, double progress, String currentStage,
                          boolean cancelRequested, int attempts, int retryCount, LocalDateTime createdAt,
                          LocalDateTime updatedAt, LocalDateTime completedAt, String error) {

    public static JobResponse from(final ExtractionJob job) {
        return new JobResponse(job.getId(), job.getDocumentId(), job.getStatus(), job.getProgress(),
                               job.getCurrentStage(), job.isCancelRequested(), job.getAttempts(),
                               job.getRetryCount(), job.getCreatedAt(), job.getUpdatedAt(), job.getCompletedAt(),
                               job.getError());
    }
}
