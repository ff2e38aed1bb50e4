package com.eyelevel.sheetextractor.store;

import com.eyelevel.sheetextractor.model.DocumentStatus;
import com.eyelevel.sheetextractor.model.Extraction;
import com.eyelevel.sheetextractor.model.ExtractionJob;
import com.eyelevel.sheetextractor.model.JobStatus;
import com.eyelevel.sheetextractor.pipeline.PipelineResult;
import com.eyelevel.sheetextractor.queue.AfterCommitEnqueuer;
import com.eyelevel.sheetextractor.repository.DocumentRepository;
import com.eyelevel.sheetextractor.repository.ExtractionJobRepository;
import com.eyelevel.sheetextractor.repository.ExtractionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The single writer of job state once a job exists.
 * <p>
 * Every method runs in its own transaction ({@code Propagation.REQUIRES_NEW}) so a recorded state change is
 * durable regardless of what the caller does next. Each write is a compare-and-set against the expected
 * current state; a lost race returns {@code false} (or an empty result) and writes nothing. Writes made on
 * behalf of a running attempt are additionally guarded by the attempt's claim token, so a worker whose claim
 * was revoked or superseded can no longer change the job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    static final String STAGE_CLAIMED = "CLAIMED";
    static final String STAGE_REQUEUED = "REQUEUED";
    static final String WORKER_LOST = "worker_lost";

    private final ExtractionJobRepository jobRepository;
    private final ExtractionRepository extractionRepository;
    private final DocumentRepository documentRepository;
    private final AfterCommitEnqueuer afterCommitEnqueuer;

    /**
     * Claims a job for processing: PENDING → PROCESSING, or takes over a PROCESSING job whose previous claim
     * was revoked by the watchdog. Assigns a fresh token, consumes one attempt and marks the document
     * PROCESSING in the same transaction.
     *
     * @param jobId The job to claim.
     * @return The claim, or empty if the job is missing, terminal, or held by another worker.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ClaimedJob> claim(final UUID jobId) {
        final UUID token = UUID.randomUUID();
        final int updated = jobRepository.claim(jobId, token, LocalDateTime.now(), STAGE_CLAIMED,
                                                JobStatus.PENDING, JobStatus.PROCESSING);
        if (updated == 0) {
            log.info("[{}] Claim rejected: job is missing, terminal or already claimed.", jobId);
            return Optional.empty();
        }
        final ExtractionJob job = jobRepository.findById(jobId).orElseThrow();
        documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.PROCESSING, null, LocalDateTime.now());
        log.info("[{}] Claimed with token {} (attempt {}/{}).", jobId, token, job.getAttempts(),
                 job.getMaxAttempts());
        return Optional.of(new ClaimedJob(jobId, token, job.getDocumentId(), job.getAttempts()));
    }

    /**
     * Records progress for the holder of {@code token}. Ignored unless the job is PROCESSING under that token
     * and the value does not go backwards. Also refreshes the heartbeat.
     *
     * @return true if the write was accepted.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean updateProgress(final UUID jobId, final UUID token, final double percent) {
        if (token == null || Double.isNaN(percent)) {
            return false;
        }
        final double clamped = Math.max(0.0, Math.min(100.0, percent));
        final boolean accepted = jobRepository.advanceProgress(jobId, token, clamped, LocalDateTime.now(),
                                                               JobStatus.PROCESSING) == 1;
        if (!accepted) {
            log.debug("[{}] Progress {} rejected for token {}.", jobId, clamped, token);
        }
        return accepted;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markStage(final UUID jobId, final UUID token, final String stage) {
        return jobRepository.markStage(jobId, token, stage, LocalDateTime.now(), JobStatus.PROCESSING) == 1;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean heartbeat(final UUID jobId, final UUID token) {
        return jobRepository.heartbeat(jobId, token, LocalDateTime.now(), JobStatus.PROCESSING) == 1;
    }

    /**
     * Reads the current job row and tells the running attempt whether to go on.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public CheckpointResult checkpoint(final UUID jobId, final UUID token) {
        final ExtractionJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PROCESSING || !token.equals(job.getAttemptToken())) {
            return CheckpointResult.CLAIM_LOST;
        }
        return job.isCancelRequested() ? CheckpointResult.CANCEL_REQUESTED : CheckpointResult.CONTINUE;
    }

    /**
     * Atomically completes the job, stores its extraction and marks the document PROCESSED. Exactly one
     * call can win per job; a loser writes nothing.
     *
     * @param jobId      The job.
     * @param token      The claim token of the finishing attempt.
     * @param result     The pipeline output.
     * @param retryCount Transient AI retries performed by this attempt.
     * @return true if this call completed the job.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean finalizeCompleted(final UUID jobId, final UUID token, final PipelineResult result,
                                     final int retryCount) {
        final LocalDateTime now = LocalDateTime.now();
        final int updated = jobRepository.finalizeClaimed(jobId, token, JobStatus.COMPLETED, 100.0, null, retryCount,
                                                          JobStatus.COMPLETED.name(), now, JobStatus.PROCESSING);
        if (updated == 0) {
            log.warn("[{}] Completion rejected for token {}: claim is no longer current.", jobId, token);
            return false;
        }
        final ExtractionJob job = jobRepository.findById(jobId).orElseThrow();

        final Extraction extraction = new Extraction();
        extraction.setId(Extraction.idForJob(jobId));
        extraction.setJobId(jobId);
        extraction.setDocumentId(job.getDocumentId());
        extraction.setExtractedData(result.extractedData());
        extraction.setConfidenceScore(result.confidence());
        extraction.setFormatType(result.formatType());
        extraction.setValidationResults(result.validationResults());
        extraction.setExtractedAt(now);
        extractionRepository.saveAndFlush(extraction);

        documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.PROCESSED, null, now);
        log.info("[{}] Marked COMPLETED with extraction {} (confidence {}).", jobId, extraction.getId(),
                 result.confidence());
        return true;
    }

    /**
     * Fails the job held under {@code token} and mirrors the error onto the document.
     *
     * @return true if this call failed the job.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean finalizeFailed(final UUID jobId, final UUID token, final String error, final int retryCount) {
        final LocalDateTime now = LocalDateTime.now();
        final ExtractionJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            return false;
        }
        final int updated = jobRepository.finalizeClaimed(jobId, token, JobStatus.FAILED, job.getProgress(), error,
                                                          retryCount, JobStatus.FAILED.name(), now,
                                                          JobStatus.PROCESSING);
        if (updated == 0) {
            log.warn("[{}] Failure rejected for token {}: claim is no longer current.", jobId, token);
            return false;
        }
        documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.ERROR, error, now);
        log.error("[{}] Marked FAILED. Reason: {}", jobId, error);
        return true;
    }

    /**
     * Cancels the job held under {@code token} after the pipeline observed the cancellation request. The
     * document returns to UPLOADED.
     *
     * @return true if this call canceled the job.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean finalizeCanceled(final UUID jobId, final UUID token, final int retryCount) {
        final LocalDateTime now = LocalDateTime.now();
        final ExtractionJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            return false;
        }
        final int updated = jobRepository.finalizeClaimed(jobId, token, JobStatus.CANCELED, job.getProgress(), null,
                                                          retryCount, JobStatus.CANCELED.name(), now,
                                                          JobStatus.PROCESSING);
        if (updated == 0) {
            log.warn("[{}] Cancellation rejected for token {}: claim is no longer current.", jobId, token);
            return false;
        }
        documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.UPLOADED, null, now);
        log.info("[{}] Marked CANCELED at {}%.", jobId, job.getProgress());
        return true;
    }

    /**
     * PENDING → CANCELED. The queue message is left in place; the worker that receives it fails to claim
     * and acknowledges it.
     *
     * @return true if the job was still PENDING and is now CANCELED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancelPending(final UUID jobId) {
        return jobRepository.cancelPending(jobId, LocalDateTime.now(), JobStatus.CANCELED.name(), JobStatus.PENDING,
                                           JobStatus.CANCELED) == 1;
    }

    /**
     * Sets the cooperative cancellation flag on a PROCESSING job.
     *
     * @return true if the job was PROCESSING.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean requestCancel(final UUID jobId) {
        return jobRepository.requestCancel(jobId, LocalDateTime.now(), JobStatus.PROCESSING) == 1;
    }

    @Transactional(readOnly = true)
    public List<ExtractionJob> findStaleProcessing(final LocalDateTime staleBefore) {
        return jobRepository.findByStatusAndHeartbeatAtBefore(JobStatus.PROCESSING, staleBefore);
    }

    @Transactional(readOnly = true)
    public List<ExtractionJob> findPendingUntouchedSince(final LocalDateTime threshold) {
        return jobRepository.findByStatusAndUpdatedAtBefore(JobStatus.PENDING, threshold);
    }

    /**
     * Re-enqueues a PENDING job that has not been touched since {@code threshold}. The job is stamped in the
     * same transaction and the message is sent after commit, so concurrent or back-to-back watchdog passes
     * enqueue it at most once per threshold window.
     *
     * @return true if this call won the re-enqueue.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean requeuePending(final UUID jobId, final LocalDateTime threshold) {
        if (jobRepository.touchPending(jobId, threshold, LocalDateTime.now(), JobStatus.PENDING) == 0) {
            log.debug("[{}] Re-enqueue skipped: job left PENDING or was re-enqueued recently.", jobId);
            return false;
        }
        afterCommitEnqueuer.enqueueAfterCommit(jobId);
        return true;
    }

    /**
     * Resolves one PROCESSING job whose worker stopped sending heartbeats before {@code staleBefore}:
     * cancels it if cancellation was requested, fails it with {@code worker_lost} once its attempts are
     * used up, and otherwise revokes the claim and re-enqueues the job after commit.
     *
     * @param job         The stale job as read by the watchdog.
     * @param staleBefore The heartbeat cutoff, re-checked by every update.
     * @return What was done.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StaleJobOutcome recoverStale(final ExtractionJob job, final LocalDateTime staleBefore) {
        final UUID jobId = job.getId();
        final LocalDateTime now = LocalDateTime.now();

        if (job.isCancelRequested()) {
            if (jobRepository.finalizeStale(jobId, JobStatus.CANCELED, null, JobStatus.CANCELED.name(), staleBefore,
                                            now, JobStatus.PROCESSING) == 1) {
                documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.UPLOADED, null, now);
                log.warn("[{}] Stale job had a pending cancellation. Marked CANCELED.", jobId);
                return StaleJobOutcome.CANCELED;
            }
            return StaleJobOutcome.UNCHANGED;
        }

        if (job.getAttempts() >= job.getMaxAttempts()) {
            if (jobRepository.finalizeStale(jobId, JobStatus.FAILED, WORKER_LOST, JobStatus.FAILED.name(),
                                            staleBefore, now, JobStatus.PROCESSING) == 1) {
                documentRepository.updateStatus(job.getDocumentId(), DocumentStatus.ERROR, WORKER_LOST, now);
                log.error("[{}] Worker lost after {} attempts. Marked FAILED.", jobId, job.getAttempts());
                return StaleJobOutcome.FAILED;
            }
            return StaleJobOutcome.UNCHANGED;
        }

        if (jobRepository.revokeStaleClaim(jobId, STAGE_REQUEUED, staleBefore, now, JobStatus.PROCESSING) == 1) {
            afterCommitEnqueuer.enqueueAfterCommit(jobId);
            log.warn("[{}] Worker stopped heartbeating (attempt {}/{}). Claim revoked and job re-enqueued.", jobId,
                     job.getAttempts(), job.getMaxAttempts());
            return StaleJobOutcome.REQUEUED;
        }
        return StaleJobOutcome.UNCHANGED;
    }
}
