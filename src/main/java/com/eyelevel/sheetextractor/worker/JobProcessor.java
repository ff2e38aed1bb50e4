package com.eyelevel.sheetextractor.worker;

import com.eyelevel.sheetextractor.exception.processing.ClaimLostException;
import com.eyelevel.sheetextractor.exception.processing.JobCanceledException;
import com.eyelevel.sheetextractor.exception.processing.StageExecutionException;
import com.eyelevel.sheetextractor.model.Document;
import com.eyelevel.sheetextractor.pipeline.PipelineExecutor;
import com.eyelevel.sheetextractor.pipeline.PipelineResult;
import com.eyelevel.sheetextractor.queue.QueueMessage;
import com.eyelevel.sheetextractor.queue.WorkQueue;
import com.eyelevel.sheetextractor.repository.DocumentRepository;
import com.eyelevel.sheetextractor.store.ClaimedJob;
import com.eyelevel.sheetextractor.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handles one delivered queue message: claim, run the pipeline, finalize, acknowledge.
 * <p>
 * The message is acknowledged once the job reached a state this worker no longer needs to act on: the claim
 * was refused, the job was finalized, or the claim was lost to another attempt. When an infrastructure failure
 * leaves the outcome unrecorded, the message is not acknowledged; the watchdog recovers the job once its
 * heartbeat goes stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobProcessor {

    static final String DOCUMENT_NOT_FOUND = "document_not_found";

    private final JobStore jobStore;
    private final PipelineExecutor pipelineExecutor;
    private final DocumentRepository documentRepository;
    private final WorkQueue workQueue;
    private final InFlightJobs inFlightJobs;

    public void process(final QueueMessage message) {
        final UUID jobId = message.jobId();
        final Optional<ClaimedJob> claimed = jobStore.claim(jobId);
        if (claimed.isEmpty()) {
            log.info("[{}] Nothing to do for this delivery. Acknowledging.", jobId);
            workQueue.ack(message.ackHandle());
            return;
        }

        final ClaimedJob claim = claimed.get();
        inFlightJobs.register(claim, message.ackHandle());
        try {
            if (run(claim)) {
                workQueue.ack(message.ackHandle());
            }
        } finally {
            inFlightJobs.remove(jobId);
        }
    }

    /**
     * Runs and finalizes a claimed job.
     *
     * @return true if the delivery can be acknowledged.
     */
    private boolean run(final ClaimedJob claim) {
        final UUID jobId = claim.jobId();
        final AtomicInteger retryCounter = new AtomicInteger();
        try {
            final Document document = documentRepository.findById(claim.documentId()).orElse(null);
            if (document == null) {
                jobStore.finalizeFailed(jobId, claim.token(), DOCUMENT_NOT_FOUND, 0);
                return true;
            }
            final PipelineResult result = pipelineExecutor.execute(claim, document, retryCounter);
            jobStore.finalizeCompleted(jobId, claim.token(), result, retryCounter.get());
            return true;
        } catch (final JobCanceledException e) {
            log.info("[{}] Cancellation observed by the pipeline.", jobId);
            jobStore.finalizeCanceled(jobId, claim.token(), retryCounter.get());
            return true;
        } catch (final StageExecutionException e) {
            log.error("[{}] Pipeline failed in stage {} ({}).", jobId, e.getStage(), e.getKind(), e);
            jobStore.finalizeFailed(jobId, claim.token(), e.getMessage(), retryCounter.get());
            return true;
        } catch (final ClaimLostException e) {
            log.warn("[{}] Claim {} lost while running. Another attempt owns the job now.", jobId, claim.token());
            return true;
        } catch (final CancellationException e) {
            log.warn("[{}] Worker interrupted. Leaving the delivery for redelivery.", jobId);
            return false;
        } catch (final RuntimeException e) {
            log.error("[{}] Could not record the outcome. Leaving the delivery for redelivery.", jobId, e);
            return false;
        }
    }
}
