package com.eyelevel.sheetextractor.pipeline.extractor;

import com.eyelevel.sheetextractor.ai.AiCallGateway;
import com.eyelevel.sheetextractor.ai.AiInferenceClient;
import com.eyelevel.sheetextractor.ai.AiInferenceRequest;
import com.eyelevel.sheetextractor.ai.AiInferenceResult;
import com.eyelevel.sheetextractor.exception.processing.ClaimLostException;
import com.eyelevel.sheetextractor.exception.processing.JobCanceledException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleConsumer;

/**
 * Job-scoped services an extractor may use: retried AI calls, progress reporting and cancellation checks.
 */
public class ExtractionContext {

    private final UUID jobId;
    private final String subtype;
    private final AiCallGateway gateway;
    private final int maxAttempts;
    private final AtomicInteger retryCounter;
    private final Runnable checkpoint;
    private final DoubleConsumer progress;

    /**
     * @param jobId        The running job.
     * @param subtype      The document subtype.
     * @param gateway      Retrying AI call gateway.
     * @param maxAttempts  Attempts per AI call, for error messages.
     * @param retryCounter Counts AI retries for the job.
     * @param checkpoint   Throws {@link JobCanceledException} or {@link ClaimLostException} when the job must stop.
     * @param progress     Receives the completed fraction of the extract stage.
     */
    public ExtractionContext(final UUID jobId, final String subtype, final AiCallGateway gateway,
                             final int maxAttempts, final AtomicInteger retryCounter, final Runnable checkpoint,
                             final DoubleConsumer progress) {
        this.jobId = jobId;
        this.subtype = subtype;
        this.gateway = gateway;
        this.maxAttempts = maxAttempts;
        this.retryCounter = retryCounter;
        this.checkpoint = checkpoint;
        this.progress = progress;
    }

    public UUID jobId() {
        return jobId;
    }

    public String subtype() {
        return subtype;
    }

    /**
     * Calls the AI client with the configured retry policy.
     *
     * @throws TransientProcessingException once all attempts failed, naming the attempt count.
     */
    public AiInferenceResult infer(final AiInferenceClient client, final AiInferenceRequest request) {
        try {
            return gateway.infer(client, request, retryCounter);
        } catch (final TransientProcessingException e) {
            throw new TransientProcessingException(
                    "AI inference failed after " + maxAttempts + " attempts: " + e.getMessage(), e);
        }
    }

    public void checkpoint() {
        checkpoint.run();
    }

    public void reportProgress(final double fraction) {
        progress.accept(fraction);
    }

    public int retryCount() {
        return retryCounter.get();
    }
}
