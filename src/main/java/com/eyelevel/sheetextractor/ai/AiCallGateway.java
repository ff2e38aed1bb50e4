package com.eyelevel.sheetextractor.ai;

import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the AI client with bounded retries. Only {@link TransientProcessingException} is retried, with
 * exponential backoff; permanent failures and cancellation pass through at once. When the attempts are
 * used up the last transient failure is rethrown.
 */
@Slf4j
@Component
public class AiCallGateway {

    /**
     * Runs one AI call under the retry policy.
     *
     * @param client       The AI client to call.
     * @param request      The unit to extract.
     * @param retryCounter Incremented once for every retry (not for the first attempt).
     * @return The result of the first successful attempt.
     */
    @Retryable(retryFor = TransientProcessingException.class,
               noRetryFor = PermanentProcessingException.class,
               maxAttemptsExpression = "${app.pipeline.ai.retry.max-attempts:3}",
               backoff = @Backoff(delayExpression = "${app.pipeline.ai.retry.initial-delay-ms:500}",
                                  multiplierExpression = "${app.pipeline.ai.retry.multiplier:2.0}",
                                  maxDelayExpression = "${app.pipeline.ai.retry.max-delay-ms:5000}"),
               listeners = {"aiCallRetryListener"})
    public AiInferenceResult infer(final AiInferenceClient client, final AiInferenceRequest request,
                                   final AtomicInteger retryCounter) {
        final RetryContext context = RetrySynchronizationManager.getContext();
        if (context != null && context.getRetryCount() > 0) {
            retryCounter.incrementAndGet();
            log.info("[{}] Retrying AI call for sheet '{}' (retry {}).", request.jobId(), request.unitName(),
                     context.getRetryCount());
        }
        return client.infer(request);
    }
}
