package com.eyelevel.sheetextractor.ai;

import com.eyelevel.sheetextractor.exception.processing.AiInvalidResponseException;
import com.eyelevel.sheetextractor.exception.processing.AiRateLimitedException;
import com.eyelevel.sheetextractor.exception.processing.AiTimeoutException;
import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;

/**
 * The external AI inference capability used by extractors. Implementations are expected to be slow and
 * occasionally flaky.
 */
public interface AiInferenceClient {

    /**
     * Turns one unit of tabular content into structured data.
     *
     * @param request The unit to extract from.
     * @return The structured payload and its confidence.
     * @throws AiTimeoutException          if the call timed out.
     * @throws AiRateLimitedException      if the service throttled the call.
     * @throws AiInvalidResponseException  if the answer is not a JSON object.
     * @throws TransientProcessingException for other retryable failures.
     * @throws PermanentProcessingException if the request itself is rejected.
     */
    AiInferenceResult infer(AiInferenceRequest request);
}
