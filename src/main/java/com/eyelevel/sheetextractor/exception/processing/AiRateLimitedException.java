package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;

/**
 * The AI service answered 429.
 */
public class AiRateLimitedException extends TransientProcessingException {
    @Serial
    private static final long serialVersionUID = -822018745003419176L;

    public AiRateLimitedException(final String message) {
        super(message);
    }

    public AiRateLimitedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
