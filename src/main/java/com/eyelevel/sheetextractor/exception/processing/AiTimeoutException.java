package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;

/**
 * The AI call did not complete in time.
 */
public class AiTimeoutException extends TransientProcessingException {
    @Serial
    private static final long serialVersionUID = 4126650832210973951L;

    public AiTimeoutException(final String message) {
        super(message);
    }

    public AiTimeoutException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
