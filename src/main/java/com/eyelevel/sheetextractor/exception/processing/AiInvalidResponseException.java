package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;

/**
 * The AI service answered with a payload that is not the expected JSON object.
 */
public class AiInvalidResponseException extends TransientProcessingException {
    @Serial
    private static final long serialVersionUID = 1377914128893610447L;

    public AiInvalidResponseException(final String message) {
        super(message);
    }

    public AiInvalidResponseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
