package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;

/**
 * A failure that may succeed when attempted again. The AI call gateway retries on this type.
 */
public class TransientProcessingException extends ProcessingException {
    @Serial
    private static final long serialVersionUID = 7422853174510826925L;

    public TransientProcessingException(final String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientProcessingException(final String message, final Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
