package com.eyelevel.sheetextractor.exception.processing;

import lombok.Getter;

import java.io.Serial;

/**
 * A failure caused by the input itself. Never retried.
 * <p>
 * The {@code reason} is a stable code such as {@code unsupported_format}, {@code corrupt_file},
 * {@code file_too_large}, {@code empty_document} or {@code validation_failed}.
 */
@Getter
public class PermanentProcessingException extends ProcessingException {
    @Serial
    private static final long serialVersionUID = -3861021779232431467L;

    private final String reason;

    public PermanentProcessingException(final String reason, final String detail) {
        super(ErrorKind.PERMANENT, detail == null ? reason : reason + ": " + detail);
        this.reason = reason;
    }

    public PermanentProcessingException(final String reason, final String detail, final Throwable cause) {
        super(ErrorKind.PERMANENT, detail == null ? reason : reason + ": " + detail, cause);
        this.reason = reason;
    }
}
