package com.eyelevel.sheetextractor.exception.processing;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for failures raised inside the extraction pipeline.
 */
@Getter
public abstract class ProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1949513620150307386L;

    private final ErrorKind kind;

    protected ProcessingException(final ErrorKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected ProcessingException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
