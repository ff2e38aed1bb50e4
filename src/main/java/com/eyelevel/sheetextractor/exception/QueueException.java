package com.eyelevel.sheetextractor.exception;

import java.io.Serial;

/**
 * A work queue operation (send, receive, delete, visibility change) failed.
 */
public class QueueException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1177620419187014412L;

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
