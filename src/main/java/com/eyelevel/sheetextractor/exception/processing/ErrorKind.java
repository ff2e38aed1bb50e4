package com.eyelevel.sheetextractor.exception.processing;

/**
 * Classifies a processing failure for retry decisions and for the collapsed job error message.
 */
public enum ErrorKind {
    /**
     * May succeed if attempted again (AI timeouts, rate limits, flaky responses).
     */
    TRANSIENT,
    /**
     * Will fail the same way on every attempt (bad input, unsupported format).
     */
    PERMANENT,
    /**
     * Cooperative cancellation.
     */
    CANCELED;

    public String label() {
        return name().toLowerCase();
    }
}
