package com.eyelevel.sheetextractor.store;

/**
 * How the watchdog resolved one stale PROCESSING job.
 */
public enum StaleJobOutcome {
    CANCELED,
    FAILED,
    REQUEUED,
    /**
     * The job changed in the meantime (finished, or its worker resumed heartbeats).
     */
    UNCHANGED
}
