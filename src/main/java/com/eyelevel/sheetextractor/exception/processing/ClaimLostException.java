package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;
import java.util.UUID;

/**
 * Raised at a pipeline checkpoint when this worker's claim token is no longer current, e.g. after the
 * watchdog handed the job to another worker or the job was finalized elsewhere. The worker stops
 * without writing anything.
 */
public class ClaimLostException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6717296113702385740L;

    public ClaimLostException(final UUID jobId, final UUID token) {
        super("Claim " + token + " on job " + jobId + " is no longer valid");
    }
}
