package com.eyelevel.sheetextractor.exception.processing;

import java.io.Serial;
import java.util.UUID;

/**
 * Raised at a pipeline checkpoint once cancellation of the running job has been requested.
 */
public class JobCanceledException extends ProcessingException {
    @Serial
    private static final long serialVersionUID = 1863072470924383170L;

    public JobCanceledException(final UUID jobId) {
        super(ErrorKind.CANCELED, "Job " + jobId + " was canceled");
    }
}
