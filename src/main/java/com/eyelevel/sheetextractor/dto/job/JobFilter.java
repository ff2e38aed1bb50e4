package com.eyelevel.sheetextractor.dto.job;

import com.eyelevel.sheetextractor.model.JobStatus;

import java.util.UUID;

/**
 * Optional criteria for listing jobs. A null field matches everything.
 */
public record JobFilter(JobStatus status, UUID documentId) {

    public static JobFilter none() {
        return new JobFilter(null, null);
    }
}
