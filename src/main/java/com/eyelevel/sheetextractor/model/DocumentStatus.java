package com.eyelevel.sheetextractor.model;

/**
 * Processing state of an uploaded document, mirrored from the outcome of its latest job.
 */
public enum DocumentStatus {
    UPLOADED, PROCESSING, PROCESSED, ERROR
}
