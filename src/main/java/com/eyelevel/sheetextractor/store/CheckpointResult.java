package com.eyelevel.sheetextractor.store;

/**
 * What a running pipeline should do at a checkpoint.
 */
public enum CheckpointResult {
    CONTINUE,
    CANCEL_REQUESTED,
    /**
     * The token is no longer current or the job is already terminal; stop without writing.
     */
    CLAIM_LOST
}
