package com.eyelevel.sheetextractor.store;

import java.util.UUID;

/**
 * A job successfully claimed by a worker. The token must accompany every later write for this attempt.
 *
 * @param jobId      The claimed job.
 * @param token      The fresh claim token.
 * @param documentId The document being processed.
 * @param attempt    The attempt number this claim started (1-based).
 */
public record ClaimedJob(UUID jobId, UUID token, UUID documentId, int attempt) {
}
