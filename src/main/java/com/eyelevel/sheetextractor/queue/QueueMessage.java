package com.eyelevel.sheetextractor.queue;

import java.util.UUID;

/**
 * A delivered job id together with the handle needed to acknowledge it or extend its visibility.
 */
public record QueueMessage(UUID jobId, String ackHandle) {
}
