package com.eyelevel.sheetextractor.queue;

import java.util.UUID;

/**
 * Wire body of a queued job: {@code {"jobId": "..."}}.
 */
public record JobMessage(UUID jobId) {
}
