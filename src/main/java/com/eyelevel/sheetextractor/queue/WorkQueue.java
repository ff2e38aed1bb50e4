package com.eyelevel.sheetextractor.queue;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable at-least-once delivery of job ids to workers.
 * <p>
 * A dequeued message stays invisible to other consumers for the visibility timeout. If it is not
 * acknowledged in that window it is delivered again, possibly to another worker. Duplicate deliveries are
 * expected and absorbed by the claim compare-and-set.
 */
public interface WorkQueue {

    void enqueue(UUID jobId);

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @param timeout Maximum time to block.
     * @return The message, or empty if none arrived in time.
     */
    Optional<QueueMessage> dequeue(Duration timeout);

    /**
     * Removes a delivered message for good.
     */
    void ack(String ackHandle);

    /**
     * Keeps a delivered message hidden for another {@code extension}, measured from now.
     */
    void extendVisibility(String ackHandle, Duration extension);
}
