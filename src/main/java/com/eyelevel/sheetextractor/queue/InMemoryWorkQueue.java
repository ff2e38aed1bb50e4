package com.eyelevel.sheetextractor.queue;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link WorkQueue} for local runs and tests. Keeps SQS semantics: a delivered message is hidden
 * until acknowledged or until its visibility timeout expires, after which it is delivered again.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.type", havingValue = "memory")
public class InMemoryWorkQueue implements WorkQueue {

    private static final long POLL_SLICE_MILLIS = 50;

    private final LinkedBlockingQueue<UUID> ready = new LinkedBlockingQueue<>();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Duration visibilityTimeout;

    public InMemoryWorkQueue(final ExtractionEngineConfig engineConfig) {
        this.visibilityTimeout = engineConfig.getQueue().getVisibilityTimeout();
    }

    @Override
    public void enqueue(final UUID jobId) {
        ready.add(jobId);
        log.debug("[{}] Enqueued in memory.", jobId);
    }

    @Override
    public Optional<QueueMessage> dequeue(final Duration timeout) {
        final long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                redeliverExpired();
                final long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                final UUID jobId = ready.poll(Math.max(0, Math.min(POLL_SLICE_MILLIS, remainingMillis)),
                                              TimeUnit.MILLISECONDS);
                if (jobId != null) {
                    final String handle = UUID.randomUUID().toString();
                    inFlight.put(handle, new InFlight(jobId, System.nanoTime() + visibilityTimeout.toNanos()));
                    return Optional.of(new QueueMessage(jobId, handle));
                }
                if (System.nanoTime() >= deadline) {
                    return Optional.empty();
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void ack(final String ackHandle) {
        inFlight.remove(ackHandle);
    }

    @Override
    public void extendVisibility(final String ackHandle, final Duration extension) {
        inFlight.computeIfPresent(ackHandle,
                                  (handle, message) -> new InFlight(message.jobId(),
                                                                    System.nanoTime() + extension.toNanos()));
    }

    /**
     * Messages waiting for delivery plus messages delivered but not yet acknowledged.
     */
    public int size() {
        return ready.size() + inFlight.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void redeliverExpired() {
        final long now = System.nanoTime();
        inFlight.forEach((handle, message) -> {
            if (message.visibleAt() - now <= 0 && inFlight.remove(handle, message)) {
                log.info("[{}] Visibility timeout expired. Redelivering.", message.jobId());
                ready.add(message.jobId());
            }
        });
    }

    private record InFlight(UUID jobId, long visibleAt) {
    }
}
