package com.eyelevel.sheetextractor.queue;

import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryWorkQueueTest {

    private InMemoryWorkQueue queue;

    @BeforeEach
    void setUp() {
        final ExtractionEngineConfig config = new ExtractionEngineConfig();
        config.getQueue().setVisibilityTimeout(Duration.ofMillis(150));
        queue = new InMemoryWorkQueue(config);
    }

    @Test
    void emptyQueueTimesOut() {
        assertThat(queue.dequeue(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void acknowledgedMessageIsGone() throws Exception {
        final UUID jobId = UUID.randomUUID();
        queue.enqueue(jobId);

        final QueueMessage message = queue.dequeue(Duration.ofMillis(100)).orElseThrow();
        queue.ack(message.ackHandle());
        Thread.sleep(200);

        assertThat(message.jobId()).isEqualTo(jobId);
        assertThat(queue.dequeue(Duration.ofMillis(50))).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void unacknowledgedMessageIsRedeliveredAfterVisibilityTimeout() {
        final UUID jobId = UUID.randomUUID();
        queue.enqueue(jobId);
        final QueueMessage first = queue.dequeue(Duration.ofMillis(100)).orElseThrow();

        assertThat(queue.dequeue(Duration.ofMillis(20))).isEmpty();
        final Optional<QueueMessage> redelivered = queue.dequeue(Duration.ofSeconds(2));

        assertThat(redelivered).isPresent();
        assertThat(redelivered.get().jobId()).isEqualTo(jobId);
        assertThat(redelivered.get().ackHandle()).isNotEqualTo(first.ackHandle());
    }

    @Test
    void extendingVisibilityDelaysRedelivery() {
        queue.enqueue(UUID.randomUUID());
        final QueueMessage message = queue.dequeue(Duration.ofMillis(100)).orElseThrow();

        queue.extendVisibility(message.ackHandle(), Duration.ofSeconds(30));

        assertThat(queue.dequeue(Duration.ofMillis(400))).isEmpty();
        assertThat(queue.inFlightCount()).isEqualTo(1);
    }

    @Test
    void duplicateEnqueuesAreDeliveredTwice() {
        final UUID jobId = UUID.randomUUID();
        queue.enqueue(jobId);
        queue.enqueue(jobId);

        assertThat(queue.dequeue(Duration.ofMillis(50))).map(QueueMessage::jobId).contains(jobId);
        assertThat(queue.dequeue(Duration.ofMillis(50))).map(QueueMessage::jobId).contains(jobId);
    }
}
