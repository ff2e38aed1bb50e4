package com.eyelevel.sheetextractor.queue;

import com.eyelevel.sheetextractor.common.json.JsonParser;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.exception.QueueException;
import com.eyelevel.sheetextractor.exception.json.JsonParsingException;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link WorkQueue} on Amazon SQS. Sends go through Spring Cloud AWS's {@link SqsTemplate}; receives use the
 * SDK client directly because workers pull one message at a time with an explicit visibility timeout
 * instead of running a listener container.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.type", havingValue = "sqs", matchIfMissing = true)
public class SqsWorkQueue implements WorkQueue {

    private static final int MAX_LONG_POLL_SECONDS = 20;

    private final SqsTemplate sqsTemplate;
    private final SqsAsyncClient sqsAsyncClient;
    private final JsonParser jsonParser;
    private final String queueName;
    private final Duration visibilityTimeout;
    private volatile String queueUrl;

    public SqsWorkQueue(final SqsTemplate sqsTemplate, final SqsAsyncClient sqsAsyncClient,
                        @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                        final ExtractionEngineConfig engineConfig) {
        this.sqsTemplate = sqsTemplate;
        this.sqsAsyncClient = sqsAsyncClient;
        this.jsonParser = jsonParser;
        this.queueName = engineConfig.getQueue().getName();
        this.visibilityTimeout = engineConfig.getQueue().getVisibilityTimeout();
    }

    @Override
    public void enqueue(final UUID jobId) {
        sqsTemplate.send(to -> to.queue(queueName).payload(Map.of("jobId", jobId.toString())));
        log.info("[{}] Sent job message to queue '{}'.", jobId, queueName);
    }

    @Override
    public Optional<QueueMessage> dequeue(final Duration timeout) {
        final int waitSeconds = (int) Math.max(0, Math.min(MAX_LONG_POLL_SECONDS, timeout.toSeconds()));
        final ReceiveMessageRequest request = ReceiveMessageRequest.builder().queueUrl(resolveQueueUrl())
                                                                   .maxNumberOfMessages(1)
                                                                   .waitTimeSeconds(waitSeconds)
                                                                   .visibilityTimeout(
                                                                           (int) visibilityTimeout.toSeconds())
                                                                   .build();
        final ReceiveMessageResponse response = await(sqsAsyncClient.receiveMessage(request), "receive");
        if (!response.hasMessages() || response.messages().isEmpty()) {
            return Optional.empty();
        }
        final Message message = response.messages().get(0);
        final UUID jobId = readJobId(message);
        if (jobId == null) {
            // Redelivering it would fail the same way every time.
            ack(message.receiptHandle());
            log.error("Deleted malformed message {} from queue '{}'.", message.messageId(), queueName);
            return Optional.empty();
        }
        log.debug("[{}] Received message {}.", jobId, message.messageId());
        return Optional.of(new QueueMessage(jobId, message.receiptHandle()));
    }

    @Override
    public void ack(final String ackHandle) {
        await(sqsAsyncClient.deleteMessage(
                DeleteMessageRequest.builder().queueUrl(resolveQueueUrl()).receiptHandle(ackHandle).build()), "delete");
    }

    @Override
    public void extendVisibility(final String ackHandle, final Duration extension) {
        await(sqsAsyncClient.changeMessageVisibility(
                ChangeMessageVisibilityRequest.builder().queueUrl(resolveQueueUrl()).receiptHandle(ackHandle)
                                              .visibilityTimeout((int) extension.toSeconds()).build()),
              "change visibility");
    }

    private UUID readJobId(final Message message) {
        if (message.body() == null || message.body().isBlank()) {
            log.error("Message {} has an empty body.", message.messageId());
            return null;
        }
        try {
            final JobMessage body = jsonParser.parseObject(message.body(), JobMessage.class);
            if (body == null || body.jobId() == null) {
                log.error("Message {} carries no jobId: {}", message.messageId(), message.body());
                return null;
            }
            return body.jobId();
        } catch (final JsonParsingException e) {
            log.error("Message {} is not a job message: {}", message.messageId(), message.body(), e);
            return null;
        }
    }

    private String resolveQueueUrl() {
        if (queueUrl == null) {
            queueUrl = await(sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build()),
                             "get queue url").queueUrl();
            log.info("Resolved SQS queue '{}' to {}", queueName, queueUrl);
        }
        return queueUrl;
    }

    private <T> T await(final CompletableFuture<T> future, final String operation) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueException("Interrupted during SQS " + operation + " on queue " + queueName, e);
        } catch (final ExecutionException e) {
            throw new QueueException("SQS " + operation + " failed on queue " + queueName, e.getCause());
        }
    }
}
