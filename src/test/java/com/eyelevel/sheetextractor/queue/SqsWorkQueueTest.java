package com.eyelevel.sheetextractor.queue;

import com.eyelevel.sheetextractor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SqsWorkQueueTest {

    private static final String QUEUE_URL = "https://sqs.eu-west-1.amazonaws.com/000000000000/extraction-jobs";

    @Mock
    private SqsTemplate sqsTemplate;
    @Mock
    private SqsAsyncClient sqsAsyncClient;

    private SqsWorkQueue queue;

    @BeforeEach
    void setUp() {
        final ExtractionEngineConfig config = new ExtractionEngineConfig();
        config.getQueue().setName("extraction-jobs");
        queue = new SqsWorkQueue(sqsTemplate, sqsAsyncClient, new JacksonJsonParser(new ObjectMapper()), config);
        when(sqsAsyncClient.getQueueUrl(any(GetQueueUrlRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build()));
    }

    @Test
    void deliversJobMessage() {
        final UUID jobId = UUID.randomUUID();
        receive("{\"jobId\":\"" + jobId + "\"}");

        final Optional<QueueMessage> message = queue.dequeue(Duration.ofSeconds(1));

        assertThat(message).contains(new QueueMessage(jobId, "receipt-1"));
        verify(sqsAsyncClient, never()).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void malformedBodyIsDeletedInsteadOfRedelivered() {
        receive("not-json");
        when(sqsAsyncClient.deleteMessage(any(DeleteMessageRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(DeleteMessageResponse.builder().build()));

        assertThat(queue.dequeue(Duration.ofSeconds(1))).isEmpty();

        final ArgumentCaptor<DeleteMessageRequest> delete = ArgumentCaptor.forClass(DeleteMessageRequest.class);
        verify(sqsAsyncClient).deleteMessage(delete.capture());
        assertThat(delete.getValue().receiptHandle()).isEqualTo("receipt-1");
        assertThat(delete.getValue().queueUrl()).isEqualTo(QUEUE_URL);
    }

    @Test
    void bodyWithoutJobIdIsDeleted() {
        receive("{\"jobId\":null}");
        when(sqsAsyncClient.deleteMessage(any(DeleteMessageRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(DeleteMessageResponse.builder().build()));

        assertThat(queue.dequeue(Duration.ofSeconds(1))).isEmpty();
        verify(sqsAsyncClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void emptyReceiveReturnsNothing() {
        when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().build()));

        assertThat(queue.dequeue(Duration.ofSeconds(1))).isEmpty();
    }

    private void receive(final String body) {
        final Message message = Message.builder().messageId("message-1").receiptHandle("receipt-1").body(body).build();
        when(sqsAsyncClient.receiveMessage(any(ReceiveMessageRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().messages(message).build()));
    }
}
