package com.eyelevel.sheetextractor.ai;

import com.eyelevel.sheetextractor.exception.processing.AiRateLimitedException;
import com.eyelevel.sheetextractor.exception.processing.AiTimeoutException;
import com.eyelevel.sheetextractor.exception.processing.JobCanceledException;
import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import com.eyelevel.sheetextractor.pipeline.extractor.ExtractionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig(AiCallGatewayTest.RetryConfig.class)
@TestPropertySource(properties = {
        "app.pipeline.ai.retry.max-attempts=3",
        "app.pipeline.ai.retry.initial-delay-ms=1",
        "app.pipeline.ai.retry.multiplier=2.0",
        "app.pipeline.ai.retry.max-delay-ms=5"
})
class AiCallGatewayTest {

    @Configuration
    @EnableRetry
    @Import({AiCallGateway.class, AiCallRetryListener.class})
    static class RetryConfig {
    }

    @Autowired
    private AiCallGateway gateway;

    private AiInferenceClient client;
    private AiInferenceRequest request;

    @BeforeEach
    void setUp() {
        client = mock(AiInferenceClient.class);
        request = new AiInferenceRequest(UUID.randomUUID(), "Invoice", "xlsx", List.of("a"), List.of(Map.of("a", 1)));
    }

    @Test
    void timeoutIsRetriedUpToMaxAttemptsThenRethrown() {
        when(client.infer(any())).thenThrow(new AiTimeoutException("simulated timeout"));
        final AtomicInteger retries = new AtomicInteger();

        assertThatThrownBy(() -> gateway.infer(client, request, retries))
                .isInstanceOf(AiTimeoutException.class)
                .hasMessage("simulated timeout");
        verify(client, times(3)).infer(request);
        assertThat(retries).hasValue(2);
    }

    @Test
    void succeedsAfterTransientFailure() {
        final AiInferenceResult result = new AiInferenceResult(Map.of("records", List.of()), 0.9);
        when(client.infer(any())).thenThrow(new AiRateLimitedException("slow down")).thenReturn(result);
        final AtomicInteger retries = new AtomicInteger();

        assertThat(gateway.infer(client, request, retries)).isSameAs(result);
        assertThat(retries).hasValue(1);
    }

    @Test
    void permanentFailureIsNotRetried() {
        when(client.infer(any())).thenThrow(new PermanentProcessingException("ai_request_rejected", "status 401"));
        final AtomicInteger retries = new AtomicInteger();

        assertThatThrownBy(() -> gateway.infer(client, request, retries))
                .isInstanceOf(PermanentProcessingException.class);
        verify(client, times(1)).infer(request);
        assertThat(retries).hasValue(0);
    }

    @Test
    void cancellationIsNotRetried() {
        when(client.infer(any())).thenThrow(new JobCanceledException(request.jobId()));

        assertThatThrownBy(() -> gateway.infer(client, request, new AtomicInteger()))
                .isInstanceOf(JobCanceledException.class);
        verify(client, times(1)).infer(request);
    }

    @Test
    void extractionContextNamesTheAttemptCountWhenRetriesAreExhausted() {
        when(client.infer(any())).thenThrow(new AiTimeoutException("simulated timeout"));
        final AtomicInteger retries = new AtomicInteger();
        final ExtractionContext context = new ExtractionContext(request.jobId(), "xlsx", gateway, 3, retries, () -> {
        }, fraction -> {
        });

        assertThatThrownBy(() -> context.infer(client, request))
                .isInstanceOf(TransientProcessingException.class)
                .hasMessage("AI inference failed after 3 attempts: simulated timeout");
        assertThat(context.retryCount()).isEqualTo(2);
    }
}
