package com.eyelevel.sheetextractor.pipeline;

import com.eyelevel.sheetextractor.ai.AiCallGateway;
import com.eyelevel.sheetextractor.ai.AiInferenceClient;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig.ValidationFailurePolicy;
import com.eyelevel.sheetextractor.exception.processing.ClaimLostException;
import com.eyelevel.sheetextractor.exception.processing.ErrorKind;
import com.eyelevel.sheetextractor.exception.processing.JobCanceledException;
import com.eyelevel.sheetextractor.exception.processing.StageExecutionException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import com.eyelevel.sheetextractor.model.Document;
import com.eyelevel.sheetextractor.pipeline.extractor.Extractor;
import com.eyelevel.sheetextractor.pipeline.extractor.ExtractorOutput;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedSheet;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedWorkbook;
import com.eyelevel.sheetextractor.pipeline.parser.Parser;
import com.eyelevel.sheetextractor.pipeline.registry.PipelineModule;
import com.eyelevel.sheetextractor.pipeline.registry.PipelineRegistry;
import com.eyelevel.sheetextractor.pipeline.registry.PipelineStages;
import com.eyelevel.sheetextractor.pipeline.validator.ValidationOutcome;
import com.eyelevel.sheetextractor.pipeline.validator.Validator;
import com.eyelevel.sheetextractor.storage.ObjectStore;
import com.eyelevel.sheetextractor.store.CheckpointResult;
import com.eyelevel.sheetextractor.store.ClaimedJob;
import com.eyelevel.sheetextractor.store.JobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineExecutorTest {

    private static final byte[] CONTENT = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);

    private final Parser parser = mock(Parser.class);
    private final Extractor extractor = mock(Extractor.class);
    private final Validator validator = mock(Validator.class);
    private final ObjectStore objectStore = mock(ObjectStore.class);
    private final JobStore jobStore = mock(JobStore.class);
    private final ExtractionEngineConfig engineConfig = new ExtractionEngineConfig();
    private final ClaimedJob claim = new ClaimedJob(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 1);

    private ThreadPoolTaskExecutor stageExecutor;
    private PipelineExecutor executor;
    private Document document;

    @BeforeEach
    void setUp() {
        stageExecutor = new ThreadPoolTaskExecutor();
        stageExecutor.setCorePoolSize(2);
        stageExecutor.setThreadNamePrefix("test-stage-");
        stageExecutor.initialize();

        final PipelineStages stages = new PipelineStages(parser, extractor, validator);
        final PipelineRegistry registry = new PipelineRegistry(List.of(new PipelineModule() {
            @Override
            public Set<String> subtypes() {
                return Set.of("csv");
            }

            @Override
            public PipelineStages stages() {
                return stages;
            }
        }));
        executor = new PipelineExecutor(registry, objectStore, jobStore, mock(AiInferenceClient.class),
                                        mock(AiCallGateway.class), stageExecutor, engineConfig);

        document = new Document();
        document.setId(claim.documentId());
        document.setFilename("invoice.csv");
        document.setFileSize(CONTENT.length);
        document.setStorageRef("docs/invoice.csv");

        when(jobStore.checkpoint(claim.jobId(), claim.token())).thenReturn(CheckpointResult.CONTINUE);
        when(objectStore.get("docs/invoice.csv")).thenAnswer(invocation -> new ByteArrayInputStream(CONTENT));
        when(parser.parse(any(), any())).thenReturn(new ParsedWorkbook(
                List.of(new ParsedSheet("invoice", List.of("a", "b"), List.of(Map.of("a", 1L, "b", 2L))))));
        when(extractor.extract(any(), any(), any())).thenReturn(
                new ExtractorOutput(Map.of("records", List.of(Map.of("a", 1L))), 0.8, List.of()));
        when(validator.validate(any())).thenReturn(ValidationOutcome.of(List.of(), List.of(), "table"));
    }

    @AfterEach
    void tearDown() {
        stageExecutor.shutdown();
    }

    @Test
    void runsAllStagesAndReportsProgress() {
        final PipelineResult result = executor.execute(claim, document, new AtomicInteger());

        assertThat(result.confidence()).isEqualTo(0.8);
        assertThat(result.formatType()).isEqualTo("table");
        assertThat(result.extractedData()).containsKey("records");
        assertThat(result.validationResults()).containsEntry("valid", true);

        final var order = inOrder(jobStore);
        order.verify(jobStore).markStage(claim.jobId(), claim.token(), "PARSE");
        order.verify(jobStore).updateProgress(claim.jobId(), claim.token(), 30.0);
        order.verify(jobStore).markStage(claim.jobId(), claim.token(), "EXTRACT");
        order.verify(jobStore).updateProgress(claim.jobId(), claim.token(), 80.0);
        order.verify(jobStore).markStage(claim.jobId(), claim.token(), "VALIDATE");
    }

    @Test
    void unsupportedSubtypeFailsInParseWithoutReadingTheFile() {
        document.setFilename("scan.pdf");
        final AtomicInteger retries = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(claim, document, retries))
                .isInstanceOf(StageExecutionException.class)
                .hasMessage("parse: permanent: unsupported_format: no pipeline for subtype 'pdf'")
                .satisfies(e -> assertThat(((StageExecutionException) e).getStage()).isEqualTo(PipelineStage.PARSE));
        assertThat(retries).hasValue(0);
        verifyNoInteractions(objectStore, extractor);
    }

    @Test
    void declaredTypeWinsOverExtension() {
        document.setFilename("export.txt");
        document.setDeclaredType("CSV");

        assertThat(PipelineExecutor.resolveSubtype(document)).isEqualTo("csv");
        assertThat(executor.execute(claim, document, new AtomicInteger()).formatType()).isEqualTo("table");
    }

    @Test
    void oversizedFileFailsInParse() {
        engineConfig.getPipeline().setMaxFileSize(4);

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageStartingWith("parse: permanent: file_too_large");
        verify(parser, never()).parse(any(), any());
    }

    @Test
    void cancellationIsObservedAtTheNextStageBoundary() {
        when(jobStore.checkpoint(claim.jobId(), claim.token())).thenReturn(CheckpointResult.CONTINUE,
                                                                          CheckpointResult.CANCEL_REQUESTED);

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOf(JobCanceledException.class);
        verify(extractor, never()).extract(any(), any(), any());
    }

    @Test
    void lostClaimStopsThePipeline() {
        when(jobStore.checkpoint(claim.jobId(), claim.token())).thenReturn(CheckpointResult.CLAIM_LOST);

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOf(ClaimLostException.class);
        verify(jobStore, never()).markStage(any(), any(), anyString());
    }

    @Test
    void extractorFailureIsWrappedWithItsStage() {
        when(extractor.extract(any(), any(), any())).thenThrow(
                new TransientProcessingException("AI inference failed after 3 attempts: simulated timeout"));

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessage("extract: transient: AI inference failed after 3 attempts: simulated timeout");
        verify(validator, never()).validate(any());
    }

    @Test
    void extractTimeoutIsTransient() {
        engineConfig.getPipeline().getTimeouts().setExtract(Duration.ofMillis(100));
        when(extractor.extract(any(), any(), any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        });

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOfSatisfying(StageExecutionException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(PipelineStage.EXTRACT);
                    assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT);
                });
    }

    @Test
    void invalidDataIsAnnotatedByDefault() {
        when(validator.validate(any())).thenReturn(
                ValidationOutcome.of(List.of("no_data_extracted"), List.of(), "table"));

        final PipelineResult result = executor.execute(claim, document, new AtomicInteger());

        assertThat(result.validationResults()).containsEntry("valid", false)
                                              .containsEntry("errors", List.of("no_data_extracted"));
    }

    @Test
    void invalidDataFailsTheJobUnderFailPolicy() {
        engineConfig.getPipeline().setValidationFailurePolicy(ValidationFailurePolicy.FAIL);
        when(validator.validate(any())).thenReturn(
                ValidationOutcome.of(List.of("no_data_extracted"), List.of(), "table"));

        assertThatThrownBy(() -> executor.execute(claim, document, new AtomicInteger()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessage("validate: permanent: validation_failed: no_data_extracted");
    }

    @Test
    void progressWritesAreBestEffort() {
        when(jobStore.updateProgress(eq(claim.jobId()), eq(claim.token()), anyDouble())).thenReturn(false);

        assertThat(executor.execute(claim, document, new AtomicInteger())).isNotNull();
    }
}
