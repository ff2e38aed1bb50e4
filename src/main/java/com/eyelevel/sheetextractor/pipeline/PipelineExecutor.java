package com.eyelevel.sheetextractor.pipeline;

import com.eyelevel.sheetextractor.ai.AiCallGateway;
import com.eyelevel.sheetextractor.ai.AiInferenceClient;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig.ValidationFailurePolicy;
import com.eyelevel.sheetextractor.exception.StorageException;
import com.eyelevel.sheetextractor.exception.processing.ClaimLostException;
import com.eyelevel.sheetextractor.exception.processing.JobCanceledException;
import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import com.eyelevel.sheetextractor.exception.processing.ProcessingException;
import com.eyelevel.sheetextractor.exception.processing.StageExecutionException;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import com.eyelevel.sheetextractor.model.Document;
import com.eyelevel.sheetextractor.pipeline.extractor.ExtractionContext;
import com.eyelevel.sheetextractor.pipeline.extractor.ExtractorOutput;
import com.eyelevel.sheetextractor.pipeline.parser.ParseContext;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedWorkbook;
import com.eyelevel.sheetextractor.pipeline.registry.PipelineRegistry;
import com.eyelevel.sheetextractor.pipeline.registry.PipelineStages;
import com.eyelevel.sheetextractor.pipeline.validator.ValidationOutcome;
import com.eyelevel.sheetextractor.storage.ObjectStore;
import com.eyelevel.sheetextractor.store.ClaimedJob;
import com.eyelevel.sheetextractor.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs parse → extract → validate for one claimed job.
 * <p>
 * Each stage runs on the stage executor under its own timeout. Before each stage, and before each AI call
 * inside extraction, the job row is checked: a cancellation request raises {@link JobCanceledException} and a
 * revoked or superseded claim raises {@link ClaimLostException}. Any other failure aborts the run at once as a
 * {@link StageExecutionException} naming the stage. Nothing is persisted here except progress and the stage
 * label; the caller finalizes the job.
 */
@Slf4j
@Service
public class PipelineExecutor {

    private final PipelineRegistry registry;
    private final ObjectStore objectStore;
    private final JobStore jobStore;
    private final AiInferenceClient aiClient;
    private final AiCallGateway aiCallGateway;
    private final AsyncTaskExecutor stageExecutor;
    private final ExtractionEngineConfig.Pipeline pipelineConfig;

    public PipelineExecutor(final PipelineRegistry registry, final ObjectStore objectStore, final JobStore jobStore,
                            final AiInferenceClient aiClient, final AiCallGateway aiCallGateway,
                            @Qualifier("pipelineStageExecutor") final AsyncTaskExecutor stageExecutor,
                            final ExtractionEngineConfig engineConfig) {
        this.registry = registry;
        this.objectStore = objectStore;
        this.jobStore = jobStore;
        this.aiClient = aiClient;
        this.aiCallGateway = aiCallGateway;
        this.stageExecutor = stageExecutor;
        this.pipelineConfig = engineConfig.getPipeline();
    }

    /**
     * Runs the pipeline.
     *
     * @param claim        The claim under which the job runs.
     * @param document     The document to process.
     * @param retryCounter Receives the number of AI retries performed.
     * @return The result to store.
     * @throws StageExecutionException if a stage failed or timed out.
     * @throws JobCanceledException    if cancellation was requested.
     * @throws ClaimLostException      if the claim is no longer current.
     * @throws CancellationException   if the worker thread was interrupted.
     */
    public PipelineResult execute(final ClaimedJob claim, final Document document, final AtomicInteger retryCounter) {
        final String subtype = resolveSubtype(document);
        log.info("[{}] Starting pipeline for document {} ('{}', subtype '{}').", claim.jobId(), document.getId(),
                 document.getFilename(), subtype);

        enterStage(claim, PipelineStage.PARSE);
        final PipelineStages stages = runStage(PipelineStage.PARSE, pipelineConfig.getTimeouts().getParse(),
                                               () -> registry.lookup(subtype).orElseThrow(
                                                       () -> new PermanentProcessingException("unsupported_format",
                                                                                              "no pipeline for subtype '"
                                                                                              + subtype + "'")));
        final ParsedWorkbook workbook = runStage(PipelineStage.PARSE, pipelineConfig.getTimeouts().getParse(),
                                                 () -> stages.parser().parse(load(document),
                                                                             new ParseContext(claim.jobId(),
                                                                                              document.getFilename(),
                                                                                              subtype)));
        reportProgress(claim, PipelineStage.PARSE.endPercent());

        enterStage(claim, PipelineStage.EXTRACT);
        final ExtractionContext extractionContext = new ExtractionContext(
                claim.jobId(), subtype, aiCallGateway, pipelineConfig.getAi().getRetry().getMaxAttempts(),
                retryCounter, () -> checkpoint(claim),
                fraction -> reportProgress(claim, PipelineStage.EXTRACT.progressAt(fraction)));
        final ExtractorOutput output = runStage(PipelineStage.EXTRACT, pipelineConfig.getTimeouts().getExtract(),
                                                () -> stages.extractor().extract(workbook, aiClient,
                                                                                 extractionContext));
        reportProgress(claim, PipelineStage.EXTRACT.endPercent());

        enterStage(claim, PipelineStage.VALIDATE);
        final ValidationOutcome outcome = runStage(PipelineStage.VALIDATE, pipelineConfig.getTimeouts().getValidate(),
                                                   () -> stages.validator().validate(output.data()));
        if (!outcome.valid()) {
            if (pipelineConfig.getValidationFailurePolicy() == ValidationFailurePolicy.FAIL) {
                throw new StageExecutionException(PipelineStage.VALIDATE,
                                                  new PermanentProcessingException("validation_failed",
                                                                                   String.join("; ",
                                                                                               outcome.errors())));
            }
            log.warn("[{}] Extracted data failed validation, keeping it annotated: {}", claim.jobId(),
                     outcome.errors());
        }

        log.info("[{}] Pipeline finished: dataType={}, valid={}, confidence={}, aiRetries={}.", claim.jobId(),
                 outcome.dataType(), outcome.valid(), output.confidence(), retryCounter.get());
        return new PipelineResult(output.data(), output.confidence(), outcome.dataType(), outcome.toMap());
    }

    /**
     * The declared type when present, otherwise the filename extension, lower-cased.
     */
    static String resolveSubtype(final Document document) {
        final String declared = document.getDeclaredType();
        final String subtype = declared != null && !declared.isBlank() ? declared
                                                                       : FilenameUtils.getExtension(
                                                                               document.getFilename());
        return subtype == null ? "" : subtype.trim().toLowerCase(Locale.ROOT);
    }

    private byte[] load(final Document document) {
        final long maxFileSize = pipelineConfig.getMaxFileSize();
        if (document.getFileSize() > maxFileSize) {
            throw tooLarge(document.getFileSize(), maxFileSize);
        }
        try (InputStream in = objectStore.get(document.getStorageRef());
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            IOUtils.copyLarge(in, out, 0, maxFileSize + 1);
            if (out.size() > maxFileSize) {
                throw tooLarge(out.size(), maxFileSize);
            }
            return out.toByteArray();
        } catch (final StorageException e) {
            throw new TransientProcessingException("object store read failed: " + e.getMessage(), e);
        } catch (final IOException e) {
            throw new TransientProcessingException("object store read failed: " + e.getMessage(), e);
        }
    }

    private static PermanentProcessingException tooLarge(final long size, final long maxFileSize) {
        return new PermanentProcessingException("file_too_large", size + " bytes exceeds the limit of "
                                                                  + maxFileSize + " bytes");
    }

    private void enterStage(final ClaimedJob claim, final PipelineStage stage) {
        checkpoint(claim);
        jobStore.markStage(claim.jobId(), claim.token(), stage.name());
        log.debug("[{}] Entering stage {}.", claim.jobId(), stage);
    }

    private void checkpoint(final ClaimedJob claim) {
        switch (jobStore.checkpoint(claim.jobId(), claim.token())) {
            case CANCEL_REQUESTED -> throw new JobCanceledException(claim.jobId());
            case CLAIM_LOST -> throw new ClaimLostException(claim.jobId(), claim.token());
            default -> {
            }
        }
    }

    private void reportProgress(final ClaimedJob claim, final double percent) {
        jobStore.updateProgress(claim.jobId(), claim.token(), percent);
    }

    private <T> T runStage(final PipelineStage stage, final Duration timeout, final Callable<T> work) {
        final Future<T> future = stageExecutor.submit(work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            final String message = "stage timed out after " + timeout.toMillis() + " ms";
            final ProcessingException cause = stage == PipelineStage.EXTRACT
                                              ? new TransientProcessingException(message)
                                              : new PermanentProcessingException("stage_timeout", message);
            throw new StageExecutionException(stage, cause);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("worker interrupted during " + stage.label());
        } catch (final ExecutionException e) {
            throw translate(stage, e.getCause());
        }
    }

    private static RuntimeException translate(final PipelineStage stage, final Throwable failure) {
        if (failure instanceof JobCanceledException || failure instanceof ClaimLostException
            || failure instanceof StageExecutionException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof ProcessingException processing) {
            return new StageExecutionException(stage, processing);
        }
        return new StageExecutionException(stage, new PermanentProcessingException(
                "internal_error", failure.getClass().getSimpleName() + ": " + failure.getMessage(), failure));
    }
}
