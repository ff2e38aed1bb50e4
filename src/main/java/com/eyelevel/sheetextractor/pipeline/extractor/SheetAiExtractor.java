package com.eyelevel.sheetextractor.pipeline.extractor;

import com.eyelevel.sheetextractor.ai.AiInferenceClient;
import com.eyelevel.sheetextractor.ai.AiInferenceRequest;
import com.eyelevel.sheetextractor.ai.AiInferenceResult;
import com.eyelevel.sheetextractor.config.ExtractionEngineConfig;
import com.eyelevel.sheetextractor.exception.processing.TransientProcessingException;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedSheet;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedWorkbook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Makes one AI call per non-empty sheet. Calls of one job run in parallel on the shared AI executor, at most
 * {@code app.pipeline.extract.max-concurrency} at a time; results are merged in workbook order regardless of
 * completion order.
 */
@Slf4j
@Component
public class SheetAiExtractor implements Extractor {

    private final AsyncTaskExecutor aiCallExecutor;
    private final int maxConcurrency;

    public SheetAiExtractor(@Qualifier("aiCallExecutor") final AsyncTaskExecutor aiCallExecutor,
                            final ExtractionEngineConfig engineConfig) {
        this.aiCallExecutor = aiCallExecutor;
        this.maxConcurrency = Math.max(1, engineConfig.getPipeline().getExtract().getMaxConcurrency());
    }

    @Override
    public ExtractorOutput extract(final ParsedWorkbook workbook, final AiInferenceClient aiClient,
                                   final ExtractionContext context) {
        final List<ParsedSheet> sheets = workbook.nonEmptySheets();
        if (sheets.isEmpty()) {
            return new ExtractorOutput(Map.of(), 0.0, List.of());
        }
        log.info("[{}] Extracting {} sheets with up to {} concurrent AI calls.", context.jobId(), sheets.size(),
                 maxConcurrency);

        final Semaphore permits = new Semaphore(maxConcurrency);
        final AtomicInteger completed = new AtomicInteger();
        final List<Future<UnitResult>> futures = new ArrayList<>(sheets.size());
        try {
            for (final ParsedSheet sheet : sheets) {
                context.checkpoint();
                permits.acquire();
                futures.add(aiCallExecutor.submit(() -> {
                    try {
                        final UnitResult unit = extractSheet(sheet, aiClient, context);
                        context.reportProgress(completed.incrementAndGet() / (double) sheets.size());
                        return unit;
                    } finally {
                        permits.release();
                    }
                }));
            }

            final List<UnitResult> units = new ArrayList<>(sheets.size());
            for (final Future<UnitResult> future : futures) {
                units.add(future.get());
            }
            final double confidence = ConfidenceAggregator.aggregate(units);
            log.info("[{}] Extraction finished: {} sheets, confidence {}.", context.jobId(), units.size(),
                     confidence);
            return new ExtractorOutput(ExtractionMerger.merge(units), confidence, List.copyOf(units));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientProcessingException("extraction interrupted", e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransientProcessingException("extraction failed: " + e.getCause(), e.getCause());
        } finally {
            futures.forEach(future -> future.cancel(true));
        }
    }

    private UnitResult extractSheet(final ParsedSheet sheet, final AiInferenceClient aiClient,
                                    final ExtractionContext context) {
        context.checkpoint();
        final AiInferenceResult result = context.infer(aiClient,
                                                       new AiInferenceRequest(context.jobId(), sheet.name(),
                                                                              context.subtype(), sheet.columns(),
                                                                              sheet.rows()));
        final Map<String, Object> payload = result.payload() == null ? Map.of() : result.payload();
        return new UnitResult(sheet.name(), payload, result.confidence(), ExtractionMerger.fieldCount(payload));
    }
}
