package com.eyelevel.sheetextractor.pipeline.extractor;

import com.eyelevel.sheetextractor.ai.AiInferenceClient;
import com.eyelevel.sheetextractor.pipeline.parser.ParsedWorkbook;

/**
 * Turns parsed sheets into structured data with the help of the AI client.
 */
public interface Extractor {

    /**
     * Extracts structured data from every non-empty sheet.
     *
     * @param workbook The parser output.
     * @param aiClient The AI capability to call.
     * @param context  Job-scoped hooks for retries, progress and cancellation.
     * @return The merged data with per-unit confidence and field counts.
     */
    ExtractorOutput extract(ParsedWorkbook workbook, AiInferenceClient aiClient, ExtractionContext context);
}
