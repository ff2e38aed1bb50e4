package com.eyelevel.sheetextractor.pipeline;

import java.util.Map;

/**
 * Everything a successful pipeline run produces, ready to be stored as an extraction.
 *
 * @param extractedData     Merged structured data.
 * @param confidence        Aggregated confidence in [0,1].
 * @param formatType        Detected data type, e.g. {@code invoice} or {@code table}.
 * @param validationResults {@code valid}, {@code errors}, {@code warnings} and {@code dataType}.
 */
public record PipelineResult(Map<String, Object> extractedData, double confidence, String formatType,
                             Map<String, Object> validationResults) {
}
