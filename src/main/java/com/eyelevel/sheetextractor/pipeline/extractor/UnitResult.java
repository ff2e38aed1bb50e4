package com.eyelevel.sheetextractor.pipeline.extractor;

import java.util.Map;

/**
 * The AI result for one sheet.
 *
 * @param unitName   The sheet name.
 * @param payload    Structured data returned for the sheet.
 * @param confidence Reported confidence, clamped to [0,1].
 * @param fieldCount Number of non-empty top-level fields in the payload.
 */
public record UnitResult(String unitName, Map<String, Object> payload, double confidence, int fieldCount) {
}
