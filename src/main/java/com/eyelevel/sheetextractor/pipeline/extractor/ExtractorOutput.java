package com.eyelevel.sheetextractor.pipeline.extractor;

import java.util.List;
import java.util.Map;

/**
 * Extractor output: merged data, aggregated confidence and the per-sheet results it was built from.
 */
public record ExtractorOutput(Map<String, Object> data, double confidence, List<UnitResult> units) {
}
