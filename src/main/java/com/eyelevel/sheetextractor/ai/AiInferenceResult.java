package com.eyelevel.sheetextractor.ai;

import java.util.Map;

/**
 * Structured data returned by the AI for one unit, with the model's self-reported confidence in [0,1].
 */
public record AiInferenceResult(Map<String, Object> payload, double confidence) {
}
