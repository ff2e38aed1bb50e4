package com.eyelevel.sheetextractor.pipeline.extractor;

import java.util.List;

/**
 * Combines per-sheet confidences into one score: a mean weighted by field count, where each sheet weighs
 * {@code max(1, fieldCount)} and each confidence is clamped to [0,1]. No sheets yields 0.0.
 */
public final class ConfidenceAggregator {

    private ConfidenceAggregator() {
    }

    public static double aggregate(final List<UnitResult> units) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (final UnitResult unit : units) {
            final double confidence = Double.isNaN(unit.confidence()) ? 0.0
                                                                      : Math.max(0.0, Math.min(1.0, unit.confidence()));
            final int weight = Math.max(1, unit.fieldCount());
            weighted += confidence * weight;
            totalWeight += weight;
        }
        return totalWeight == 0.0 ? 0.0 : weighted / totalWeight;
    }
}
