package com.eyelevel.sheetextractor.pipeline.extractor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceAggregatorTest {

    @Test
    void noUnitsYieldsZero() {
        assertThat(ConfidenceAggregator.aggregate(List.of())).isZero();
    }

    @Test
    void singleUnitKeepsItsConfidence() {
        assertThat(ConfidenceAggregator.aggregate(List.of(unit(0.82, 5)))).isEqualTo(0.82, within(1e-9));
    }

    @Test
    void weighsUnitsByFieldCount() {
        final double aggregated = ConfidenceAggregator.aggregate(List.of(unit(0.9, 9), unit(0.3, 1)));

        assertThat(aggregated).isEqualTo((0.9 * 9 + 0.3) / 10, within(1e-9));
    }

    @Test
    void unitWithoutFieldsStillCountsOnce() {
        final double aggregated = ConfidenceAggregator.aggregate(List.of(unit(1.0, 0), unit(0.0, 0)));

        assertThat(aggregated).isEqualTo(0.5, within(1e-9));
    }

    @Test
    void outOfRangeAndNanConfidencesAreClamped() {
        final double aggregated = ConfidenceAggregator.aggregate(
                List.of(unit(1.7, 1), unit(-0.4, 1), unit(Double.NaN, 2)));

        assertThat(aggregated).isEqualTo(0.25, within(1e-9)).isBetween(0.0, 1.0);
    }

    private static UnitResult unit(final double confidence, final int fieldCount) {
        return new UnitResult("Sheet", Map.of(), confidence, fieldCount);
    }
}
