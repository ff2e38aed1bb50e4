package com.eyelevel.sheetextractor.pipeline.extractor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-sheet payloads into one document in workbook order.
 * <p>
 * Lists under the same key are concatenated; any other value keeps the first non-empty occurrence. The
 * untouched per-sheet payloads are kept under {@code sheets} when the workbook had more than one sheet.
 */
public final class ExtractionMerger {

    static final String SHEETS_KEY = "sheets";

    private ExtractionMerger() {
    }

    public static Map<String, Object> merge(final List<UnitResult> units) {
        final Map<String, Object> merged = new LinkedHashMap<>();
        for (final UnitResult unit : units) {
            unit.payload().forEach((key, value) -> mergeValue(merged, key, value));
        }
        if (units.size() > 1) {
            final Map<String, Object> sheets = new LinkedHashMap<>();
            units.forEach(unit -> sheets.put(unit.unitName(), unit.payload()));
            merged.put(SHEETS_KEY, sheets);
        }
        return merged;
    }

    @SuppressWarnings("unchecked")
    private static void mergeValue(final Map<String, Object> merged, final String key, final Object value) {
        if (isEmpty(value)) {
            merged.putIfAbsent(key, value);
            return;
        }
        final Object existing = merged.get(key);
        if (existing instanceof List<?> existingList && value instanceof List<?> list) {
            final List<Object> combined = new ArrayList<>((List<Object>) existingList);
            combined.addAll(list);
            merged.put(key, combined);
        } else if (isEmpty(existing)) {
            merged.put(key, value);
        }
    }

    /**
     * Counts the top-level entries that carry data.
     */
    public static int fieldCount(final Map<String, Object> payload) {
        return (int) payload.values().stream().filter(value -> !isEmpty(value)).count();
    }

    static boolean isEmpty(final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
