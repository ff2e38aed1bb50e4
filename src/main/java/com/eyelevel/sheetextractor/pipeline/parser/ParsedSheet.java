package com.eyelevel.sheetextractor.pipeline.parser;

import java.util.List;
import java.util.Map;

/**
 * One sheet of a parsed workbook. Rows map column headers to typed cell values ({@link String},
 * {@link Long}, {@link Double}, {@link Boolean}, ISO-8601 date strings, or null for blanks).
 */
public record ParsedSheet(String name, List<String> columns, List<Map<String, Object>> rows) {

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
