package com.eyelevel.sheetextractor.pipeline.parser;

import java.util.List;

/**
 * Parser output: sheets in workbook order.
 */
public record ParsedWorkbook(List<ParsedSheet> sheets) {

    public List<ParsedSheet> nonEmptySheets() {
        return sheets.stream().filter(sheet -> !sheet.isEmpty()).toList();
    }
}
