package com.eyelevel.sheetextractor.pipeline.parser;

import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;

/**
 * Turns raw document bytes into sheets of typed rows.
 */
public interface Parser {

    /**
     * Parses a document. Parsing is deterministic, so failures are never retried.
     *
     * @param content The document bytes.
     * @param context Job and file information.
     * @return The parsed workbook with at least one non-empty sheet.
     * @throws PermanentProcessingException with reason {@code corrupt_file} or {@code empty_document}.
     */
    ParsedWorkbook parse(byte[] content, ParseContext context);
}
