package com.eyelevel.sheetextractor.pipeline.parser;

import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses Excel workbooks ({@code xlsx} and legacy {@code xls}) with Apache POI. The first non-blank row of
 * each sheet is the header; formulas are evaluated; fully blank rows are skipped.
 */
@Slf4j
@Component
public class WorkbookParser implements Parser {

    private static final double MAX_EXACT_LONG = 1e15;

    @Override
    public ParsedWorkbook parse(final byte[] content, final ParseContext context) {
        final List<ParsedSheet> sheets = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            final DataFormatter formatter = new DataFormatter();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                sheets.add(parseSheet(workbook.getSheetAt(i), evaluator, formatter));
            }
        } catch (final EncryptedDocumentException e) {
            throw new PermanentProcessingException("corrupt_file", "workbook is password protected", e);
        } catch (final IOException | RuntimeException e) {
            throw new PermanentProcessingException("corrupt_file", "unreadable workbook: " + e.getMessage(), e);
        }

        final ParsedWorkbook workbook = new ParsedWorkbook(List.copyOf(sheets));
        if (workbook.nonEmptySheets().isEmpty()) {
            throw new PermanentProcessingException("empty_document", "no sheet contains data rows");
        }
        log.info("[{}] Parsed '{}': {} sheets, {} with data.", context.jobId(), context.filename(), sheets.size(),
                 workbook.nonEmptySheets().size());
        return workbook;
    }

    private ParsedSheet parseSheet(final Sheet sheet, final FormulaEvaluator evaluator,
                                   final DataFormatter formatter) {
        List<String> columns = null;
        final List<Map<String, Object>> rows = new ArrayList<>();

        for (final Row row : sheet) {
            final int width = Math.max(0, row.getLastCellNum());
            final List<Object> values = new ArrayList<>(width);
            boolean blank = true;
            for (int c = 0; c < width; c++) {
                final Object value = cellValue(row.getCell(c), evaluator, formatter);
                values.add(value);
                blank &= value == null;
            }
            if (blank) {
                continue;
            }
            if (columns == null) {
                columns = HeaderNames.normalize(values.stream().map(v -> v == null ? null : v.toString()).toList());
                continue;
            }
            final Map<String, Object> record = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                record.put(columns.get(c), c < values.size() ? values.get(c) : null);
            }
            rows.add(record);
        }
        return new ParsedSheet(sheet.getSheetName(), columns == null ? List.of() : columns, rows);
    }

    private Object cellValue(final Cell cell, final FormulaEvaluator evaluator, final DataFormatter formatter) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = evaluator.evaluateFormulaCell(cell);
        }
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell) ? dateValue(cell.getLocalDateTimeCellValue())
                                                               : numberValue(cell.getNumericCellValue());
            case STRING -> {
                final String text = cell.getStringCellValue().trim();
                yield text.isEmpty() ? null : text;
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            case ERROR -> formatter.formatCellValue(cell, evaluator);
            default -> null;
        };
    }

    private static Object numberValue(final double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return (long) value;
        }
        return value;
    }

    private static String dateValue(final LocalDateTime value) {
        if (value == null) {
            return null;
        }
        return value.toLocalTime().toSecondOfDay() == 0 ? value.toLocalDate().toString() : value.toString();
    }
}
