package com.eyelevel.sheetextractor.pipeline.parser;

import com.eyelevel.sheetextractor.exception.processing.PermanentProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.ByteOrderMark;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses delimited text with Apache Commons CSV into a single sheet named after the file.
 * <p>
 * The content is decoded as UTF-8 (a byte order mark is skipped) and falls back to ISO-8859-1 when it is
 * not valid UTF-8. The delimiter is detected from the first lines among comma, semicolon, tab and pipe.
 * Plain integers and decimals become numbers; values with leading zeros stay text.
 */
@Slf4j
@Component
public class CsvParser implements Parser {

    static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final int SAMPLE_LINES = 10;
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9]\\d{0,17})");
    private static final Pattern DECIMAL = Pattern.compile("-?(0|[1-9]\\d*)\\.\\d+");

    @Override
    public ParsedWorkbook parse(final byte[] content, final ParseContext context) {
        final String text = decode(content);
        if (text.isBlank()) {
            throw new PermanentProcessingException("empty_document", "file has no content");
        }
        final char delimiter = detectDelimiter(text);
        final CSVFormat format = CSVFormat.DEFAULT.builder()
                                                  .setDelimiter(delimiter)
                                                  .setIgnoreEmptyLines(true)
                                                  .setIgnoreSurroundingSpaces(true)
                                                  .build();

        List<String> columns = null;
        final List<Map<String, Object>> rows = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(text))) {
            for (final CSVRecord record : parser) {
                if (columns == null) {
                    columns = HeaderNames.normalize(record.toList());
                    continue;
                }
                if (isBlank(record)) {
                    continue;
                }
                final Map<String, Object> row = new LinkedHashMap<>();
                for (int c = 0; c < columns.size(); c++) {
                    row.put(columns.get(c), c < record.size() ? typedValue(record.get(c)) : null);
                }
                rows.add(row);
            }
        } catch (final IOException | UncheckedIOException | IllegalStateException e) {
            throw new PermanentProcessingException("corrupt_file", "malformed CSV: " + e.getMessage(), e);
        }

        if (rows.isEmpty()) {
            throw new PermanentProcessingException("empty_document", "no data rows below the header");
        }
        final String sheetName = context.filename() == null ? "Sheet1" : FilenameUtils.getBaseName(context.filename());
        log.info("[{}] Parsed CSV '{}' with delimiter '{}': {} columns, {} rows.", context.jobId(),
                 context.filename(), delimiter == '\t' ? "\\t" : String.valueOf(delimiter), columns.size(),
                 rows.size());
        return new ParsedWorkbook(List.of(new ParsedSheet(sheetName, columns, rows)));
    }

    static String decode(final byte[] content) {
        final byte[] bom = ByteOrderMark.UTF_8.getBytes();
        int offset = 0;
        if (content.length >= bom.length && Arrays.equals(Arrays.copyOf(content, bom.length), bom)) {
            offset = bom.length;
        }
        final ByteBuffer buffer = ByteBuffer.wrap(content, offset, content.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(buffer)
                                         .toString();
        } catch (final CharacterCodingException e) {
            log.debug("Content is not valid UTF-8, decoding as ISO-8859-1.");
            return new String(content, offset, content.length - offset, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Picks the candidate that appears in the header line and splits the most sample lines into the same
     * number of fields as the header. Ties go to the higher per-line count, then to candidate order.
     */
    static char detectDelimiter(final String text) {
        final List<String> lines = text.lines().filter(line -> !line.isBlank()).limit(SAMPLE_LINES).toList();
        char best = ',';
        int bestConsistency = -1;
        int bestCount = 0;
        for (final char candidate : CANDIDATE_DELIMITERS) {
            final int headerCount = count(lines.get(0), candidate);
            if (headerCount == 0) {
                continue;
            }
            int consistency = 0;
            for (final String line : lines) {
                if (count(line, candidate) == headerCount) {
                    consistency++;
                }
            }
            if (consistency > bestConsistency || (consistency == bestConsistency && headerCount > bestCount)) {
                best = candidate;
                bestConsistency = consistency;
                bestCount = headerCount;
            }
        }
        return best;
    }

    private static int count(final String line, final char candidate) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == candidate && !quoted) {
                count++;
            }
        }
        return count;
    }

    private static boolean isBlank(final CSVRecord record) {
        for (final String value : record) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    static Object typedValue(final String raw) {
        if (raw == null) {
            return null;
        }
        final String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        if (INTEGER.matcher(value).matches()) {
            return Long.parseLong(value);
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return value;
    }
}
