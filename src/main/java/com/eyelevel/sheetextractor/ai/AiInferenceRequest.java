package com.eyelevel.sheetextractor.ai;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of AI work: the tabular content of a single sheet.
 *
 * @param jobId     The job the call is made for, used for logging and retry accounting.
 * @param unitName  The sheet name.
 * @param subtype   The document subtype ({@code xlsx}, {@code csv}, ...).
 * @param columns   Column headers in sheet order.
 * @param rows      Data rows keyed by column header.
 */
public record AiInferenceRequest(UUID jobId, String unitName, String subtype, List<String> columns,
                                 List<Map<String, Object>> rows) {
}
