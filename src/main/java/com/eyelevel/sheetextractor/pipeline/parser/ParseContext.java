package com.eyelevel.sheetextractor.pipeline.parser;

import java.util.UUID;

/**
 * What a parser knows about the document besides its bytes.
 */
public record ParseContext(UUID jobId, String filename, String subtype) {
}
