package com.eyelevel.sheetextractor.pipeline.validator;

import java.util.Map;

/**
 * Checks extracted data against the schema of its detected data type. Implementations are deterministic and
 * do no I/O.
 */
public interface Validator {

    ValidationOutcome validate(Map<String, Object> data);
}
