package com.eyelevel.sheetextractor.pipeline.validator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating extracted data. {@code valid} is true exactly when there are no errors.
 */
public record ValidationOutcome(boolean valid, List<String> errors, List<String> warnings, String dataType) {

    public static ValidationOutcome of(final List<String> errors, final List<String> warnings,
                                       final String dataType) {
        return new ValidationOutcome(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings), dataType);
    }

    /**
     * The form stored in the extraction's {@code validationResults} column.
     */
    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("valid", valid);
        map.put("errors", errors);
        map.put("warnings", warnings);
        map.put("dataType", dataType);
        return map;
    }
}
