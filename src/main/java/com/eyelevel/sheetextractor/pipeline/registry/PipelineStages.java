package com.eyelevel.sheetextractor.pipeline.registry;

import com.eyelevel.sheetextractor.pipeline.extractor.Extractor;
import com.eyelevel.sheetextractor.pipeline.parser.Parser;
import com.eyelevel.sheetextractor.pipeline.validator.Validator;

import java.util.Objects;

/**
 * The parser, extractor and validator used for one document subtype.
 */
public record PipelineStages(Parser parser, Extractor extractor, Validator validator) {

    public PipelineStages {
        Objects.requireNonNull(parser, "parser must not be null");
        Objects.requireNonNull(extractor, "extractor must not be null");
        Objects.requireNonNull(validator, "validator must not be null");
    }
}
