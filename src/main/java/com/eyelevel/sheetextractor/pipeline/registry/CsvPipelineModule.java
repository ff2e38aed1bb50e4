package com.eyelevel.sheetextractor.pipeline.registry;

import com.eyelevel.sheetextractor.pipeline.extractor.SheetAiExtractor;
import com.eyelevel.sheetextractor.pipeline.parser.CsvParser;
import com.eyelevel.sheetextractor.pipeline.validator.SpreadsheetValidator;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Delimited text files.
 */
@Component
public class CsvPipelineModule implements PipelineModule {

    private final PipelineStages stages;

    public CsvPipelineModule(final CsvParser parser, final SheetAiExtractor extractor,
                             final SpreadsheetValidator validator) {
        this.stages = new PipelineStages(parser, extractor, validator);
    }

    @Override
    public Set<String> subtypes() {
        return Set.of("csv");
    }

    @Override
    public PipelineStages stages() {
        return stages;
    }
}
