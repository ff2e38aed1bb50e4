package com.eyelevel.sheetextractor.pipeline.registry;

import com.eyelevel.sheetextractor.pipeline.extractor.SheetAiExtractor;
import com.eyelevel.sheetextractor.pipeline.parser.WorkbookParser;
import com.eyelevel.sheetextractor.pipeline.validator.SpreadsheetValidator;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Excel workbooks, both the OOXML and the legacy binary format.
 */
@Component
public class WorkbookPipelineModule implements PipelineModule {

    private final PipelineStages stages;

    public WorkbookPipelineModule(final WorkbookParser parser, final SheetAiExtractor extractor,
                                  final SpreadsheetValidator validator) {
        this.stages = new PipelineStages(parser, extractor, validator);
    }

    @Override
    public Set<String> subtypes() {
        return Set.of("xlsx", "xls");
    }

    @Override
    public PipelineStages stages() {
        return stages;
    }
}
