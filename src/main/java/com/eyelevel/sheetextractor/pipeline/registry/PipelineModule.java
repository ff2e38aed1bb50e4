package com.eyelevel.sheetextractor.pipeline.registry;

import java.util.Set;

/**
 * Contributes the pipeline for one or more document subtypes. Every bean of this type is registered in the
 * {@link PipelineRegistry} at startup, so supporting a new format means adding a module bean.
 */
public interface PipelineModule {

    /**
     * Lower-case subtypes handled by this module, e.g. {@code xlsx}.
     */
    Set<String> subtypes();

    PipelineStages stages();
}
