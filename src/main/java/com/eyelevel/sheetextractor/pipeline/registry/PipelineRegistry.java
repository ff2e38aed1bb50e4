package com.eyelevel.sheetextractor.pipeline.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from document subtype to its {@link PipelineStages}, built once from all
 * {@link PipelineModule} beans. Two modules claiming the same subtype fail startup.
 */
@Slf4j
@Service
public class PipelineRegistry {

    private final Map<String, PipelineStages> stagesBySubtype;

    public PipelineRegistry(final List<PipelineModule> modules) {
        final Map<String, PipelineStages> registered = new HashMap<>();
        for (final PipelineModule module : modules) {
            for (final String subtype : module.subtypes()) {
                final String key = subtype.toLowerCase(Locale.ROOT);
                if (registered.putIfAbsent(key, module.stages()) != null) {
                    throw new IllegalStateException("Duplicate pipeline registration for subtype '" + key + "' by "
                                                    + module.getClass().getSimpleName());
                }
            }
        }
        this.stagesBySubtype = Map.copyOf(registered);
        log.info("PipelineRegistry initialized with subtypes {}.", stagesBySubtype.keySet());
    }

    /**
     * Finds the pipeline for a subtype, ignoring case.
     *
     * @param subtype The document subtype, e.g. {@code xlsx}. May be null.
     * @return The stages, or empty if the subtype is not supported.
     */
    public Optional<PipelineStages> lookup(final String subtype) {
        if (subtype == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stagesBySubtype.get(subtype.trim().toLowerCase(Locale.ROOT)));
    }

    public Set<String> supportedSubtypes() {
        return stagesBySubtype.keySet();
    }
}
