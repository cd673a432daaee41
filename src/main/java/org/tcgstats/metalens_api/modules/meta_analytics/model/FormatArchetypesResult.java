package org.tcgstats.metalens_api.modules.meta_analytics.model;

import java.util.List;

/**
 * Archetypes observed in a format over one window, ordered by meta share descending.
 */
public record FormatArchetypesResult(
        List<FormatArchetype> archetypes,
        AnalysisMetadata metadata
) {
    public boolean isEmpty() {
        return archetypes.isEmpty();
    }
}
