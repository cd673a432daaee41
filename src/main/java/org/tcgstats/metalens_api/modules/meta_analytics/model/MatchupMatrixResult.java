package org.tcgstats.metalens_api.modules.meta_analytics.model;

import java.util.List;
import java.util.Map;

/**
 * Pairwise matchup table keyed by player archetype name, then opponent archetype name.
 * <p>
 * Only pairs that met in the window are present.
 *
 * @param matrix     player archetype -> opponent archetype -> cell
 * @param archetypes every archetype that appears as a row, sorted ascending by name
 * @param metadata   format and window
 */
public record MatchupMatrixResult(
        Map<String, Map<String, MatchupCell>> matrix,
        List<String> archetypes,
        AnalysisMetadata metadata
) {
    public boolean isEmpty() {
        return matrix.isEmpty();
    }
}
