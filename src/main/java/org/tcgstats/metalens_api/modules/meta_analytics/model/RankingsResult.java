package org.tcgstats.metalens_api.modules.meta_analytics.model;

import java.util.List;

/**
 * Ranked archetype comparison, ordered by current meta share descending.
 */
public record RankingsResult(
        List<RankingRow> rows,
        AnalysisMetadata metadata
) {
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
