package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.ArchetypeRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ShareResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces one window's decklists to per-archetype sample sizes and meta share.
 * <p>
 * Display fields come from the first row seen for each archetype. Result order is unspecified.
 */
public final class ShareCalculator {

    private ShareCalculator() {}

    public static List<ShareResult> calculate(Collection<ArchetypeRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, ArchetypeRow> representatives = new LinkedHashMap<>();
        Map<Long, Integer> counts = new LinkedHashMap<>();
        for (ArchetypeRow row : rows) {
            representatives.putIfAbsent(row.archetypeId(), row);
            counts.merge(row.archetypeId(), 1, Integer::sum);
        }

        double total = rows.size();
        List<ShareResult> results = new ArrayList<>(counts.size());
        counts.forEach((archetypeId, sampleSize) -> {
            var representative = representatives.get(archetypeId);
            results.add(new ShareResult(
                    archetypeId,
                    representative.mainTitle(),
                    representative.colorIdentity(),
                    representative.strategy(),
                    sampleSize,
                    sampleSize / total * 100));
        });
        return results;
    }
}
