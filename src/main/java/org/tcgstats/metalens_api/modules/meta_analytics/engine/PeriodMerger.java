package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ShareResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.WinRateResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Joins both periods' share and win-rate results into one comparison row per archetype.
 * <p>
 * Only archetypes present in the current share results produce rows. Previous shares and both
 * periods' win rates are left-joined on archetype id; a missing side leaves its fields
 * {@code null}.
 */
public final class PeriodMerger {

    private PeriodMerger() {}

    public static List<RankingRow> merge(
            Collection<ShareResult> currentShares,
            Collection<ShareResult> previousShares,
            Collection<WinRateResult> currentWinRates,
            Collection<WinRateResult> previousWinRates) {

        var previousShareById = index(previousShares, ShareResult::archetypeId);
        var currentWinById = index(currentWinRates, WinRateResult::archetypeId);
        var previousWinById = index(previousWinRates, WinRateResult::archetypeId);

        List<RankingRow> rows = new ArrayList<>(currentShares.size());
        for (ShareResult current : currentShares) {
            var previousShare = previousShareById.get(current.archetypeId());
            var currentWin = currentWinById.get(current.archetypeId());
            var previousWin = previousWinById.get(current.archetypeId());

            rows.add(new RankingRow(
                    current.archetypeId(),
                    current.mainTitle(),
                    current.colorIdentity(),
                    current.strategy(),
                    current.metaShare(),
                    previousShare == null ? null : previousShare.metaShare(),
                    currentWin == null ? null : currentWin.winRate(),
                    previousWin == null ? null : previousWin.winRate(),
                    current.sampleSize(),
                    previousShare == null ? null : previousShare.sampleSize(),
                    currentWin == null ? null : currentWin.matchCount(),
                    previousWin == null ? null : previousWin.matchCount(),
                    false));
        }
        return rows;
    }

    private static <T> Map<Long, T> index(Collection<T> results, Function<T, Long> id) {
        Map<Long, T> byId = new HashMap<>(results.size() * 2);
        for (T result : results) {
            byId.put(id.apply(result), result);
        }
        return byId;
    }
}
