package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.jspecify.annotations.Nullable;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingRow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Post-merge equality filters and collapsing of ranking rows into buckets.
 * <p>
 * A bucket sums sample sizes, match counts and meta shares of its members. Its win rates are
 * the plain mean of the members' present win rates, not weighted by match count, and the row
 * is marked {@code grouped}. Both categorical fields of a bucket carry the grouping key, so
 * grouping by strategy also writes the strategy into {@code colorIdentity} and vice versa.
 * A previous-period or match-count sum stays {@code null} when no member has a value.
 */
public final class FilterGroupEngine {

    private FilterGroupEngine() {}

    public static List<RankingRow> apply(
            List<RankingRow> rows,
            @Nullable String colorIdentity,
            @Nullable String strategy,
            @Nullable GroupBy groupBy) {
        var result = rows;
        if (colorIdentity != null) {
            result = filterByColorIdentity(result, colorIdentity);
        }
        if (strategy != null) {
            result = filterByStrategy(result, strategy);
        }
        if (groupBy != null) {
            result = group(result, groupBy);
        }
        return result;
    }

    public static List<RankingRow> filterByColorIdentity(Collection<RankingRow> rows, String colorIdentity) {
        return rows.stream().filter(row -> colorIdentity.equals(row.colorIdentity())).toList();
    }

    public static List<RankingRow> filterByStrategy(Collection<RankingRow> rows, String strategy) {
        return rows.stream().filter(row -> strategy.equals(row.strategy())).toList();
    }

    public static List<RankingRow> group(Collection<RankingRow> rows, GroupBy groupBy) {
        Function<RankingRow, @Nullable String> key = switch (groupBy) {
            case COLOR_IDENTITY -> RankingRow::colorIdentity;
            case STRATEGY -> RankingRow::strategy;
        };

        // null keys form their own bucket
        Map<@Nullable String, List<RankingRow>> buckets = new LinkedHashMap<>();
        for (RankingRow row : rows) {
            buckets.computeIfAbsent(key.apply(row), k -> new ArrayList<>()).add(row);
        }

        List<RankingRow> grouped = new ArrayList<>(buckets.size());
        buckets.forEach((bucketKey, members) -> grouped.add(collapse(bucketKey, members)));
        return grouped;
    }

    private static RankingRow collapse(@Nullable String bucketKey, List<RankingRow> members) {
        return new RankingRow(
                null,
                RankingRow.GROUPED_TITLE,
                bucketKey,
                bucketKey,
                members.stream().mapToDouble(RankingRow::metaShareCurrent).sum(),
                sumDoubles(members, RankingRow::metaSharePrevious),
                mean(members, RankingRow::winRateCurrent),
                mean(members, RankingRow::winRatePrevious),
                members.stream().mapToInt(RankingRow::sampleSizeCurrent).sum(),
                sumInts(members, RankingRow::sampleSizePrevious),
                sumInts(members, RankingRow::matchCountCurrent),
                sumInts(members, RankingRow::matchCountPrevious),
                true);
    }

    private static @Nullable Double sumDoubles(List<RankingRow> members, Function<RankingRow, @Nullable Double> field) {
        var present = members.stream().map(field).filter(Objects::nonNull).toList();
        return present.isEmpty() ? null : present.stream().mapToDouble(Double::doubleValue).sum();
    }

    private static @Nullable Integer sumInts(List<RankingRow> members, Function<RankingRow, @Nullable Integer> field) {
        var present = members.stream().map(field).filter(Objects::nonNull).toList();
        return present.isEmpty() ? null : present.stream().mapToInt(Integer::intValue).sum();
    }

    private static @Nullable Double mean(List<RankingRow> members, Function<RankingRow, @Nullable Double> field) {
        var present = members.stream().map(field).filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        return present.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }
}
