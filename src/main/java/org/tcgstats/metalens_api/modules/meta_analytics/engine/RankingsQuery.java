package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Set;

/**
 * Parameters of one ranking request.
 * <p>
 * When {@code previousEndDays} is set the previous period is anchored that many days before now
 * instead of immediately preceding the current period. Its start is then
 * {@code previousStartDays} days before now, or {@code previousDays} before its end.
 *
 * @param format            tournament format, e.g. Standard or Modern
 * @param currentDays       length of the current period, ending now
 * @param previousDays      length of the previous period
 * @param previousStartDays optional explicit start of the previous period, in days before now
 * @param previousEndDays   optional explicit end of the previous period, in days before now
 * @param colorIdentity     optional equality filter on color identity
 * @param strategy          optional equality filter on strategy, normalized to lower case
 * @param groupBy           optional field to collapse rows on
 */
public record RankingsQuery(
        String format,
        int currentDays,
        int previousDays,
        @Nullable Integer previousStartDays,
        @Nullable Integer previousEndDays,
        @Nullable String colorIdentity,
        @Nullable String strategy,
        @Nullable GroupBy groupBy
) {
    public static final Set<String> STRATEGIES = Set.of("aggro", "midrange", "control", "ramp", "combo");

    public RankingsQuery {
        if (format == null || format.isBlank()) {
            throw new MetaValidationException("format must not be blank");
        }
        colorIdentity = blankToNull(colorIdentity);
        strategy = blankToNull(strategy);
        if (strategy != null) {
            strategy = strategy.toLowerCase(Locale.ROOT);
            if (!STRATEGIES.contains(strategy)) {
                throw new MetaValidationException(
                        "strategy must be one of aggro, midrange, control, ramp, combo, got '%s'".formatted(strategy));
            }
        }
    }

    public static RankingsQuery of(String format, int currentDays, int previousDays) {
        return new RankingsQuery(format, currentDays, previousDays, null, null, null, null, null);
    }

    public RankingsQuery withPreviousOffsets(@Nullable Integer startDays, @Nullable Integer endDays) {
        return new RankingsQuery(format, currentDays, previousDays, startDays, endDays, colorIdentity, strategy, groupBy);
    }

    public RankingsQuery withFilters(@Nullable String colorIdentity, @Nullable String strategy) {
        return new RankingsQuery(format, currentDays, previousDays, previousStartDays, previousEndDays,
                colorIdentity, strategy, groupBy);
    }

    public RankingsQuery withGroupBy(@Nullable GroupBy groupBy) {
        return new RankingsQuery(format, currentDays, previousDays, previousStartDays, previousEndDays,
                colorIdentity, strategy, groupBy);
    }

    public boolean hasExplicitPreviousPeriod() {
        return previousStartDays != null || previousEndDays != null;
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
