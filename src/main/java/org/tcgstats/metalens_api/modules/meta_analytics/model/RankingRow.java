package org.tcgstats.metalens_api.modules.meta_analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Current-versus-previous comparison for one archetype, or for one bucket of archetypes
 * when {@code grouped} is set.
 * <p>
 * Every previous-period field, and every match field, is independently nullable: {@code null}
 * means the archetype was not observed on that side, never zero.
 *
 * @param archetypeId        archetype identifier, {@code null} for grouped buckets
 * @param mainTitle          display name, {@value #GROUPED_TITLE} for grouped buckets
 * @param colorIdentity      color identity tag
 * @param strategy           strategy tag
 * @param metaShareCurrent   meta share in the current period
 * @param metaSharePrevious  meta share in the previous period
 * @param winRateCurrent     win rate in the current period; for buckets, the unweighted mean of member win rates
 * @param winRatePrevious    win rate in the previous period; for buckets, the unweighted mean of member win rates
 * @param sampleSizeCurrent  decklists in the current period
 * @param sampleSizePrevious decklists in the previous period
 * @param matchCountCurrent  directional match observations in the current period
 * @param matchCountPrevious directional match observations in the previous period
 * @param grouped            whether this row aggregates several archetypes
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RankingRow(
        @Nullable Long archetypeId,
        String mainTitle,
        @Nullable String colorIdentity,
        @Nullable String strategy,
        double metaShareCurrent,
        @Nullable Double metaSharePrevious,
        @Nullable Double winRateCurrent,
        @Nullable Double winRatePrevious,
        int sampleSizeCurrent,
        @Nullable Integer sampleSizePrevious,
        @Nullable Integer matchCountCurrent,
        @Nullable Integer matchCountPrevious,
        boolean grouped
) {
    public static final String GROUPED_TITLE = "grouped";
}
