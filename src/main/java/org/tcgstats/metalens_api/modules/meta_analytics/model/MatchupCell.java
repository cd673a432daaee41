package org.tcgstats.metalens_api.modules.meta_analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Head-to-head record of one archetype (the row) against another (the column).
 *
 * @param winRate    win percentage of the row archetype, {@code null} when below the minimum sample
 * @param matchCount directional observations from the row archetype's seat
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MatchupCell(
        @Nullable Double winRate,
        int matchCount
) {}
