package org.tcgstats.metalens_api.modules.meta_analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Match performance of one archetype inside a single window.
 *
 * @param archetypeId archetype identifier
 * @param mainTitle   display name
 * @param wins        directional observations won
 * @param matchCount  directional observations, one per seat the archetype occupied
 * @param winRate     {@code wins / matchCount * 100}, or {@code null} when below the minimum sample
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record WinRateResult(
        long archetypeId,
        String mainTitle,
        int wins,
        int matchCount,
        @Nullable Double winRate
) {}
