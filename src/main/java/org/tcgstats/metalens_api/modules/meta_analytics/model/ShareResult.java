package org.tcgstats.metalens_api.modules.meta_analytics.model;

import org.jspecify.annotations.Nullable;

/**
 * Meta share of one archetype inside a single window.
 *
 * @param archetypeId   archetype identifier
 * @param mainTitle     display name
 * @param colorIdentity color identity tag, may be absent
 * @param strategy      strategy tag
 * @param sampleSize    number of decklists registered with this archetype
 * @param metaShare     {@code sampleSize} as a percentage of all decklists in the window
 */
public record ShareResult(
        long archetypeId,
        String mainTitle,
        @Nullable String colorIdentity,
        String strategy,
        int sampleSize,
        double metaShare
) {}
