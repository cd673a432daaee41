package org.tcgstats.metalens_api.modules.meta_analytics.model;

import org.jspecify.annotations.Nullable;

/**
 * Single-window summary entry for one archetype of a format.
 */
public record FormatArchetype(
        long archetypeId,
        String name,
        @Nullable String colorIdentity,
        String strategy,
        int deckCount,
        double metaShare
) {}
