package org.tcgstats.metalens_api.modules.meta_analytics.model;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * One decklist's archetype assignment inside a format.
 *
 * @param archetypeId    stable archetype identifier, shared by every decklist of that archetype
 * @param mainTitle      display name of the archetype
 * @param colorIdentity  color identity tag, may be absent
 * @param strategy       one of aggro, midrange, control, ramp, combo
 * @param tournamentDate start of the tournament the decklist was registered in
 */
@NullMarked
public record ArchetypeRow(
        long archetypeId,
        String mainTitle,
        @Nullable String colorIdentity,
        String strategy,
        Instant tournamentDate
) {
    public ArchetypeRow {
        Objects.requireNonNull(mainTitle, "mainTitle");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(tournamentDate, "tournamentDate");
    }
}
