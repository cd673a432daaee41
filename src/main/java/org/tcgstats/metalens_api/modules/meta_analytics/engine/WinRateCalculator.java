package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.jspecify.annotations.Nullable;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.WinRateResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces one window's matches to per-archetype win rates.
 * <p>
 * Each match is counted once from each seat: the player archetype records {@code player1}'s
 * result and the opponent archetype records {@code player2}'s result. A mirror match therefore
 * gives its archetype one win and one loss.
 */
public final class WinRateCalculator {

    public static final int DEFAULT_MIN_MATCHES = 3;

    private final int minMatches;

    public WinRateCalculator() {
        this(DEFAULT_MIN_MATCHES);
    }

    public WinRateCalculator(int minMatches) {
        if (minMatches < 1) {
            throw new IllegalArgumentException("minMatches must be at least 1, got " + minMatches);
        }
        this.minMatches = minMatches;
    }

    public List<WinRateResult> calculate(Collection<MatchRow> matches) {
        if (matches.isEmpty()) {
            return List.of();
        }

        Map<Long, Tally> tallies = new LinkedHashMap<>();
        for (MatchRow match : matches) {
            tallies.computeIfAbsent(match.playerArchetypeId(), id -> new Tally(match.playerArchetypeName()))
                    .record(match.player1Won());
            tallies.computeIfAbsent(match.opponentArchetypeId(), id -> new Tally(match.opponentArchetypeName()))
                    .record(match.player2Won());
        }

        List<WinRateResult> results = new ArrayList<>(tallies.size());
        tallies.forEach((archetypeId, tally) -> results.add(new WinRateResult(
                archetypeId,
                tally.name,
                tally.wins,
                tally.observations,
                winRate(tally.wins, tally.observations, minMatches))));
        return results;
    }

    /**
     * Win percentage, or {@code null} when {@code observations} is below {@code minMatches}.
     * Zero wins on a sufficient sample is a real 0.0.
     */
    static @Nullable Double winRate(int wins, int observations, int minMatches) {
        if (observations < minMatches) {
            return null;
        }
        return (double) wins / observations * 100;
    }

    private static final class Tally {
        private final String name;
        private int wins;
        private int observations;

        private Tally(String name) {
            this.name = name;
        }

        private void record(boolean won) {
            observations++;
            if (won) {
                wins++;
            }
        }
    }
}
