package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchupCell;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces one window's matches to an ordered-pair win-rate table keyed by archetype name.
 * <p>
 * Every match contributes one observation to {@code [player][opponent]} and one, with seats
 * swapped, to {@code [opponent][player]}, so for two archetypes A and B with N matches between
 * them the two cells' counts sum to 2N. Win rates below the minimum sample are {@code null}.
 */
public final class MatchupMatrixCalculator {

    private final int minMatches;

    public MatchupMatrixCalculator() {
        this(WinRateCalculator.DEFAULT_MIN_MATCHES);
    }

    public MatchupMatrixCalculator(int minMatches) {
        if (minMatches < 1) {
            throw new IllegalArgumentException("minMatches must be at least 1, got " + minMatches);
        }
        this.minMatches = minMatches;
    }

    /**
     * @return player archetype -> opponent archetype -> cell, both levels sorted by name;
     *         empty when there are no matches
     */
    public Map<String, Map<String, MatchupCell>> calculate(Collection<MatchRow> matches) {
        if (matches.isEmpty()) {
            return Map.of();
        }

        // [wins, observations] per ordered pair
        Map<String, Map<String, int[]>> tallies = new TreeMap<>();
        for (MatchRow match : matches) {
            record(tallies, match.playerArchetypeName(), match.opponentArchetypeName(), match.player1Won());
            record(tallies, match.opponentArchetypeName(), match.playerArchetypeName(), match.player2Won());
        }

        Map<String, Map<String, MatchupCell>> matrix = new TreeMap<>();
        tallies.forEach((player, opponents) -> {
            Map<String, MatchupCell> row = new TreeMap<>();
            opponents.forEach((opponent, tally) -> row.put(opponent,
                    new MatchupCell(WinRateCalculator.winRate(tally[0], tally[1], minMatches), tally[1])));
            matrix.put(player, Collections.unmodifiableMap(row));
        });
        return Collections.unmodifiableMap(matrix);
    }

    private static void record(Map<String, Map<String, int[]>> tallies, String player, String opponent, boolean won) {
        var tally = tallies.computeIfAbsent(player, p -> new TreeMap<>())
                .computeIfAbsent(opponent, o -> new int[2]);
        if (won) {
            tally[0]++;
        }
        tally[1]++;
    }
}
