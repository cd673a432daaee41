package org.tcgstats.metalens_api.modules.meta_analytics.model;

import org.jspecify.annotations.NullMarked;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed 1v1 match, labelled from player1's seat.
 * <p>
 * The winner must be one of the two players; unfinished or drawn matches never reach this type.
 *
 * @param playerArchetypeId     archetype of player1
 * @param playerArchetypeName   display name of player1's archetype
 * @param opponentArchetypeId   archetype of player2
 * @param opponentArchetypeName display name of player2's archetype
 * @param player1Id             first seat
 * @param player2Id             second seat
 * @param winnerId              either {@code player1Id} or {@code player2Id}
 * @param tournamentDate        start of the tournament the match was played in
 */
@NullMarked
public record MatchRow(
        long playerArchetypeId,
        String playerArchetypeName,
        long opponentArchetypeId,
        String opponentArchetypeName,
        String player1Id,
        String player2Id,
        String winnerId,
        Instant tournamentDate
) {
    public MatchRow {
        Objects.requireNonNull(playerArchetypeName, "playerArchetypeName");
        Objects.requireNonNull(opponentArchetypeName, "opponentArchetypeName");
        Objects.requireNonNull(player1Id, "player1Id");
        Objects.requireNonNull(player2Id, "player2Id");
        Objects.requireNonNull(winnerId, "winnerId");
        Objects.requireNonNull(tournamentDate, "tournamentDate");
        if (!winnerId.equals(player1Id) && !winnerId.equals(player2Id)) {
            throw new IllegalArgumentException(
                    "winnerId %s is neither %s nor %s".formatted(winnerId, player1Id, player2Id));
        }
    }

    public boolean player1Won() {
        return winnerId.equals(player1Id);
    }

    public boolean player2Won() {
        return winnerId.equals(player2Id);
    }
}
