package com.spinrank.tournament.model;

import java.util.UUID;

/**
 * @param place 1-based place; playoff losers of the same round share a place,
 *              {@code null} while a playoff player is still alive
 */
public record Standing(
        Integer place,
        UUID playerId,
        Integer entryRating,
        int played,
        int wins,
        int losses,
        int setsWon,
        int setsLost
) {

    public int setDifferential() {
        return setsWon - setsLost;
    }
}
