package com.spinrank.tournament.model;

import java.util.UUID;

/**
 * Scheduled pairing of a round-robin or Swiss round.
 */
public record Fixture(
        int round,
        int position,
        UUID playerA,
        UUID playerB
) {

    public boolean involves(UUID playerId) {
        return playerId.equals(playerA) || playerId.equals(playerB);
    }

    public boolean pairs(UUID first, UUID second) {
        return (first.equals(playerA) && second.equals(playerB))
                || (first.equals(playerB) && second.equals(playerA));
    }
}
