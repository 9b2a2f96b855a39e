package com.spinrank.tournament.model;

import java.util.UUID;

/**
 * A player entered into one tournament.
 *
 * @param playerId    stable player identifier
 * @param entryRating rating frozen at entry time, {@code null} for unrated players
 * @param entryOrder  0-based registration order, used as the final standings tiebreak
 */
public record Participant(
        UUID playerId,
        Integer entryRating,
        int entryOrder
) {
}
