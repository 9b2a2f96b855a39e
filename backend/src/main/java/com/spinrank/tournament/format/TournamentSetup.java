package com.spinrank.tournament.format;

import java.util.List;
import java.util.UUID;

/**
 * Format-specific creation options. Every field is optional; unset values fall back to configured defaults.
 */
public record TournamentSetup(
        Integer swissRounds,
        Boolean pairByRating,
        Integer groupCount,
        Integer finalSize,
        List<UUID> autoQualified,
        List<List<UUID>> groups,
        List<UUID> bracketPositions
) {

    public static TournamentSetup defaults() {
        return new TournamentSetup(null, null, null, null, List.of(), null, null);
    }
}
