package com.spinrank.tournament.model;

import java.util.UUID;

public record FinalRating(
        UUID playerId,
        Integer entryRating,
        int ratingChange,
        Integer finalRating
) {
}
