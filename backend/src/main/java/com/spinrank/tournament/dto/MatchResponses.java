package com.spinrank.tournament.dto;

import com.spinrank.tournament.model.TournamentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class MatchResponses {

    private MatchResponses() {
    }

    public record MatchResult(
            UUID matchId,
            UUID tournamentId,
            Integer round,
            Integer position,
            UUID participantA,
            UUID participantB,
            Integer setsA,
            Integer setsB,
            boolean forfeitA,
            boolean forfeitB,
            UUID winnerId,
            Integer ratingBeforeA,
            Integer ratingBeforeB,
            Integer ratingChangeA,
            Integer ratingChangeB,
            Integer ratingAfterA,
            Integer ratingAfterB,
            boolean upset,
            OffsetDateTime recordedAt,
            TournamentStatus tournamentStatus
    ) {
    }
}
