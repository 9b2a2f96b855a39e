package com.spinrank.tournament.model;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable result ledger entry. Rating-before values are snapshotted when the result is first recorded.
 */
public record MatchRecord(
        UUID matchId,
        int round,
        int position,
        UUID participantA,
        UUID participantB,
        int setsA,
        int setsB,
        boolean forfeitA,
        boolean forfeitB,
        UUID winnerId,
        Integer ratingBeforeA,
        Integer ratingBeforeB,
        int ratingChangeA,
        int ratingChangeB,
        boolean upset,
        OffsetDateTime recordedAt
) {

    public UUID loserId() {
        return winnerId.equals(participantA) ? participantB : participantA;
    }

    public Integer ratingAfterA() {
        return ratingBeforeA == null ? null : Math.max(0, ratingBeforeA + ratingChangeA);
    }

    public Integer ratingAfterB() {
        return ratingBeforeB == null ? null : Math.max(0, ratingBeforeB + ratingChangeB);
    }

    public boolean isForfeit() {
        return forfeitA || forfeitB;
    }

    public boolean involves(UUID playerId) {
        return playerId.equals(participantA) || playerId.equals(participantB);
    }

    public boolean isAt(int round, int position) {
        return this.round == round && this.position == position;
    }

    public int ratingChangeFor(UUID playerId) {
        if (playerId.equals(participantA)) {
            return ratingChangeA;
        }
        return playerId.equals(participantB) ? ratingChangeB : 0;
    }

    public MatchScore score() {
        return new MatchScore(setsA, setsB, forfeitA, forfeitB);
    }
}
