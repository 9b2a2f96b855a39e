package com.spinrank.tournament.format;

import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.rating.PointExchange;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.web.TournamentEngineException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Result plumbing shared by the single-stage formats.
 */
public abstract class AbstractFormatHandler implements TournamentFormatHandler {

    protected final RatingAdjustmentEngine ratingAdjustmentEngine;

    protected AbstractFormatHandler(RatingAdjustmentEngine ratingAdjustmentEngine) {
        this.ratingAdjustmentEngine = ratingAdjustmentEngine;
    }

    /**
     * Reads the submitted score in the orientation of the scheduled sides and validates it.
     */
    protected MatchScore orientAndValidate(
            ResultSubmission submission,
            UUID sideA,
            UUID sideB,
            int round,
            int position
    ) {
        if (submission == null || submission.score() == null) {
            throw TournamentEngineException.invalidResult("A score is required");
        }
        MatchScore score = submission.score();
        UUID namedA = submission.participantA();
        UUID namedB = submission.participantB();
        if (namedA != null || namedB != null) {
            boolean sameOrder = Objects.equals(namedA, sideA) && Objects.equals(namedB, sideB);
            boolean reversed = Objects.equals(namedA, sideB) && Objects.equals(namedB, sideA);
            if (!sameOrder && !reversed) {
                throw TournamentEngineException.invalidState(
                        "Players " + namedA + " and " + namedB + " do not meet at round " + round
                                + ", position " + position);
            }
            if (reversed) {
                score = score.swapped();
            }
        }
        return score.validated();
    }

    protected MatchRecord buildRecord(
            UUID matchId,
            int round,
            int position,
            UUID sideA,
            UUID sideB,
            MatchScore score,
            Integer ratingBeforeA,
            Integer ratingBeforeB,
            OffsetDateTime recordedAt
    ) {
        boolean aWins = score.sideAWins();
        PointExchange exchange = ratingAdjustmentEngine.pointExchange(ratingBeforeA, ratingBeforeB, aWins);
        return new MatchRecord(
                matchId,
                round,
                position,
                sideA,
                sideB,
                score.setsA(),
                score.setsB(),
                score.forfeitA(),
                score.forfeitB(),
                aWins ? sideA : sideB,
                ratingBeforeA,
                ratingBeforeB,
                exchange.deltaA(),
                exchange.deltaB(),
                exchange.upset(),
                recordedAt
        );
    }

    /**
     * Re-scores an existing result with its stored rating-before snapshot.
     */
    protected MatchRecord rescore(MatchRecord existing, MatchScore score, OffsetDateTime recordedAt) {
        return buildRecord(
                existing.matchId(),
                existing.round(),
                existing.position(),
                existing.participantA(),
                existing.participantB(),
                score,
                existing.ratingBeforeA(),
                existing.ratingBeforeB(),
                recordedAt
        );
    }

    protected static void replaceRecord(Tournament tournament, MatchRecord replacement) {
        List<MatchRecord> matches = tournament.getMatches();
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i).matchId().equals(replacement.matchId())) {
                matches.set(i, replacement);
                return;
            }
        }
        throw new IllegalStateException("Match " + replacement.matchId() + " is not recorded");
    }
}
