package com.spinrank.tournament.format;

import com.spinrank.tournament.model.MatchScore;

import java.util.UUID;

/**
 * A result as submitted by the caller. Participants are optional; when given, they may be in either order
 * and the score is read in the same order.
 */
public record ResultSubmission(
        UUID participantA,
        UUID participantB,
        MatchScore score
) {

    public static ResultSubmission of(MatchScore score) {
        return new ResultSubmission(null, null, score);
    }
}
