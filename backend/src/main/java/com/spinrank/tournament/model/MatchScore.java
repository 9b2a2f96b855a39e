package com.spinrank.tournament.model;

import com.spinrank.tournament.web.TournamentEngineException;

/**
 * Submitted outcome of a single match, oriented to the node's A/B sides.
 */
public record MatchScore(
        int setsA,
        int setsB,
        boolean forfeitA,
        boolean forfeitB
) {

    public static MatchScore sets(int setsA, int setsB) {
        return new MatchScore(setsA, setsB, false, false);
    }

    public static MatchScore forfeitBy(boolean sideA) {
        return new MatchScore(0, 0, sideA, !sideA);
    }

    public MatchScore validated() {
        if (setsA < 0 || setsB < 0) {
            throw TournamentEngineException.invalidResult(
                    "Set counts must be non-negative, got " + setsA + ":" + setsB);
        }
        if (forfeitA && forfeitB) {
            throw TournamentEngineException.invalidResult("Both sides cannot forfeit the same match");
        }
        if (!isForfeit() && setsA == setsB) {
            throw TournamentEngineException.invalidResult(
                    "Equal score " + setsA + ":" + setsB + " does not decide a winner");
        }
        return this;
    }

    public boolean isForfeit() {
        return forfeitA || forfeitB;
    }

    public boolean sideAWins() {
        if (forfeitA) {
            return false;
        }
        if (forfeitB) {
            return true;
        }
        return setsA > setsB;
    }

    public MatchScore swapped() {
        return new MatchScore(setsB, setsA, forfeitB, forfeitA);
    }
}
