package com.spinrank.tournament.model;

import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchScoreTest {

    @Test
    void higherSetCountWins() {
        assertTrue(MatchScore.sets(3, 2).validated().sideAWins());
        assertFalse(MatchScore.sets(1, 3).validated().sideAWins());
    }

    @Test
    void forfeitOverridesSetCounts() {
        MatchScore score = new MatchScore(3, 0, true, false).validated();

        assertTrue(score.isForfeit());
        assertFalse(score.sideAWins());
        assertTrue(MatchScore.forfeitBy(false).validated().sideAWins());
    }

    @Test
    void swappedMirrorsSidesAndForfeits() {
        MatchScore swapped = new MatchScore(1, 3, true, false).swapped();

        assertEquals(new MatchScore(3, 1, false, true), swapped);
    }

    @Test
    void rejectsScoresThatDecideNothing() {
        assertInvalid(MatchScore.sets(0, 0));
        assertInvalid(MatchScore.sets(2, 2));
        assertInvalid(MatchScore.sets(-1, 3));
        assertInvalid(new MatchScore(0, 0, true, true));
    }

    private static void assertInvalid(MatchScore score) {
        TournamentEngineException exception = assertThrows(TournamentEngineException.class, score::validated);
        assertEquals(TournamentErrorCode.INVALID_RESULT, exception.getErrorCode());
    }
}
