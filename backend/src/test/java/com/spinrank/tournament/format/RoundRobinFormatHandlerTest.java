package com.spinrank.tournament.format;

import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.schedule.RoundRobinScheduler;
import com.spinrank.tournament.schedule.StandingsCalculator;
import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundRobinFormatHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-04-02T18:30:00Z");

    private static final UUID A = UUID.fromString("00000000-0000-0000-0000-000000000C01");
    private static final UUID B = UUID.fromString("00000000-0000-0000-0000-000000000C02");
    private static final UUID C = UUID.fromString("00000000-0000-0000-0000-000000000C03");
    private static final UUID D = UUID.fromString("00000000-0000-0000-0000-000000000C04");

    private RoundRobinFormatHandler handler;
    private Tournament tournament;

    @BeforeEach
    void setUp() {
        handler = new RoundRobinFormatHandler(
                new RatingAdjustmentEngine(), new RoundRobinScheduler(), new StandingsCalculator());
        tournament = new Tournament();
        tournament.setTournamentId(UUID.fromString("00000000-0000-0000-0000-000000000F01"));
        tournament.setFormat(TournamentFormat.ROUND_ROBIN);
        tournament.setParticipants(List.of(
                new Participant(A, 1500, 0),
                new Participant(B, 1400, 1),
                new Participant(C, 1300, 2),
                new Participant(D, 1200, 3)
        ));
        handler.initialize(tournament, TournamentSetup.defaults());
    }

    @Test
    void everyMatchIsRatedFromEntryRatings() {
        MatchRecord upset = handler.recordResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(1, 3)), NOW);
        MatchRecord later = handler.recordResult(tournament, 3, 0, ResultSubmission.of(MatchScore.sets(3, 2)), NOW);

        assertEquals(C, upset.winnerId());
        assertTrue(upset.upset());
        assertEquals(-40, upset.ratingChangeA());
        assertEquals(40, upset.ratingChangeB());

        assertEquals(A, later.participantA());
        assertEquals(1500, later.ratingBeforeA());
        assertEquals(1400, later.ratingBeforeB());
    }

    @Test
    void rejectsUnknownFixturesAndDuplicateResults() {
        TournamentEngineException missing = assertThrows(TournamentEngineException.class,
                () -> handler.recordResult(tournament, 9, 0, ResultSubmission.of(MatchScore.sets(3, 0)), NOW));
        assertEquals(TournamentErrorCode.NOT_FOUND, missing.getErrorCode());

        handler.recordResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(3, 0)), NOW);
        TournamentEngineException duplicate = assertThrows(TournamentEngineException.class,
                () -> handler.recordResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(3, 0)), NOW));
        assertEquals(TournamentErrorCode.INVALID_STATE, duplicate.getErrorCode());
    }

    @Test
    void editKeepsTheStoredRatingSnapshot() {
        MatchRecord original = handler.recordResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(1, 3)), NOW);

        MatchRecord edited = handler.editResult(tournament, 2, 0,
                new ResultSubmission(C, A, MatchScore.sets(0, 3)), NOW);

        assertEquals(original.matchId(), edited.matchId());
        assertEquals(A, edited.winnerId());
        assertEquals(3, edited.setsA());
        assertEquals(0, edited.setsB());
        assertEquals(1500, edited.ratingBeforeA());
        assertEquals(1300, edited.ratingBeforeB());
        assertEquals(1, edited.ratingChangeA());
        assertEquals(1, tournament.getMatches().size());
    }

    @Test
    void deleteReopensTheFixture() {
        handler.recordResult(tournament, 1, 1, ResultSubmission.of(MatchScore.sets(3, 1)), NOW);

        handler.deleteResult(tournament, 1, 1);

        assertTrue(tournament.getMatches().isEmpty());
        TournamentEngineException again = assertThrows(TournamentEngineException.class,
                () -> handler.deleteResult(tournament, 1, 1));
        assertEquals(TournamentErrorCode.INVALID_STATE, again.getErrorCode());
    }

    @Test
    void completesOnceEveryFixtureHasAResult() {
        assertEquals(6, handler.expectedMatchCount(tournament));
        for (Fixture fixture : tournament.getFixtures()) {
            assertFalse(handler.isComplete(tournament));
            handler.recordResult(tournament, fixture.round(), fixture.position(),
                    ResultSubmission.of(MatchScore.sets(3, 0)), NOW);
        }

        assertTrue(handler.isComplete(tournament));
        List<Standing> standings = handler.standings(tournament);
        assertEquals(4, standings.size());
        assertEquals(6, standings.stream().mapToInt(Standing::wins).sum());
    }
}
