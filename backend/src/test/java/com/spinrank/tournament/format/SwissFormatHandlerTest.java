package com.spinrank.tournament.format;

import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.schedule.StandingsCalculator;
import com.spinrank.tournament.schedule.SwissPairingPlanner;
import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwissFormatHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-04-03T09:00:00Z");

    private static final UUID P1 = UUID.fromString("00000000-0000-0000-0000-000000000E01");
    private static final UUID P3 = UUID.fromString("00000000-0000-0000-0000-000000000E03");

    private SwissFormatHandler handler;
    private Tournament tournament;

    @BeforeEach
    void setUp() {
        handler = new SwissFormatHandler(
                new RatingAdjustmentEngine(),
                new SwissPairingPlanner(),
                new StandingsCalculator(),
                new SpinrankRuntimeProperties()
        );
        tournament = swiss(TournamentSetup.defaults());
    }

    @Test
    void initializeResolvesRoundsAndPairsRoundOne() {
        assertEquals(4, tournament.getSwissSettings().rounds());
        assertTrue(tournament.getSwissSettings().pairByRating());
        assertEquals(4, tournament.getFixtures().size());
        assertEquals(16, handler.expectedMatchCount(tournament));
        assertEquals(1, SwissFormatHandler.pairedRounds(tournament));
    }

    @Test
    void roundCountOutsideTheBoundsIsRejected() {
        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> swiss(new TournamentSetup(5, null, null, null, List.of(), null, null)));

        assertEquals(TournamentErrorCode.INVALID_ROUND_CONFIG, exception.getErrorCode());
    }

    @Test
    void nextRoundWaitsForEveryResultOfTheCurrentOne() {
        handler.recordResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(3, 0)), NOW);

        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> handler.pairNextRound(tournament));

        assertEquals(TournamentErrorCode.INVALID_STATE, exception.getErrorCode());
    }

    @Test
    void ratingsChainIntoLaterRounds() {
        recordRound(1);

        List<Fixture> roundTwo = handler.pairNextRound(tournament);
        assertEquals(new Fixture(2, 0, P1, P3), roundTwo.get(0));

        MatchRecord result = handler.recordResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(3, 1)), NOW);
        assertEquals(1804, result.ratingBeforeA());
        assertEquals(1604, result.ratingBeforeB());
    }

    @Test
    void onlyTheLatestRoundAcceptsDeletes() {
        recordRound(1);
        handler.pairNextRound(tournament);
        handler.recordResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(3, 1)), NOW);

        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> handler.deleteResult(tournament, 1, 0));
        assertEquals(TournamentErrorCode.INVALID_STATE, exception.getErrorCode());

        handler.deleteResult(tournament, 2, 0);
        assertEquals(4, tournament.getMatches().size());

        MatchRecord edited = handler.editResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(3, 2)), NOW);
        assertEquals(2, edited.setsB());
    }

    @Test
    void pairedRoundsKeepTheirWinners() {
        recordRound(1);
        handler.pairNextRound(tournament);
        MatchRecord before = tournament.findMatch(1, 0).orElseThrow();

        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> handler.editResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(1, 3)), NOW));
        assertEquals(TournamentErrorCode.INVALID_STATE, exception.getErrorCode());
        assertEquals(before, tournament.findMatch(1, 0).orElseThrow());

        TournamentEngineException forfeit = assertThrows(TournamentEngineException.class,
                () -> handler.editResult(tournament, 1, 0, ResultSubmission.of(MatchScore.forfeitBy(true)), NOW));
        assertEquals(TournamentErrorCode.INVALID_STATE, forfeit.getErrorCode());

        MatchRecord corrected = handler.editResult(tournament, 1, 0, ResultSubmission.of(MatchScore.sets(3, 2)), NOW);
        assertEquals(before.winnerId(), corrected.winnerId());
        assertEquals(2, corrected.setsB());

        handler.recordResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(3, 0)), NOW);
        MatchRecord flipped = handler.editResult(tournament, 2, 0, ResultSubmission.of(MatchScore.sets(0, 3)), NOW);
        assertEquals(tournament.findFixture(2, 0).orElseThrow().playerB(), flipped.winnerId());
    }

    @Test
    void playsEveryConfiguredRoundThenRefusesAnother() {
        for (int round = 1; round <= 4; round++) {
            if (round > 1) {
                handler.pairNextRound(tournament);
            }
            assertFalse(handler.isComplete(tournament));
            recordRound(round);
        }

        assertTrue(handler.isComplete(tournament));
        assertEquals(16, tournament.getMatches().size());
        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> handler.pairNextRound(tournament));
        assertEquals(TournamentErrorCode.INVALID_STATE, exception.getErrorCode());
        assertEquals(P1, handler.standings(tournament).get(0).playerId());
    }

    private void recordRound(int round) {
        for (Fixture fixture : new ArrayList<>(tournament.getFixtures())) {
            if (fixture.round() == round) {
                handler.recordResult(tournament, round, fixture.position(),
                        ResultSubmission.of(MatchScore.sets(3, 0)), NOW);
            }
        }
    }

    private Tournament swiss(TournamentSetup setup) {
        List<Participant> participants = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            participants.add(new Participant(
                    UUID.fromString(String.format("00000000-0000-0000-0000-000000000E%02d", i)),
                    1900 - 100 * i,
                    i - 1));
        }
        Tournament created = new Tournament();
        created.setTournamentId(UUID.fromString("00000000-0000-0000-0000-000000000F02"));
        created.setFormat(TournamentFormat.SWISS);
        created.setParticipants(participants);
        handler.initialize(created, setup);
        return created;
    }
}
