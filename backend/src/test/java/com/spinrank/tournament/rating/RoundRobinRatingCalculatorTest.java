package com.spinrank.tournament.rating;

import com.spinrank.tournament.model.FinalRating;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class RoundRobinRatingCalculatorTest {

    private final RoundRobinRatingCalculator calculator = new RoundRobinRatingCalculator(new RatingAdjustmentEngine());

    @Test
    void smallGainsFallBackToEntryRatingBeforeTheFinalReplay() {
        List<Participant> participants = participants(1500, 1500);
        UUID a = participants.get(0).playerId();
        UUID b = participants.get(1).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(win(1, a, b)));

        assertEquals(1508, passes.firstPass().get(a));
        assertEquals(1492, passes.firstPass().get(b));
        assertEquals(1500, passes.secondPass().get(a));
        assertEquals(1500, passes.secondPass().get(b));
        assertEquals(1500, passes.thirdPass().get(b));
        assertEquals(1508, passes.finalRatings().get(a));
        assertEquals(1492, passes.finalRatings().get(b));
    }

    @Test
    void firstPassUsesTheRunningRating() {
        List<Participant> participants = participants(1500, 1600, 1600);
        UUID a = participants.get(0).playerId();
        UUID b = participants.get(1).playerId();
        UUID c = participants.get(2).playerId();

        // 100 apart is a 20 point upset, then 80 apart is worth 16
        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants,
                List.of(win(1, a, b), win(2, a, c)));

        assertEquals(1536, passes.firstPass().get(a));
        assertEquals(1580, passes.firstPass().get(b));
        assertEquals(1500, passes.secondPass().get(a));
        assertEquals(1600, passes.secondPass().get(b));
    }

    @Test
    void moderateGainKeepsTheFirstPassRating() {
        List<Participant> participants = participants(1500, 1650, 1650);
        UUID a = participants.get(0).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants,
                List.of(win(1, a, participants.get(1).playerId()), win(2, a, participants.get(2).playerId())));

        assertEquals(1555, passes.firstPass().get(a));
        assertEquals(1555, passes.secondPass().get(a));
        assertEquals(1555, passes.thirdPass().get(a));
    }

    @Test
    void largeGainWithWinsAndLossesAveragesWithBestWinAndWorstLoss() {
        List<Participant> participants = participants(1500, 1800, 1800, 1900);
        UUID a = participants.get(0).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(
                win(1, a, participants.get(1).playerId()),
                win(2, a, participants.get(2).playerId()),
                win(3, participants.get(3).playerId(), a)
        ));

        assertEquals(1610, passes.firstPass().get(a));
        // (1610 + (1800 + 1900) / 2) / 2
        assertEquals(1730, passes.secondPass().get(a));
    }

    @Test
    void largeGainWithOnlyWinsTakesTheUpperMedianOpponent() {
        List<Participant> participants = participants(1500, 1800, 1800, 1700);
        UUID a = participants.get(0).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(
                win(1, a, participants.get(1).playerId()),
                win(2, a, participants.get(2).playerId()),
                win(3, a, participants.get(3).playerId())
        ));

        assertEquals(1630, passes.firstPass().get(a));
        assertEquals(1800, passes.secondPass().get(a));
    }

    @Test
    void thirdPassNeverStartsARatedPlayerBelowEntry() {
        List<Participant> participants = participants(1500, 1800, 1800, 1200, 1200, 1200);
        UUID a = participants.get(0).playerId();
        List<MatchRecord> matches = new ArrayList<>();
        for (int i = 1; i < participants.size(); i++) {
            matches.add(win(i, a, participants.get(i).playerId()));
        }

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, matches);

        assertEquals(1610, passes.firstPass().get(a));
        assertEquals(1200, passes.secondPass().get(a));
        assertEquals(1500, passes.thirdPass().get(a));
    }

    @Test
    void unratedWinnerIsPlacedAboveTheBestBeatenOpponent() {
        List<Participant> participants = participants(1500, 1540, null);
        UUID a = participants.get(0).playerId();
        UUID b = participants.get(1).playerId();
        UUID u = participants.get(2).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants,
                List.of(win(1, u, a), win(2, u, b), win(3, a, b)));

        assertFalse(passes.firstPass().containsKey(u));
        assertEquals(1550, passes.secondPass().get(u));
        assertEquals(1550, passes.thirdPass().get(u));
        assertEquals(1563, passes.finalRatings().get(u));
        assertEquals(1507, passes.finalRatings().get(a));
        assertEquals(1522, passes.finalRatings().get(b));
    }

    @Test
    void unratedLoserIsPlacedBelowTheWeakestWinner() {
        List<Participant> participants = participants(1500, 1600, null);
        UUID u = participants.get(2).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(
                win(1, participants.get(0).playerId(), u),
                win(2, participants.get(1).playerId(), u)
        ));

        assertEquals(1495, passes.secondPass().get(u));
    }

    @Test
    void unratedPlayerWithWinsAndLossesSitsBetweenThem() {
        List<Participant> participants = participants(1500, 1600, null);
        UUID u = participants.get(2).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(
                win(1, u, participants.get(0).playerId()),
                win(2, participants.get(1).playerId(), u)
        ));

        assertEquals(1550, passes.secondPass().get(u));
    }

    @Test
    void unratedEstimateReadsAdjustedOpponentRatings() {
        List<Participant> participants = participants(1500, 1650, 1650, null);
        UUID a = participants.get(0).playerId();
        UUID u = participants.get(3).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(
                win(1, a, participants.get(1).playerId()),
                win(2, a, participants.get(2).playerId()),
                win(3, a, u)
        ));

        assertEquals(1555, passes.secondPass().get(a));
        assertEquals(1555, passes.secondPass().get(u));
    }

    @Test
    void unratedPlayersWhoOnlyMetUnratedOpponentsStartFromDefault() {
        List<Participant> participants = participants(null, null);
        UUID first = participants.get(0).playerId();
        UUID second = participants.get(1).playerId();

        RoundRobinRatingCalculator.RatingPasses passes = calculator.calculate(participants, List.of(win(1, first, second)));

        assertEquals(RoundRobinRatingCalculator.UNRATED_ESTIMATE, passes.secondPass().get(first));
        assertEquals(RoundRobinRatingCalculator.UNRATED_ESTIMATE, passes.secondPass().get(second));
        assertEquals(1208, passes.finalRatings().get(first));
        assertEquals(1192, passes.finalRatings().get(second));
    }

    @Test
    void forfeitsAreIgnored() {
        List<Participant> participants = participants(1500, 1500, null);
        UUID a = participants.get(0).playerId();
        UUID b = participants.get(1).playerId();
        UUID u = participants.get(2).playerId();

        List<FinalRating> ratings = calculator.finalRatings(participants,
                List.of(forfeitWin(1, a, b), forfeitWin(2, a, u)));

        assertEquals(1500, ratings.get(0).finalRating());
        assertEquals(0, ratings.get(0).ratingChange());
        assertEquals(1500, ratings.get(1).finalRating());
        assertNull(ratings.get(2).finalRating());
    }

    @Test
    void finalReplayNeverDropsBelowZero() {
        List<Participant> participants = participants(0, 0);
        UUID a = participants.get(0).playerId();
        UUID b = participants.get(1).playerId();

        List<FinalRating> ratings = calculator.finalRatings(participants, List.of(win(1, b, a)));

        assertEquals(0, ratings.get(0).finalRating());
        assertEquals(0, ratings.get(0).ratingChange());
        assertEquals(8, ratings.get(1).finalRating());
        assertEquals(8, ratings.get(1).ratingChange());
    }

    private static List<Participant> participants(Integer... ratings) {
        List<Participant> participants = new ArrayList<>();
        List<Integer> values = Arrays.asList(ratings);
        for (int i = 0; i < values.size(); i++) {
            participants.add(new Participant(UUID.randomUUID(), values.get(i), i));
        }
        return participants;
    }

    private static MatchRecord win(int round, UUID winner, UUID loser) {
        return new MatchRecord(UUID.randomUUID(), round, 0, winner, loser, 3, 1, false, false, winner,
                null, null, 0, 0, false, OffsetDateTime.now());
    }

    private static MatchRecord forfeitWin(int round, UUID winner, UUID loser) {
        return new MatchRecord(UUID.randomUUID(), round, 0, winner, loser, 0, 0, false, true, winner,
                null, null, 0, 0, false, OffsetDateTime.now());
    }
}
