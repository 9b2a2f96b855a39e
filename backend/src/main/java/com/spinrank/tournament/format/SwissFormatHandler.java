package com.spinrank.tournament.format;

import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.SwissSettings;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.rating.RatingLedger;
import com.spinrank.tournament.schedule.StandingsCalculator;
import com.spinrank.tournament.schedule.SwissPairingPlanner;
import com.spinrank.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Swiss system. Round 1 is paired at creation, later rounds on request once the previous round is
 * fully recorded. Ratings chain round over round like an elimination draw.
 */
@Component
public class SwissFormatHandler extends AbstractFixtureFormatHandler {

    private static final Logger log = LoggerFactory.getLogger(SwissFormatHandler.class);

    private final SwissPairingPlanner pairingPlanner;
    private final StandingsCalculator standingsCalculator;
    private final SpinrankRuntimeProperties properties;

    public SwissFormatHandler(
            RatingAdjustmentEngine ratingAdjustmentEngine,
            SwissPairingPlanner pairingPlanner,
            StandingsCalculator standingsCalculator,
            SpinrankRuntimeProperties properties
    ) {
        super(ratingAdjustmentEngine);
        this.pairingPlanner = pairingPlanner;
        this.standingsCalculator = standingsCalculator;
        this.properties = properties;
    }

    @Override
    public TournamentFormat format() {
        return TournamentFormat.SWISS;
    }

    @Override
    public List<Tournament> initialize(Tournament tournament, TournamentSetup setup) {
        int rounds = pairingPlanner.resolveRounds(tournament.getParticipants().size(), setup.swissRounds());
        boolean pairByRating = setup.pairByRating() != null
                ? setup.pairByRating()
                : properties.getSwiss().isPairByRating();
        tournament.setSwissSettings(new SwissSettings(rounds, pairByRating));
        tournament.setFixtures(new ArrayList<>(pairingPlanner.pairRound(
                tournament.getParticipants(), List.of(), List.of(), 1, pairByRating)));
        return List.of();
    }

    @Override
    public int expectedMatchCount(Tournament tournament) {
        return tournament.getSwissSettings().rounds() * tournament.getParticipants().size() / 2;
    }

    public List<Fixture> pairNextRound(Tournament tournament) {
        SwissSettings settings = tournament.getSwissSettings();
        int pairedRounds = pairedRounds(tournament);
        if (pairedRounds >= settings.rounds()) {
            throw TournamentEngineException.invalidState(
                    "All " + settings.rounds() + " Swiss rounds are already paired");
        }
        long open = tournament.getFixtures().stream()
                .filter(fixture -> fixture.round() == pairedRounds)
                .filter(fixture -> tournament.findMatch(fixture.round(), fixture.position()).isEmpty())
                .count();
        if (open > 0) {
            throw TournamentEngineException.invalidState(
                    "Swiss round " + pairedRounds + " still has " + open + " unrecorded matches");
        }

        List<Fixture> next = pairingPlanner.pairRound(
                tournament.getParticipants(),
                tournament.getMatches(),
                tournament.getFixtures(),
                pairedRounds + 1,
                settings.pairByRating()
        );
        tournament.getFixtures().addAll(next);
        log.info("Paired Swiss round {} of tournament {}", pairedRounds + 1, tournament.getTournamentId());
        return next;
    }

    public static int pairedRounds(Tournament tournament) {
        return tournament.getFixtures().stream()
                .mapToInt(Fixture::round)
                .max()
                .orElse(0);
    }

    /**
     * Only results of the latest paired round may be removed; earlier rounds already shaped later pairings.
     */
    @Override
    public void deleteResult(Tournament tournament, int round, int position) {
        int latest = pairedRounds(tournament);
        if (round < latest) {
            throw TournamentEngineException.invalidState(
                    "Round " + round + " results cannot be deleted once round " + latest + " is paired");
        }
        super.deleteResult(tournament, round, position);
    }

    /**
     * Earlier rounds accept score corrections, but not a different winner.
     */
    @Override
    public MatchRecord editResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        int latest = pairedRounds(tournament);
        if (round < latest) {
            MatchRecord existing = requireRecorded(tournament, round, position);
            MatchScore score = orientAndValidate(
                    submission, existing.participantA(), existing.participantB(), round, position);
            UUID winner = score.sideAWins() ? existing.participantA() : existing.participantB();
            if (!winner.equals(existing.winnerId())) {
                throw TournamentEngineException.invalidState("Round " + round
                        + " winner cannot change once round " + latest + " is paired");
            }
        }
        return super.editResult(tournament, round, position, submission, recordedAt);
    }

    @Override
    public List<Standing> standings(Tournament tournament) {
        return standingsCalculator.rank(tournament.getParticipants(), tournament.getMatches());
    }

    @Override
    protected Integer ratingBefore(Tournament tournament, UUID playerId, int round, int position) {
        return RatingLedger.of(tournament.getParticipants(), tournament.getMatches())
                .ratingBefore(playerId, round, position);
    }
}
