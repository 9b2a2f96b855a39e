package com.spinrank.tournament.format;

import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.schedule.RoundRobinScheduler;
import com.spinrank.tournament.schedule.StandingsCalculator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * All-play-all group. Group matches are unordered, so every match is rated from entry ratings.
 */
@Component
public class RoundRobinFormatHandler extends AbstractFixtureFormatHandler {

    private final RoundRobinScheduler scheduler;
    private final StandingsCalculator standingsCalculator;

    public RoundRobinFormatHandler(
            RatingAdjustmentEngine ratingAdjustmentEngine,
            RoundRobinScheduler scheduler,
            StandingsCalculator standingsCalculator
    ) {
        super(ratingAdjustmentEngine);
        this.scheduler = scheduler;
        this.standingsCalculator = standingsCalculator;
    }

    @Override
    public TournamentFormat format() {
        return TournamentFormat.ROUND_ROBIN;
    }

    @Override
    public List<Tournament> initialize(Tournament tournament, TournamentSetup setup) {
        tournament.setFixtures(scheduler.schedule(tournament.getParticipants()));
        return List.of();
    }

    @Override
    public int expectedMatchCount(Tournament tournament) {
        return RoundRobinScheduler.expectedMatches(tournament.getParticipants().size());
    }

    @Override
    public List<Standing> standings(Tournament tournament) {
        return standingsCalculator.rank(tournament.getParticipants(), tournament.getMatches());
    }

    @Override
    protected Integer ratingBefore(Tournament tournament, UUID playerId, int round, int position) {
        return tournament.findParticipant(playerId)
                .map(Participant::entryRating)
                .orElse(null);
    }
}
