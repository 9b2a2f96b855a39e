package com.spinrank.tournament.format;

import com.spinrank.tournament.bracket.BracketBuilder;
import com.spinrank.tournament.bracket.BracketStateMachine;
import com.spinrank.tournament.model.Bracket;
import com.spinrank.tournament.model.BracketMatch;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.rating.RatingLedger;
import com.spinrank.tournament.schedule.StandingsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Single elimination. Ratings chain round over round: each match starts from the rating the player
 * left their previous match with.
 */
@Component
public class PlayoffFormatHandler extends AbstractFormatHandler {

    private static final Logger log = LoggerFactory.getLogger(PlayoffFormatHandler.class);

    private final BracketBuilder bracketBuilder;
    private final BracketStateMachine stateMachine;
    private final StandingsCalculator standingsCalculator;

    public PlayoffFormatHandler(
            RatingAdjustmentEngine ratingAdjustmentEngine,
            BracketBuilder bracketBuilder,
            BracketStateMachine stateMachine,
            StandingsCalculator standingsCalculator
    ) {
        super(ratingAdjustmentEngine);
        this.bracketBuilder = bracketBuilder;
        this.stateMachine = stateMachine;
        this.standingsCalculator = standingsCalculator;
    }

    @Override
    public TournamentFormat format() {
        return TournamentFormat.PLAYOFF;
    }

    @Override
    public List<Tournament> initialize(Tournament tournament, TournamentSetup setup) {
        BracketBuilder.BracketPlan plan = setup.bracketPositions() != null
                ? bracketBuilder.buildFromPositions(tournament.getParticipants(), setup.bracketPositions())
                : bracketBuilder.build(tournament.getParticipants());
        tournament.setBracket(plan.bracket());
        return List.of();
    }

    /**
     * Builds the bracket from an explicit seed order instead of entry ratings.
     */
    public void initializeSeeded(Tournament tournament, List<Participant> seedOrder) {
        tournament.setBracket(bracketBuilder.buildSeeded(seedOrder).bracket());
    }

    @Override
    public int expectedMatchCount(Tournament tournament) {
        return tournament.getParticipants().size() - 1;
    }

    @Override
    public boolean isComplete(Tournament tournament) {
        return tournament.getBracket() != null && tournament.getBracket().isComplete();
    }

    @Override
    public MatchRecord recordResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        Bracket bracket = tournament.getBracket();
        BracketMatch node = stateMachine.requireReady(bracket, round, position);
        UUID sideA = node.getSlotA().playerId();
        UUID sideB = node.getSlotB().playerId();
        MatchScore score = orientAndValidate(submission, sideA, sideB, round, position);

        RatingLedger ledger = RatingLedger.of(tournament.getParticipants(), tournament.getMatches());
        MatchRecord record = buildRecord(
                UUID.randomUUID(),
                round,
                position,
                sideA,
                sideB,
                score,
                ledger.ratingBefore(sideA, round, position),
                ledger.ratingBefore(sideB, round, position),
                recordedAt
        );
        tournament.getMatches().add(record);
        stateMachine.decide(bracket, node, record.winnerId(), record.matchId());

        log.info(
                "Recorded playoff result {} at round {}, position {}: winner {} ({} / {})",
                record.matchId(), round, position, record.winnerId(), record.ratingChangeA(), record.ratingChangeB()
        );
        return record;
    }

    @Override
    public MatchRecord editResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        Bracket bracket = tournament.getBracket();
        BracketMatch node = stateMachine.requireRecorded(bracket, round, position);
        MatchRecord existing = tournament.findMatchById(node.getMatchId())
                .orElseThrow(() -> new IllegalStateException("Bracket references missing match " + node.getMatchId()));
        MatchScore score = orientAndValidate(
                submission, existing.participantA(), existing.participantB(), round, position);

        MatchRecord updated = rescore(existing, score, recordedAt);
        replaceRecord(tournament, updated);

        if (!updated.winnerId().equals(existing.winnerId())) {
            List<BracketMatch> cleared = stateMachine.invalidateDownstream(bracket, node);
            removeResults(tournament, cleared);
            stateMachine.decide(bracket, node, updated.winnerId(), updated.matchId());
            log.warn(
                    "Winner of round {}, position {} changed from {} to {}; discarded {} downstream results",
                    round, position, existing.winnerId(), updated.winnerId(), cleared.size()
            );
        } else {
            log.info("Corrected score of playoff result {} at round {}, position {}", updated.matchId(), round, position);
        }
        return updated;
    }

    @Override
    public void deleteResult(Tournament tournament, int round, int position) {
        Bracket bracket = tournament.getBracket();
        BracketMatch node = stateMachine.requireRecorded(bracket, round, position);
        UUID matchId = node.getMatchId();
        List<BracketMatch> cleared = stateMachine.clearDecision(bracket, node);
        tournament.getMatches().removeIf(match -> match.matchId().equals(matchId));
        removeResults(tournament, cleared);
        log.warn(
                "Deleted playoff result {} at round {}, position {}; discarded {} downstream results",
                matchId, round, position, cleared.size()
        );
    }

    @Override
    public List<Standing> standings(Tournament tournament) {
        return standingsCalculator.playoffPlacements(
                tournament.getBracket(), tournament.getParticipants(), tournament.getMatches());
    }

    @Override
    public void recompute(Tournament tournament) {
        List<MatchRecord> orphans = stateMachine.rebuild(tournament.getBracket(), tournament.getMatches());
        if (!orphans.isEmpty()) {
            Set<UUID> orphanIds = new HashSet<>();
            orphans.forEach(orphan -> orphanIds.add(orphan.matchId()));
            tournament.getMatches().removeIf(match -> orphanIds.contains(match.matchId()));
            log.warn("Dropped {} results that no longer fit the bracket of {}", orphans.size(), tournament.getTournamentId());
        }
    }

    private static void removeResults(Tournament tournament, List<BracketMatch> cleared) {
        Set<UUID> clearedIds = new HashSet<>();
        for (BracketMatch node : cleared) {
            if (node.getMatchId() != null) {
                clearedIds.add(node.getMatchId());
            }
        }
        tournament.getMatches().removeIf(match -> clearedIds.contains(match.matchId()));
    }
}
