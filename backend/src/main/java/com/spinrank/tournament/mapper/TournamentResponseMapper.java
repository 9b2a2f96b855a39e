package com.spinrank.tournament.mapper;

import com.spinrank.tournament.bracket.BracketBuilder;
import com.spinrank.tournament.dto.MatchResponses;
import com.spinrank.tournament.dto.TournamentResponses;
import com.spinrank.tournament.format.SwissFormatHandler;
import com.spinrank.tournament.model.Bracket;
import com.spinrank.tournament.model.BracketMatch;
import com.spinrank.tournament.model.BracketSlot;
import com.spinrank.tournament.model.FinalRating;
import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.PreliminarySettings;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.SwissSettings;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.rating.PointExchange;
import com.spinrank.tournament.rating.RatingLedger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Component
public class TournamentResponseMapper {

    public TournamentResponses.TournamentSummary toSummary(Tournament tournament, MatchCounts counts) {
        return new TournamentResponses.TournamentSummary(
                tournament.getTournamentId(),
                tournament.getName(),
                tournament.getFormat(),
                tournament.getStatus(),
                tournament.isCancelled(),
                tournament.getStage(),
                tournament.getParentTournamentId(),
                tournament.getParticipants().size(),
                counts.expected(),
                counts.recorded(),
                counts.complete(),
                tournament.getCreatedAt(),
                tournament.getUpdatedAt(),
                tournament.getCompletedAt()
        );
    }

    public TournamentResponses.TournamentDetail toDetail(Tournament tournament, MatchCounts counts) {
        Bracket bracket = tournament.getBracket();
        List<TournamentResponses.ParticipantView> participants = tournament.getParticipants().stream()
                .map(participant -> new TournamentResponses.ParticipantView(
                        participant.playerId(),
                        participant.entryRating(),
                        participant.entryOrder(),
                        bracket != null ? bracket.seedOf(participant.playerId()) : null
                ))
                .toList();

        return new TournamentResponses.TournamentDetail(
                tournament.getTournamentId(),
                tournament.getName(),
                tournament.getFormat(),
                tournament.getStatus(),
                tournament.isCancelled(),
                tournament.getStage(),
                tournament.getParentTournamentId(),
                tournament.getGroupIndex(),
                participants,
                counts.expected(),
                counts.recorded(),
                counts.complete(),
                toSwissView(tournament),
                toPreliminaryView(tournament.getPreliminarySettings()),
                List.copyOf(tournament.getChildTournamentIds()),
                tournament.getFinalTournamentId(),
                toStandingViews(tournament.getFinalStandings()),
                tournament.getFinalRatings().stream().map(this::toFinalRatingView).toList(),
                tournament.getCreatedAt(),
                tournament.getUpdatedAt(),
                tournament.getCompletedAt()
        );
    }

    public TournamentResponses.BracketView toBracketView(Tournament tournament) {
        Bracket bracket = tournament.getBracket();
        return new TournamentResponses.BracketView(
                tournament.getTournamentId(),
                bracket.getSize(),
                bracket.getTotalRounds(),
                bracket.byeCount(),
                bracket.isComplete(),
                bracket.finalMatch().getWinnerId(),
                toRoundViews(bracket)
        );
    }

    public List<TournamentResponses.FixtureView> toFixtureViews(Tournament tournament) {
        List<TournamentResponses.FixtureView> views = new ArrayList<>(tournament.getFixtures().size());
        for (Fixture fixture : tournament.getFixtures()) {
            MatchRecord match = tournament.findMatch(fixture.round(), fixture.position()).orElse(null);
            views.add(new TournamentResponses.FixtureView(
                    fixture.round(),
                    fixture.position(),
                    fixture.playerA(),
                    fixture.playerB(),
                    match != null,
                    match != null ? match.matchId() : null,
                    match != null ? match.winnerId() : null
            ));
        }
        return views;
    }

    public List<TournamentResponses.StandingView> toStandingViews(Collection<Standing> standings) {
        return standings.stream()
                .map(standing -> new TournamentResponses.StandingView(
                        standing.place(),
                        standing.playerId(),
                        standing.entryRating(),
                        standing.played(),
                        standing.wins(),
                        standing.losses(),
                        standing.setsWon(),
                        standing.setsLost(),
                        standing.setDifferential()
                ))
                .toList();
    }

    public List<TournamentResponses.RatingRoundView> toRatingRoundViews(List<RatingLedger.RoundRatings> rounds) {
        return rounds.stream()
                .map(round -> new TournamentResponses.RatingRoundView(
                        round.round(),
                        round.ratings().stream()
                                .map(line -> new TournamentResponses.RatingLineView(
                                        line.playerId(),
                                        line.ratingBefore(),
                                        line.change(),
                                        line.ratingAfter()
                                ))
                                .toList()
                ))
                .toList();
    }

    public MatchResponses.MatchResult toMatchResult(Tournament tournament, MatchRecord match) {
        return new MatchResponses.MatchResult(
                match.matchId(),
                tournament.getTournamentId(),
                match.round(),
                match.position(),
                match.participantA(),
                match.participantB(),
                match.setsA(),
                match.setsB(),
                match.forfeitA(),
                match.forfeitB(),
                match.winnerId(),
                match.ratingBeforeA(),
                match.ratingBeforeB(),
                match.ratingChangeA(),
                match.ratingChangeB(),
                match.ratingAfterA(),
                match.ratingAfterB(),
                match.upset(),
                match.recordedAt(),
                tournament.getStatus()
        );
    }

    public TournamentResponses.BracketPreview toBracketPreview(BracketBuilder.BracketPlan plan) {
        return new TournamentResponses.BracketPreview(
                plan.bracketSize(),
                plan.totalRounds(),
                plan.numSeeded(),
                plan.byeCount(),
                plan.seededEntries().stream()
                        .map(entry -> new TournamentResponses.SeededEntryView(
                                entry.playerId(),
                                entry.entryRating(),
                                entry.rank(),
                                entry.seed(),
                                entry.round1Position(),
                                entry.receivesBye()
                        ))
                        .toList(),
                toRoundViews(plan.bracket())
        );
    }

    public TournamentResponses.PointExchangePreview toPointExchangePreview(
            int ratingA,
            int ratingB,
            boolean aWon,
            PointExchange exchange
    ) {
        return new TournamentResponses.PointExchangePreview(
                ratingA,
                ratingB,
                aWon,
                exchange.ratingDifference(),
                exchange.upset(),
                exchange.points(),
                exchange.deltaA(),
                exchange.deltaB(),
                Math.max(0, ratingA + exchange.deltaA()),
                Math.max(0, ratingB + exchange.deltaB())
        );
    }

    private List<TournamentResponses.BracketRoundView> toRoundViews(Bracket bracket) {
        List<TournamentResponses.BracketRoundView> rounds = new ArrayList<>(bracket.getTotalRounds());
        for (int round = 1; round <= bracket.getTotalRounds(); round++) {
            rounds.add(new TournamentResponses.BracketRoundView(
                    round,
                    bracket.round(round).stream()
                            .map(node -> toNodeView(bracket, node))
                            .toList()
            ));
        }
        return rounds;
    }

    private TournamentResponses.BracketNodeView toNodeView(Bracket bracket, BracketMatch node) {
        return new TournamentResponses.BracketNodeView(
                node.getRound(),
                node.getPosition(),
                node.getState(),
                node.isByeResolved(),
                toSlotView(bracket, node.getSlotA()),
                toSlotView(bracket, node.getSlotB()),
                node.getWinnerId(),
                node.getMatchId()
        );
    }

    private static TournamentResponses.SlotView toSlotView(Bracket bracket, BracketSlot slot) {
        return new TournamentResponses.SlotView(slot.kind(), slot.playerId(), bracket.seedOf(slot.playerId()));
    }

    private TournamentResponses.SwissView toSwissView(Tournament tournament) {
        SwissSettings settings = tournament.getSwissSettings();
        if (settings == null) {
            return null;
        }
        return new TournamentResponses.SwissView(
                settings.rounds(),
                SwissFormatHandler.pairedRounds(tournament),
                settings.pairByRating()
        );
    }

    private static TournamentResponses.PreliminaryView toPreliminaryView(PreliminarySettings settings) {
        if (settings == null) {
            return null;
        }
        return new TournamentResponses.PreliminaryView(
                settings.groupCount(),
                settings.finalSize(),
                settings.autoQualified()
        );
    }

    private TournamentResponses.FinalRatingView toFinalRatingView(FinalRating rating) {
        return new TournamentResponses.FinalRatingView(
                rating.playerId(),
                rating.entryRating(),
                rating.ratingChange(),
                rating.finalRating()
        );
    }

    /**
     * Expected versus recorded match counts and the format's completion predicate.
     */
    public record MatchCounts(
            int expected,
            int recorded,
            boolean complete
    ) {
    }
}
