package com.spinrank.tournament.dto;

import com.spinrank.tournament.model.BracketMatchState;
import com.spinrank.tournament.model.SlotKind;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.model.TournamentStage;
import com.spinrank.tournament.model.TournamentStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class TournamentResponses {

    private TournamentResponses() {
    }

    public record TournamentSummary(
            UUID tournamentId,
            String name,
            TournamentFormat format,
            TournamentStatus status,
            boolean cancelled,
            TournamentStage stage,
            UUID parentTournamentId,
            Integer participantCount,
            Integer expectedMatchCount,
            Integer recordedMatchCount,
            boolean complete,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record TournamentDetail(
            UUID tournamentId,
            String name,
            TournamentFormat format,
            TournamentStatus status,
            boolean cancelled,
            TournamentStage stage,
            UUID parentTournamentId,
            Integer groupIndex,
            List<ParticipantView> participants,
            Integer expectedMatchCount,
            Integer recordedMatchCount,
            boolean complete,
            SwissView swiss,
            PreliminaryView preliminary,
            List<UUID> childTournamentIds,
            UUID finalTournamentId,
            List<StandingView> finalStandings,
            List<FinalRatingView> finalRatings,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record ParticipantView(
            UUID playerId,
            Integer entryRating,
            Integer entryOrder,
            Integer seed
    ) {
    }

    public record SwissView(
            Integer rounds,
            Integer pairedRounds,
            boolean pairByRating
    ) {
    }

    public record PreliminaryView(
            Integer groupCount,
            Integer finalSize,
            List<UUID> autoQualified
    ) {
    }

    public record BracketView(
            UUID tournamentId,
            Integer bracketSize,
            Integer totalRounds,
            Integer byeCount,
            boolean complete,
            UUID championId,
            List<BracketRoundView> rounds
    ) {
    }

    public record BracketRoundView(
            Integer round,
            List<BracketNodeView> matches
    ) {
    }

    public record BracketNodeView(
            Integer round,
            Integer position,
            BracketMatchState state,
            boolean bye,
            SlotView slotA,
            SlotView slotB,
            UUID winnerId,
            UUID matchId
    ) {
    }

    public record SlotView(
            SlotKind kind,
            UUID playerId,
            Integer seed
    ) {
    }

    public record FixtureView(
            Integer round,
            Integer position,
            UUID playerA,
            UUID playerB,
            boolean decided,
            UUID matchId,
            UUID winnerId
    ) {
    }

    public record StandingView(
            Integer place,
            UUID playerId,
            Integer entryRating,
            Integer played,
            Integer wins,
            Integer losses,
            Integer setsWon,
            Integer setsLost,
            Integer setDifferential
    ) {
    }

    public record RatingRoundView(
            Integer round,
            List<RatingLineView> ratings
    ) {
    }

    public record RatingLineView(
            UUID playerId,
            Integer ratingBefore,
            Integer change,
            Integer ratingAfter
    ) {
    }

    public record FinalRatingView(
            UUID playerId,
            Integer entryRating,
            Integer ratingChange,
            Integer finalRating
    ) {
    }

    public record BracketPreview(
            Integer bracketSize,
            Integer totalRounds,
            Integer numSeeded,
            Integer byeCount,
            List<SeededEntryView> entries,
            List<BracketRoundView> rounds
    ) {
    }

    public record SeededEntryView(
            UUID playerId,
            Integer entryRating,
            Integer rank,
            Integer seed,
            Integer round1Position,
            boolean receivesBye
    ) {
    }

    public record PointExchangePreview(
            Integer ratingA,
            Integer ratingB,
            boolean aWon,
            Integer ratingDifference,
            boolean upset,
            Integer points,
            Integer deltaA,
            Integer deltaB,
            Integer ratingAfterA,
            Integer ratingAfterB
    ) {
    }
}
