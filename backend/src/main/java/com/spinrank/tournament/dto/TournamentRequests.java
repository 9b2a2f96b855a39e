package com.spinrank.tournament.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public final class TournamentRequests {

    private TournamentRequests() {
    }

    public record CreateTournamentRequest(
            @NotBlank(message = "name is required")
            @Size(max = 200, message = "name must be at most 200 characters")
            String name,

            @NotBlank(message = "format is required")
            String format,

            @NotEmpty(message = "participants are required")
            List<@Valid @NotNull(message = "participant entry is required") ParticipantEntry> participants,

            @Valid
            SwissOptions swiss,

            @Valid
            PreliminaryOptions preliminary,

            List<UUID> bracketPositions
    ) {
    }

    public record ParticipantEntry(
            @NotNull(message = "playerId is required")
            UUID playerId,

            @PositiveOrZero(message = "rating must be non-negative")
            Integer rating
    ) {
    }

    public record SwissOptions(
            @Positive(message = "swiss.rounds must be positive")
            Integer rounds,

            Boolean pairByRating
    ) {
    }

    public record PreliminaryOptions(
            @Positive(message = "preliminary.groupCount must be positive")
            Integer groupCount,

            @Positive(message = "preliminary.finalSize must be positive")
            Integer finalSize,

            List<UUID> autoQualified,

            List<List<UUID>> groups
    ) {
    }

    /**
     * Missing set counts read as 0, which only a forfeit can decide.
     */
    public record RecordResultRequest(
            @JsonAlias("member1Id") UUID participantA,
            @JsonAlias("member2Id") UUID participantB,

            @JsonAlias("player1Sets")
            @PositiveOrZero(message = "setsA must be non-negative")
            Integer setsA,

            @JsonAlias("player2Sets")
            @PositiveOrZero(message = "setsB must be non-negative")
            Integer setsB,

            @JsonAlias("player1Forfeit") boolean forfeitA,
            @JsonAlias("player2Forfeit") boolean forfeitB
    ) {
    }

    public record BracketPreviewRequest(
            @NotEmpty(message = "participants are required")
            List<@Valid @NotNull(message = "participant entry is required") ParticipantEntry> participants,

            List<UUID> bracketPositions
    ) {
    }
}
