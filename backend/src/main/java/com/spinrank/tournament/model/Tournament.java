package com.spinrank.tournament.model;

import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate of one tournament: participants, structure and result ledger.
 * Published instances are treated as snapshots; writers mutate a {@link #copy()} and publish it.
 */
@Getter
@Setter
public class Tournament {

    public static final Comparator<MatchRecord> ROUND_THEN_POSITION =
            Comparator.comparingInt(MatchRecord::round).thenComparingInt(MatchRecord::position);

    private UUID tournamentId;
    private String name;
    private TournamentFormat format;
    private TournamentStatus status = TournamentStatus.ACTIVE;
    private boolean cancelled;
    private TournamentStage stage = TournamentStage.STANDALONE;
    private UUID parentTournamentId;
    private Integer groupIndex;
    private List<Participant> participants = new ArrayList<>();
    private List<MatchRecord> matches = new ArrayList<>();
    private Bracket bracket;
    private List<Fixture> fixtures = new ArrayList<>();
    private SwissSettings swissSettings;
    private PreliminarySettings preliminarySettings;
    private List<UUID> childTournamentIds = new ArrayList<>();
    private UUID finalTournamentId;
    private List<Standing> finalStandings = new ArrayList<>();
    private List<FinalRating> finalRatings = new ArrayList<>();
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime completedAt;

    public boolean isActive() {
        return status == TournamentStatus.ACTIVE;
    }

    public Optional<Participant> findParticipant(UUID playerId) {
        return participants.stream()
                .filter(participant -> participant.playerId().equals(playerId))
                .findFirst();
    }

    public Optional<MatchRecord> findMatch(int round, int position) {
        return matches.stream()
                .filter(match -> match.isAt(round, position))
                .findFirst();
    }

    public Optional<MatchRecord> findMatchById(UUID matchId) {
        return matches.stream()
                .filter(match -> match.matchId().equals(matchId))
                .findFirst();
    }

    public Optional<Fixture> findFixture(int round, int position) {
        return fixtures.stream()
                .filter(fixture -> fixture.round() == round && fixture.position() == position)
                .findFirst();
    }

    public List<MatchRecord> matchesInRoundOrder() {
        List<MatchRecord> ordered = new ArrayList<>(matches);
        ordered.sort(ROUND_THEN_POSITION);
        return ordered;
    }

    public Tournament copy() {
        Tournament copy = new Tournament();
        copy.setTournamentId(tournamentId);
        copy.setName(name);
        copy.setFormat(format);
        copy.setStatus(status);
        copy.setCancelled(cancelled);
        copy.setStage(stage);
        copy.setParentTournamentId(parentTournamentId);
        copy.setGroupIndex(groupIndex);
        copy.setParticipants(new ArrayList<>(participants));
        copy.setMatches(new ArrayList<>(matches));
        copy.setBracket(bracket != null ? bracket.copy() : null);
        copy.setFixtures(new ArrayList<>(fixtures));
        copy.setSwissSettings(swissSettings);
        copy.setPreliminarySettings(preliminarySettings);
        copy.setChildTournamentIds(new ArrayList<>(childTournamentIds));
        copy.setFinalTournamentId(finalTournamentId);
        copy.setFinalStandings(new ArrayList<>(finalStandings));
        copy.setFinalRatings(new ArrayList<>(finalRatings));
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setCompletedAt(completedAt);
        return copy;
    }
}
