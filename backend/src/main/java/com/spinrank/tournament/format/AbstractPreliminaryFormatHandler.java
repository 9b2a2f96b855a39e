package com.spinrank.tournament.format;

import com.spinrank.tournament.bracket.BracketBuilder;
import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.PreliminarySettings;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.model.TournamentStage;
import com.spinrank.tournament.repository.InMemoryTournamentRepository;
import com.spinrank.tournament.service.PreliminaryQualificationService;
import com.spinrank.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Two-stage event: round-robin groups feeding a final stage.
 *
 * The parent holds no matches of its own. Group stages are created with the parent; the final stage
 * is created by {@link #advance(Tournament, OffsetDateTime)} once every group is complete.
 */
public abstract class AbstractPreliminaryFormatHandler implements TournamentFormatHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractPreliminaryFormatHandler.class);
    private static final int DEFAULT_GROUP_SIZE = 4;

    private static final Comparator<Standing> CROSS_GROUP_ORDER = Comparator
            .comparing(Standing::place, Comparator.nullsFirst(Comparator.<Integer>naturalOrder()))
            .thenComparing(Comparator.comparingInt(Standing::wins).reversed())
            .thenComparing(Comparator.comparingInt(Standing::setDifferential).reversed())
            .thenComparing(Standing::entryRating, Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
            .thenComparing(Standing::playerId);

    protected final InMemoryTournamentRepository repository;
    protected final RoundRobinFormatHandler groupHandler;
    protected final PreliminaryQualificationService qualificationService;
    protected final SpinrankRuntimeProperties properties;

    protected AbstractPreliminaryFormatHandler(
            InMemoryTournamentRepository repository,
            RoundRobinFormatHandler groupHandler,
            PreliminaryQualificationService qualificationService,
            SpinrankRuntimeProperties properties
    ) {
        this.repository = repository;
        this.groupHandler = groupHandler;
        this.qualificationService = qualificationService;
        this.properties = properties;
    }

    protected abstract TournamentFormat finalFormat();

    protected abstract int defaultFinalSize();

    protected abstract TournamentFormatHandler finalHandler();

    protected abstract void initializeFinal(Tournament finalStage, List<Participant> seedOrder);

    protected abstract int expectedFinalMatches(int finalSize);

    @Override
    public List<Tournament> initialize(Tournament parent, TournamentSetup setup) {
        List<Participant> participants = parent.getParticipants();
        Map<UUID, Participant> byId = new HashMap<>();
        participants.forEach(participant -> byId.put(participant.playerId(), participant));

        List<UUID> autoQualified = setup.autoQualified() != null ? List.copyOf(setup.autoQualified()) : List.of();
        Set<UUID> autoSet = new HashSet<>();
        for (UUID playerId : autoQualified) {
            if (!byId.containsKey(playerId)) {
                throw TournamentEngineException.notFound("Auto-qualified player " + playerId + " is not entered");
            }
            if (!autoSet.add(playerId)) {
                throw TournamentEngineException.invalidEntryCount("Player " + playerId + " is auto-qualified twice");
            }
        }

        List<Participant> pool = participants.stream()
                .filter(participant -> !autoSet.contains(participant.playerId()))
                .toList();
        List<List<Participant>> groups = setup.groups() != null
                ? explicitGroups(setup.groups(), byId, autoSet, pool.size())
                : snakeGroups(pool, resolveGroupCount(setup, pool.size()));
        for (int i = 0; i < groups.size(); i++) {
            if (groups.get(i).size() < 2) {
                throw TournamentEngineException.invalidEntryCount(
                        "Group " + groupLabel(i) + " needs at least 2 players, got " + groups.get(i).size());
            }
        }

        int finalSize = resolveFinalSize(setup.finalSize(), participants.size());
        if (finalSize < autoQualified.size() + groups.size()) {
            throw TournamentEngineException.invalidEntryCount(
                    "Final of " + finalSize + " cannot hold " + autoQualified.size() + " auto-qualified players and "
                            + groups.size() + " group winners");
        }

        List<Tournament> stages = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            Tournament group = newStage(parent, TournamentFormat.ROUND_ROBIN, TournamentStage.PRELIMINARY_GROUP,
                    parent.getName() + " - Group " + groupLabel(i), reindex(groups.get(i)), parent.getCreatedAt());
            group.setGroupIndex(i);
            groupHandler.initialize(group, TournamentSetup.defaults());
            stages.add(group);
            parent.getChildTournamentIds().add(group.getTournamentId());
        }
        parent.setPreliminarySettings(new PreliminarySettings(groups.size(), finalSize, autoQualified));
        return stages;
    }

    @Override
    public int expectedMatchCount(Tournament parent) {
        int expected = 0;
        for (Tournament group : groupStages(parent)) {
            expected += groupHandler.expectedMatchCount(group);
        }
        Optional<Tournament> finalStage = finalStage(parent);
        if (finalStage.isPresent()) {
            expected += finalHandler().expectedMatchCount(finalStage.get());
        } else {
            expected += expectedFinalMatches(parent.getPreliminarySettings().finalSize());
        }
        return expected;
    }

    @Override
    public int recordedMatchCount(Tournament parent) {
        return stages(parent).stream()
                .mapToInt(stage -> stage.getMatches().size())
                .sum();
    }

    @Override
    public boolean isComplete(Tournament parent) {
        return finalStage(parent)
                .map(stage -> !stage.isActive() && !stage.isCancelled())
                .orElse(false);
    }

    @Override
    public MatchRecord recordResult(
            Tournament parent,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        throw resultsLiveOnStages(parent);
    }

    @Override
    public MatchRecord editResult(
            Tournament parent,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        throw resultsLiveOnStages(parent);
    }

    @Override
    public void deleteResult(Tournament parent, int round, int position) {
        throw resultsLiveOnStages(parent);
    }

    /**
     * Final-stage placings first, then everyone eliminated in the groups ordered by group place.
     */
    @Override
    public List<Standing> standings(Tournament parent) {
        List<Standing> groupStandings = new ArrayList<>();
        for (Tournament group : groupStages(parent)) {
            groupStandings.addAll(stageStandings(group, groupHandler));
        }

        Optional<Tournament> finalStage = finalStage(parent);
        List<Standing> result = new ArrayList<>();
        Set<UUID> placed = new HashSet<>();
        if (finalStage.isPresent()) {
            for (Standing standing : stageStandings(finalStage.get(), finalHandler())) {
                result.add(standing);
                placed.add(standing.playerId());
            }
        } else {
            for (UUID playerId : parent.getPreliminarySettings().autoQualified()) {
                Integer rating = parent.findParticipant(playerId).map(Participant::entryRating).orElse(null);
                result.add(new Standing(null, playerId, rating, 0, 0, 0, 0, 0));
                placed.add(playerId);
            }
        }

        List<Standing> eliminated = new ArrayList<>(groupStandings.stream()
                .filter(standing -> !placed.contains(standing.playerId()))
                .toList());
        eliminated.sort(CROSS_GROUP_ORDER);
        int offset = finalStage.isPresent() ? result.size() : 0;
        for (int i = 0; i < eliminated.size(); i++) {
            Standing standing = eliminated.get(i);
            result.add(new Standing(offset + i + 1, standing.playerId(), standing.entryRating(), standing.played(),
                    standing.wins(), standing.losses(), standing.setsWon(), standing.setsLost()));
        }
        return result;
    }

    /**
     * Creates the final stage once every group is complete. The caller publishes the returned stage.
     */
    public Optional<Tournament> advance(Tournament parent, OffsetDateTime now) {
        PreliminarySettings settings = parent.getPreliminarySettings();
        if (!parent.isActive() || parent.getFinalTournamentId() != null) {
            return Optional.empty();
        }
        List<Tournament> groups = groupStages(parent);
        if (groups.size() != settings.groupCount()
                || groups.stream().anyMatch(group -> group.isActive() || group.isCancelled())) {
            return Optional.empty();
        }

        List<List<Standing>> groupStandings = groups.stream()
                .map(Tournament::getFinalStandings)
                .toList();
        List<PreliminaryQualificationService.Qualifier> qualifiers = qualificationService.qualify(
                parent.getParticipants(), settings.autoQualified(), groupStandings, settings.finalSize());
        List<Participant> seedOrder = qualificationService.seedFinal(qualifiers);

        Tournament finalStage = newStage(parent, finalFormat(), TournamentStage.FINAL,
                parent.getName() + " - Final", seedOrder, now);
        initializeFinal(finalStage, seedOrder);
        parent.setFinalTournamentId(finalStage.getTournamentId());
        parent.getChildTournamentIds().add(finalStage.getTournamentId());
        log.info(
                "Created {} final {} for tournament {} with {} qualifiers",
                finalFormat(), finalStage.getTournamentId(), parent.getTournamentId(), seedOrder.size()
        );
        return Optional.of(finalStage);
    }

    public List<Tournament> stages(Tournament parent) {
        List<Tournament> stages = new ArrayList<>();
        for (UUID childId : parent.getChildTournamentIds()) {
            repository.findById(childId).ifPresent(stages::add);
        }
        return stages;
    }

    protected List<Tournament> groupStages(Tournament parent) {
        return stages(parent).stream()
                .filter(stage -> stage.getStage() == TournamentStage.PRELIMINARY_GROUP)
                .sorted(Comparator.comparing(Tournament::getGroupIndex))
                .toList();
    }

    protected Optional<Tournament> finalStage(Tournament parent) {
        if (parent.getFinalTournamentId() == null) {
            return Optional.empty();
        }
        return repository.findById(parent.getFinalTournamentId());
    }

    private static List<Standing> stageStandings(Tournament stage, TournamentFormatHandler handler) {
        return stage.isActive() || stage.getFinalStandings().isEmpty()
                ? handler.standings(stage)
                : stage.getFinalStandings();
    }

    private int resolveGroupCount(TournamentSetup setup, int poolSize) {
        if (setup.groupCount() != null) {
            if (setup.groupCount() < 1) {
                throw TournamentEngineException.invalidEntryCount("Group count must be positive, got " + setup.groupCount());
            }
            return setup.groupCount();
        }
        return Math.max(1, poolSize / DEFAULT_GROUP_SIZE);
    }

    private int resolveFinalSize(Integer requested, int participantCount) {
        if (requested == null) {
            return Math.min(defaultFinalSize(), participantCount);
        }
        if (requested < 2 || requested > participantCount) {
            throw TournamentEngineException.invalidEntryCount(
                    "Final size must be between 2 and " + participantCount + ", got " + requested);
        }
        return requested;
    }

    private static List<List<Participant>> snakeGroups(List<Participant> pool, int groupCount) {
        List<Participant> ranked = new ArrayList<>(pool);
        ranked.sort(BracketBuilder.SEED_ORDER);
        List<List<Participant>> groups = new ArrayList<>(groupCount);
        for (int i = 0; i < groupCount; i++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < ranked.size(); i++) {
            int row = i / groupCount;
            int column = i % groupCount;
            int group = row % 2 == 0 ? column : groupCount - 1 - column;
            groups.get(group).add(ranked.get(i));
        }
        return groups;
    }

    private static List<List<Participant>> explicitGroups(
            List<List<UUID>> requested,
            Map<UUID, Participant> byId,
            Set<UUID> autoQualified,
            int poolSize
    ) {
        Set<UUID> assigned = new HashSet<>();
        List<List<Participant>> groups = new ArrayList<>(requested.size());
        for (List<UUID> members : requested) {
            List<Participant> group = new ArrayList<>();
            for (UUID playerId : members == null ? List.<UUID>of() : members) {
                Participant participant = byId.get(playerId);
                if (participant == null) {
                    throw TournamentEngineException.notFound("Grouped player " + playerId + " is not entered");
                }
                if (autoQualified.contains(playerId) || !assigned.add(playerId)) {
                    throw TournamentEngineException.invalidEntryCount(
                            "Player " + playerId + " is assigned more than once");
                }
                group.add(participant);
            }
            groups.add(group);
        }
        if (groups.isEmpty() || assigned.size() != poolSize) {
            throw TournamentEngineException.invalidEntryCount(
                    "Groups place " + assigned.size() + " of " + poolSize + " players without auto-qualification");
        }
        return groups;
    }

    private static List<Participant> reindex(List<Participant> members) {
        List<Participant> reindexed = new ArrayList<>(members.size());
        for (Participant member : members) {
            reindexed.add(new Participant(member.playerId(), member.entryRating(), reindexed.size()));
        }
        return reindexed;
    }

    private static Tournament newStage(
            Tournament parent,
            TournamentFormat format,
            TournamentStage stage,
            String name,
            List<Participant> participants,
            OffsetDateTime createdAt
    ) {
        Tournament child = new Tournament();
        child.setTournamentId(UUID.randomUUID());
        child.setName(name);
        child.setFormat(format);
        child.setStage(stage);
        child.setParentTournamentId(parent.getTournamentId());
        child.setParticipants(new ArrayList<>(participants));
        child.setCreatedAt(createdAt);
        child.setUpdatedAt(createdAt);
        return child;
    }

    private static String groupLabel(int index) {
        return String.valueOf((char) ('A' + index % 26)) + (index >= 26 ? index / 26 : "");
    }

    private static TournamentEngineException resultsLiveOnStages(Tournament parent) {
        return TournamentEngineException.invalidState(
                "Tournament " + parent.getTournamentId() + " records results on its stage tournaments");
    }
}
