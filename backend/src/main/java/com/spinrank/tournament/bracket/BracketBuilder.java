package com.spinrank.tournament.bracket;

import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.model.Bracket;
import com.spinrank.tournament.model.BracketMatch;
import com.spinrank.tournament.model.BracketSlot;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds single-elimination draws.
 *
 * Entrants are ranked by entry rating (unrated last, ties to the lower player id) and placed on the
 * standard seed template. Ranks beyond the entry count become byes, so the top
 * {@code bracketSize - n} entrants receive the round-1 byes.
 */
@Component
@RequiredArgsConstructor
public class BracketBuilder {

    public static final Comparator<Participant> SEED_ORDER = Comparator
            .comparing(Participant::entryRating, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Participant::playerId);

    private final SpinrankRuntimeProperties properties;
    private final BracketStateMachine stateMachine;

    public static int bracketSize(int participantCount) {
        if (participantCount <= 2) {
            return 2;
        }
        return Integer.highestOneBit(participantCount - 1) << 1;
    }

    public static int totalRounds(int bracketSize) {
        return Integer.numberOfTrailingZeros(bracketSize);
    }

    static int roundUpToPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        return Integer.highestOneBit(value - 1) << 1;
    }

    public int numSeeded(int bracketSize) {
        int quarter = (bracketSize + 3) / 4;
        int seeded = roundUpToPowerOfTwo(quarter);
        SpinrankRuntimeProperties.Bracket limits = properties.getBracket();
        return Math.max(limits.getMinSeeded(), Math.min(limits.getMaxSeeded(), seeded));
    }

    /**
     * Seed number at each round-1 line. Lines {@code 2p} and {@code 2p + 1} meet in node {@code p}.
     * Size 8 yields {@code 1, 8, 4, 5, 3, 6, 7, 2}.
     */
    public static int[] seedTemplate(int bracketSize) {
        List<Integer> seeds = new ArrayList<>(List.of(1, 2));
        while (seeds.size() < bracketSize) {
            int nextSize = seeds.size() * 2;
            List<Integer> next = new ArrayList<>(nextSize);
            for (int i = 0; i < seeds.size(); i++) {
                int seed = seeds.get(i);
                int complement = nextSize + 1 - seed;
                if (i == seeds.size() - 1) {
                    next.add(complement);
                    next.add(seed);
                } else {
                    next.add(seed);
                    next.add(complement);
                }
            }
            seeds = next;
        }
        return seeds.stream().mapToInt(Integer::intValue).toArray();
    }

    public BracketPlan build(List<Participant> participants) {
        validateParticipants(participants);
        List<Participant> ranked = new ArrayList<>(participants);
        ranked.sort(SEED_ORDER);
        return buildSeeded(ranked);
    }

    /**
     * Places entrants in the given order: the first is seed 1, the second seed 2 and so on.
     */
    public BracketPlan buildSeeded(List<Participant> seedOrder) {
        validateParticipants(seedOrder);
        int size = bracketSize(seedOrder.size());
        int[] template = seedTemplate(size);

        List<UUID> lines = new ArrayList<>(size);
        for (int seed : template) {
            lines.add(seed <= seedOrder.size() ? seedOrder.get(seed - 1).playerId() : null);
        }
        return assemble(seedOrder, lines);
    }

    /**
     * Uses caller-supplied round-1 lines ({@code null} for a bye). Seeds are still assigned by rating.
     */
    public BracketPlan buildFromPositions(List<Participant> participants, List<UUID> lines) {
        validateParticipants(participants);
        int size = bracketSize(participants.size());
        if (lines == null || lines.size() != size) {
            throw TournamentEngineException.invalidEntryCount(
                    "Bracket of " + participants.size() + " players needs " + size + " positions, got "
                            + (lines == null ? 0 : lines.size()));
        }

        Set<UUID> expected = new HashSet<>();
        participants.forEach(participant -> expected.add(participant.playerId()));
        Set<UUID> placed = new HashSet<>();
        for (UUID line : lines) {
            if (line == null) {
                continue;
            }
            if (!expected.contains(line)) {
                throw TournamentEngineException.notFound("Position lists unknown player " + line);
            }
            if (!placed.add(line)) {
                throw TournamentEngineException.invalidEntryCount("Player " + line + " is placed twice");
            }
        }
        if (placed.size() != expected.size()) {
            throw TournamentEngineException.invalidEntryCount(
                    "Positions place " + placed.size() + " of " + expected.size() + " players");
        }
        for (int p = 0; p < size / 2; p++) {
            if (lines.get(2 * p) == null && lines.get(2 * p + 1) == null) {
                throw TournamentEngineException.invalidEntryCount(
                        "Round 1 position " + p + " pairs two byes");
            }
        }

        List<Participant> ranked = new ArrayList<>(participants);
        ranked.sort(SEED_ORDER);
        return assemble(ranked, lines);
    }

    private BracketPlan assemble(List<Participant> ranked, List<UUID> lines) {
        int n = ranked.size();
        int size = lines.size();
        int numSeeded = numSeeded(size);

        Map<UUID, Integer> seeds = new LinkedHashMap<>();
        for (int i = 0; i < Math.min(numSeeded, n); i++) {
            seeds.put(ranked.get(i).playerId(), i + 1);
        }

        Bracket bracket = new Bracket(size, seeds);
        Map<UUID, Integer> positions = new HashMap<>();
        for (BracketMatch node : bracket.round(1)) {
            int p = node.getPosition();
            BracketSlot slotA = toSlot(lines.get(2 * p));
            BracketSlot slotB = toSlot(lines.get(2 * p + 1));
            if (slotA.isBye()) {
                BracketSlot swap = slotA;
                slotA = slotB;
                slotB = swap;
            }
            node.setSlotA(slotA);
            node.setSlotB(slotB);
            positions.put(slotA.playerId(), p);
            if (slotB.isBye()) {
                node.setWinnerId(slotA.playerId());
            } else {
                positions.put(slotB.playerId(), p);
            }
        }
        for (BracketMatch node : bracket.round(1)) {
            stateMachine.advance(bracket, node);
        }

        List<SeededEntry> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Participant participant = ranked.get(i);
            int position = positions.get(participant.playerId());
            BracketMatch node = bracket.node(1, position);
            entries.add(new SeededEntry(
                    participant.playerId(),
                    participant.entryRating(),
                    i + 1,
                    seeds.get(participant.playerId()),
                    position,
                    node.isByeResolved()
            ));
        }

        return new BracketPlan(
                size,
                bracket.getTotalRounds(),
                numSeeded,
                size - n,
                List.copyOf(entries),
                bracket
        );
    }

    private void validateParticipants(List<Participant> participants) {
        SpinrankRuntimeProperties.Tournament limits = properties.getTournament();
        int count = participants == null ? 0 : participants.size();
        if (count < Math.max(2, limits.getMinParticipants())) {
            throw TournamentEngineException.invalidEntryCount(
                    "Elimination bracket needs at least " + Math.max(2, limits.getMinParticipants())
                            + " participants, got " + count);
        }
        if (count > limits.getMaxParticipants()) {
            throw TournamentEngineException.invalidEntryCount(
                    "Elimination bracket accepts at most " + limits.getMaxParticipants()
                            + " participants, got " + count);
        }
        Set<UUID> ids = new HashSet<>();
        for (Participant participant : participants) {
            if (participant.playerId() == null) {
                throw TournamentEngineException.invalidEntryCount("Participant is missing playerId");
            }
            if (!ids.add(participant.playerId())) {
                throw TournamentEngineException.invalidEntryCount(
                        "Duplicate participant: " + participant.playerId());
            }
        }
    }

    private static BracketSlot toSlot(UUID playerId) {
        return playerId == null ? BracketSlot.bye() : BracketSlot.player(playerId);
    }

    public record BracketPlan(
            int bracketSize,
            int totalRounds,
            int numSeeded,
            int byeCount,
            List<SeededEntry> seededEntries,
            Bracket bracket
    ) {
    }

    /**
     * @param rank          1-based rating rank
     * @param seed          displayed seed, {@code null} for unseeded entrants
     * @param round1Position position of the entrant's round-1 node
     */
    public record SeededEntry(
            UUID playerId,
            Integer entryRating,
            int rank,
            Integer seed,
            int round1Position,
            boolean receivesBye
    ) {
    }
}
