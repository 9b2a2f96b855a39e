package com.spinrank.tournament.model;

import com.spinrank.tournament.web.TournamentEngineException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Elimination draw stored as a flat arena of nodes addressed by {@code (round, position)}.
 * Round {@code r} starts at offset {@code size - size / 2^(r-1)} and holds {@code size / 2^r} nodes.
 */
@Getter
public class Bracket {

    private final int size;
    private final int totalRounds;
    private final List<BracketMatch> nodes;
    private final Map<UUID, Integer> seeds;

    public Bracket(int size, Map<UUID, Integer> seeds) {
        if (size < 2 || Integer.bitCount(size) != 1) {
            throw new IllegalArgumentException("Bracket size must be a power of two >= 2: " + size);
        }
        this.size = size;
        this.totalRounds = Integer.numberOfTrailingZeros(size);
        this.nodes = new ArrayList<>(size - 1);
        for (int round = 1; round <= totalRounds; round++) {
            for (int position = 0; position < matchesInRound(round); position++) {
                nodes.add(new BracketMatch(round, position));
            }
        }
        this.seeds = new LinkedHashMap<>(seeds);
    }

    private Bracket(int size, int totalRounds, List<BracketMatch> nodes, Map<UUID, Integer> seeds) {
        this.size = size;
        this.totalRounds = totalRounds;
        this.nodes = nodes;
        this.seeds = seeds;
    }

    public int matchesInRound(int round) {
        return size >> round;
    }

    public boolean contains(int round, int position) {
        return round >= 1 && round <= totalRounds && position >= 0 && position < matchesInRound(round);
    }

    public BracketMatch node(int round, int position) {
        if (!contains(round, position)) {
            throw TournamentEngineException.notFound(
                    "No bracket match at round " + round + ", position " + position
                            + " (bracket has " + totalRounds + " rounds)");
        }
        return nodes.get(offset(round) + position);
    }

    public List<BracketMatch> round(int round) {
        if (round < 1 || round > totalRounds) {
            throw TournamentEngineException.notFound("No bracket round " + round);
        }
        int offset = offset(round);
        return Collections.unmodifiableList(nodes.subList(offset, offset + matchesInRound(round)));
    }

    public BracketMatch finalMatch() {
        return nodes.get(nodes.size() - 1);
    }

    public boolean isComplete() {
        return finalMatch().getState() == BracketMatchState.DECIDED;
    }

    public Integer seedOf(UUID playerId) {
        return playerId == null ? null : seeds.get(playerId);
    }

    public Map<UUID, Integer> getSeeds() {
        return Collections.unmodifiableMap(seeds);
    }

    public int byeCount() {
        return (int) round(1).stream()
                .filter(node -> node.getSlotB().isBye() || node.getSlotA().isBye())
                .count();
    }

    public Bracket copy() {
        List<BracketMatch> copiedNodes = new ArrayList<>(nodes.size());
        for (BracketMatch node : nodes) {
            copiedNodes.add(node.copy());
        }
        return new Bracket(size, totalRounds, copiedNodes, new LinkedHashMap<>(seeds));
    }

    private int offset(int round) {
        return size - (size >> (round - 1));
    }
}
