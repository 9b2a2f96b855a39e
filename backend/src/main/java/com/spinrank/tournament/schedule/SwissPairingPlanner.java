package com.spinrank.tournament.schedule;

import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Swiss round configuration and pairing.
 *
 * Players are ordered by wins, then entry rating when pairing by rating, then entry order.
 * Each player in turn meets the next player it has not met yet; choices are undone when they
 * leave the remainder unpairable. Adjacent pairing is used only if no rematch-free pairing is found.
 */
@Component
public class SwissPairingPlanner {

    private static final Logger log = LoggerFactory.getLogger(SwissPairingPlanner.class);
    private static final int SEARCH_BUDGET = 200_000;

    public RoundBounds roundBounds(int participantCount) {
        if (participantCount < 2 || participantCount % 2 != 0) {
            throw TournamentEngineException.invalidEntryCount(
                    "Swiss needs an even number of participants, got " + participantCount);
        }
        int ceilLog2 = 32 - Integer.numberOfLeadingZeros(participantCount - 1);
        return new RoundBounds(ceilLog2 + 1, participantCount / 2);
    }

    /**
     * Validates the requested round count, defaulting to the lower bound.
     */
    public int resolveRounds(int participantCount, Integer requestedRounds) {
        RoundBounds bounds = roundBounds(participantCount);
        int rounds = requestedRounds != null ? requestedRounds : bounds.minRounds();
        if (!bounds.contains(rounds)) {
            throw TournamentEngineException.invalidRoundConfig(
                    "Swiss with " + participantCount + " players needs between " + bounds.minRounds()
                            + " and " + bounds.maxRounds() + " rounds, got " + rounds);
        }
        return rounds;
    }

    public List<Fixture> pairRound(
            List<Participant> participants,
            Collection<MatchRecord> matches,
            Collection<Fixture> previousFixtures,
            int round,
            boolean pairByRating
    ) {
        Map<UUID, Integer> wins = new HashMap<>();
        for (MatchRecord match : matches) {
            wins.merge(match.winnerId(), 1, Integer::sum);
        }

        Comparator<Participant> order = Comparator
                .comparingInt((Participant participant) -> wins.getOrDefault(participant.playerId(), 0))
                .reversed();
        if (pairByRating) {
            order = order.thenComparing(Participant::entryRating,
                    Comparator.nullsLast(Comparator.reverseOrder()));
        }
        order = order.thenComparingInt(Participant::entryOrder);

        List<UUID> ranked = participants.stream()
                .sorted(order)
                .map(Participant::playerId)
                .toList();

        Set<String> played = new HashSet<>();
        for (Fixture fixture : previousFixtures) {
            played.add(pairKey(fixture.playerA(), fixture.playerB()));
        }

        List<UUID> pairs = new ArrayList<>(ranked.size());
        int[] budget = {SEARCH_BUDGET};
        if (!pairWithoutRematch(ranked, played, pairs, budget)) {
            log.warn("No rematch-free pairing for Swiss round {}; falling back to adjacent pairing", round);
            pairs = new ArrayList<>(ranked);
        }

        List<Fixture> fixtures = new ArrayList<>(pairs.size() / 2);
        for (int i = 0; i + 1 < pairs.size(); i += 2) {
            fixtures.add(new Fixture(round, i / 2, pairs.get(i), pairs.get(i + 1)));
        }
        return fixtures;
    }

    private static boolean pairWithoutRematch(List<UUID> remaining, Set<String> played, List<UUID> out, int[] budget) {
        if (remaining.isEmpty()) {
            return true;
        }
        if (--budget[0] < 0) {
            return false;
        }
        UUID first = remaining.get(0);
        for (int j = 1; j < remaining.size(); j++) {
            UUID candidate = remaining.get(j);
            if (played.contains(pairKey(first, candidate))) {
                continue;
            }
            List<UUID> rest = new ArrayList<>(remaining.size() - 2);
            for (int k = 1; k < remaining.size(); k++) {
                if (k != j) {
                    rest.add(remaining.get(k));
                }
            }
            out.add(first);
            out.add(candidate);
            if (pairWithoutRematch(rest, played, out, budget)) {
                return true;
            }
            out.remove(out.size() - 1);
            out.remove(out.size() - 1);
        }
        return false;
    }

    private static String pairKey(UUID first, UUID second) {
        return first.compareTo(second) < 0 ? first + ":" + second : second + ":" + first;
    }

    public record RoundBounds(
            int minRounds,
            int maxRounds
    ) {
        public boolean contains(int rounds) {
            return rounds >= minRounds && rounds <= maxRounds;
        }
    }
}
