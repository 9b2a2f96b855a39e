package com.spinrank.tournament.rating;

import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Tournament;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Replays recorded rating changes in round-then-position order on top of entry ratings.
 * Stored rating-before values are never re-derived; only the running totals are.
 */
public final class RatingLedger {

    private final Map<UUID, Integer> entryRatings;
    private final List<MatchRecord> ordered;

    private RatingLedger(Map<UUID, Integer> entryRatings, List<MatchRecord> ordered) {
        this.entryRatings = entryRatings;
        this.ordered = ordered;
    }

    public static RatingLedger of(Collection<Participant> participants, Collection<MatchRecord> matches) {
        Map<UUID, Integer> entryRatings = new LinkedHashMap<>();
        for (Participant participant : participants) {
            entryRatings.put(participant.playerId(), participant.entryRating());
        }
        List<MatchRecord> ordered = new ArrayList<>(matches);
        ordered.sort(Tournament.ROUND_THEN_POSITION);
        return new RatingLedger(entryRatings, ordered);
    }

    public Integer entryRating(UUID playerId) {
        return entryRatings.get(playerId);
    }

    /**
     * Rating carried into the match at {@code (round, position)}: the entry rating plus every
     * change from matches ordered strictly before that coordinate.
     */
    public Integer ratingBefore(UUID playerId, int round, int position) {
        Integer rating = entryRatings.get(playerId);
        if (rating == null) {
            return null;
        }
        for (MatchRecord match : ordered) {
            if (match.round() > round || (match.round() == round && match.position() >= position)) {
                break;
            }
            if (match.involves(playerId)) {
                rating = Math.max(0, rating + match.ratingChangeFor(playerId));
            }
        }
        return rating;
    }

    public Integer currentRating(UUID playerId) {
        return ratingBefore(playerId, Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    public int totalChange(UUID playerId) {
        int total = 0;
        for (MatchRecord match : ordered) {
            if (match.involves(playerId)) {
                total += match.ratingChangeFor(playerId);
            }
        }
        return total;
    }

    /**
     * Per-round view: for every round with results, each player's rating entering the round,
     * the change applied in it and the rating leaving it.
     */
    public List<RoundRatings> perRoundView() {
        Map<UUID, Integer> running = new HashMap<>(entryRatings);
        Map<Integer, List<MatchRecord>> byRound = new TreeMap<>();
        for (MatchRecord match : ordered) {
            byRound.computeIfAbsent(match.round(), ignored -> new ArrayList<>()).add(match);
        }

        List<RoundRatings> rounds = new ArrayList<>();
        for (Map.Entry<Integer, List<MatchRecord>> entry : byRound.entrySet()) {
            Map<UUID, PlayerRatingLine> lines = new LinkedHashMap<>();
            for (MatchRecord match : entry.getValue()) {
                applyToLine(lines, running, match.participantA(), match.ratingChangeA());
                applyToLine(lines, running, match.participantB(), match.ratingChangeB());
            }
            for (PlayerRatingLine line : lines.values()) {
                running.put(line.playerId(), line.ratingAfter());
            }
            rounds.add(new RoundRatings(entry.getKey(), List.copyOf(lines.values())));
        }
        return rounds;
    }

    private static void applyToLine(
            Map<UUID, PlayerRatingLine> lines,
            Map<UUID, Integer> running,
            UUID playerId,
            int change
    ) {
        if (playerId == null) {
            return;
        }
        PlayerRatingLine line = lines.get(playerId);
        if (line == null) {
            Integer before = running.get(playerId);
            line = new PlayerRatingLine(playerId, before, 0, before);
        }
        int total = line.change() + change;
        Integer after = line.ratingBefore() == null ? null : Math.max(0, line.ratingBefore() + total);
        lines.put(playerId, new PlayerRatingLine(playerId, line.ratingBefore(), total, after));
    }

    public record RoundRatings(
            int round,
            List<PlayerRatingLine> ratings
    ) {
    }

    public record PlayerRatingLine(
            UUID playerId,
            Integer ratingBefore,
            int change,
            Integer ratingAfter
    ) {
    }
}
