package com.spinrank.tournament.rating;

import com.spinrank.tournament.model.FinalRating;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Tournament;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Post-tournament rating for a completed round robin, computed in four passes over the
 * non-forfeit results.
 *
 * <ol>
 *     <li>Rated players replay their games against rated opponents from the entry rating.</li>
 *     <li>Rated players with a large gain are re-anchored on their opponents' ratings; unrated
 *     players get an estimate from the adjusted ratings of the rated players they met.</li>
 *     <li>No rated player starts the final pass below the entry rating.</li>
 *     <li>Every player replays all games against the opponents' third-pass ratings.</li>
 * </ol>
 *
 * Points come from the same {@link PointExchangeTable} as the per-match exchange.
 */
@Component
public class RoundRobinRatingCalculator {

    static final int UNRATED_ESTIMATE = 1200;
    static final int KEEP_GAIN_THRESHOLD = 50;
    static final int ADJUST_GAIN_THRESHOLD = 75;
    static final int SINGLE_OPPONENT_CAP = 100;

    private final PointExchangeTable table;

    public RoundRobinRatingCalculator(RatingAdjustmentEngine ratingAdjustmentEngine) {
        this.table = ratingAdjustmentEngine.getTable();
    }

    public List<FinalRating> finalRatings(Collection<Participant> participants, Collection<MatchRecord> matches) {
        RatingPasses passes = calculate(participants, matches);
        List<FinalRating> ratings = new ArrayList<>(participants.size());
        for (Participant participant : participants) {
            Integer entry = participant.entryRating();
            Integer result = passes.finalRatings().get(participant.playerId());
            int change = entry == null || result == null ? 0 : result - entry;
            ratings.add(new FinalRating(participant.playerId(), entry, change, result));
        }
        return ratings;
    }

    public RatingPasses calculate(Collection<Participant> participants, Collection<MatchRecord> matches) {
        Map<UUID, Integer> initial = new LinkedHashMap<>();
        for (Participant participant : participants) {
            initial.put(participant.playerId(), participant.entryRating());
        }
        Map<UUID, List<Game>> games = gamesByPlayer(initial, matches);

        Map<UUID, Integer> firstPass = new LinkedHashMap<>();
        for (Map.Entry<UUID, Integer> entry : initial.entrySet()) {
            if (entry.getValue() != null) {
                firstPass.put(entry.getKey(), replayAgainstEntryRatings(entry.getValue(), games.get(entry.getKey())));
            }
        }

        // Unrated estimates read the rated adjustments, so rated players go first.
        Map<UUID, Integer> secondPass = new LinkedHashMap<>();
        for (Map.Entry<UUID, Integer> entry : firstPass.entrySet()) {
            UUID playerId = entry.getKey();
            secondPass.put(playerId, adjustRated(initial.get(playerId), entry.getValue(), games.get(playerId)));
        }
        for (Map.Entry<UUID, Integer> entry : initial.entrySet()) {
            if (entry.getValue() == null && !games.get(entry.getKey()).isEmpty()) {
                secondPass.put(entry.getKey(), estimateUnrated(games.get(entry.getKey()), secondPass));
            }
        }

        Map<UUID, Integer> thirdPass = new LinkedHashMap<>();
        for (UUID playerId : initial.keySet()) {
            Integer adjusted = secondPass.get(playerId);
            if (adjusted != null) {
                Integer entry = initial.get(playerId);
                thirdPass.put(playerId, entry == null ? adjusted : Math.max(adjusted, entry));
            }
        }

        Map<UUID, Integer> finalRatings = new LinkedHashMap<>();
        for (UUID playerId : initial.keySet()) {
            Integer start = thirdPass.get(playerId);
            if (start != null) {
                finalRatings.put(playerId, replayAgainstAdjustedRatings(start, games.get(playerId), thirdPass));
            }
        }

        return new RatingPasses(
                Collections.unmodifiableMap(firstPass),
                Collections.unmodifiableMap(secondPass),
                Collections.unmodifiableMap(thirdPass),
                Collections.unmodifiableMap(finalRatings)
        );
    }

    private int replayAgainstEntryRatings(int entryRating, List<Game> games) {
        int rating = entryRating;
        for (Game game : games) {
            if (game.opponentRating() != null) {
                rating += signedPoints(rating, game.opponentRating(), game.won());
            }
        }
        return rating;
    }

    private int adjustRated(int entryRating, int firstPass, List<Game> games) {
        int gained = firstPass - entryRating;
        if (gained < KEEP_GAIN_THRESHOLD) {
            return entryRating;
        }
        if (gained < ADJUST_GAIN_THRESHOLD) {
            return firstPass;
        }

        List<Integer> opponents = new ArrayList<>();
        List<Integer> beaten = new ArrayList<>();
        List<Integer> lostTo = new ArrayList<>();
        for (Game game : games) {
            if (game.opponentRating() == null) {
                continue;
            }
            opponents.add(game.opponentRating());
            (game.won() ? beaten : lostTo).add(game.opponentRating());
        }

        if (!beaten.isEmpty() && !lostTo.isEmpty()) {
            double midpoint = (Collections.max(beaten) + Collections.min(lostTo)) / 2.0;
            return (int) Math.round((firstPass + midpoint) / 2.0);
        }
        if (opponents.isEmpty()) {
            return firstPass;
        }
        if (opponents.size() == 1) {
            return beaten.isEmpty()
                    ? Math.min(firstPass, entryRating)
                    : Math.min(firstPass, entryRating + SINGLE_OPPONENT_CAP);
        }
        // upper median
        Collections.sort(opponents);
        return opponents.get(opponents.size() / 2);
    }

    private int estimateUnrated(List<Game> games, Map<UUID, Integer> ratedAdjustments) {
        List<Integer> beaten = new ArrayList<>();
        List<Integer> lostTo = new ArrayList<>();
        for (Game game : games) {
            if (game.opponentRating() == null) {
                continue;
            }
            int opponentRating = ratedAdjustments.getOrDefault(game.opponentId(), game.opponentRating());
            (game.won() ? beaten : lostTo).add(opponentRating);
        }

        if (beaten.isEmpty() && lostTo.isEmpty()) {
            return UNRATED_ESTIMATE;
        }
        if (!beaten.isEmpty() && !lostTo.isEmpty()) {
            return (int) Math.round((Collections.max(beaten) + Collections.min(lostTo)) / 2.0);
        }
        if (lostTo.isEmpty()) {
            int best = Collections.max(beaten);
            return best + spreadBonus(best - Collections.min(beaten));
        }
        int worst = Collections.min(lostTo);
        return worst - spreadBonus(Collections.max(lostTo) - worst);
    }

    private static int spreadBonus(int spread) {
        if (spread >= 1 && spread <= 50) {
            return 10;
        }
        if (spread > 50 && spread <= 100) {
            return 5;
        }
        if (spread > 100 && spread <= 150) {
            return 1;
        }
        return 0;
    }

    private int replayAgainstAdjustedRatings(int start, List<Game> games, Map<UUID, Integer> adjusted) {
        int rating = start;
        for (Game game : games) {
            Integer opponentRating = adjusted.get(game.opponentId());
            if (opponentRating != null) {
                rating += signedPoints(rating, opponentRating, game.won());
            }
        }
        return Math.max(0, rating);
    }

    private int signedPoints(int rating, int opponentRating, boolean won) {
        int diff = opponentRating - rating;
        boolean upset = (won && diff > 0) || (!won && diff < 0);
        int points = table.ruleFor(Math.abs(diff)).pointsFor(upset);
        return won ? points : -points;
    }

    private static Map<UUID, List<Game>> gamesByPlayer(Map<UUID, Integer> initial, Collection<MatchRecord> matches) {
        Map<UUID, List<Game>> games = new LinkedHashMap<>();
        initial.keySet().forEach(playerId -> games.put(playerId, new ArrayList<>()));

        List<MatchRecord> ordered = new ArrayList<>(matches);
        ordered.sort(Tournament.ROUND_THEN_POSITION);
        for (MatchRecord match : ordered) {
            if (match.isForfeit()
                    || !initial.containsKey(match.participantA())
                    || !initial.containsKey(match.participantB())) {
                continue;
            }
            UUID a = match.participantA();
            UUID b = match.participantB();
            boolean aWon = a.equals(match.winnerId());
            games.get(a).add(new Game(b, initial.get(b), aWon));
            games.get(b).add(new Game(a, initial.get(a), !aWon));
        }
        return games;
    }

    private record Game(UUID opponentId, Integer opponentRating, boolean won) {
    }

    /**
     * Intermediate and final ratings per player. Players absent from a map took no part in that pass.
     */
    public record RatingPasses(
            Map<UUID, Integer> firstPass,
            Map<UUID, Integer> secondPass,
            Map<UUID, Integer> thirdPass,
            Map<UUID, Integer> finalRatings
    ) {
    }
}
