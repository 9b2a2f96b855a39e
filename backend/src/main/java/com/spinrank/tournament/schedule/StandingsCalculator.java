package com.spinrank.tournament.schedule;

import com.spinrank.tournament.model.Bracket;
import com.spinrank.tournament.model.BracketMatch;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregates recorded results into rankings.
 * A forfeit counts as a 1-0 decision in both matches and sets, whatever set counts were submitted.
 */
@Component
public class StandingsCalculator {

    /**
     * Wins descending, then set differential descending, then entry order.
     */
    public List<Standing> rank(List<Participant> participants, Collection<MatchRecord> matches) {
        Map<UUID, Tally> tallies = tally(participants, matches);
        List<Participant> ordered = new ArrayList<>(participants);
        ordered.sort(Comparator
                .comparingInt((Participant participant) -> tallies.get(participant.playerId()).wins)
                .reversed()
                .thenComparing(Comparator.comparingInt(
                        (Participant participant) -> tallies.get(participant.playerId()).setDifferential())
                        .reversed())
                .thenComparingInt(Participant::entryOrder));

        List<Standing> standings = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Participant participant = ordered.get(i);
            standings.add(tallies.get(participant.playerId()).toStanding(i + 1, participant));
        }
        return standings;
    }

    /**
     * Elimination placings: champion 1st, final loser 2nd, losers of round {@code r} share
     * place {@code 2^(totalRounds - r) + 1}. Players still alive carry no place and list first.
     */
    public List<Standing> playoffPlacements(
            Bracket bracket,
            List<Participant> participants,
            Collection<MatchRecord> matches
    ) {
        Map<UUID, Tally> tallies = tally(participants, matches);
        Map<UUID, Integer> places = new HashMap<>();
        for (BracketMatch node : bracket.getNodes()) {
            UUID loser = node.loserId();
            if (loser != null) {
                places.put(loser, (1 << (bracket.getTotalRounds() - node.getRound())) + 1);
            }
        }
        BracketMatch finalMatch = bracket.finalMatch();
        if (finalMatch.getWinnerId() != null) {
            places.put(finalMatch.getWinnerId(), 1);
        }

        List<Participant> ordered = new ArrayList<>(participants);
        ordered.sort(Comparator
                .comparingInt((Participant participant) -> places.getOrDefault(participant.playerId(), 0))
                .thenComparing(Comparator.comparingInt(
                        (Participant participant) -> tallies.get(participant.playerId()).wins).reversed())
                .thenComparing((Participant participant) -> bracket.seedOf(participant.playerId()),
                        Comparator.<Integer>nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(Participant::entryOrder));

        List<Standing> standings = new ArrayList<>(ordered.size());
        for (Participant participant : ordered) {
            standings.add(tallies.get(participant.playerId())
                    .toStanding(places.get(participant.playerId()), participant));
        }
        return standings;
    }

    private static Map<UUID, Tally> tally(List<Participant> participants, Collection<MatchRecord> matches) {
        Map<UUID, Tally> tallies = new LinkedHashMap<>();
        for (Participant participant : participants) {
            tallies.put(participant.playerId(), new Tally());
        }
        for (MatchRecord match : matches) {
            Tally winner = tallies.get(match.winnerId());
            Tally loser = tallies.get(match.loserId());
            if (winner == null || loser == null) {
                continue;
            }
            winner.played++;
            loser.played++;
            winner.wins++;
            loser.losses++;
            if (match.isForfeit()) {
                winner.setsWon++;
                loser.setsLost++;
            } else {
                boolean winnerIsA = match.winnerId().equals(match.participantA());
                int winnerSets = winnerIsA ? match.setsA() : match.setsB();
                int loserSets = winnerIsA ? match.setsB() : match.setsA();
                winner.setsWon += winnerSets;
                winner.setsLost += loserSets;
                loser.setsWon += loserSets;
                loser.setsLost += winnerSets;
            }
        }
        return tallies;
    }

    private static final class Tally {
        private int played;
        private int wins;
        private int losses;
        private int setsWon;
        private int setsLost;

        private int setDifferential() {
            return setsWon - setsLost;
        }

        private Standing toStanding(Integer place, Participant participant) {
            return new Standing(place, participant.playerId(), participant.entryRating(),
                    played, wins, losses, setsWon, setsLost);
        }
    }
}
