package com.spinrank.tournament.service;

import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.web.TournamentEngineException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Decides who advances from preliminary groups to the final stage and in which seed order.
 */
@Service
public class PreliminaryQualificationService {

    private static final Comparator<Qualifier> BY_RATING = Comparator
            .comparing(Qualifier::entryRating, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Qualifier::playerId);

    /**
     * Auto-qualified players first, then every group winner, then remaining slots filled place by place
     * (all 2nd places, then all 3rd places, ...), each place ordered by entry rating.
     */
    public List<Qualifier> qualify(
            List<Participant> entrants,
            List<UUID> autoQualified,
            List<List<Standing>> groupStandings,
            int finalSize
    ) {
        Map<UUID, Participant> byId = new HashMap<>();
        entrants.forEach(participant -> byId.put(participant.playerId(), participant));

        List<Qualifier> qualifiers = new ArrayList<>(finalSize);
        Set<UUID> taken = new HashSet<>();
        for (UUID playerId : autoQualified) {
            Participant participant = requireEntrant(byId, playerId);
            if (taken.add(playerId)) {
                qualifiers.add(new Qualifier(playerId, participant.entryRating(), QualificationRoute.AUTO, null, null));
            }
        }

        int deepestPlace = groupStandings.stream().mapToInt(List::size).max().orElse(0);
        for (int place = 1; place <= deepestPlace && qualifiers.size() < finalSize; place++) {
            List<Qualifier> candidates = new ArrayList<>();
            for (int group = 0; group < groupStandings.size(); group++) {
                List<Standing> standings = groupStandings.get(group);
                if (standings.size() < place) {
                    continue;
                }
                UUID playerId = standings.get(place - 1).playerId();
                if (taken.contains(playerId)) {
                    continue;
                }
                Participant participant = requireEntrant(byId, playerId);
                QualificationRoute route = place == 1 ? QualificationRoute.GROUP_WINNER : QualificationRoute.GROUP_PLACE;
                candidates.add(new Qualifier(playerId, participant.entryRating(), route, group, place));
            }
            candidates.sort(BY_RATING);
            for (Qualifier candidate : candidates) {
                if (candidate.route() != QualificationRoute.GROUP_WINNER && qualifiers.size() >= finalSize) {
                    break;
                }
                taken.add(candidate.playerId());
                qualifiers.add(candidate);
            }
        }
        return qualifiers;
    }

    /**
     * Final seed order: auto-qualified by rating, group winners by rating, then the rest as they qualified.
     * The returned participants carry their seed order as entry order.
     */
    public List<Participant> seedFinal(List<Qualifier> qualifiers) {
        List<Qualifier> auto = new ArrayList<>();
        List<Qualifier> winners = new ArrayList<>();
        List<Qualifier> rest = new ArrayList<>();
        for (Qualifier qualifier : qualifiers) {
            switch (qualifier.route()) {
                case AUTO -> auto.add(qualifier);
                case GROUP_WINNER -> winners.add(qualifier);
                default -> rest.add(qualifier);
            }
        }
        auto.sort(BY_RATING);
        winners.sort(BY_RATING);

        Set<Qualifier> ordered = new LinkedHashSet<>();
        ordered.addAll(auto);
        ordered.addAll(winners);
        ordered.addAll(rest);

        List<Participant> seeded = new ArrayList<>(ordered.size());
        for (Qualifier qualifier : ordered) {
            seeded.add(new Participant(qualifier.playerId(), qualifier.entryRating(), seeded.size()));
        }
        return seeded;
    }

    private static Participant requireEntrant(Map<UUID, Participant> byId, UUID playerId) {
        Participant participant = byId.get(playerId);
        if (participant == null) {
            throw TournamentEngineException.notFound("Player " + playerId + " is not entered in this tournament");
        }
        return participant;
    }

    public enum QualificationRoute {
        AUTO,
        GROUP_WINNER,
        GROUP_PLACE
    }

    /**
     * @param groupIndex 0-based group, {@code null} for auto-qualified players
     * @param groupPlace place reached in the group, {@code null} for auto-qualified players
     */
    public record Qualifier(
            UUID playerId,
            Integer entryRating,
            QualificationRoute route,
            Integer groupIndex,
            Integer groupPlace
    ) {
    }
}
