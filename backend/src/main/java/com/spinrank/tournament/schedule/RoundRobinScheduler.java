package com.spinrank.tournament.schedule;

import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.web.TournamentEngineException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * All-play-all fixtures organised into rounds with the circle method.
 * Even fields play {@code n - 1} rounds, odd fields {@code n} rounds with one player resting each round.
 */
@Component
public class RoundRobinScheduler {

    public static int expectedMatches(int participantCount) {
        return participantCount * (participantCount - 1) / 2;
    }

    public static int roundCount(int participantCount) {
        return participantCount % 2 == 0 ? participantCount - 1 : participantCount;
    }

    public List<Fixture> schedule(List<Participant> participants) {
        if (participants == null || participants.size() < 2) {
            throw TournamentEngineException.invalidEntryCount(
                    "Round robin needs at least 2 participants, got "
                            + (participants == null ? 0 : participants.size()));
        }
        List<UUID> ring = new ArrayList<>(participants.size() + 1);
        participants.stream()
                .sorted(Comparator.comparingInt(Participant::entryOrder))
                .forEach(participant -> ring.add(participant.playerId()));
        if (ring.size() % 2 == 1) {
            ring.add(null);
        }

        int slots = ring.size();
        List<Fixture> fixtures = new ArrayList<>(expectedMatches(participants.size()));
        for (int round = 1; round < slots; round++) {
            int position = 0;
            for (int i = 0; i < slots / 2; i++) {
                UUID home = ring.get(i);
                UUID away = ring.get(slots - 1 - i);
                if (home != null && away != null) {
                    fixtures.add(new Fixture(round, position++, home, away));
                }
            }
            // first entry stays fixed, the rest rotate one step clockwise
            ring.add(1, ring.remove(slots - 1));
        }
        return fixtures;
    }
}
