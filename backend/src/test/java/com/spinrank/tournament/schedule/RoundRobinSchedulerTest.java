package com.spinrank.tournament.schedule;

import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoundRobinSchedulerTest {

    private static final UUID A = UUID.fromString("00000000-0000-0000-0000-000000000C01");
    private static final UUID B = UUID.fromString("00000000-0000-0000-0000-000000000C02");
    private static final UUID C = UUID.fromString("00000000-0000-0000-0000-000000000C03");
    private static final UUID D = UUID.fromString("00000000-0000-0000-0000-000000000C04");

    private final RoundRobinScheduler scheduler = new RoundRobinScheduler();

    @Test
    void fourPlayersPlayThreeRoundsWithTheFirstEntrantFixed() {
        List<Fixture> fixtures = scheduler.schedule(List.of(
                new Participant(A, 1500, 0),
                new Participant(B, 1400, 1),
                new Participant(C, 1300, 2),
                new Participant(D, 1200, 3)
        ));

        assertEquals(List.of(
                new Fixture(1, 0, A, D),
                new Fixture(1, 1, B, C),
                new Fixture(2, 0, A, C),
                new Fixture(2, 1, D, B),
                new Fixture(3, 0, A, B),
                new Fixture(3, 1, C, D)
        ), fixtures);
    }

    @Test
    void oddFieldsRestOnePlayerPerRound() {
        List<Participant> participants = participants(5);

        List<Fixture> fixtures = scheduler.schedule(participants);

        assertEquals(10, fixtures.size());
        assertEquals(5, RoundRobinScheduler.roundCount(5));
        Map<Integer, Integer> perRound = new HashMap<>();
        fixtures.forEach(fixture -> perRound.merge(fixture.round(), 1, Integer::sum));
        assertEquals(5, perRound.size());
        perRound.values().forEach(count -> assertEquals(2, count));
    }

    @Test
    void everyPairMeetsExactlyOnceAndNobodyPlaysTwiceInARound() {
        for (int n = 2; n <= 17; n++) {
            List<Participant> participants = participants(n);
            List<Fixture> fixtures = scheduler.schedule(participants);

            assertEquals(RoundRobinScheduler.expectedMatches(n), fixtures.size());
            Set<String> pairs = new HashSet<>();
            Map<Integer, Set<UUID>> busy = new HashMap<>();
            for (Fixture fixture : fixtures) {
                String key = fixture.playerA().compareTo(fixture.playerB()) < 0
                        ? fixture.playerA() + ":" + fixture.playerB()
                        : fixture.playerB() + ":" + fixture.playerA();
                assertTrue(pairs.add(key), "rematch " + key + " for n=" + n);
                Set<UUID> inRound = busy.computeIfAbsent(fixture.round(), ignored -> new HashSet<>());
                assertTrue(inRound.add(fixture.playerA()));
                assertTrue(inRound.add(fixture.playerB()));
            }
            assertEquals(RoundRobinScheduler.roundCount(n), busy.size());
        }
    }

    @Test
    void rejectsFieldsSmallerThanTwo() {
        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> scheduler.schedule(List.of(new Participant(A, 1500, 0))));

        assertEquals(TournamentErrorCode.INVALID_ENTRY_COUNT, exception.getErrorCode());
    }

    private static List<Participant> participants(int count) {
        List<Participant> participants = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            participants.add(new Participant(UUID.randomUUID(), 1000 + i, i));
        }
        return participants;
    }
}
