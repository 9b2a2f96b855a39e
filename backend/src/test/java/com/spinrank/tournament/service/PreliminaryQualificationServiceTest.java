package com.spinrank.tournament.service;

import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PreliminaryQualificationServiceTest {

    private static final UUID X = UUID.fromString("00000000-0000-0000-0000-000000000B00");
    private static final UUID A1 = UUID.fromString("00000000-0000-0000-0000-000000000A11");
    private static final UUID A2 = UUID.fromString("00000000-0000-0000-0000-000000000A12");
    private static final UUID A3 = UUID.fromString("00000000-0000-0000-0000-000000000A13");
    private static final UUID B1 = UUID.fromString("00000000-0000-0000-0000-000000000B11");
    private static final UUID B2 = UUID.fromString("00000000-0000-0000-0000-000000000B12");
    private static final UUID B3 = UUID.fromString("00000000-0000-0000-0000-000000000B13");

    private final PreliminaryQualificationService service = new PreliminaryQualificationService();

    private final List<Participant> entrants = List.of(
            new Participant(X, 2000, 0),
            new Participant(A1, 1500, 1),
            new Participant(A2, 1450, 2),
            new Participant(A3, 1300, 3),
            new Participant(B1, 1400, 4),
            new Participant(B2, 1480, 5),
            new Participant(B3, 1350, 6)
    );

    private final List<List<Standing>> groupStandings = List.of(
            List.of(standing(1, A1, 1500), standing(2, A2, 1450), standing(3, A3, 1300)),
            List.of(standing(1, B1, 1400), standing(2, B2, 1480), standing(3, B3, 1350))
    );

    @Test
    void autoQualifiedThenGroupWinnersThenBestRatedRunnersUp() {
        List<PreliminaryQualificationService.Qualifier> qualifiers =
                service.qualify(entrants, List.of(X), groupStandings, 4);

        assertEquals(List.of(X, A1, B1, B2), qualifiers.stream()
                .map(PreliminaryQualificationService.Qualifier::playerId).toList());
        assertEquals(PreliminaryQualificationService.QualificationRoute.AUTO, qualifiers.get(0).route());
        assertNull(qualifiers.get(0).groupIndex());
        assertEquals(PreliminaryQualificationService.QualificationRoute.GROUP_WINNER, qualifiers.get(2).route());
        assertEquals(1, qualifiers.get(2).groupIndex());
        assertEquals(2, qualifiers.get(3).groupPlace());
    }

    @Test
    void largerFinalsFillPlaceByPlace() {
        List<PreliminaryQualificationService.Qualifier> qualifiers =
                service.qualify(entrants, List.of(X), groupStandings, 6);

        assertEquals(List.of(X, A1, B1, B2, A2, B3), qualifiers.stream()
                .map(PreliminaryQualificationService.Qualifier::playerId).toList());
    }

    @Test
    void finalSeedingKeepsRouteOrderAndRenumbersEntries() {
        List<Participant> seeded = service.seedFinal(service.qualify(entrants, List.of(X), groupStandings, 6));

        assertEquals(List.of(X, A1, B1, B2, A2, B3), seeded.stream().map(Participant::playerId).toList());
        for (int i = 0; i < seeded.size(); i++) {
            assertEquals(i, seeded.get(i).entryOrder());
        }
        assertEquals(1480, seeded.get(3).entryRating());
    }

    @Test
    void unknownAutoQualifiedPlayerIsNotFound() {
        TournamentEngineException exception = assertThrows(TournamentEngineException.class,
                () -> service.qualify(entrants, List.of(UUID.randomUUID()), groupStandings, 4));

        assertEquals(TournamentErrorCode.NOT_FOUND, exception.getErrorCode());
    }

    private static Standing standing(int place, UUID playerId, int rating) {
        return new Standing(place, playerId, rating, 2, 3 - place, place - 1, 0, 0);
    }
}
