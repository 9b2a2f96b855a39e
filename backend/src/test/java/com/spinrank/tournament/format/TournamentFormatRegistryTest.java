package com.spinrank.tournament.format;

import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.web.TournamentEngineException;
import com.spinrank.tournament.web.TournamentErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TournamentFormatRegistryTest {

    @Mock
    private TournamentFormatHandler playoffHandler;

    @Mock
    private TournamentFormatHandler roundRobinHandler;

    @Test
    void resolvesTagsCaseInsensitivelyWithDashes() {
        when(playoffHandler.format()).thenReturn(TournamentFormat.PLAYOFF);
        when(roundRobinHandler.format()).thenReturn(TournamentFormat.ROUND_ROBIN);
        TournamentFormatRegistry registry = new TournamentFormatRegistry(List.of(playoffHandler, roundRobinHandler));

        assertEquals(TournamentFormat.PLAYOFF, registry.resolveFormat("playoff"));
        assertEquals(TournamentFormat.ROUND_ROBIN, registry.resolveFormat("Round-Robin"));
        assertSame(roundRobinHandler, registry.handlerFor(TournamentFormat.ROUND_ROBIN));
        assertEquals(Set.of(TournamentFormat.PLAYOFF, TournamentFormat.ROUND_ROBIN), registry.supportedFormats());
    }

    @Test
    void unknownOrUnregisteredFormatsAreUnsupported() {
        when(playoffHandler.format()).thenReturn(TournamentFormat.PLAYOFF);
        TournamentFormatRegistry registry = new TournamentFormatRegistry(List.of(playoffHandler));

        TournamentEngineException unknown = assertThrows(TournamentEngineException.class,
                () -> registry.resolveFormat("multi_round_robins"));
        assertEquals(TournamentErrorCode.UNSUPPORTED_FORMAT, unknown.getErrorCode());

        TournamentEngineException unregistered = assertThrows(TournamentEngineException.class,
                () -> registry.resolveFormat("swiss"));
        assertEquals(TournamentErrorCode.UNSUPPORTED_FORMAT, unregistered.getErrorCode());

        TournamentEngineException missing = assertThrows(TournamentEngineException.class,
                () -> registry.handlerFor(null));
        assertEquals(TournamentErrorCode.UNSUPPORTED_FORMAT, missing.getErrorCode());
    }

    @Test
    void duplicateHandlersFailFast() {
        when(playoffHandler.format()).thenReturn(TournamentFormat.PLAYOFF);
        when(roundRobinHandler.format()).thenReturn(TournamentFormat.PLAYOFF);

        assertThrows(IllegalStateException.class,
                () -> new TournamentFormatRegistry(List.of(playoffHandler, roundRobinHandler)));
    }
}
