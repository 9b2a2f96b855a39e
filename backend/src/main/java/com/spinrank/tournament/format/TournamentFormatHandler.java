package com.spinrank.tournament.format;

import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Behaviour of one tournament format. Callers dispatch through {@link TournamentFormatRegistry}
 * instead of branching on the format tag.
 */
public interface TournamentFormatHandler {

    TournamentFormat format();

    /**
     * Builds the format's structure on a freshly created tournament.
     *
     * @return stage tournaments created alongside it, empty for single-stage formats
     */
    List<Tournament> initialize(Tournament tournament, TournamentSetup setup);

    int expectedMatchCount(Tournament tournament);

    default int recordedMatchCount(Tournament tournament) {
        return tournament.getMatches().size();
    }

    default boolean isComplete(Tournament tournament) {
        return recordedMatchCount(tournament) >= expectedMatchCount(tournament);
    }

    default boolean canDelete(Tournament tournament) {
        return recordedMatchCount(tournament) == 0;
    }

    MatchRecord recordResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    );

    MatchRecord editResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    );

    void deleteResult(Tournament tournament, int round, int position);

    List<Standing> standings(Tournament tournament);

    /**
     * Rebuilds derived state from the flat result list. Must be idempotent.
     */
    default void recompute(Tournament tournament) {
    }
}
