package com.spinrank.tournament.format;

import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Formats whose matches are scheduled fixtures addressed by {@code (round, position)}.
 * A fixture is ready until a result is recorded against it; there is no downstream to invalidate.
 */
public abstract class AbstractFixtureFormatHandler extends AbstractFormatHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractFixtureFormatHandler.class);

    protected AbstractFixtureFormatHandler(RatingAdjustmentEngine ratingAdjustmentEngine) {
        super(ratingAdjustmentEngine);
    }

    /**
     * Rating carried into the fixture at {@code (round, position)}.
     */
    protected abstract Integer ratingBefore(Tournament tournament, UUID playerId, int round, int position);

    @Override
    public MatchRecord recordResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        Fixture fixture = requireFixture(tournament, round, position);
        if (tournament.findMatch(round, position).isPresent()) {
            throw TournamentEngineException.invalidState(
                    "Match at round " + round + ", position " + position + " is already decided; edit the result instead");
        }
        MatchScore score = orientAndValidate(submission, fixture.playerA(), fixture.playerB(), round, position);
        MatchRecord record = buildRecord(
                UUID.randomUUID(),
                round,
                position,
                fixture.playerA(),
                fixture.playerB(),
                score,
                ratingBefore(tournament, fixture.playerA(), round, position),
                ratingBefore(tournament, fixture.playerB(), round, position),
                recordedAt
        );
        tournament.getMatches().add(record);
        log.info(
                "Recorded {} result {} at round {}, position {}: winner {}",
                format(), record.matchId(), round, position, record.winnerId()
        );
        return record;
    }

    @Override
    public MatchRecord editResult(
            Tournament tournament,
            int round,
            int position,
            ResultSubmission submission,
            OffsetDateTime recordedAt
    ) {
        requireFixture(tournament, round, position);
        MatchRecord existing = requireRecorded(tournament, round, position);
        MatchScore score = orientAndValidate(
                submission, existing.participantA(), existing.participantB(), round, position);
        MatchRecord updated = rescore(existing, score, recordedAt);
        replaceRecord(tournament, updated);
        log.info("Corrected {} result {} at round {}, position {}", format(), updated.matchId(), round, position);
        return updated;
    }

    @Override
    public void deleteResult(Tournament tournament, int round, int position) {
        requireFixture(tournament, round, position);
        MatchRecord existing = requireRecorded(tournament, round, position);
        tournament.getMatches().removeIf(match -> match.matchId().equals(existing.matchId()));
        log.info("Deleted {} result {} at round {}, position {}", format(), existing.matchId(), round, position);
    }

    protected static Fixture requireFixture(Tournament tournament, int round, int position) {
        return tournament.findFixture(round, position)
                .orElseThrow(() -> TournamentEngineException.notFound(
                        "No fixture at round " + round + ", position " + position));
    }

    protected static MatchRecord requireRecorded(Tournament tournament, int round, int position) {
        return tournament.findMatch(round, position)
                .orElseThrow(() -> TournamentEngineException.invalidState(
                        "Match at round " + round + ", position " + position + " has no recorded result"));
    }
}
