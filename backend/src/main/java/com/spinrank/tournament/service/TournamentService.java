package com.spinrank.tournament.service;

import com.spinrank.tournament.bracket.BracketBuilder;
import com.spinrank.tournament.config.SpinrankRuntimeProperties;
import com.spinrank.tournament.dto.MatchResponses;
import com.spinrank.tournament.dto.TournamentRequests;
import com.spinrank.tournament.dto.TournamentResponses;
import com.spinrank.tournament.format.AbstractPreliminaryFormatHandler;
import com.spinrank.tournament.format.ResultSubmission;
import com.spinrank.tournament.format.SwissFormatHandler;
import com.spinrank.tournament.format.TournamentFormatHandler;
import com.spinrank.tournament.format.TournamentFormatRegistry;
import com.spinrank.tournament.format.TournamentSetup;
import com.spinrank.tournament.mapper.TournamentResponseMapper;
import com.spinrank.tournament.model.FinalRating;
import com.spinrank.tournament.model.Fixture;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.MatchScore;
import com.spinrank.tournament.model.Participant;
import com.spinrank.tournament.model.Standing;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.model.TournamentFormat;
import com.spinrank.tournament.model.TournamentStatus;
import com.spinrank.tournament.rating.PointExchange;
import com.spinrank.tournament.rating.RatingAdjustmentEngine;
import com.spinrank.tournament.rating.RatingLedger;
import com.spinrank.tournament.rating.RoundRobinRatingCalculator;
import com.spinrank.tournament.repository.InMemoryTournamentRepository;
import com.spinrank.tournament.web.TournamentEngineException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for every tournament operation.
 *
 * Writes to one tournament are serialized by its lock and applied to a private copy that is only
 * published when the whole transition succeeded. Compound parents are advanced after the stage's
 * lock has been released, so no thread ever holds two tournament locks.
 */
@Service
@RequiredArgsConstructor
public class TournamentService {

    private static final Logger log = LoggerFactory.getLogger(TournamentService.class);

    private final InMemoryTournamentRepository tournamentRepository;
    private final TournamentFormatRegistry formatRegistry;
    private final BracketBuilder bracketBuilder;
    private final RatingAdjustmentEngine ratingAdjustmentEngine;
    private final RoundRobinRatingCalculator roundRobinRatingCalculator;
    private final TournamentResponseMapper responseMapper;
    private final SpinrankRuntimeProperties properties;

    public TournamentResponses.TournamentDetail createTournament(TournamentRequests.CreateTournamentRequest request) {
        TournamentFormat format = formatRegistry.resolveFormat(request.format());
        TournamentFormatHandler handler = formatRegistry.handlerFor(format);
        List<Participant> participants = toParticipants(request.participants());
        validateEntryCount(participants);

        OffsetDateTime now = OffsetDateTime.now();
        Tournament tournament = new Tournament();
        tournament.setTournamentId(UUID.randomUUID());
        tournament.setName(request.name().trim());
        tournament.setFormat(format);
        tournament.setParticipants(new ArrayList<>(participants));
        tournament.setCreatedAt(now);
        tournament.setUpdatedAt(now);

        List<Tournament> stages = handler.initialize(tournament, toSetup(request));
        stages.forEach(tournamentRepository::save);
        tournamentRepository.save(tournament);

        log.info(
                "Created {} tournament {} with {} participants and {} stages",
                format, tournament.getTournamentId(), participants.size(), stages.size()
        );
        return toDetail(tournament);
    }

    public List<TournamentResponses.TournamentSummary> listTournaments() {
        return tournamentRepository.findAll().stream()
                .map(tournament -> responseMapper.toSummary(tournament, counts(tournament)))
                .toList();
    }

    public TournamentResponses.TournamentDetail getTournament(UUID tournamentId) {
        return toDetail(requireTournament(tournamentId));
    }

    public TournamentResponses.BracketView getBracket(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        if (tournament.getBracket() == null) {
            throw TournamentEngineException.notFound("Tournament " + tournamentId + " has no elimination bracket");
        }
        return responseMapper.toBracketView(tournament);
    }

    public List<TournamentResponses.FixtureView> getFixtures(UUID tournamentId) {
        return responseMapper.toFixtureViews(requireTournament(tournamentId));
    }

    public List<TournamentResponses.StandingView> getStandings(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        if (!tournament.isActive()) {
            return responseMapper.toStandingViews(tournament.getFinalStandings());
        }
        return responseMapper.toStandingViews(formatRegistry.handlerFor(tournament.getFormat()).standings(tournament));
    }

    /**
     * Incremental per-round rating view, replayed in round-then-position order.
     */
    public List<TournamentResponses.RatingRoundView> getRatingRounds(UUID tournamentId) {
        Tournament tournament = requireTournament(tournamentId);
        if (tournament.getFormat().isCompound()) {
            throw TournamentEngineException.invalidState(
                    "Tournament " + tournamentId + " tracks ratings on its stage tournaments");
        }
        RatingLedger ledger = RatingLedger.of(tournament.getParticipants(), tournament.getMatches());
        return responseMapper.toRatingRoundViews(ledger.perRoundView());
    }

    public MatchResponses.MatchResult recordResult(
            UUID tournamentId,
            int round,
            int position,
            TournamentRequests.RecordResultRequest request
    ) {
        ResultSubmission submission = toSubmission(request);
        Mutation<MatchRecord> mutation = mutate(tournamentId, true, (tournament, handler, now) ->
                handler.recordResult(tournament, round, position, submission, now));
        return responseMapper.toMatchResult(mutation.tournament(), mutation.result());
    }

    public MatchResponses.MatchResult editResult(
            UUID tournamentId,
            int round,
            int position,
            TournamentRequests.RecordResultRequest request
    ) {
        ResultSubmission submission = toSubmission(request);
        Mutation<MatchRecord> mutation = mutate(tournamentId, true, (tournament, handler, now) ->
                handler.editResult(tournament, round, position, submission, now));
        return responseMapper.toMatchResult(mutation.tournament(), mutation.result());
    }

    public TournamentResponses.TournamentDetail deleteResult(UUID tournamentId, int round, int position) {
        Mutation<Void> mutation = mutate(tournamentId, true, (tournament, handler, now) -> {
            handler.deleteResult(tournament, round, position);
            return null;
        });
        return toDetail(mutation.tournament());
    }

    public List<TournamentResponses.FixtureView> pairNextSwissRound(UUID tournamentId) {
        Mutation<List<Fixture>> mutation = mutate(tournamentId, true, (tournament, handler, now) -> {
            if (!(handler instanceof SwissFormatHandler swissHandler)) {
                throw TournamentEngineException.invalidState("Tournament " + tournamentId + " is not a Swiss tournament");
            }
            return swissHandler.pairNextRound(tournament);
        });
        int pairedRound = mutation.result().isEmpty() ? 0 : mutation.result().get(0).round();
        return responseMapper.toFixtureViews(mutation.tournament()).stream()
                .filter(fixture -> fixture.round() == pairedRound)
                .toList();
    }

    /**
     * Rebuilds derived structure and standings from the flat result list. Safe to repeat.
     */
    public TournamentResponses.TournamentDetail recompute(UUID tournamentId) {
        Mutation<Void> mutation = mutate(tournamentId, false, (tournament, handler, now) -> {
            handler.recompute(tournament);
            if (!tournament.isActive() && !tournament.isCancelled()) {
                freeze(tournament, handler);
            }
            return null;
        });
        if (mutation.tournament().getFormat().isCompound()) {
            advanceParent(tournamentId, OffsetDateTime.now());
        }
        return getTournament(tournamentId);
    }

    public TournamentResponses.TournamentDetail cancelTournament(UUID tournamentId) {
        Mutation<Void> mutation = mutate(tournamentId, true, (tournament, handler, now) -> {
            freeze(tournament, handler);
            tournament.setStatus(TournamentStatus.COMPLETED);
            tournament.setCancelled(true);
            tournament.setCompletedAt(now);
            log.info("Cancelled tournament {} with {} recorded results",
                    tournamentId, handler.recordedMatchCount(tournament));
            return null;
        });
        for (UUID stageId : mutation.tournament().getChildTournamentIds()) {
            cancelIfActive(stageId);
        }
        return toDetail(mutation.tournament());
    }

    public void deleteTournament(UUID tournamentId) {
        List<UUID> stageIds;
        ReentrantLock lock = requireLock(tournamentId);
        lock.lock();
        try {
            Tournament tournament = requireTournament(tournamentId);
            if (tournament.getParentTournamentId() != null) {
                throw TournamentEngineException.invalidState(
                        "Stage tournament " + tournamentId + " can only be deleted with its parent");
            }
            TournamentFormatHandler handler = formatRegistry.handlerFor(tournament.getFormat());
            if (!handler.canDelete(tournament)) {
                throw TournamentEngineException.invalidState(
                        "Tournament " + tournamentId + " has recorded results; cancel it instead");
            }
            stageIds = tournamentRepository.findByParentTournamentId(tournamentId).stream()
                    .map(Tournament::getTournamentId)
                    .toList();
            tournamentRepository.delete(tournamentId);
        } finally {
            lock.unlock();
        }

        for (UUID stageId : stageIds) {
            tournamentRepository.lockFor(stageId).ifPresent(stageLock -> {
                stageLock.lock();
                try {
                    tournamentRepository.delete(stageId);
                } finally {
                    stageLock.unlock();
                }
            });
        }
        log.info("Deleted tournament {} and {} stages", tournamentId, stageIds.size());
    }

    public TournamentResponses.BracketPreview previewBracket(TournamentRequests.BracketPreviewRequest request) {
        List<Participant> participants = toParticipants(request.participants());
        BracketBuilder.BracketPlan plan = request.bracketPositions() != null
                ? bracketBuilder.buildFromPositions(participants, request.bracketPositions())
                : bracketBuilder.build(participants);
        return responseMapper.toBracketPreview(plan);
    }

    public TournamentResponses.PointExchangePreview previewPointExchange(int ratingA, int ratingB, boolean aWon) {
        if (ratingA < 0 || ratingB < 0) {
            throw TournamentEngineException.invalidResult(
                    "Ratings must be non-negative, got " + ratingA + " and " + ratingB);
        }
        PointExchange exchange = ratingAdjustmentEngine.pointExchange(ratingA, ratingB, aWon);
        return responseMapper.toPointExchangePreview(ratingA, ratingB, aWon, exchange);
    }

    private <T> Mutation<T> mutate(UUID tournamentId, boolean requireActive, TournamentMutation<T> change) {
        OffsetDateTime now = OffsetDateTime.now();
        Tournament published;
        T result;
        ReentrantLock lock = requireLock(tournamentId);
        lock.lock();
        try {
            Tournament current = requireTournament(tournamentId);
            if (requireActive && !current.isActive()) {
                throw TournamentEngineException.invalidState("Tournament " + tournamentId
                        + (current.isCancelled() ? " is cancelled" : " is already completed"));
            }
            Tournament working = current.copy();
            TournamentFormatHandler handler = formatRegistry.handlerFor(working.getFormat());
            result = change.apply(working, handler, now);
            completeIfResolved(working, handler, now);
            working.setUpdatedAt(now);
            published = tournamentRepository.save(working);
        } finally {
            lock.unlock();
        }

        if (published.getParentTournamentId() != null && !published.isActive()) {
            advanceParent(published.getParentTournamentId(), now);
        }
        return new Mutation<>(published, result);
    }

    private void advanceParent(UUID parentId, OffsetDateTime now) {
        ReentrantLock lock = tournamentRepository.lockFor(parentId).orElse(null);
        if (lock == null) {
            return;
        }
        lock.lock();
        try {
            Tournament parent = tournamentRepository.findById(parentId).orElse(null);
            if (parent == null || !parent.isActive()) {
                return;
            }
            TournamentFormatHandler handler = formatRegistry.handlerFor(parent.getFormat());
            if (!(handler instanceof AbstractPreliminaryFormatHandler compoundHandler)) {
                return;
            }
            Tournament working = parent.copy();
            Optional<Tournament> finalStage = compoundHandler.advance(working, now);
            finalStage.ifPresent(tournamentRepository::save);
            completeIfResolved(working, compoundHandler, now);
            working.setUpdatedAt(now);
            tournamentRepository.save(working);
        } finally {
            lock.unlock();
        }
    }

    private void cancelIfActive(UUID tournamentId) {
        Optional<Tournament> stage = tournamentRepository.findById(tournamentId);
        if (stage.isPresent() && stage.get().isActive()) {
            try {
                cancelTournament(tournamentId);
            } catch (TournamentEngineException ex) {
                log.warn("Stage tournament {} finished before it could be cancelled: {}", tournamentId, ex.getMessage());
            }
        }
    }

    private void completeIfResolved(Tournament tournament, TournamentFormatHandler handler, OffsetDateTime now) {
        if (!tournament.isActive() || !handler.isComplete(tournament)) {
            return;
        }
        freeze(tournament, handler);
        tournament.setStatus(TournamentStatus.COMPLETED);
        tournament.setCompletedAt(now);
        log.info(
                "Completed {} tournament {} after {} results",
                tournament.getFormat(), tournament.getTournamentId(), handler.recordedMatchCount(tournament)
        );
    }

    /**
     * Snapshots final standings and each participant's post-tournament rating.
     */
    private void freeze(Tournament tournament, TournamentFormatHandler handler) {
        List<Standing> standings = handler.standings(tournament);
        tournament.setFinalStandings(new ArrayList<>(standings));
        tournament.setFinalRatings(finalRatings(tournament, handler));
    }

    /**
     * Completed round robins, group stages included, go through the multi-pass calculation. Other formats
     * and unfinished round robins sum the recorded exchanges. A compound parent sums what each stage froze.
     */
    private List<FinalRating> finalRatings(Tournament tournament, TournamentFormatHandler handler) {
        if (handler instanceof AbstractPreliminaryFormatHandler compoundHandler) {
            return compoundFinalRatings(tournament, compoundHandler.stages(tournament));
        }
        if (tournament.getFormat() == TournamentFormat.ROUND_ROBIN && handler.isComplete(tournament)) {
            return roundRobinRatingCalculator.finalRatings(tournament.getParticipants(), tournament.getMatches());
        }
        RatingLedger ledger = RatingLedger.of(tournament.getParticipants(), tournament.getMatches());
        List<FinalRating> ratings = new ArrayList<>(tournament.getParticipants().size());
        for (Participant participant : tournament.getParticipants()) {
            int change = ledger.totalChange(participant.playerId());
            Integer entry = participant.entryRating();
            ratings.add(new FinalRating(participant.playerId(), entry, change,
                    entry == null ? null : Math.max(0, entry + change)));
        }
        return ratings;
    }

    private List<FinalRating> compoundFinalRatings(Tournament parent, List<Tournament> stages) {
        List<FinalRating> ratings = new ArrayList<>(parent.getParticipants().size());
        for (Participant participant : parent.getParticipants()) {
            UUID playerId = participant.playerId();
            int change = 0;
            Integer estimate = null;
            for (Tournament stage : stages) {
                if (stage.getParticipants().stream().noneMatch(entry -> entry.playerId().equals(playerId))) {
                    continue;
                }
                Optional<FinalRating> frozen = stage.getFinalRatings().stream()
                        .filter(rating -> rating.playerId().equals(playerId))
                        .findFirst();
                if (frozen.isPresent()) {
                    change += frozen.get().ratingChange();
                    if (frozen.get().finalRating() != null) {
                        estimate = frozen.get().finalRating();
                    }
                } else {
                    change += RatingLedger.of(stage.getParticipants(), stage.getMatches()).totalChange(playerId);
                }
            }
            Integer entry = participant.entryRating();
            ratings.add(new FinalRating(playerId, entry, change,
                    entry == null ? estimate : Math.max(0, entry + change)));
        }
        return ratings;
    }

    private ReentrantLock requireLock(UUID tournamentId) {
        return tournamentRepository.lockFor(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("Tournament not found: " + tournamentId));
    }

    private Tournament requireTournament(UUID tournamentId) {
        return tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> TournamentEngineException.notFound("Tournament not found: " + tournamentId));
    }

    private TournamentResponses.TournamentDetail toDetail(Tournament tournament) {
        return responseMapper.toDetail(tournament, counts(tournament));
    }

    private TournamentResponseMapper.MatchCounts counts(Tournament tournament) {
        TournamentFormatHandler handler = formatRegistry.handlerFor(tournament.getFormat());
        return new TournamentResponseMapper.MatchCounts(
                handler.expectedMatchCount(tournament),
                handler.recordedMatchCount(tournament),
                handler.isComplete(tournament)
        );
    }

    private void validateEntryCount(List<Participant> participants) {
        SpinrankRuntimeProperties.Tournament limits = properties.getTournament();
        int min = Math.max(2, limits.getMinParticipants());
        if (participants.size() < min) {
            throw TournamentEngineException.invalidEntryCount(
                    "Tournament needs at least " + min + " participants, got " + participants.size());
        }
        if (participants.size() > limits.getMaxParticipants()) {
            throw TournamentEngineException.invalidEntryCount(
                    "Tournament accepts at most " + limits.getMaxParticipants() + " participants, got "
                            + participants.size());
        }
    }

    private static List<Participant> toParticipants(List<TournamentRequests.ParticipantEntry> entries) {
        List<Participant> participants = new ArrayList<>(entries.size());
        Set<UUID> seen = new HashSet<>();
        for (TournamentRequests.ParticipantEntry entry : entries) {
            if (!seen.add(entry.playerId())) {
                throw TournamentEngineException.invalidEntryCount("Duplicate participant: " + entry.playerId());
            }
            participants.add(new Participant(entry.playerId(), entry.rating(), participants.size()));
        }
        return participants;
    }

    private static TournamentSetup toSetup(TournamentRequests.CreateTournamentRequest request) {
        TournamentRequests.SwissOptions swiss = request.swiss();
        TournamentRequests.PreliminaryOptions preliminary = request.preliminary();
        return new TournamentSetup(
                swiss != null ? swiss.rounds() : null,
                swiss != null ? swiss.pairByRating() : null,
                preliminary != null ? preliminary.groupCount() : null,
                preliminary != null ? preliminary.finalSize() : null,
                preliminary != null && preliminary.autoQualified() != null ? preliminary.autoQualified() : List.of(),
                preliminary != null ? preliminary.groups() : null,
                request.bracketPositions()
        );
    }

    private static ResultSubmission toSubmission(TournamentRequests.RecordResultRequest request) {
        MatchScore score = new MatchScore(
                request.setsA() != null ? request.setsA() : 0,
                request.setsB() != null ? request.setsB() : 0,
                request.forfeitA(),
                request.forfeitB()
        );
        return new ResultSubmission(request.participantA(), request.participantB(), score);
    }

    @FunctionalInterface
    private interface TournamentMutation<T> {
        T apply(Tournament working, TournamentFormatHandler handler, OffsetDateTime now);
    }

    private record Mutation<T>(Tournament tournament, T result) {
    }
}
