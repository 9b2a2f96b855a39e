package com.spinrank.tournament.controller;

import com.spinrank.tournament.dto.MatchResponses;
import com.spinrank.tournament.dto.TournamentRequests;
import com.spinrank.tournament.dto.TournamentResponses;
import com.spinrank.tournament.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tournaments")
public class TournamentController {

    private final TournamentService tournamentService;

    public TournamentController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @PostMapping
    public ResponseEntity<TournamentResponses.TournamentDetail> createTournament(
            @Valid @RequestBody TournamentRequests.CreateTournamentRequest request
    ) {
        TournamentResponses.TournamentDetail tournament = tournamentService.createTournament(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(tournament);
    }

    @GetMapping
    public ResponseEntity<List<TournamentResponses.TournamentSummary>> listTournaments() {
        return ResponseEntity.ok(tournamentService.listTournaments());
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<TournamentResponses.TournamentDetail> getTournament(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getTournament(tournamentId));
    }

    @GetMapping("/{tournamentId}/bracket")
    public ResponseEntity<TournamentResponses.BracketView> getBracket(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getBracket(tournamentId));
    }

    @GetMapping("/{tournamentId}/fixtures")
    public ResponseEntity<List<TournamentResponses.FixtureView>> getFixtures(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getFixtures(tournamentId));
    }

    @GetMapping("/{tournamentId}/standings")
    public ResponseEntity<List<TournamentResponses.StandingView>> getStandings(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getStandings(tournamentId));
    }

    @GetMapping("/{tournamentId}/ratings")
    public ResponseEntity<List<TournamentResponses.RatingRoundView>> getRatingRounds(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.getRatingRounds(tournamentId));
    }

    @PostMapping("/{tournamentId}/matches/{round}/{position}")
    public ResponseEntity<MatchResponses.MatchResult> recordResult(
            @PathVariable UUID tournamentId,
            @PathVariable int round,
            @PathVariable int position,
            @Valid @RequestBody TournamentRequests.RecordResultRequest request
    ) {
        MatchResponses.MatchResult result = tournamentService.recordResult(tournamentId, round, position, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PutMapping("/{tournamentId}/matches/{round}/{position}")
    public ResponseEntity<MatchResponses.MatchResult> editResult(
            @PathVariable UUID tournamentId,
            @PathVariable int round,
            @PathVariable int position,
            @Valid @RequestBody TournamentRequests.RecordResultRequest request
    ) {
        return ResponseEntity.ok(tournamentService.editResult(tournamentId, round, position, request));
    }

    @DeleteMapping("/{tournamentId}/matches/{round}/{position}")
    public ResponseEntity<TournamentResponses.TournamentDetail> deleteResult(
            @PathVariable UUID tournamentId,
            @PathVariable int round,
            @PathVariable int position
    ) {
        return ResponseEntity.ok(tournamentService.deleteResult(tournamentId, round, position));
    }

    @PostMapping("/{tournamentId}/swiss/rounds")
    public ResponseEntity<List<TournamentResponses.FixtureView>> pairNextSwissRound(@PathVariable UUID tournamentId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tournamentService.pairNextSwissRound(tournamentId));
    }

    @PostMapping("/{tournamentId}/recompute")
    public ResponseEntity<TournamentResponses.TournamentDetail> recompute(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.recompute(tournamentId));
    }

    @PostMapping("/{tournamentId}/cancel")
    public ResponseEntity<TournamentResponses.TournamentDetail> cancelTournament(@PathVariable UUID tournamentId) {
        return ResponseEntity.ok(tournamentService.cancelTournament(tournamentId));
    }

    @DeleteMapping("/{tournamentId}")
    public ResponseEntity<Void> deleteTournament(@PathVariable UUID tournamentId) {
        tournamentService.deleteTournament(tournamentId);
        return ResponseEntity.noContent().build();
    }
}
