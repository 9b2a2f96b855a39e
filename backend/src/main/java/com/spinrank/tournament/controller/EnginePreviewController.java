package com.spinrank.tournament.controller;

import com.spinrank.tournament.dto.TournamentRequests;
import com.spinrank.tournament.dto.TournamentResponses;
import com.spinrank.tournament.service.TournamentService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Previews computed by the same bracket builder and rating engine the tournaments use.
 */
@RestController
@RequestMapping("/api")
public class EnginePreviewController {

    private final TournamentService tournamentService;

    public EnginePreviewController(TournamentService tournamentService) {
        this.tournamentService = tournamentService;
    }

    @PostMapping("/brackets/preview")
    public ResponseEntity<TournamentResponses.BracketPreview> previewBracket(
            @Valid @RequestBody TournamentRequests.BracketPreviewRequest request
    ) {
        return ResponseEntity.ok(tournamentService.previewBracket(request));
    }

    @GetMapping("/ratings/point-exchange")
    public ResponseEntity<TournamentResponses.PointExchangePreview> previewPointExchange(
            @RequestParam int ratingA,
            @RequestParam int ratingB,
            @RequestParam boolean aWon
    ) {
        return ResponseEntity.ok(tournamentService.previewPointExchange(ratingA, ratingB, aWon));
    }
}
