package com.spinrank.tournament.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class TournamentEngineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TournamentEngineExceptionHandler.class);

    @ExceptionHandler(TournamentEngineException.class)
    public ResponseEntity<TournamentEngineErrorResponse> handle(TournamentEngineException ex) {
        log.debug("Rejected tournament request with {}: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new TournamentEngineErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record TournamentEngineErrorResponse(
            String code,
            String message
    ) {
    }
}
