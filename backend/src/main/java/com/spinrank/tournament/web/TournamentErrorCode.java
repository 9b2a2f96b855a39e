package com.spinrank.tournament.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum TournamentErrorCode {
    INVALID_ENTRY_COUNT(HttpStatus.BAD_REQUEST, "invalid_entry_count"),
    INVALID_ROUND_CONFIG(HttpStatus.BAD_REQUEST, "invalid_round_config"),
    INVALID_STATE(HttpStatus.CONFLICT, "invalid_state"),
    INVALID_RESULT(HttpStatus.BAD_REQUEST, "invalid_result"),
    UNSUPPORTED_FORMAT(HttpStatus.BAD_REQUEST, "unsupported_format"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "not_found");

    private final HttpStatus status;
    private final String code;

    TournamentErrorCode(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }
}
