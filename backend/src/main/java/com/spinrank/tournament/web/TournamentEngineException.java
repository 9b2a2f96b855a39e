package com.spinrank.tournament.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Recoverable rejection raised by the tournament engine.
 * The message names the offending coordinate or values so callers can re-prompt.
 */
@Getter
public class TournamentEngineException extends RuntimeException {

    private final TournamentErrorCode errorCode;

    public TournamentEngineException(TournamentErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public static TournamentEngineException invalidEntryCount(String detail) {
        return new TournamentEngineException(TournamentErrorCode.INVALID_ENTRY_COUNT, detail);
    }

    public static TournamentEngineException invalidRoundConfig(String detail) {
        return new TournamentEngineException(TournamentErrorCode.INVALID_ROUND_CONFIG, detail);
    }

    public static TournamentEngineException invalidState(String detail) {
        return new TournamentEngineException(TournamentErrorCode.INVALID_STATE, detail);
    }

    public static TournamentEngineException invalidResult(String detail) {
        return new TournamentEngineException(TournamentErrorCode.INVALID_RESULT, detail);
    }

    public static TournamentEngineException unsupportedFormat(String detail) {
        return new TournamentEngineException(TournamentErrorCode.UNSUPPORTED_FORMAT, detail);
    }

    public static TournamentEngineException notFound(String detail) {
        return new TournamentEngineException(TournamentErrorCode.NOT_FOUND, detail);
    }
}
