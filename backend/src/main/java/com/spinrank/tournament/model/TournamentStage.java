package com.spinrank.tournament.model;

/**
 * Role of a tournament inside a compound event.
 */
public enum TournamentStage {
    STANDALONE,
    PRELIMINARY_GROUP,
    FINAL
}
