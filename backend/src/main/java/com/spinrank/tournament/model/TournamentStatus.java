package com.spinrank.tournament.model;

public enum TournamentStatus {
    ACTIVE,
    COMPLETED
}
