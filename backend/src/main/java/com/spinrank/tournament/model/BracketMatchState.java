package com.spinrank.tournament.model;

public enum BracketMatchState {
    /** Fewer than two real occupants known. */
    PENDING,
    /** Both occupants known, no result yet. */
    READY,
    /** Winner decided by a recorded result or a bye. */
    DECIDED
}
