package com.spinrank.tournament.model;

public enum SlotKind {
    PLAYER,
    BYE,
    UNDETERMINED
}
