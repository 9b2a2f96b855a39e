package com.spinrank.tournament.model;

import java.util.Objects;
import java.util.UUID;

public record BracketSlot(
        SlotKind kind,
        UUID playerId
) {

    private static final BracketSlot BYE = new BracketSlot(SlotKind.BYE, null);
    private static final BracketSlot UNDETERMINED = new BracketSlot(SlotKind.UNDETERMINED, null);

    public static BracketSlot player(UUID playerId) {
        return new BracketSlot(SlotKind.PLAYER, Objects.requireNonNull(playerId, "playerId is required"));
    }

    public static BracketSlot bye() {
        return BYE;
    }

    public static BracketSlot undetermined() {
        return UNDETERMINED;
    }

    public boolean isPlayer() {
        return kind == SlotKind.PLAYER;
    }

    public boolean isBye() {
        return kind == SlotKind.BYE;
    }
}
