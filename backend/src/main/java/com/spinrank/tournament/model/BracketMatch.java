package com.spinrank.tournament.model;

import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * One {@code (round, position)} node of an elimination draw.
 * Round is 1-based, position is 0-based within its round.
 */
@Getter
@Setter
public class BracketMatch {

    private int round;
    private int position;
    private BracketSlot slotA = BracketSlot.undetermined();
    private BracketSlot slotB = BracketSlot.undetermined();
    private UUID matchId;
    private UUID winnerId;

    public BracketMatch() {
    }

    public BracketMatch(int round, int position) {
        this.round = round;
        this.position = position;
    }

    public BracketMatchState getState() {
        if (winnerId != null) {
            return BracketMatchState.DECIDED;
        }
        if (slotA.isPlayer() && slotB.isPlayer()) {
            return BracketMatchState.READY;
        }
        return BracketMatchState.PENDING;
    }

    /**
     * True when the node was decided by a bye rather than a recorded result.
     */
    public boolean isByeResolved() {
        return winnerId != null && matchId == null;
    }

    public boolean hasOccupant(UUID playerId) {
        return playerId != null
                && (playerId.equals(slotA.playerId()) || playerId.equals(slotB.playerId()));
    }

    public UUID loserId() {
        if (winnerId == null || isByeResolved()) {
            return null;
        }
        return winnerId.equals(slotA.playerId()) ? slotB.playerId() : slotA.playerId();
    }

    public BracketMatch copy() {
        BracketMatch copy = new BracketMatch(round, position);
        copy.setSlotA(slotA);
        copy.setSlotB(slotB);
        copy.setMatchId(matchId);
        copy.setWinnerId(winnerId);
        return copy;
    }
}
