package com.spinrank.tournament.bracket;

import com.spinrank.tournament.model.Bracket;
import com.spinrank.tournament.model.BracketMatch;
import com.spinrank.tournament.model.BracketMatchState;
import com.spinrank.tournament.model.BracketSlot;
import com.spinrank.tournament.model.MatchRecord;
import com.spinrank.tournament.model.Tournament;
import com.spinrank.tournament.web.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Advancement rules for an elimination bracket.
 *
 * Node states are derived from occupants and winner: PENDING until both occupants are known,
 * READY until a result is recorded, then DECIDED. The winner of {@code (r, p)} feeds
 * {@code (r + 1, p / 2)}, slot A for even positions and slot B for odd ones.
 */
@Component
public class BracketStateMachine {

    private static final Logger log = LoggerFactory.getLogger(BracketStateMachine.class);

    public BracketMatch requireReady(Bracket bracket, int round, int position) {
        BracketMatch node = bracket.node(round, position);
        switch (node.getState()) {
            case READY -> {
                return node;
            }
            case DECIDED -> throw TournamentEngineException.invalidState(node.isByeResolved()
                    ? describe(node) + " is a bye and takes no result"
                    : describe(node) + " is already decided; edit the result instead");
            default -> throw TournamentEngineException.invalidState(
                    describe(node) + " is still waiting for an upstream result");
        }
    }

    public BracketMatch requireRecorded(Bracket bracket, int round, int position) {
        BracketMatch node = bracket.node(round, position);
        if (node.isByeResolved()) {
            throw TournamentEngineException.invalidState(describe(node) + " is a bye and has no result");
        }
        if (node.getMatchId() == null) {
            throw TournamentEngineException.invalidState(describe(node) + " has no recorded result");
        }
        return node;
    }

    public void decide(Bracket bracket, BracketMatch node, UUID winnerId, UUID matchId) {
        if (!node.hasOccupant(winnerId)) {
            throw new IllegalArgumentException("Winner " + winnerId + " does not occupy " + describe(node));
        }
        node.setWinnerId(winnerId);
        node.setMatchId(matchId);
        advance(bracket, node);
    }

    /**
     * Copies a decided node's winner into the slot it feeds in the next round.
     */
    public void advance(Bracket bracket, BracketMatch node) {
        if (node.getWinnerId() == null || node.getRound() == bracket.getTotalRounds()) {
            return;
        }
        BracketMatch next = bracket.node(node.getRound() + 1, node.getPosition() / 2);
        if (feedsSlotA(node)) {
            next.setSlotA(BracketSlot.player(node.getWinnerId()));
        } else {
            next.setSlotB(BracketSlot.player(node.getWinnerId()));
        }
    }

    /**
     * Resets every node that derived its occupants from {@code node}'s winner, recursively.
     * Returns snapshots of the downstream nodes whose results were discarded, nearest first.
     */
    public List<BracketMatch> invalidateDownstream(Bracket bracket, BracketMatch node) {
        List<BracketMatch> cleared = new ArrayList<>();
        invalidateFrom(bracket, node, cleared);
        return cleared;
    }

    /**
     * Removes the node's own result together with the downstream cascade. The node goes back to READY.
     */
    public List<BracketMatch> clearDecision(Bracket bracket, BracketMatch node) {
        List<BracketMatch> cleared = invalidateDownstream(bracket, node);
        node.setWinnerId(null);
        node.setMatchId(null);
        return cleared;
    }

    /**
     * Rebuilds derived node state from the round-1 skeleton and the flat result list.
     * Returns results that no longer fit the structure.
     */
    public List<MatchRecord> rebuild(Bracket bracket, List<MatchRecord> records) {
        for (BracketMatch node : bracket.getNodes()) {
            if (node.getRound() > 1) {
                node.setSlotA(BracketSlot.undetermined());
                node.setSlotB(BracketSlot.undetermined());
                node.setWinnerId(null);
                node.setMatchId(null);
            } else if (!node.isByeResolved()) {
                node.setWinnerId(null);
                node.setMatchId(null);
            }
        }
        for (BracketMatch node : bracket.round(1)) {
            advance(bracket, node);
        }

        List<MatchRecord> ordered = new ArrayList<>(records);
        ordered.sort(Tournament.ROUND_THEN_POSITION);
        List<MatchRecord> orphans = new ArrayList<>();
        for (MatchRecord record : ordered) {
            if (!bracket.contains(record.round(), record.position())) {
                orphans.add(record);
                continue;
            }
            BracketMatch node = bracket.node(record.round(), record.position());
            boolean fits = node.getState() == BracketMatchState.READY
                    && record.participantA().equals(node.getSlotA().playerId())
                    && record.participantB().equals(node.getSlotB().playerId());
            if (!fits) {
                log.warn("Result {} no longer fits {}", record.matchId(), describe(node));
                orphans.add(record);
                continue;
            }
            decide(bracket, node, record.winnerId(), record.matchId());
        }
        return orphans;
    }

    private void invalidateFrom(Bracket bracket, BracketMatch node, List<BracketMatch> cleared) {
        if (node.getRound() == bracket.getTotalRounds()) {
            return;
        }
        BracketMatch next = bracket.node(node.getRound() + 1, node.getPosition() / 2);
        BracketSlot fed = feedsSlotA(node) ? next.getSlotA() : next.getSlotB();
        if (!fed.isPlayer()) {
            return;
        }
        if (feedsSlotA(node)) {
            next.setSlotA(BracketSlot.undetermined());
        } else {
            next.setSlotB(BracketSlot.undetermined());
        }
        if (next.getWinnerId() != null) {
            cleared.add(next.copy());
            next.setWinnerId(null);
            next.setMatchId(null);
            invalidateFrom(bracket, next, cleared);
        }
    }

    private static boolean feedsSlotA(BracketMatch node) {
        return node.getPosition() % 2 == 0;
    }

    static String describe(BracketMatch node) {
        return "Match at round " + node.getRound() + ", position " + node.getPosition();
    }
}
