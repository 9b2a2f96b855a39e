package com.spinrank.tournament.rating;

import org.springframework.stereotype.Component;

/**
 * Table-driven point exchange between two rated players.
 *
 * The winner gains exactly what the loser drops. Points are capped at the loser's
 * pre-match rating so the exchange stays zero-sum while no rating falls below 0.
 */
@Component
public class RatingAdjustmentEngine {

    private final PointExchangeTable table;

    public RatingAdjustmentEngine() {
        this(PointExchangeTable.standard());
    }

    public RatingAdjustmentEngine(PointExchangeTable table) {
        this.table = table;
    }

    public PointExchange pointExchange(int ratingA, int ratingB, boolean aWon) {
        if (ratingA < 0 || ratingB < 0) {
            throw new IllegalArgumentException("Ratings must be non-negative: " + ratingA + ", " + ratingB);
        }
        int diff = ratingB - ratingA;
        boolean upset = (aWon && diff > 0) || (!aWon && diff < 0);
        int points = table.ruleFor(Math.abs(diff)).pointsFor(upset);

        int loserRating = aWon ? ratingB : ratingA;
        points = Math.min(points, loserRating);

        int deltaA = aWon ? points : -points;
        return new PointExchange(deltaA, -deltaA, points, upset, diff);
    }

    /**
     * Unrated players take no part in the exchange.
     */
    public PointExchange pointExchange(Integer ratingA, Integer ratingB, boolean aWon) {
        if (ratingA == null || ratingB == null) {
            return PointExchange.none();
        }
        return pointExchange(ratingA.intValue(), ratingB.intValue(), aWon);
    }

    public PointExchangeTable getTable() {
        return table;
    }
}
