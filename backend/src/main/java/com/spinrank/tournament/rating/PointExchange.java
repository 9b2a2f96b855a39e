package com.spinrank.tournament.rating;

/**
 * Signed rating deltas for one match, {@code deltaA == -deltaB}.
 */
public record PointExchange(
        int deltaA,
        int deltaB,
        int points,
        boolean upset,
        int ratingDifference
) {

    public static PointExchange none() {
        return new PointExchange(0, 0, 0, false, 0);
    }
}
