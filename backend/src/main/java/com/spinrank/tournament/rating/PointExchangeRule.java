package com.spinrank.tournament.rating;

/**
 * One band of the point-exchange table, inclusive on both ends.
 */
public record PointExchangeRule(
        int minDifference,
        int maxDifference,
        int expectedPoints,
        int upsetPoints
) {

    public boolean covers(int absoluteDifference) {
        return absoluteDifference >= minDifference && absoluteDifference <= maxDifference;
    }

    public int pointsFor(boolean upset) {
        return upset ? upsetPoints : expectedPoints;
    }
}
