package com.spinrank.tournament.model;

public record SwissSettings(
        int rounds,
        boolean pairByRating
) {
}
