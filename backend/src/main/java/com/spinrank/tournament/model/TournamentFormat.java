package com.spinrank.tournament.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TournamentFormat {
    ROUND_ROBIN(false),
    PLAYOFF(false),
    SWISS(false),
    PRELIMINARY_WITH_FINAL_ROUND_ROBIN(true),
    PRELIMINARY_WITH_FINAL_PLAYOFF(true);

    private final boolean compound;

    TournamentFormat(boolean compound) {
        this.compound = compound;
    }

    public boolean isCompound() {
        return compound;
    }

    public static Optional<TournamentFormat> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(format -> format.name().equals(normalized))
                .findFirst();
    }
}
