package com.spinrank.tournament.model;

import java.util.List;
import java.util.UUID;

/**
 * @param groupCount     number of preliminary round-robin groups
 * @param finalSize      number of players advancing to the final stage
 * @param autoQualified  players seeded straight into the final without playing a group
 */
public record PreliminarySettings(
        int groupCount,
        int finalSize,
        List<UUID> autoQualified
) {
}
