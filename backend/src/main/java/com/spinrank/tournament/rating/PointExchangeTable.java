package com.spinrank.tournament.rating;

import java.util.List;

/**
 * Banded lookup from absolute rating difference to exchanged points.
 * Differences beyond the last band use the last band.
 */
public final class PointExchangeTable {

    private static final PointExchangeTable STANDARD = new PointExchangeTable(List.of(
            new PointExchangeRule(0, 12, 8, 8),
            new PointExchangeRule(13, 37, 7, 10),
            new PointExchangeRule(38, 62, 6, 13),
            new PointExchangeRule(63, 87, 5, 16),
            new PointExchangeRule(88, 112, 4, 20),
            new PointExchangeRule(113, 137, 3, 25),
            new PointExchangeRule(138, 162, 2, 30),
            new PointExchangeRule(163, 187, 2, 35),
            new PointExchangeRule(188, 212, 1, 40),
            new PointExchangeRule(213, 237, 1, 45),
            new PointExchangeRule(238, 262, 0, 50),
            new PointExchangeRule(263, 287, 0, 55),
            new PointExchangeRule(288, 312, 0, 60),
            new PointExchangeRule(313, 337, 0, 65),
            new PointExchangeRule(338, 362, 0, 70),
            new PointExchangeRule(363, 387, 0, 75),
            new PointExchangeRule(388, 412, 0, 80),
            new PointExchangeRule(413, 437, 0, 85),
            new PointExchangeRule(438, 462, 0, 90),
            new PointExchangeRule(463, 487, 0, 95),
            new PointExchangeRule(488, Integer.MAX_VALUE, 0, 100)
    ));

    private final List<PointExchangeRule> rules;

    public PointExchangeTable(List<PointExchangeRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Point exchange table needs at least one band");
        }
        if (rules.get(0).minDifference() != 0) {
            throw new IllegalArgumentException("First band must start at 0");
        }
        for (int i = 1; i < rules.size(); i++) {
            if (rules.get(i).minDifference() != rules.get(i - 1).maxDifference() + 1) {
                throw new IllegalArgumentException("Bands must be contiguous at index " + i);
            }
        }
        this.rules = List.copyOf(rules);
    }

    public static PointExchangeTable standard() {
        return STANDARD;
    }

    public PointExchangeRule ruleFor(int absoluteDifference) {
        if (absoluteDifference < 0) {
            throw new IllegalArgumentException("Rating difference must be absolute: " + absoluteDifference);
        }
        for (PointExchangeRule rule : rules) {
            if (rule.covers(absoluteDifference)) {
                return rule;
            }
        }
        return rules.get(rules.size() - 1);
    }

    public List<PointExchangeRule> rules() {
        return rules;
    }
}
