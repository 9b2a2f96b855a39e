package com.spinrank.tournament.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Engine limits and format defaults.
 * Defaults mirror {@code application.yml}; every value can be overridden per deployment.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "spinrank")
public class SpinrankRuntimeProperties {

    private Tournament tournament = new Tournament();
    private Bracket bracket = new Bracket();
    private Swiss swiss = new Swiss();
    private Preliminary preliminary = new Preliminary();

    @Getter
    @Setter
    public static class Tournament {
        private int minParticipants = 2;
        private int maxParticipants = 200;
    }

    @Getter
    @Setter
    public static class Bracket {
        /**
         * Lower clamp for the number of entrants that display a seed number.
         */
        private int minSeeded = 2;

        /**
         * Upper clamp for the number of entrants that display a seed number.
         */
        private int maxSeeded = 32;
    }

    @Getter
    @Setter
    public static class Swiss {
        /**
         * Order players inside a score group by entry rating before entry order.
         */
        private boolean pairByRating = true;
    }

    @Getter
    @Setter
    public static class Preliminary {
        private int defaultFinalPlayoffSize = 4;
        private int defaultFinalRoundRobinSize = 6;
    }
}
