package com.bracketeer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Participant bounds and default toggles for the built-in bracket formats.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bracketeer.engine")
public class BracketeerEngineProperties {

    private SingleElimination singleElimination = new SingleElimination();
    private DoubleElimination doubleElimination = new DoubleElimination();
    private RoundRobin roundRobin = new RoundRobin();
    private Swiss swiss = new Swiss();

    @Getter
    @Setter
    public static class SingleElimination {
        private int minParticipants = 2;
        private int maxParticipants = 256;

        /**
         * Used when the stage config does not set third_place_match.
         */
        private boolean thirdPlaceMatch = false;
    }

    @Getter
    @Setter
    public static class DoubleElimination {
        private int minParticipants = 4;
        private int maxParticipants = 128;

        /**
         * Used when the stage config does not set grand_finals_reset.
         */
        private boolean grandFinalsReset = true;
    }

    @Getter
    @Setter
    public static class RoundRobin {
        private int minParticipants = 3;
        private int maxParticipants = 20;
    }

    @Getter
    @Setter
    public static class Swiss {
        private int minParticipants = 4;
        private int maxParticipants = 64;
        private int minRounds = 1;
        private int maxRounds = 10;
    }
}
