package com.bracketeer.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BracketeerEnginePropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(BracketeerEngineProperties.class, BracketPreviewProperties.class);

    @Test
    void contextStartsWithPropertyBeans() {
        contextRunner.run(context -> {
            assertTrue(context.containsBean("bracketeerEngineProperties"));
            assertTrue(context.containsBean("bracketPreviewProperties"));
        });
    }

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            BracketeerEngineProperties engine = context.getBean(BracketeerEngineProperties.class);
            BracketPreviewProperties preview = context.getBean(BracketPreviewProperties.class);

            assertEquals(2, engine.getSingleElimination().getMinParticipants());
            assertEquals(256, engine.getSingleElimination().getMaxParticipants());
            assertFalse(engine.getSingleElimination().isThirdPlaceMatch());
            assertEquals(4, engine.getDoubleElimination().getMinParticipants());
            assertEquals(128, engine.getDoubleElimination().getMaxParticipants());
            assertTrue(engine.getDoubleElimination().isGrandFinalsReset());
            assertEquals(3, engine.getRoundRobin().getMinParticipants());
            assertEquals(20, engine.getRoundRobin().getMaxParticipants());
            assertEquals(4, engine.getSwiss().getMinParticipants());
            assertEquals(64, engine.getSwiss().getMaxParticipants());
            assertEquals(1, engine.getSwiss().getMinRounds());
            assertEquals(10, engine.getSwiss().getMaxRounds());

            assertNull(preview.getInput());
            assertNull(preview.getOutput());
            assertTrue(preview.isPretty());
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "bracketeer.engine.single-elimination.third-place-match=true",
                        "bracketeer.engine.double-elimination.grand-finals-reset=false",
                        "bracketeer.engine.round-robin.max-participants=12",
                        "bracketeer.engine.swiss.max-rounds=7",
                        "bracketeer.preview.input=/tmp/request.json",
                        "bracketeer.preview.pretty=false"
                )
                .run(context -> {
                    BracketeerEngineProperties engine = context.getBean(BracketeerEngineProperties.class);
                    BracketPreviewProperties preview = context.getBean(BracketPreviewProperties.class);

                    assertTrue(engine.getSingleElimination().isThirdPlaceMatch());
                    assertFalse(engine.getDoubleElimination().isGrandFinalsReset());
                    assertEquals(12, engine.getRoundRobin().getMaxParticipants());
                    assertEquals(7, engine.getSwiss().getMaxRounds());
                    assertEquals("/tmp/request.json", preview.getInput());
                    assertFalse(preview.isPretty());
                });
    }
}
