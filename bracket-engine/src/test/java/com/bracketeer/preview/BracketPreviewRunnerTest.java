package com.bracketeer.preview;

import com.bracketeer.config.BracketPreviewProperties;
import com.bracketeer.config.BracketeerEngineProperties;
import com.bracketeer.generator.DoubleEliminationGenerator;
import com.bracketeer.generator.RoundRobinGenerator;
import com.bracketeer.generator.SingleEliminationGenerator;
import com.bracketeer.generator.SwissPairingPlanner;
import com.bracketeer.generator.SwissSystemGenerator;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.service.BracketConfigurationException;
import com.bracketeer.service.BracketEngineService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BracketPreviewRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private BracketPreviewProperties previewProperties;
    private BracketPreviewRunner runner;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        BracketeerEngineProperties engineProperties = new BracketeerEngineProperties();
        BracketEngineService engine = new BracketEngineService(List.of(
                new SingleEliminationGenerator(engineProperties),
                new DoubleEliminationGenerator(engineProperties),
                new RoundRobinGenerator(engineProperties),
                new SwissSystemGenerator(engineProperties, new SwissPairingPlanner())
        ));
        previewProperties = new BracketPreviewProperties();
        runner = new BracketPreviewRunner(engine, previewProperties, objectMapper);
    }

    @Test
    void renderPreview_appliesManualSeedsBeforeGenerating() throws Exception {
        String rendered = runner.renderPreview(fixture("/preview/swiss-request.json"));

        JsonNode matches = objectMapper.readTree(rendered);
        assertEquals(3, matches.size());
        assertEquals("Ember", matches.get(0).get("team_a_name").asText());
        assertEquals("Blaze", matches.get(0).get("team_b_name").asText());
        assertEquals("Drift", matches.get(1).get("team_a_name").asText());
        assertEquals("Aurora", matches.get(1).get("team_b_name").asText());

        JsonNode bye = matches.get(2);
        assertEquals(13L, bye.get("team_a_id").asLong());
        assertTrue(bye.get("team_b_id").isNull());
        assertEquals("BYE", bye.get("team_b_name").asText());
        assertEquals(77L, bye.get("tournament_id").asLong());
        assertEquals(78L, bye.get("stage_id").asLong());
        assertEquals(4, bye.get("metadata").get("rounds_count").asInt());
        assertTrue(rendered.contains(System.lineSeparator()));
    }

    @Test
    void renderPreview_compactWhenPrettyPrintingIsOff() throws Exception {
        previewProperties.setPretty(false);

        String rendered = runner.renderPreview(fixture("/preview/swiss-request.json"));

        assertFalse(rendered.contains("\n"));
        assertTrue(rendered.startsWith("[{"));
    }

    @Test
    void renderPreview_missingFileIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.renderPreview(tempDir.resolve("missing.json")));
    }

    @Test
    void run_writesMatchesToConfiguredOutput() throws Exception {
        Path output = tempDir.resolve("matches.json");
        previewProperties.setInput(fixture("/preview/swiss-request.json").toString());
        previewProperties.setOutput(output.toString());

        runner.run(new DefaultApplicationArguments());

        assertTrue(Files.exists(output));
        assertEquals(3, objectMapper.readTree(output.toFile()).size());
    }

    @Test
    void generate_randomSeedingIsReproducible() {
        BracketPreviewRequest request = request("round_robin", "random", 2024L);

        List<MatchRecord> first = runner.generate(request);
        List<MatchRecord> second = runner.generate(request);

        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    void generate_surfacesEngineValidationErrors() {
        BracketPreviewRequest request = request("double_elim", null, null);

        assertThrows(BracketConfigurationException.class, () -> runner.generate(request));
    }

    @Test
    void generate_requiresTournamentAndStage() {
        BracketPreviewRequest request = new BracketPreviewRequest(null, null, List.of(), null, null, null);

        assertThrows(IllegalArgumentException.class, () -> runner.generate(request));
    }

    @Test
    void runnerBeanOnlyExistsWhenInputIsSet() {
        ApplicationContextRunner contextRunner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        ConfigurationPropertiesAutoConfiguration.class,
                        JacksonAutoConfiguration.class
                ))
                .withUserConfiguration(
                        BracketeerEngineProperties.class,
                        BracketPreviewProperties.class,
                        SingleEliminationGenerator.class,
                        BracketEngineService.class,
                        BracketPreviewRunner.class
                );

        contextRunner.run(context -> assertTrue(context.getBeansOfType(BracketPreviewRunner.class).isEmpty()));
        contextRunner
                .withPropertyValues("bracketeer.preview.input=request.json")
                .run(context -> assertEquals(1, context.getBeansOfType(BracketPreviewRunner.class).size()));
    }

    private static BracketPreviewRequest request(String stageType, String seedingMethod, Long randomSeed) {
        return new BracketPreviewRequest(
                new BracketPreviewRequest.Tournament(5L, "Scrim Night", "valorant", "groups", 5, 8, "open", null, null),
                new BracketPreviewRequest.Stage(6L, "Groups", stageType, 1, Map.of(), null),
                List.of(
                        new BracketPreviewRequest.Team(1L, "Falcons"),
                        new BracketPreviewRequest.Team(2L, "Herons"),
                        new BracketPreviewRequest.Team(3L, "Kites")
                ),
                seedingMethod,
                randomSeed,
                null
        );
    }

    private Path fixture(String resource) throws Exception {
        return Path.of(getClass().getResource(resource).toURI());
    }
}
