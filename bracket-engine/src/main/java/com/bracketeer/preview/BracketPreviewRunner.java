package com.bracketeer.preview;

import com.bracketeer.config.BracketPreviewProperties;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.MatchRecordJsonCodec;
import com.bracketeer.model.Participant;
import com.bracketeer.seeding.ParticipantSeeding;
import com.bracketeer.seeding.SeedingMethod;
import com.bracketeer.service.BracketEngineService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Generates a bracket from a JSON request file and prints the matches as JSON.
 * Run with {@code --bracketeer.preview.input=request.json}, optionally adding
 * {@code --bracketeer.preview.output=matches.json}.
 */
@Component
@ConditionalOnProperty(prefix = "bracketeer.preview", name = "input")
@RequiredArgsConstructor
public class BracketPreviewRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BracketPreviewRunner.class);

    private final BracketEngineService bracketEngineService;
    private final BracketPreviewProperties bracketPreviewProperties;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        Path input = Path.of(bracketPreviewProperties.getInput());
        log.info("Generating bracket preview from {}", input);
        String rendered = renderPreview(input);

        String output = bracketPreviewProperties.getOutput();
        if (output == null || output.isBlank()) {
            System.out.println(rendered);
            return;
        }
        Path outputPath = Path.of(output);
        Files.writeString(outputPath, rendered);
        log.info("Wrote bracket preview to {}", outputPath);
    }

    public String renderPreview(Path input) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Preview request file not found: " + input);
        }
        BracketPreviewRequest request = objectMapper.readValue(input.toFile(), BracketPreviewRequest.class);
        List<MatchRecord> matches = generate(request);
        ArrayNode json = MatchRecordJsonCodec.toJson(matches);
        return bracketPreviewProperties.isPretty()
                ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
                : objectMapper.writeValueAsString(json);
    }

    List<MatchRecord> generate(BracketPreviewRequest request) {
        if (request.tournament() == null || request.stage() == null) {
            throw new IllegalArgumentException("Preview request requires 'tournament' and 'stage'");
        }
        if (request.participants() == null) {
            throw new IllegalArgumentException("Preview request requires 'participants'");
        }

        List<Participant> participants = request.participants().stream()
                .map(BracketPreviewRequest.Team::toParticipant)
                .toList();
        SeedingMethod seedingMethod = SeedingMethod.fromValue(request.seedingMethod());
        Random random = request.randomSeed() == null ? new Random() : new Random(request.randomSeed());
        List<Participant> seeded = ParticipantSeeding.apply(seedingMethod, participants, random, request.manualSeeds());

        return bracketEngineService.generateBracketForStage(
                request.tournament().toDescriptor(),
                request.stage().toDescriptor(),
                seeded
        );
    }
}
