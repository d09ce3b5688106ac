package com.bracketeer.service;

import com.bracketeer.generator.BracketGenerator;
import com.bracketeer.generator.ValidationResult;
import com.bracketeer.model.MatchRecord;
import com.bracketeer.model.Participant;
import com.bracketeer.model.StageDescriptor;
import com.bracketeer.model.TournamentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves a stage's bracket format and delegates to the registered generator.
 *
 * <p>Lookups read an immutable snapshot of the registry and take no lock; registration copies
 * the snapshot under a lock and publishes the new one.
 */
@Service
public class BracketEngineService {

    private static final Logger log = LoggerFactory.getLogger(BracketEngineService.class);

    private final Object registryLock = new Object();
    private volatile Map<String, BracketGenerator> generators;

    public BracketEngineService(List<BracketGenerator> bracketGenerators) {
        Map<String, BracketGenerator> initial = new LinkedHashMap<>();
        for (BracketGenerator generator : bracketGenerators) {
            put(initial, generator.formatKey(), generator);
            for (String alias : generator.aliases()) {
                put(initial, alias, generator);
            }
        }
        this.generators = Collections.unmodifiableMap(initial);
        log.info("Bracket engine initialized with formats {}", getSupportedFormats());
    }

    /**
     * Stage type wins; the tournament's format hint is only consulted when the stage type is
     * missing or unknown.
     */
    public String determineFormat(TournamentDescriptor tournament, StageDescriptor stage) {
        Map<String, BracketGenerator> registry = generators;

        String stageType = stage == null ? null : normalizeFormat(stage.type());
        if (stageType != null && registry.containsKey(stageType)) {
            return stageType;
        }

        String formatHint = tournament == null ? null : normalizeFormat(tournament.formatHint());
        if (formatHint != null && registry.containsKey(formatHint)) {
            return formatHint;
        }

        String requested = stageType != null ? stageType : formatHint;
        throw new UnsupportedBracketFormatException(requested == null ? "<none>" : requested, getSupportedFormats());
    }

    public List<MatchRecord> generateBracketForStage(
            TournamentDescriptor tournament,
            StageDescriptor stage,
            List<Participant> participants
    ) {
        Objects.requireNonNull(tournament, "tournament is required");
        Objects.requireNonNull(stage, "stage is required");
        Objects.requireNonNull(participants, "participants are required");

        String format = determineFormat(tournament, stage);
        BracketGenerator generator = generators.get(format);

        List<String> participantErrors = checkParticipants(participants);
        if (!participantErrors.isEmpty()) {
            log.warn("Rejected {} bracket for tournament {}, stage {}: {}",
                    format, tournament.id(), stage.id(), participantErrors);
            throw new BracketConfigurationException(format, participantErrors);
        }

        ValidationResult validation = generator.validate(tournament, stage, participants.size());
        if (!validation.valid()) {
            List<String> errors = validation.errors().isEmpty()
                    ? List.of("Generator rejected the stage without a reason")
                    : validation.errors();
            log.warn("Rejected {} bracket for tournament {}, stage {}: {}",
                    format, tournament.id(), stage.id(), errors);
            throw new BracketConfigurationException(format, errors);
        }

        List<MatchRecord> matches;
        try {
            matches = generator.generate(tournament, stage, List.copyOf(participants));
        } catch (RuntimeException ex) {
            log.error("Bracket generation failed for tournament {}, stage {} (format {})",
                    tournament.id(), stage.id(), format, ex);
            throw new BracketGenerationException(format, tournament.id(), stage.id(), ex);
        }

        log.info("Generated {} bracket for tournament {}, stage {}: participants={}, matches={}",
                format, tournament.id(), stage.id(), participants.size(), matches.size());
        return List.copyOf(matches);
    }

    /**
     * Adds or replaces the generator for a format key.
     */
    public void registerGenerator(String formatKey, BracketGenerator generator) {
        Objects.requireNonNull(generator, "generator is required");
        String key = normalizeFormat(formatKey);
        if (key == null) {
            throw new IllegalArgumentException("Format key is required");
        }
        synchronized (registryLock) {
            Map<String, BracketGenerator> updated = new LinkedHashMap<>(generators);
            put(updated, key, generator);
            generators = Collections.unmodifiableMap(updated);
        }
    }

    public List<String> getSupportedFormats() {
        return generators.keySet().stream().sorted().toList();
    }

    public boolean supportsFormat(String formatKey) {
        String key = normalizeFormat(formatKey);
        return key != null && generators.containsKey(key);
    }

    /**
     * Lowercases and turns spaces and hyphens into underscores; blank input yields null.
     */
    public static String normalizeFormat(String format) {
        if (format == null || format.isBlank()) {
            return null;
        }
        return format.trim()
                .toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
    }

    private static void put(Map<String, BracketGenerator> registry, String formatKey, BracketGenerator generator) {
        String key = normalizeFormat(formatKey);
        if (key == null) {
            throw new IllegalArgumentException(
                    "Generator " + generator.getClass().getName() + " declares a blank format key"
            );
        }
        BracketGenerator previous = registry.put(key, generator);
        if (previous != null && previous != generator) {
            log.warn("Replacing bracket generator for format '{}': {} -> {}",
                    key, previous.getClass().getName(), generator.getClass().getName());
        } else if (previous == null) {
            log.debug("Registered bracket generator for format '{}': {}", key, generator.getClass().getName());
        }
    }

    private static List<String> checkParticipants(List<Participant> participants) {
        List<String> errors = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < participants.size(); i++) {
            Participant participant = participants.get(i);
            if (participant == null) {
                errors.add("Participant at seed " + (i + 1) + " is missing");
                continue;
            }
            if (!seen.add(participant.id())) {
                errors.add("Duplicate participant id: " + participant.id());
            }
        }
        return errors;
    }
}
