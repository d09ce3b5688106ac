package com.bracketeer.seeding;

import com.bracketeer.model.Participant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Orders a participant list before it is handed to a generator. The returned order is the seed order.
 */
public final class ParticipantSeeding {

    private ParticipantSeeding() {
    }

    public static List<Participant> apply(
            SeedingMethod method,
            List<Participant> participants,
            Random random,
            Map<Long, Integer> manualSeeds
    ) {
        Objects.requireNonNull(method, "seeding method is required");
        return switch (method) {
            case SLOT_ORDER -> slotOrder(participants);
            case RANDOM -> random(participants, random);
            case MANUAL -> manual(participants, manualSeeds);
        };
    }

    public static List<Participant> slotOrder(List<Participant> participants) {
        Objects.requireNonNull(participants, "participants are required");
        return List.copyOf(participants);
    }

    public static List<Participant> random(List<Participant> participants, Random random) {
        Objects.requireNonNull(participants, "participants are required");
        Objects.requireNonNull(random, "random source is required for random seeding");
        List<Participant> shuffled = new ArrayList<>(participants);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled);
    }

    /**
     * Sorts participants by an explicit seed per participant id, lowest seed first.
     */
    public static List<Participant> manual(List<Participant> participants, Map<Long, Integer> manualSeeds) {
        Objects.requireNonNull(participants, "participants are required");
        if (manualSeeds == null) {
            throw new IllegalArgumentException("Manual seeding requires a seed for every participant");
        }

        Map<Long, Integer> seedsById = new HashMap<>();
        Set<Integer> usedSeeds = new HashSet<>();
        for (Participant participant : participants) {
            Integer seed = manualSeeds.get(participant.id());
            if (seed == null) {
                throw new IllegalArgumentException(
                        "Manual seeding requires a seed for every participant. Missing for participant: "
                                + describe(participant)
                );
            }
            if (seed < 1) {
                throw new IllegalArgumentException(
                        "Manual seed must be positive for participant " + describe(participant) + " (got " + seed + ")"
                );
            }
            if (!usedSeeds.add(seed)) {
                throw new IllegalArgumentException("Duplicate manual seed: " + seed);
            }
            seedsById.put(participant.id(), seed);
        }

        List<Participant> ordered = new ArrayList<>(participants);
        ordered.sort(Comparator.comparingInt(participant -> seedsById.get(participant.id())));
        return List.copyOf(ordered);
    }

    private static String describe(Participant participant) {
        return participant.name() != null ? participant.name() : String.valueOf(participant.id());
    }
}
