package com.bracketeer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A generated match. {@code id} stays null until the caller persists the record.
 */
public record MatchRecord(
        Long id,
        Long tournamentId,
        Long stageId,
        int roundNumber,
        int matchNumber,
        BracketSegment segment,
        MatchSlot teamA,
        MatchSlot teamB,
        MatchState state,
        Map<String, Object> metadata
) {

    public MatchRecord {
        Objects.requireNonNull(segment, "segment is required");
        Objects.requireNonNull(teamA, "teamA slot is required");
        Objects.requireNonNull(teamB, "teamB slot is required");
        Objects.requireNonNull(state, "state is required");
        if (roundNumber < 1) {
            throw new IllegalArgumentException("roundNumber must be at least 1");
        }
        if (matchNumber < 1) {
            throw new IllegalArgumentException("matchNumber must be at least 1");
        }
        if (teamA.isBye() && teamB.isBye()) {
            throw new IllegalArgumentException("A match cannot pair two byes");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Long teamAId() {
        return teamA.participantId();
    }

    public Long teamBId() {
        return teamB.participantId();
    }

    public String teamAName() {
        return teamA.displayName();
    }

    public String teamBName() {
        return teamB.displayName();
    }

    public String stageType() {
        return segment.wireValue();
    }

    public boolean hasBye() {
        return teamA.isBye() || teamB.isBye();
    }
}
