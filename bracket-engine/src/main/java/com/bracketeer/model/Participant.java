package com.bracketeer.model;

import java.util.Objects;

/**
 * A competing team. Seed is implied by the participant's position in the list handed to a generator.
 */
public record Participant(Long id, String name) {

    public Participant {
        Objects.requireNonNull(id, "participant id is required");
    }
}
