package com.bracketeer.model;

import java.util.Objects;

/**
 * Two participants meeting in a Swiss round. A null {@code second} means {@code first} receives the bye.
 */
public record SwissPairing(Participant first, Participant second) {

    public SwissPairing {
        Objects.requireNonNull(first, "first participant is required");
        if (second != null && first.id().equals(second.id())) {
            throw new IllegalArgumentException("A participant cannot be paired with itself: " + first.id());
        }
    }

    public static SwissPairing bye(Participant participant) {
        return new SwissPairing(participant, null);
    }

    public boolean isBye() {
        return second == null;
    }
}
