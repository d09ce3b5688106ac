package com.bracketeer.seeding;

import java.util.Arrays;
import java.util.Locale;

public enum SeedingMethod {
    SLOT_ORDER("slot-order"),
    RANDOM("random"),
    MANUAL("manual");

    private final String wireValue;

    SeedingMethod(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static SeedingMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SLOT_ORDER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(method -> method.wireValue.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown seeding method: " + value));
    }
}
