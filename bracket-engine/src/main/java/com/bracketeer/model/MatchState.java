package com.bracketeer.model;

public enum MatchState {
    PENDING("pending");

    private final String wireValue;

    MatchState(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
