package com.bracketeer.model;

public enum BracketSegment {
    MAIN("main"),
    WINNERS("winners"),
    LOSERS("losers"),
    GRAND_FINALS("grand_finals"),
    GRAND_FINALS_RESET("grand_finals_reset");

    private final String wireValue;

    BracketSegment(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
