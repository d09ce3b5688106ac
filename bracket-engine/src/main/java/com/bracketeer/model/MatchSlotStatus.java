package com.bracketeer.model;

public enum MatchSlotStatus {
    RESOLVED,
    UNRESOLVED,
    BYE
}
