package com.bracketeer.model;

public record SingleEliminationConfig(boolean thirdPlaceMatch) {
}
