package com.bracketeer.model;

public record DoubleEliminationConfig(boolean grandFinalsReset) {
}
