package com.bracketeer.model;

public record SwissConfig(int roundsCount) {
}
