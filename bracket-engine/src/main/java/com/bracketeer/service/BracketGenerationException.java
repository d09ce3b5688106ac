package com.bracketeer.service;

import lombok.Getter;

/**
 * A generator failed after its validation passed.
 */
@Getter
public class BracketGenerationException extends RuntimeException {

    private final String format;
    private final Long tournamentId;
    private final Long stageId;

    public BracketGenerationException(String format, Long tournamentId, Long stageId, Throwable cause) {
        super("Failed to generate "
                + format
                + " bracket for tournament "
                + tournamentId
                + ", stage "
                + stageId
                + ": "
                + cause.getMessage(), cause);
        this.format = format;
        this.tournamentId = tournamentId;
        this.stageId = stageId;
    }
}
