package com.bracketeer.service;

import lombok.Getter;

import java.util.List;

/**
 * The stage cannot be generated as configured: participant count out of bounds, a missing or
 * invalid stage setting, or a malformed participant list.
 */
@Getter
public class BracketConfigurationException extends RuntimeException {

    private final String format;
    private final List<String> errors;

    public BracketConfigurationException(String format, List<String> errors) {
        super("Invalid " + format + " bracket configuration: " + String.join("; ", errors));
        this.format = format;
        this.errors = List.copyOf(errors);
    }
}
