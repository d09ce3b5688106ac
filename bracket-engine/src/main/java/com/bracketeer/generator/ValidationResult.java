package com.bracketeer.generator;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? OK : new ValidationResult(false, errors);
    }
}
