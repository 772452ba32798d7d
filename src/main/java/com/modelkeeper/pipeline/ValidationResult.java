package com.modelkeeper.pipeline;

import java.util.List;

public record ValidationResult(List<String> violations) {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationResult failed(String violation) {
        return new ValidationResult(List.of(violation));
    }

    public boolean passed() {
        return violations.isEmpty();
    }
}
