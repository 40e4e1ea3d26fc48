package com.example.shifthybrid.validation;

import com.example.shifthybrid.constraint.Violation;

import java.util.List;

public record ValidationResult(List<Violation> violations, FairnessMetrics metrics) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public List<Violation> tierOne() {
        return violations.stream().filter(Violation::mandatory).toList();
    }

    public boolean clean() {
        return violations.isEmpty();
    }
}
