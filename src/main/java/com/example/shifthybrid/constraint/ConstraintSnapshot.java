package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.CalendarMandates;

import java.util.List;

/**
 * Versioned, read-only configuration handed to one run. Never mutated mid-run.
 */
public record ConstraintSnapshot(String version, List<Constraint> constraints, CalendarMandates mandates) {

    public ConstraintSnapshot {
        version = version == null || version.isBlank() ? "unversioned" : version;
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        mandates = mandates == null ? CalendarMandates.none() : mandates;
    }

    public <T extends Constraint> List<T> ofType(Class<T> type) {
        return constraints.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
