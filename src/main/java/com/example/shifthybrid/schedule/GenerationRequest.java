package com.example.shifthybrid.schedule;

import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.predictor.PredictorFeatures;
import com.example.shifthybrid.staff.Staff;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Input of one generation run. Optional parts fall back to: no constraints, no
 * mandates, no predictor features, the configured seed and predictor timeout.
 */
public record GenerationRequest(
        @NotEmpty List<@Valid Staff> roster,
        @NotNull @Valid DateRange dateRange,
        List<Constraint> constraints,
        CalendarMandates calendarMandates,
        PredictorFeatures predictorFeatures,
        Long rngSeed,
        String snapshotVersion,
        Long predictorTimeoutMillis
) {
    public GenerationRequest {
        constraints = constraints == null ? List.of() : constraints;
        calendarMandates = calendarMandates == null ? CalendarMandates.none() : calendarMandates;
    }

    public static GenerationRequest of(List<Staff> roster, DateRange dateRange, List<Constraint> constraints,
                                       CalendarMandates mandates, Long rngSeed) {
        return new GenerationRequest(roster, dateRange, constraints, mandates, null, rngSeed, null, null);
    }
}
