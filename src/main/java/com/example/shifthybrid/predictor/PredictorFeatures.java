package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.ShiftValue;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Opaque model input. {@code historicalPeriods} holds past schedules, each as
 * staff id to date to value; {@code attributes} is passed through untouched.
 */
public record PredictorFeatures(List<Map<String, Map<LocalDate, ShiftValue>>> historicalPeriods,
                                Map<String, Object> attributes) {

    public PredictorFeatures {
        historicalPeriods = historicalPeriods == null ? List.of() : List.copyOf(historicalPeriods);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static PredictorFeatures empty() {
        return new PredictorFeatures(List.of(), Map.of());
    }
}
