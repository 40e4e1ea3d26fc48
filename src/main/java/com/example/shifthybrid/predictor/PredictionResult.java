package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.DateCell;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Predictor output, or the reason there is none.
 */
public record PredictionResult(Map<DateCell, ShiftDistribution> perCell, Double confidence,
                               boolean available, String reason) {

    public PredictionResult {
        perCell = perCell == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(perCell));
    }

    public static PredictionResult of(Map<DateCell, ShiftDistribution> perCell, double confidence) {
        return new PredictionResult(perCell, confidence, true, null);
    }

    public static PredictionResult unavailable(String reason) {
        return new PredictionResult(Map.of(), null, false, reason);
    }
}
