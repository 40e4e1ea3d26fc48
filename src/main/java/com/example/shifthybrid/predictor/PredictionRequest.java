package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.DateRange;
import com.example.shifthybrid.staff.Staff;

import java.util.List;

public record PredictionRequest(List<Staff> roster, DateRange dateRange, PredictorFeatures features) {

    public PredictionRequest {
        roster = roster == null ? List.of() : List.copyOf(roster);
        features = features == null ? PredictorFeatures.empty() : features;
    }
}
