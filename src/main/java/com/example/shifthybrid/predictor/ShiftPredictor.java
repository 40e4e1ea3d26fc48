package com.example.shifthybrid.predictor;

/**
 * External model proposing a value distribution per cell. Implementations may be slow
 * or fail; callers go through {@link PredictorAdapter}.
 */
public interface ShiftPredictor {

    PredictionResult predict(PredictionRequest request);
}
