package com.example.shifthybrid.engine;

/**
 * Per-run choice of seeding strategy. {@code confidence} is null when the predictor was unavailable.
 */
public record HybridDecision(ConfidenceBand band, GenerationMethod method, Double confidence, String reason) {

    public boolean usesPrediction() {
        return method != GenerationMethod.RULE_ONLY;
    }

    public boolean tierOneOnly() {
        return method == GenerationMethod.PREDICTOR_DIRECT;
    }
}
