package com.example.shifthybrid.engine;

public enum GenerationMethod {
    /** Predictor output adopted, only tier-1 checks and repair. */
    PREDICTOR_DIRECT,
    /** Predictor output as seed, corrected by the full rule pipeline. */
    HYBRID,
    /** Predictor output discarded. */
    RULE_ONLY
}
