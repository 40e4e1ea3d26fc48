package com.example.shifthybrid.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 生成エンジンの設定値。起動時に一度だけ読み込む
 */
@Component
public class EngineSettings {
    private final double highConfidenceThreshold;
    private final double mediumConfidenceThreshold;
    private final long predictorTimeoutMillis;
    private final int fixedPointMaxIterations;
    private final int repairMaxPasses;
    private final int weeklyRestDays;
    private final long defaultSeed;

    public EngineSettings(
            @Value("${engine.confidence.high:0.8}") double highConfidenceThreshold,
            @Value("${engine.confidence.medium:0.6}") double mediumConfidenceThreshold,
            @Value("${engine.predictor.timeout-millis:2000}") long predictorTimeoutMillis,
            @Value("${engine.generator.max-iterations:5}") int fixedPointMaxIterations,
            @Value("${engine.repair.max-passes:3}") int repairMaxPasses,
            @Value("${engine.fairness.weekly-rest-days:2}") int weeklyRestDays,
            @Value("${engine.rng.default-seed:42}") long defaultSeed) {
        if (mediumConfidenceThreshold > highConfidenceThreshold) {
            throw new IllegalArgumentException("engine.confidence.medium must not exceed engine.confidence.high");
        }
        this.highConfidenceThreshold = highConfidenceThreshold;
        this.mediumConfidenceThreshold = mediumConfidenceThreshold;
        this.predictorTimeoutMillis = predictorTimeoutMillis;
        this.fixedPointMaxIterations = Math.max(1, fixedPointMaxIterations);
        this.repairMaxPasses = Math.max(0, repairMaxPasses);
        this.weeklyRestDays = Math.max(0, weeklyRestDays);
        this.defaultSeed = defaultSeed;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(0.8, 0.6, 2000, 5, 3, 2, 42L);
    }

    public double getHighConfidenceThreshold() { return highConfidenceThreshold; }
    public double getMediumConfidenceThreshold() { return mediumConfidenceThreshold; }
    public long getPredictorTimeoutMillis() { return predictorTimeoutMillis; }
    public int getFixedPointMaxIterations() { return fixedPointMaxIterations; }
    public int getRepairMaxPasses() { return repairMaxPasses; }
    public int getWeeklyRestDays() { return weeklyRestDays; }
    public long getDefaultSeed() { return defaultSeed; }
}
