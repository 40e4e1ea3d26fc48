package com.example.shifthybrid.engine;

import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.predictor.PredictionResult;
import com.example.shifthybrid.predictor.ShiftDistribution;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Maps the run confidence to a band and seeds the schedule accordingly. Banding is per
 * run, never per cell.
 */
@Component
public class HybridDecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(HybridDecisionEngine.class);

    private final EngineSettings settings;

    public HybridDecisionEngine(EngineSettings settings) {
        this.settings = settings;
    }

    public HybridDecision decide(PredictionResult prediction) {
        if (prediction == null || !prediction.available() || prediction.confidence() == null) {
            String reason = prediction == null ? "no prediction" : prediction.reason();
            return new HybridDecision(ConfidenceBand.UNAVAILABLE, GenerationMethod.RULE_ONLY, null, reason);
        }
        double confidence = prediction.confidence();
        HybridDecision decision;
        if (confidence >= settings.getHighConfidenceThreshold()) {
            decision = new HybridDecision(ConfidenceBand.HIGH, GenerationMethod.PREDICTOR_DIRECT, confidence, null);
        } else if (confidence >= settings.getMediumConfidenceThreshold()) {
            decision = new HybridDecision(ConfidenceBand.MEDIUM, GenerationMethod.HYBRID, confidence, null);
        } else {
            decision = new HybridDecision(ConfidenceBand.LOW, GenerationMethod.RULE_ONLY, confidence,
                    "confidence below " + settings.getMediumConfidenceThreshold());
        }
        logger.debug("Confidence {} -> band {} ({})", confidence, decision.band(), decision.method());
        return decision;
    }

    /**
     * Writes the predicted value into every unlocked cell the prediction covers. Cells it
     * does not cover keep {@link ShiftValue#NORMAL}. Does nothing for rule-only runs.
     *
     * @return number of cells changed
     */
    public int seed(HybridDecision decision, PredictionResult prediction, Schedule schedule, RosterContext roster) {
        if (!decision.usesPrediction()) {
            return 0;
        }
        int changed = 0;
        for (String staffId : schedule.staffIds()) {
            Staff staff = roster.staff(staffId);
            for (LocalDate date : schedule.dates()) {
                DateCell cell = DateCell.of(staffId, date);
                ShiftDistribution distribution = prediction.perCell().get(cell);
                if (distribution == null || schedule.isLocked(cell)) {
                    continue;
                }
                if (schedule.assign(cell, bestEligible(distribution, staff))) {
                    changed++;
                }
            }
        }
        return changed;
    }

    /** Argmax restricted to values the staff member may work. */
    static ShiftValue bestEligible(ShiftDistribution distribution, Staff staff) {
        ShiftValue best = ShiftValue.NORMAL;
        double bestProbability = 0;
        for (ShiftValue value : ShiftValue.values()) {
            double p = distribution.probability(value);
            if (staff.mayWork(value) && p > bestProbability) {
                best = value;
                bestProbability = p;
            }
        }
        return best;
    }
}
