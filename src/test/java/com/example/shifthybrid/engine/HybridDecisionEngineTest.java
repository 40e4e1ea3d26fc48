package com.example.shifthybrid.engine;

import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.predictor.PredictionResult;
import com.example.shifthybrid.predictor.ShiftDistribution;
import com.example.shifthybrid.schedule.CalendarMandates;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import com.example.shifthybrid.support.TestRosters;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.shifthybrid.support.TestRosters.START;
import static org.assertj.core.api.Assertions.assertThat;

class HybridDecisionEngineTest {

    private final HybridDecisionEngine engine = new HybridDecisionEngine(EngineSettings.defaults());

    @Test
    void decide_bandsFollowThresholds() {
        assertThat(engine.decide(withConfidence(0.8)).method()).isEqualTo(GenerationMethod.PREDICTOR_DIRECT);
        assertThat(engine.decide(withConfidence(0.79)).band()).isEqualTo(ConfidenceBand.MEDIUM);
        assertThat(engine.decide(withConfidence(0.6)).method()).isEqualTo(GenerationMethod.HYBRID);
        assertThat(engine.decide(withConfidence(0.59)).band()).isEqualTo(ConfidenceBand.LOW);
        assertThat(engine.decide(withConfidence(0.59)).method()).isEqualTo(GenerationMethod.RULE_ONLY);
    }

    @Test
    void decide_unavailablePrediction_isRuleOnly() {
        HybridDecision decision = engine.decide(PredictionResult.unavailable("timeout after 10 ms"));

        assertThat(decision.band()).isEqualTo(ConfidenceBand.UNAVAILABLE);
        assertThat(decision.method()).isEqualTo(GenerationMethod.RULE_ONLY);
        assertThat(decision.confidence()).isNull();
        assertThat(decision.reason()).contains("timeout");
        assertThat(decision.usesPrediction()).isFalse();
    }

    @Test
    void seed_keepsLockedCellsAndLeavesUncoveredCellsNormal() {
        List<Staff> roster = List.of(Staff.of("s1", true), Staff.of("s2", false));
        CalendarMandates mandates = new CalendarMandates(List.of(START), List.of());
        RosterContext context = TestRosters.context(roster, TestRosters.days(3), List.of(), mandates);
        Schedule schedule = TestRosters.schedule(context);
        Map<DateCell, ShiftDistribution> cells = new LinkedHashMap<>();
        cells.put(DateCell.of("s1", START), ShiftDistribution.certain(ShiftValue.OFF));
        cells.put(DateCell.of("s1", START.plusDays(1)), ShiftDistribution.certain(ShiftValue.LATE));
        cells.put(DateCell.of("s2", START.plusDays(1)), new ShiftDistribution(
                Map.of(ShiftValue.EARLY, 0.7, ShiftValue.OFF, 0.3)));
        PredictionResult prediction = PredictionResult.of(cells, 0.7);

        int changed = engine.seed(engine.decide(prediction), prediction, schedule, context);

        assertThat(changed).isEqualTo(2);
        assertThat(schedule.valueAt("s1", START)).isEqualTo(ShiftValue.NORMAL);
        assertThat(schedule.valueAt("s1", START.plusDays(1))).isEqualTo(ShiftValue.LATE);
        assertThat(schedule.valueAt("s2", START.plusDays(1))).isEqualTo(ShiftValue.OFF);
        assertThat(schedule.valueAt("s1", START.plusDays(2))).isEqualTo(ShiftValue.NORMAL);
    }

    @Test
    void seed_ruleOnlyDecision_writesNothing() {
        RosterContext context = TestRosters.context(TestRosters.staff(2), TestRosters.days(2), List.of());
        Schedule schedule = TestRosters.schedule(context);
        PredictionResult prediction = PredictionResult.of(
                Map.of(DateCell.of("s1", START), ShiftDistribution.certain(ShiftValue.OFF)), 0.3);

        assertThat(engine.seed(engine.decide(prediction), prediction, schedule, context)).isZero();
        assertThat(schedule.valueAt("s1", START)).isEqualTo(ShiftValue.NORMAL);
    }

    private static PredictionResult withConfidence(double confidence) {
        return PredictionResult.of(Map.of(DateCell.of("s1", START), ShiftDistribution.certain(ShiftValue.LATE)),
                confidence);
    }
}
