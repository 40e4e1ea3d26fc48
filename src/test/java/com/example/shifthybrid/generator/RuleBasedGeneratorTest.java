package com.example.shifthybrid.generator;

import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.CoverageRule;
import com.example.shifthybrid.constraint.DailyLimit;
import com.example.shifthybrid.constraint.PriorityRule;
import com.example.shifthybrid.constraint.PriorityRuleType;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.StaffGroupRule;
import com.example.shifthybrid.engine.ConfidenceBand;
import com.example.shifthybrid.engine.GenerationMethod;
import com.example.shifthybrid.engine.HybridDecision;
import com.example.shifthybrid.schedule.CancellationToken;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.support.TestRosters;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.shifthybrid.support.TestRosters.START;
import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedGeneratorTest {

    private static final HybridDecision RULE_ONLY =
            new HybridDecision(ConfidenceBand.UNAVAILABLE, GenerationMethod.RULE_ONLY, null, "no predictor");

    private final RuleBasedGenerator generator = new RuleBasedGenerator(EngineSettings.defaults());

    @Test
    void generate_dailyOffCap_neverExceededAfterCrowdedSeed() {
        DailyLimit cap = DailyLimit.max("daily-off", ShiftValue.OFF, 2);
        GenerationContext context = context(5, List.of(cap));
        for (int i = 1; i <= 4; i++) {
            context.schedule().assign("s" + i, START, ShiftValue.OFF);
        }

        FixedPointRunner.Result result = generator.generate(context, RULE_ONLY, CancellationToken.none());

        Schedule schedule = context.schedule();
        for (LocalDate date : schedule.dates()) {
            assertThat(schedule.countOn(date, ShiftValue.OFF)).as("offs on %s", date).isLessThanOrEqualTo(2);
        }
        assertThat(cap.evaluate(schedule, context.roster())).isEmpty();
        assertThat(result.reports()).isNotEmpty();
        assertThat(schedule.count("s5", ShiftValue.OFF)).isPositive();
    }

    @Test
    void generate_memberOff_backupCoversOverItsPreference() {
        StaffGroupRule group = new StaffGroupRule("front-cover", null, null, null, "front", List.of("s1", "s2"),
                null, new CoverageRule("s3", ShiftValue.LATE), null);
        PriorityRule backupPrefersEarly = PriorityRule.of("s3-early", PriorityRuleType.PREFERRED_SHIFT, "s3",
                List.of(), List.of(ShiftValue.EARLY));
        GenerationContext context = context(3, List.of(group, backupPrefersEarly));
        LocalDate memberOff = START.plusDays(2);
        context.schedule().assign("s1", memberOff, ShiftValue.OFF);

        FixedPointRunner.Result result = generator.generate(context, RULE_ONLY, CancellationToken.none());

        assertThat(context.schedule().valueAt("s1", memberOff)).isEqualTo(ShiftValue.OFF);
        assertThat(context.schedule().valueAt("s3", memberOff)).isEqualTo(ShiftValue.LATE);
        assertThat(context.schedule().valueAt("s3", START)).isEqualTo(ShiftValue.EARLY);
        assertThat(group.evaluate(context.schedule(), context.roster())).isEmpty();
        assertThat(result.converged()).isTrue();
    }

    @Test
    void generate_predictorDirect_skipsRuleStages() {
        GenerationContext context = context(2, List.of(DailyLimit.max("daily-off", ShiftValue.OFF, 0)));
        context.schedule().assign("s1", START, ShiftValue.OFF);
        HybridDecision direct = new HybridDecision(ConfidenceBand.HIGH, GenerationMethod.PREDICTOR_DIRECT, 0.9, null);

        FixedPointRunner.Result result = generator.generate(context, direct, CancellationToken.none());

        assertThat(result.reports()).isEmpty();
        assertThat(context.schedule().valueAt("s1", START)).isEqualTo(ShiftValue.OFF);
        assertThat(generator.stages()).extracting(GenerationStage::name).containsExactly(
                "staff-groups", "priority-rules", "limits", "priority-reapply", "off-day-fairness", "priority-final");
    }

    @Test
    void generate_sameSeed_sameGrid() {
        List<Constraint> constraints = List.of(
                DailyLimit.max("daily-off", ShiftValue.OFF, 2),
                new PriorityRule("exc", null, null, null, PriorityRuleType.AVOID_SHIFT_WITH_EXCEPTIONS,
                        List.of("s1", "s2"), List.of(), List.of(ShiftValue.NORMAL),
                        List.of(ShiftValue.EARLY, ShiftValue.LATE)));
        GenerationContext first = context(4, constraints);
        GenerationContext second = context(4, constraints);

        generator.generate(first, RULE_ONLY, CancellationToken.none());
        generator.generate(second, RULE_ONLY, CancellationToken.none());

        assertThat(first.schedule().snapshot()).isEqualTo(second.schedule().snapshot());
        assertThat(first.claim(DateCell.of("s1", START)))
                .isEqualTo(ConstraintKind.AVOID_SHIFT_WITH_EXCEPTIONS);
    }

    private static GenerationContext context(int staff, List<Constraint> constraints) {
        RosterContext roster = TestRosters.context(TestRosters.staff(staff), TestRosters.week(), constraints);
        return new GenerationContext(TestRosters.schedule(roster), roster, 42L, 2);
    }
}
