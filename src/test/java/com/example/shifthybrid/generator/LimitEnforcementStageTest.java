package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.ConsecutiveWorkLimit;
import com.example.shifthybrid.constraint.DailyLimit;
import com.example.shifthybrid.constraint.MonthlyLimit;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.WeeklyLimit;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import com.example.shifthybrid.support.TestRosters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.shifthybrid.support.TestRosters.START;
import static org.assertj.core.api.Assertions.assertThat;

class LimitEnforcementStageTest {

    private final LimitEnforcementStage stage = new LimitEnforcementStage();

    @Test
    void apply_dailyOverQuota_movesOffToOtherDaysOfSameStaff() {
        DailyLimit cap = DailyLimit.max("daily-off", ShiftValue.OFF, 1);
        GenerationContext context = context(TestRosters.staff(3), List.of(cap));
        for (String id : List.of("s1", "s2", "s3")) {
            context.schedule().assign(id, START, ShiftValue.OFF);
        }

        int changed = stage.apply(context);

        assertThat(changed).isPositive();
        assertThat(cap.evaluate(context.schedule(), context.roster())).isEmpty();
        assertThat(context.schedule().countOn(START, ShiftValue.OFF)).isEqualTo(1);
        for (String id : List.of("s1", "s2", "s3")) {
            assertThat(context.schedule().count(id, ShiftValue.OFF)).as(id).isEqualTo(1);
        }
    }

    @Test
    void apply_longStreak_breaksItWithDaysOff() {
        ConsecutiveWorkLimit streak = ConsecutiveWorkLimit.of("streak", 3);
        GenerationContext context = context(TestRosters.staff(1), List.of(streak));

        stage.apply(context);

        assertThat(streak.evaluate(context.schedule(), context.roster())).isEmpty();
        assertThat(context.schedule().count("s1", ShiftValue.OFF)).isBetween(1, 2);
    }

    @Test
    void apply_weeklyMinimum_raisesMissingShift() {
        WeeklyLimit minimum = WeeklyLimit.min("weekly-off", ShiftValue.OFF, 1);
        GenerationContext context = context(TestRosters.staff(2), List.of(minimum));

        stage.apply(context);

        assertThat(minimum.evaluate(context.schedule(), context.roster())).isEmpty();
        assertThat(context.schedule().count("s1", ShiftValue.OFF)).isEqualTo(1);
    }

    @Test
    void apply_monthlyMaxOnEarly_replacesSurplusWithNormal() {
        MonthlyLimit earlyCap = MonthlyLimit.of("monthly-early", ShiftValue.EARLY, null, 2);
        GenerationContext context = context(List.of(Staff.of("s1", true)), List.of(earlyCap));
        for (int i = 0; i < 5; i++) {
            context.schedule().assign("s1", START.plusDays(i), ShiftValue.EARLY);
        }

        stage.apply(context);

        assertThat(context.schedule().count("s1", ShiftValue.EARLY)).isEqualTo(2);
        assertThat(context.schedule().count("s1", ShiftValue.NORMAL)).isEqualTo(5);
    }

    private static GenerationContext context(List<Staff> roster, List<Constraint> constraints) {
        RosterContext rosterContext = TestRosters.context(roster, TestRosters.week(), constraints);
        return new GenerationContext(TestRosters.schedule(rosterContext), rosterContext, 42L, 2);
    }
}
