package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.CalendarMandates;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import com.example.shifthybrid.support.TestRosters;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static com.example.shifthybrid.support.TestRosters.START;
import static org.assertj.core.api.Assertions.assertThat;

class ConstraintEvaluationTest {

    private final List<Staff> roster = TestRosters.staff(4);

    @Test
    void dailyLimit_overMax_reportsMatchingCells() {
        DailyLimit limit = DailyLimit.max("daily-off", ShiftValue.OFF, 1);
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(limit));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START, ShiftValue.OFF);
        schedule.assign("s2", START, ShiftValue.OFF);

        List<Violation> violations = limit.evaluate(schedule, context);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).cells())
                .containsExactly(DateCell.of("s1", START), DateCell.of("s2", START));
        assertThat(violations.get(0).tier()).isEqualTo(1);
        assertThat(violations.get(0).declarationIndex()).isZero();
    }

    @Test
    void dailyLimit_underMin_reportsOtherCells() {
        DailyLimit limit = new DailyLimit("late-cover", null, null, null, ShiftValue.LATE, 1, null, null,
                List.of(DayOfWeek.MONDAY));
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(limit));
        Schedule schedule = TestRosters.schedule(context);

        List<Violation> violations = limit.evaluate(schedule, context);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).cells()).hasSize(4).allMatch(c -> c.date().equals(START));
    }

    @Test
    void dailyLimit_mandateDate_notCounted() {
        DailyLimit limit = DailyLimit.max("daily-off", ShiftValue.OFF, 1);
        List<Staff> lateOnly = List.of(Staff.of("a", false), Staff.of("b", false));
        CalendarMandates mandates = new CalendarMandates(List.of(), List.of(START));
        RosterContext context = TestRosters.context(lateOnly, TestRosters.week(), List.of(limit), mandates);

        assertThat(limit.evaluate(TestRosters.schedule(context), context)).isEmpty();
    }

    @Test
    void weeklyLimit_checksEveryFullWindow() {
        WeeklyLimit limit = WeeklyLimit.max("weekly-off", ShiftValue.OFF, 1);
        RosterContext context = TestRosters.context(roster, TestRosters.days(8), List.of(limit));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START, ShiftValue.OFF);
        schedule.assign("s1", START.plusDays(6), ShiftValue.OFF);

        List<Violation> violations = limit.evaluate(schedule, context);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).kind()).isEqualTo(ConstraintKind.WEEKLY_LIMIT);
        assertThat(violations.get(0).tier()).isEqualTo(2);
        assertThat(violations.get(0).cells()).extracting(DateCell::staffId).containsOnly("s1");
    }

    @Test
    void weeklyLimit_horizonShorterThanWindow_hasNothingToCheck() {
        WeeklyLimit limit = WeeklyLimit.min("weekly-off", ShiftValue.OFF, 2);
        RosterContext context = TestRosters.context(roster, TestRosters.days(5), List.of(limit));

        assertThat(limit.evaluate(TestRosters.schedule(context), context)).isEmpty();
    }

    @Test
    void consecutiveLimit_longStreak_reportsWholeStreak() {
        ConsecutiveWorkLimit limit = ConsecutiveWorkLimit.of("streak", 5);
        RosterContext context = TestRosters.context(roster.subList(0, 1), TestRosters.week(), List.of(limit));
        Schedule schedule = TestRosters.schedule(context);

        List<Violation> violations = limit.evaluate(schedule, context);

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).cells()).hasSize(7);
    }

    @Test
    void consecutiveLimit_mustOffDateEndsStreakEvenWhenLockedEarly() {
        ConsecutiveWorkLimit limit = ConsecutiveWorkLimit.of("streak", 5);
        CalendarMandates mandates = new CalendarMandates(List.of(), List.of(START.plusDays(3)));
        RosterContext context = TestRosters.context(roster.subList(0, 1), TestRosters.week(), List.of(limit), mandates);
        Schedule schedule = TestRosters.schedule(context);

        assertThat(schedule.valueAt("s1", START.plusDays(3))).isEqualTo(ShiftValue.EARLY);
        assertThat(limit.evaluate(schedule, context)).isEmpty();
    }

    @Test
    void groupConflict_countsOffAndEarlyMembers() {
        StaffGroupRule group = new StaffGroupRule("g", null, null, null, "front", List.of("s1", "s2"), 1,
                null, null);
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(group));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START, ShiftValue.OFF);
        schedule.assign("s2", START, ShiftValue.EARLY);

        List<Violation> violations = group.evaluate(schedule, context);

        assertThat(violations).singleElement()
                .satisfies(v -> {
                    assertThat(v.kind()).isEqualTo(ConstraintKind.STAFF_GROUP_CONFLICT);
                    assertThat(v.cells()).hasSize(2);
                });
    }

    @Test
    void groupCoverage_memberOff_requiresBackupShift() {
        StaffGroupRule group = new StaffGroupRule("g", null, null, null, "front", List.of("s1", "s2"), null,
                new CoverageRule("s3", ShiftValue.LATE), null);
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(group));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START.plusDays(1), ShiftValue.OFF);

        List<Violation> violations = group.evaluate(schedule, context);

        assertThat(violations).singleElement()
                .satisfies(v -> {
                    assertThat(v.kind()).isEqualTo(ConstraintKind.BACKUP_COVERAGE);
                    assertThat(v.cells()).containsExactly(DateCell.of("s3", START.plusDays(1)));
                });

        schedule.assign("s3", START.plusDays(1), ShiftValue.LATE);
        assertThat(group.evaluate(schedule, context)).isEmpty();
    }

    @Test
    void groupProximity_missingPairedOff_listsNearestCandidatesFirst() {
        StaffGroupRule group = new StaffGroupRule("pair", null, null, null, "pair", List.of("s1", "s2"), null,
                null, new ProximityPattern("s1", "s2", 1));
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(group));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START.plusDays(4), ShiftValue.OFF);

        List<Violation> violations = group.evaluate(schedule, context);

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.cells()).containsExactly(
                        DateCell.of("s2", START.plusDays(4)),
                        DateCell.of("s2", START.plusDays(5)),
                        DateCell.of("s2", START.plusDays(3))));

        schedule.assign("s2", START.plusDays(5), ShiftValue.OFF);
        assertThat(group.evaluate(schedule, context)).isEmpty();
    }

    @Test
    void allScope_leavesOutBackupStaff() {
        StaffGroupRule group = new StaffGroupRule("g", null, null, null, "front", List.of("s1", "s2"), null,
                new CoverageRule("s3", ShiftValue.NORMAL), null);
        DailyLimit limit = DailyLimit.max("daily-off", ShiftValue.OFF, 1);
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(group, limit));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START, ShiftValue.OFF);
        schedule.assign("s3", START, ShiftValue.OFF);

        assertThat(context.resolveScope(LimitScope.all())).containsExactly("s1", "s2", "s4");
        assertThat(limit.evaluate(schedule, context)).isEmpty();
        assertThat(context.declarationIndex(limit)).isEqualTo(1);
    }

    @Test
    void priorityRule_reportsUnlockedMatchingDaysOnly() {
        PriorityRule rule = PriorityRule.of("pref", PriorityRuleType.PREFERRED_SHIFT, "s1",
                List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY), List.of(ShiftValue.LATE));
        CalendarMandates mandates = new CalendarMandates(List.of(START), List.of());
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(rule), mandates);
        Schedule schedule = TestRosters.schedule(context);

        List<Violation> violations = rule.evaluate(schedule, context);

        assertThat(violations).singleElement()
                .satisfies(v -> {
                    assertThat(v.kind()).isEqualTo(ConstraintKind.PREFERRED_SHIFT);
                    assertThat(v.tier()).isEqualTo(3);
                    assertThat(v.cells()).containsExactly(DateCell.of("s1", START.plusDays(1)));
                });
    }

    @Test
    void explicitTier_overridesKindDefault() {
        DailyLimit soft = new DailyLimit("soft", 3, null, 5, ShiftValue.OFF, null, 0, null, null);
        RosterContext context = TestRosters.context(roster, TestRosters.week(), List.of(soft));
        Schedule schedule = TestRosters.schedule(context);
        schedule.assign("s1", START, ShiftValue.OFF);

        Violation violation = soft.evaluate(schedule, context).get(0);

        assertThat(violation.tier()).isEqualTo(3);
        assertThat(violation.hardConstraint()).isFalse();
        assertThat(violation.severity()).isEqualTo(Severity.LOW);
        assertThat(violation.weight()).isEqualTo(5L);
    }

    @Test
    void constraint_unionIsClosedOverItsSixTypes() {
        assertThat(Constraint.class.isSealed()).isTrue();
        assertThat(Constraint.class.getPermittedSubclasses()).containsExactlyInAnyOrder(
                DailyLimit.class, WeeklyLimit.class, MonthlyLimit.class, ConsecutiveWorkLimit.class,
                StaffGroupRule.class, PriorityRule.class);
    }

    @Test
    void violation_massGrowsWithAffectedCells() {
        RosterContext context = TestRosters.context(TestRosters.staff(4), TestRosters.days(1),
                List.of(DailyLimit.max("daily-off", ShiftValue.OFF, 1)));
        Schedule schedule = TestRosters.schedule(context);
        for (String staffId : context.staffIds()) {
            schedule.assign(staffId, START, ShiftValue.OFF);
        }

        Violation violation = context.snapshot().constraints().get(0).evaluate(schedule, context).get(0);

        assertThat(violation.mass()).isEqualTo(4 * violation.weight());
        assertThat(violation.sameIssueAs(violation)).isTrue();
    }
}
