package com.example.shifthybrid.validation;

import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.PriorityRule;
import com.example.shifthybrid.constraint.PriorityRuleType;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.lock.LockedCells;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes every violation of a schedule plus its fairness metrics. Never writes to the
 * schedule.
 */
@Component
public class ScheduleValidator {

    public ValidationResult validate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = violations(schedule, context);
        return new ValidationResult(violations, metrics(schedule, context, violations));
    }

    /** All violations, sorted by tier, priority, declaration order and first cell. */
    public List<Violation> violations(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        violations.addAll(calendarViolations(schedule, context.lockedCells()));
        violations.addAll(eligibilityViolations(schedule, context));
        for (Constraint constraint : context.constraints()) {
            violations.addAll(constraint.evaluate(schedule, context));
        }
        violations.sort(Violation.PRIORITY_ORDER);
        return violations;
    }

    public long weightedScore(List<Violation> violations) {
        return violations.stream().mapToLong(Violation::weight).sum();
    }

    /** Weighted score counted per affected cell; the measure repair has to lower. */
    public long weightedMass(List<Violation> violations) {
        return violations.stream().mapToLong(Violation::mass).sum();
    }

    private List<Violation> calendarViolations(ScheduleView schedule, LockedCells lockedCells) {
        List<Violation> violations = new ArrayList<>();
        for (Map.Entry<DateCell, ShiftValue> locked : lockedCells.asMap().entrySet()) {
            ShiftValue actual = schedule.valueAt(locked.getKey());
            if (actual != locked.getValue()) {
                violations.add(Violation.builtIn(lockedCells.reason(locked.getKey()), List.of(locked.getKey()),
                        String.format("%s must be %s but is %s", locked.getKey(), locked.getValue(), actual)));
            }
        }
        return violations;
    }

    private List<Violation> eligibilityViolations(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        for (String staffId : schedule.staffIds()) {
            Staff staff = context.staff(staffId);
            for (LocalDate date : schedule.dates()) {
                ShiftValue value = schedule.valueAt(staffId, date);
                if (staff != null && !staff.mayWork(value)) {
                    violations.add(Violation.builtIn(ConstraintKind.SHIFT_ELIGIBILITY,
                            List.of(DateCell.of(staffId, date)),
                            String.format("%s may not work %s (on %s)", staffId, value, date)));
                }
            }
        }
        return violations;
    }

    FairnessMetrics metrics(ScheduleView schedule, RosterContext context, List<Violation> violations) {
        Map<String, Integer> offDays = new LinkedHashMap<>();
        for (String staffId : schedule.staffIds()) {
            int count = 0;
            for (LocalDate date : schedule.dates()) {
                if (schedule.valueAt(staffId, date) == ShiftValue.OFF) {
                    count++;
                }
            }
            offDays.put(staffId, count);
        }
        double mean = offDays.values().stream().mapToInt(Integer::intValue).average().orElse(0);
        double variance = offDays.values().stream()
                .mapToDouble(c -> (c - mean) * (c - mean))
                .average()
                .orElse(0);

        int[] perTier = new int[4];
        for (Violation violation : violations) {
            perTier[Math.max(1, Math.min(3, violation.tier()))]++;
        }
        return new FairnessMetrics(offDays, variance, honorRate(schedule, context), weightedScore(violations),
                perTier[1], perTier[2], perTier[3]);
    }

    private double honorRate(ScheduleView schedule, RosterContext context) {
        int applicable = 0;
        int honored = 0;
        for (PriorityRule rule : context.snapshot().ofType(PriorityRule.class)) {
            if (rule.ruleType() != PriorityRuleType.PREFERRED_SHIFT) {
                continue;
            }
            for (String staffId : rule.staffIds()) {
                if (!context.hasStaff(staffId)) {
                    continue;
                }
                for (LocalDate date : context.dates()) {
                    if (!rule.appliesTo(staffId, date) || context.isLocked(staffId, date)) {
                        continue;
                    }
                    applicable++;
                    if (rule.satisfiedBy(schedule.valueAt(staffId, date))) {
                        honored++;
                    }
                }
            }
        }
        return applicable == 0 ? 1.0 : (double) honored / applicable;
    }
}
