package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Individual preference or restriction for the listed staff on the listed days of week.
 * <p>
 * {@code shifts} holds the preferred, avoided or allowed shifts depending on the rule type;
 * {@code allowedShifts} holds the replacements of an avoid-with-exceptions rule. Locked
 * cells are never checked.
 */
public record PriorityRule(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        PriorityRuleType ruleType,
        List<String> staffIds,
        List<DayOfWeek> daysOfWeek,
        List<ShiftValue> shifts,
        List<ShiftValue> allowedShifts
) implements Constraint {

    private static final List<ShiftValue> AVOID_FALLBACK =
            List.of(ShiftValue.NORMAL, ShiftValue.LATE, ShiftValue.EARLY, ShiftValue.OFF);

    public PriorityRule {
        staffIds = staffIds == null ? List.of() : List.copyOf(staffIds);
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
        shifts = shifts == null ? List.of() : List.copyOf(shifts);
        allowedShifts = allowedShifts == null ? List.of() : List.copyOf(allowedShifts);
    }

    public static PriorityRule of(String id, PriorityRuleType type, String staffId, List<DayOfWeek> days,
                                  List<ShiftValue> shifts) {
        return new PriorityRule(id, null, null, null, type, List.of(staffId), days, shifts, List.of());
    }

    @Override
    public ConstraintKind primaryKind() {
        return ruleType.kind();
    }

    public boolean appliesTo(String staffId, LocalDate date) {
        return staffIds.contains(staffId)
                && (daysOfWeek.isEmpty() || daysOfWeek.contains(date.getDayOfWeek()));
    }

    /** Whether {@code value} already satisfies this rule. */
    public boolean satisfiedBy(ShiftValue value) {
        return switch (ruleType) {
            case PREFERRED_SHIFT, ALLOW_ONLY_SHIFTS -> shifts.contains(value);
            case AVOID_SHIFT, AVOID_SHIFT_WITH_EXCEPTIONS -> !shifts.contains(value);
            case REQUIRED_OFF -> value == ShiftValue.OFF;
        };
    }

    /**
     * Value this rule wants in a cell currently holding {@code current}. Returns
     * {@code current} when it already satisfies the rule or no eligible value does.
     * The random source is only drawn from when an exception has to be picked.
     */
    public ShiftValue enforce(ShiftValue current, Staff staff, Random random) {
        return enforce(current, staff, random, v -> true);
    }

    /**
     * Like {@link #enforce(ShiftValue, Staff, Random)} but only considers values that
     * {@code acceptable} lets through, e.g. values higher-precedence rules still allow.
     */
    public ShiftValue enforce(ShiftValue current, Staff staff, Random random, Predicate<ShiftValue> acceptable) {
        if (satisfiedBy(current)) {
            return current;
        }
        Predicate<ShiftValue> usable = v -> staff.mayWork(v) && acceptable.test(v);
        return switch (ruleType) {
            case PREFERRED_SHIFT, ALLOW_ONLY_SHIFTS -> firstUsable(shifts, usable, current);
            case REQUIRED_OFF -> usable.test(ShiftValue.OFF) ? ShiftValue.OFF : current;
            case AVOID_SHIFT -> firstUsable(avoidFallback(), usable, current);
            case AVOID_SHIFT_WITH_EXCEPTIONS -> {
                List<ShiftValue> candidates = allowedShifts.stream()
                        .filter(v -> !shifts.contains(v) && usable.test(v))
                        .toList();
                if (candidates.isEmpty()) {
                    yield firstUsable(avoidFallback(), usable, current);
                }
                yield candidates.get(random.nextInt(candidates.size()));
            }
        };
    }

    private List<ShiftValue> avoidFallback() {
        return AVOID_FALLBACK.stream().filter(v -> !shifts.contains(v)).toList();
    }

    private static ShiftValue firstUsable(List<ShiftValue> values, Predicate<ShiftValue> usable, ShiftValue current) {
        return values.stream().filter(usable).findFirst().orElse(current);
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        int index = context.declarationIndex(this);
        for (String staffId : staffIds) {
            if (!context.hasStaff(staffId)) {
                continue;
            }
            for (LocalDate date : context.dates()) {
                if (!appliesTo(staffId, date) || context.isLocked(staffId, date)) {
                    continue;
                }
                ShiftValue value = schedule.valueAt(staffId, date);
                if (!satisfiedBy(value)) {
                    violations.add(Violation.of(this, index, primaryKind(), List.of(DateCell.of(staffId, date)),
                            String.format("%s: %s has %s on %s (%s %s)",
                                    id, staffId, value, date, ruleType, shifts)));
                }
            }
        }
        return violations;
    }
}
