package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * At most {@code maxConsecutiveDays} working days in a row. A must-day-off date ends a
 * streak even for staff locked to an early shift on it.
 */
public record ConsecutiveWorkLimit(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        Integer maxConsecutiveDays,
        LimitScope scope
) implements Constraint {

    public static final int DEFAULT_MAX_CONSECUTIVE_DAYS = 5;

    public ConsecutiveWorkLimit {
        maxConsecutiveDays = maxConsecutiveDays == null ? DEFAULT_MAX_CONSECUTIVE_DAYS : maxConsecutiveDays;
        scope = scope == null ? LimitScope.all() : scope;
    }

    public static ConsecutiveWorkLimit of(String id, int maxConsecutiveDays) {
        return new ConsecutiveWorkLimit(id, null, null, null, maxConsecutiveDays, LimitScope.all());
    }

    @Override
    public ConstraintKind primaryKind() {
        return ConstraintKind.CONSECUTIVE_WORK_LIMIT;
    }

    /** Whether the cell counts as a rest day for streak purposes. */
    public static boolean isRest(ScheduleView schedule, RosterContext context, String staffId, LocalDate date) {
        return !schedule.valueAt(staffId, date).isWorking()
                || context.snapshot().mandates().mustOff().contains(date);
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        int index = context.declarationIndex(this);
        for (String staffId : context.resolveScope(scope)) {
            List<DateCell> streak = new ArrayList<>();
            for (LocalDate date : context.dates()) {
                if (isRest(schedule, context, staffId, date)) {
                    addIfTooLong(violations, index, staffId, streak);
                    streak = new ArrayList<>();
                } else {
                    streak.add(DateCell.of(staffId, date));
                }
            }
            addIfTooLong(violations, index, staffId, streak);
        }
        return violations;
    }

    private void addIfTooLong(List<Violation> violations, int index, String staffId, List<DateCell> streak) {
        if (streak.size() > maxConsecutiveDays) {
            violations.add(Violation.of(this, index, ConstraintKind.CONSECUTIVE_WORK_LIMIT, streak,
                    String.format("%s: %s works %d days in a row from %s, max %d",
                            id, staffId, streak.size(), streak.get(0).date(), maxConsecutiveDays)));
        }
    }
}
