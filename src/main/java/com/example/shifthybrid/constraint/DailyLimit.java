package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Number of scoped staff holding {@code shift} on a single date, e.g. "at most two off per day".
 * Dates carrying a calendar mandate are not counted.
 */
public record DailyLimit(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        ShiftValue shift,
        Integer min,
        Integer max,
        LimitScope scope,
        List<DayOfWeek> daysOfWeek
) implements Constraint {

    public DailyLimit {
        scope = scope == null ? LimitScope.all() : scope;
        daysOfWeek = daysOfWeek == null ? List.of() : List.copyOf(daysOfWeek);
    }

    public static DailyLimit max(String id, ShiftValue shift, int max) {
        return new DailyLimit(id, null, null, null, shift, null, max, LimitScope.all(), List.of());
    }

    public static DailyLimit min(String id, ShiftValue shift, int min) {
        return new DailyLimit(id, null, null, null, shift, min, null, LimitScope.all(), List.of());
    }

    @Override
    public ConstraintKind primaryKind() {
        return ConstraintKind.DAILY_LIMIT;
    }

    public boolean appliesOn(LocalDate date) {
        return daysOfWeek.isEmpty() || daysOfWeek.contains(date.getDayOfWeek());
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        List<String> scoped = context.resolveScope(scope);
        int index = context.declarationIndex(this);
        for (LocalDate date : context.dates()) {
            if (context.isMandateDate(date) || !appliesOn(date)) {
                continue;
            }
            List<DateCell> matching = new ArrayList<>();
            List<DateCell> others = new ArrayList<>();
            for (String staffId : scoped) {
                DateCell cell = DateCell.of(staffId, date);
                if (schedule.valueAt(cell) == shift) {
                    matching.add(cell);
                } else {
                    others.add(cell);
                }
            }
            if (max != null && matching.size() > max) {
                violations.add(Violation.of(this, index, ConstraintKind.DAILY_LIMIT, matching,
                        String.format("%s: %d staff on %s %s, max %d", id, matching.size(), shift, date, max)));
            }
            if (min != null && matching.size() < min) {
                violations.add(Violation.of(this, index, ConstraintKind.DAILY_LIMIT, others,
                        String.format("%s: %d staff on %s %s, min %d", id, matching.size(), shift, date, min)));
            }
        }
        return violations;
    }
}
