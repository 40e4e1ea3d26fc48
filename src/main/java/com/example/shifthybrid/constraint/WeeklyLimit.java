package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-staff count of {@code shift} inside every full rolling window of {@code windowDays}
 * days. A horizon shorter than the window has no window to check.
 */
public record WeeklyLimit(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        ShiftValue shift,
        Integer min,
        Integer max,
        LimitScope scope,
        Integer windowDays
) implements Constraint {

    public static final int DEFAULT_WINDOW_DAYS = 7;

    public WeeklyLimit {
        scope = scope == null ? LimitScope.all() : scope;
        windowDays = windowDays == null ? DEFAULT_WINDOW_DAYS : windowDays;
    }

    public static WeeklyLimit max(String id, ShiftValue shift, int max) {
        return new WeeklyLimit(id, null, null, null, shift, null, max, LimitScope.all(), DEFAULT_WINDOW_DAYS);
    }

    public static WeeklyLimit min(String id, ShiftValue shift, int min) {
        return new WeeklyLimit(id, null, null, null, shift, min, null, LimitScope.all(), DEFAULT_WINDOW_DAYS);
    }

    @Override
    public ConstraintKind primaryKind() {
        return ConstraintKind.WEEKLY_LIMIT;
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        List<LocalDate> dates = context.dates();
        int index = context.declarationIndex(this);
        for (String staffId : context.resolveScope(scope)) {
            for (int start = 0; start + windowDays <= dates.size(); start++) {
                List<DateCell> matching = new ArrayList<>();
                List<DateCell> others = new ArrayList<>();
                for (LocalDate date : dates.subList(start, start + windowDays)) {
                    if (context.isMandateDate(date)) {
                        continue;
                    }
                    DateCell cell = DateCell.of(staffId, date);
                    if (schedule.valueAt(cell) == shift) {
                        matching.add(cell);
                    } else {
                        others.add(cell);
                    }
                }
                LocalDate from = dates.get(start);
                if (max != null && matching.size() > max) {
                    violations.add(Violation.of(this, index, ConstraintKind.WEEKLY_LIMIT, matching,
                            String.format("%s: %s has %d %s in the %d days from %s, max %d",
                                    id, staffId, matching.size(), shift, windowDays, from, max)));
                }
                if (min != null && matching.size() < min) {
                    violations.add(Violation.of(this, index, ConstraintKind.WEEKLY_LIMIT, others,
                            String.format("%s: %s has %d %s in the %d days from %s, min %d",
                                    id, staffId, matching.size(), shift, windowDays, from, min)));
                }
            }
        }
        return violations;
    }
}
