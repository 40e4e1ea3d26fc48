package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-staff count of {@code shift} over the whole run period.
 */
public record MonthlyLimit(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        ShiftValue shift,
        Integer min,
        Integer max,
        LimitScope scope
) implements Constraint {

    public MonthlyLimit {
        scope = scope == null ? LimitScope.all() : scope;
    }

    public static MonthlyLimit of(String id, ShiftValue shift, Integer min, Integer max) {
        return new MonthlyLimit(id, null, null, null, shift, min, max, LimitScope.all());
    }

    @Override
    public ConstraintKind primaryKind() {
        return ConstraintKind.MONTHLY_LIMIT;
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        int index = context.declarationIndex(this);
        for (String staffId : context.resolveScope(scope)) {
            List<DateCell> matching = new ArrayList<>();
            List<DateCell> others = new ArrayList<>();
            for (LocalDate date : context.dates()) {
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
            if (max != null && matching.size() > max) {
                violations.add(Violation.of(this, index, ConstraintKind.MONTHLY_LIMIT, matching,
                        String.format("%s: %s has %d %s in the period, max %d", id, staffId, matching.size(), shift, max)));
            }
            if (min != null && matching.size() < min) {
                violations.add(Violation.of(this, index, ConstraintKind.MONTHLY_LIMIT, others,
                        String.format("%s: %s has %d %s in the period, min %d", id, staffId, matching.size(), shift, min)));
            }
        }
        return violations;
    }
}
