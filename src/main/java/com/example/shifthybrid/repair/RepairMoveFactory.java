package com.example.shifthybrid.repair;

import com.example.shifthybrid.constraint.ConsecutiveWorkLimit;
import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.DailyLimit;
import com.example.shifthybrid.constraint.MonthlyLimit;
import com.example.shifthybrid.constraint.PriorityRule;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.StaffGroupRule;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.constraint.WeeklyLimit;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Candidate corrections for one violation, smallest first. Each single change is
 * followed by swap variants that hand the old value to another cell, so counts
 * elsewhere stay level.
 */
class RepairMoveFactory {

    private static final int SWAP_PARTNERS = 4;
    private static final List<ShiftValue> AVOID_FALLBACK =
            List.of(ShiftValue.NORMAL, ShiftValue.LATE, ShiftValue.EARLY, ShiftValue.OFF);

    List<RepairMove> candidates(Violation violation, ScheduleView schedule, RosterContext context) {
        List<CellChange> changes = switch (violation.kind()) {
            // locked cells are never rewritten
            case CALENDAR_MUST_WORK, CALENDAR_MUST_DAY_OFF -> List.of();
            case SHIFT_ELIGIBILITY, STAFF_GROUP_CONFLICT -> toValue(violation.cells(), ShiftValue.NORMAL);
            case CONSECUTIVE_WORK_LIMIT -> streakCuts(violation, context);
            case MONTHLY_LIMIT, DAILY_LIMIT, WEEKLY_LIMIT -> limitChanges(violation, schedule, context);
            case BACKUP_COVERAGE -> coverageChanges(violation, schedule, context);
            case PROXIMITY_PATTERN -> toValue(violation.cells(), ShiftValue.OFF);
            case ALLOW_ONLY_SHIFTS, AVOID_SHIFT_WITH_EXCEPTIONS, AVOID_SHIFT, PREFERRED_SHIFT, REQUIRED_OFF ->
                    priorityChanges(violation, context);
            case FAIR_DISTRIBUTION -> List.of();
        };

        List<RepairMove> moves = new ArrayList<>();
        for (CellChange change : changes) {
            if (context.isLocked(change.cell().staffId(), change.cell().date())) {
                continue;
            }
            Staff staff = context.staff(change.cell().staffId());
            if (staff == null || !staff.mayWork(change.value())
                    || schedule.valueAt(change.cell()) == change.value()) {
                continue;
            }
            String label = violation.kind() + " " + change.cell() + " -> " + change.value();
            moves.add(RepairMove.single(change, label));
            for (CellChange partner : swapPartners(change, schedule, context)) {
                moves.add(RepairMove.pair(change, partner, label + " swapping " + partner.cell()));
            }
        }
        return moves;
    }

    private List<CellChange> limitChanges(Violation violation, ScheduleView schedule, RosterContext context) {
        Optional<Constraint> constraint = context.constraint(violation.constraintId());
        if (constraint.isEmpty() || violation.cells().isEmpty()) {
            return List.of();
        }
        ShiftValue shift = shiftOf(constraint.get());
        if (shift == null) {
            return List.of();
        }
        boolean overMax = schedule.valueAt(violation.cells().get(0)) == shift;
        List<CellChange> changes = new ArrayList<>();
        for (DateCell cell : violation.cells()) {
            if (overMax) {
                replacementFor(shift, context.staff(cell.staffId()))
                        .ifPresent(r -> changes.add(new CellChange(cell, r)));
            } else {
                changes.add(new CellChange(cell, shift));
            }
        }
        return changes;
    }

    /**
     * Off days that break a streak, the day right after the longest legal run first so the
     * days before it stay clean.
     */
    private List<CellChange> streakCuts(Violation violation, RosterContext context) {
        List<DateCell> streak = violation.cells();
        int cut = context.constraint(violation.constraintId()).orElse(null) instanceof ConsecutiveWorkLimit limit
                ? limit.maxConsecutiveDays()
                : 0;
        List<DateCell> ordered = new ArrayList<>();
        if (cut > 0 && cut < streak.size()) {
            ordered.add(streak.get(cut));
        }
        streak.stream().filter(c -> !ordered.contains(c)).forEach(ordered::add);
        return toValue(ordered, ShiftValue.OFF);
    }

    private List<CellChange> coverageChanges(Violation violation, ScheduleView schedule, RosterContext context) {
        Optional<Constraint> constraint = context.constraint(violation.constraintId());
        if (constraint.isEmpty() || !(constraint.get() instanceof StaffGroupRule group) || group.coverage() == null) {
            return List.of();
        }
        List<CellChange> changes = new ArrayList<>(toValue(violation.cells(), group.coverage().requiredShift()));
        // or take away the reason for cover
        for (DateCell backup : violation.cells()) {
            for (String member : group.members()) {
                if (schedule.valueAt(member, backup.date()) == ShiftValue.OFF) {
                    changes.add(CellChange.of(member, backup.date(), ShiftValue.NORMAL));
                }
            }
        }
        return changes;
    }

    private List<CellChange> priorityChanges(Violation violation, RosterContext context) {
        Optional<Constraint> constraint = context.constraint(violation.constraintId());
        if (constraint.isEmpty() || !(constraint.get() instanceof PriorityRule rule)) {
            return List.of();
        }
        List<ShiftValue> wanted = switch (rule.ruleType()) {
            case PREFERRED_SHIFT, ALLOW_ONLY_SHIFTS -> rule.shifts();
            case REQUIRED_OFF -> List.of(ShiftValue.OFF);
            case AVOID_SHIFT -> AVOID_FALLBACK.stream().filter(v -> !rule.shifts().contains(v)).toList();
            case AVOID_SHIFT_WITH_EXCEPTIONS -> {
                List<ShiftValue> values = new ArrayList<>(rule.allowedShifts());
                AVOID_FALLBACK.stream()
                        .filter(v -> !rule.shifts().contains(v) && !values.contains(v))
                        .forEach(values::add);
                yield values;
            }
        };
        List<CellChange> changes = new ArrayList<>();
        for (DateCell cell : violation.cells()) {
            for (ShiftValue value : wanted) {
                changes.add(new CellChange(cell, value));
            }
        }
        return changes;
    }

    /**
     * Cells that currently hold the new value and could take the old one instead: other
     * staff on the same date first, then the same staff on other dates.
     */
    private List<CellChange> swapPartners(CellChange change, ScheduleView schedule, RosterContext context) {
        DateCell cell = change.cell();
        ShiftValue oldValue = schedule.valueAt(cell);
        List<CellChange> partners = new ArrayList<>();
        for (String other : context.staffIds()) {
            if (partners.size() >= SWAP_PARTNERS) {
                break;
            }
            if (!other.equals(cell.staffId()) && swappable(other, cell.date(), change.value(), oldValue, schedule, context)) {
                partners.add(CellChange.of(other, cell.date(), oldValue));
            }
        }
        int sameStaff = 0;
        for (LocalDate date : context.dates()) {
            if (sameStaff >= SWAP_PARTNERS) {
                break;
            }
            if (!date.equals(cell.date()) && swappable(cell.staffId(), date, change.value(), oldValue, schedule, context)) {
                partners.add(CellChange.of(cell.staffId(), date, oldValue));
                sameStaff++;
            }
        }
        return partners;
    }

    private boolean swappable(String staffId, LocalDate date, ShiftValue holds, ShiftValue takes,
                              ScheduleView schedule, RosterContext context) {
        return schedule.valueAt(staffId, date) == holds
                && !context.isLocked(staffId, date)
                && context.staff(staffId).mayWork(takes);
    }

    private static List<CellChange> toValue(List<DateCell> cells, ShiftValue value) {
        return cells.stream().map(c -> new CellChange(c, value)).toList();
    }

    private static Optional<ShiftValue> replacementFor(ShiftValue shift, Staff staff) {
        if (shift != ShiftValue.NORMAL) {
            return Optional.of(ShiftValue.NORMAL);
        }
        return AVOID_FALLBACK.stream().filter(v -> v != ShiftValue.NORMAL && staff.mayWork(v)).findFirst();
    }

    private static ShiftValue shiftOf(Constraint constraint) {
        if (constraint instanceof DailyLimit daily) {
            return daily.shift();
        }
        if (constraint instanceof WeeklyLimit weekly) {
            return weekly.shift();
        }
        if (constraint instanceof MonthlyLimit monthly) {
            return monthly.shift();
        }
        return null;
    }
}
