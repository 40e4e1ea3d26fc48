package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ScheduleView;
import com.example.shifthybrid.schedule.ShiftValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Rules over a named group of staff. Each clause is optional:
 * <ul>
 *   <li>{@code maxSimultaneousOff} - members off or early on the same date</li>
 *   <li>{@code coverage} - backup works the required shift while a member is off</li>
 *   <li>{@code proximity} - paired days off between two staff</li>
 * </ul>
 * Mandate dates are not checked.
 */
public record StaffGroupRule(
        String id,
        Integer tier,
        @JsonProperty("isHardConstraint") Boolean hardConstraint,
        Integer penaltyWeight,
        String name,
        List<String> members,
        Integer maxSimultaneousOff,
        CoverageRule coverage,
        ProximityPattern proximity
) implements Constraint {

    public StaffGroupRule {
        members = members == null ? List.of() : List.copyOf(members);
        id = id == null || id.isBlank() ? "group-" + name : id;
    }

    @Override
    public ConstraintKind primaryKind() {
        if (maxSimultaneousOff != null) {
            return ConstraintKind.STAFF_GROUP_CONFLICT;
        }
        return coverage != null ? ConstraintKind.BACKUP_COVERAGE : ConstraintKind.PROXIMITY_PATTERN;
    }

    @Override
    public List<Violation> evaluate(ScheduleView schedule, RosterContext context) {
        List<Violation> violations = new ArrayList<>();
        int index = context.declarationIndex(this);
        for (LocalDate date : context.dates()) {
            if (context.isMandateDate(date)) {
                continue;
            }
            if (maxSimultaneousOff != null) {
                List<DateCell> away = absentMembers(schedule, date);
                if (away.size() > maxSimultaneousOff) {
                    violations.add(Violation.of(this, index, ConstraintKind.STAFF_GROUP_CONFLICT, away,
                            String.format("%s: %d members off or early on %s, max %d",
                                    name, away.size(), date, maxSimultaneousOff)));
                }
            }
            if (coverage != null && coverageNeeded(schedule, date)) {
                DateCell backup = DateCell.of(coverage.backupStaffId(), date);
                if (schedule.valueAt(backup) != coverage.requiredShift()) {
                    violations.add(Violation.of(this, index, ConstraintKind.BACKUP_COVERAGE, List.of(backup),
                            String.format("%s: %s must cover with %s on %s",
                                    name, coverage.backupStaffId(), coverage.requiredShift(), date)));
                }
            }
            if (proximity != null && schedule.valueAt(proximity.triggerStaffId(), date) == ShiftValue.OFF
                    && !targetOffNear(schedule, context, date)) {
                violations.add(Violation.of(this, index, ConstraintKind.PROXIMITY_PATTERN,
                        proximityCandidates(context, date),
                        String.format("%s: %s has no day off within %d days of %s's day off on %s",
                                name, proximity.targetStaffId(), proximity.withinDays(),
                                proximity.triggerStaffId(), date)));
            }
        }
        return violations;
    }

    /** Members that are off or early on the date, in member order. */
    public List<DateCell> absentMembers(ScheduleView schedule, LocalDate date) {
        List<DateCell> away = new ArrayList<>();
        for (String member : members) {
            if (schedule.valueAt(member, date).isOffOrEarly()) {
                away.add(DateCell.of(member, date));
            }
        }
        return away;
    }

    public boolean coverageNeeded(ScheduleView schedule, LocalDate date) {
        if (coverage == null) {
            return false;
        }
        for (String member : members) {
            if (!member.equals(coverage.backupStaffId())
                    && schedule.valueAt(member, date) == ShiftValue.OFF) {
                return true;
            }
        }
        return false;
    }

    public boolean targetOffNear(ScheduleView schedule, RosterContext context, LocalDate date) {
        int within = proximity.withinDays();
        for (LocalDate d = date.minusDays(within); !d.isAfter(date.plusDays(within)); d = d.plusDays(1)) {
            if (context.horizon().contains(d) && schedule.valueAt(proximity.targetStaffId(), d) == ShiftValue.OFF) {
                return true;
            }
        }
        return false;
    }

    /** Target cells that could take the paired day off, nearest first. */
    public List<DateCell> proximityCandidates(RosterContext context, LocalDate date) {
        List<DateCell> cells = new ArrayList<>();
        String target = proximity.targetStaffId();
        for (int offset = 0; offset <= proximity.withinDays(); offset++) {
            addCandidate(cells, context, target, date.plusDays(offset));
            if (offset > 0) {
                addCandidate(cells, context, target, date.minusDays(offset));
            }
        }
        return cells;
    }

    private static void addCandidate(List<DateCell> cells, RosterContext context, String staffId, LocalDate date) {
        if (context.horizon().contains(date) && !context.isLocked(staffId, date)) {
            cells.add(DateCell.of(staffId, date));
        }
    }
}
