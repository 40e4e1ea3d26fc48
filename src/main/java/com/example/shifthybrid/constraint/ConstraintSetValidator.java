package com.example.shifthybrid.constraint;

import com.example.shifthybrid.exception.ConfigurationException;
import com.example.shifthybrid.schedule.CalendarMandates;
import com.example.shifthybrid.schedule.DateRange;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rejects contradictory or malformed snapshots before anything is generated.
 */
@Component
public class ConstraintSetValidator {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintSetValidator.class);

    public void validate(List<Staff> roster, DateRange horizon, ConstraintSnapshot snapshot) {
        if (horizon == null || !horizon.wellFormed()) {
            throw new ConfigurationException(null, "Date range is missing or ends before it starts: " + horizon);
        }
        Set<String> staffIds = validateRoster(roster);
        validateMandates(horizon, snapshot.mandates());

        Set<String> groupNames = new HashSet<>();
        for (StaffGroupRule group : snapshot.ofType(StaffGroupRule.class)) {
            if (group.name() == null || group.name().isBlank()) {
                throw new ConfigurationException(group.id(), "Staff group needs a name");
            }
            if (!groupNames.add(group.name())) {
                throw new ConfigurationException(group.id(), "Duplicate staff group name " + group.name());
            }
        }

        RosterContext scopes = new RosterContext(roster, horizon, snapshot, null);
        Set<String> ids = new HashSet<>();
        for (Constraint constraint : snapshot.constraints()) {
            if (constraint == null) {
                throw new ConfigurationException(null, "Null constraint in snapshot " + snapshot.version());
            }
            if (constraint.id() == null || constraint.id().isBlank()) {
                throw new ConfigurationException(null, "Constraint without id: " + constraint);
            }
            if (!ids.add(constraint.id())) {
                throw new ConfigurationException(constraint.id(), "Duplicate constraint id " + constraint.id());
            }
            validateCommon(constraint);
            if (constraint instanceof DailyLimit daily) {
                validateDaily(daily, scopes, staffIds, groupNames);
            } else if (constraint instanceof WeeklyLimit weekly) {
                validateWeekly(weekly, scopes, staffIds, groupNames);
            } else if (constraint instanceof MonthlyLimit monthly) {
                validateMonthly(monthly, horizon, scopes, staffIds, groupNames);
            } else if (constraint instanceof ConsecutiveWorkLimit consecutive) {
                validateConsecutive(consecutive, horizon, snapshot.mandates(), staffIds, groupNames);
            } else if (constraint instanceof StaffGroupRule group) {
                validateGroup(group, staffIds);
            } else if (constraint instanceof PriorityRule rule) {
                validatePriorityRule(rule, staffIds);
            }
        }
        logger.debug("Snapshot {} accepted: {} constraints, {} staff", snapshot.version(),
                snapshot.constraints().size(), staffIds.size());
    }

    private Set<String> validateRoster(List<Staff> roster) {
        if (roster == null || roster.isEmpty()) {
            throw new ConfigurationException(null, "Roster is empty");
        }
        Set<String> ids = new HashSet<>();
        for (Staff staff : roster) {
            if (staff == null || staff.id() == null || staff.id().isBlank()) {
                throw new ConfigurationException(null, "Roster entry without id");
            }
            if (!ids.add(staff.id())) {
                throw new ConfigurationException(null, "Duplicate staff id " + staff.id());
            }
        }
        return ids;
    }

    private void validateMandates(DateRange horizon, CalendarMandates mandates) {
        Set<LocalDate> both = mandates.mustWork().stream()
                .filter(mandates.mustOff()::contains)
                .collect(Collectors.toCollection(TreeSet::new));
        if (!both.isEmpty()) {
            throw new ConfigurationException("calendar", "Dates are both must-work and must-day-off: " + both);
        }
        List<LocalDate> outside = mandates.mandateDates().stream()
                .filter(d -> !horizon.contains(d))
                .toList();
        if (!outside.isEmpty()) {
            logger.warn("Ignoring {} mandate date(s) outside {}..{}: {}", outside.size(),
                    horizon.start(), horizon.end(), outside);
        }
    }

    private void validateCommon(Constraint constraint) {
        Integer tier = constraint.tier();
        if (tier != null && (tier < 1 || tier > 3)) {
            throw new ConfigurationException(constraint.id(), "Tier must be 1, 2 or 3 but was " + tier);
        }
        if (Boolean.TRUE.equals(constraint.hardConstraint())
                && constraint.effectiveTier(constraint.primaryKind()) != 1) {
            throw new ConfigurationException(constraint.id(), "Only tier 1 constraints can be hard");
        }
        if (constraint.penaltyWeight() != null && constraint.penaltyWeight() < 0) {
            throw new ConfigurationException(constraint.id(), "Penalty weight must not be negative");
        }
    }

    private void validateBounds(String id, ShiftValue shift, Integer min, Integer max) {
        if (shift == null) {
            throw new ConfigurationException(id, "Limit needs a shift");
        }
        if (min == null && max == null) {
            throw new ConfigurationException(id, "Limit needs a min or a max");
        }
        if ((min != null && min < 0) || (max != null && max < 0)) {
            throw new ConfigurationException(id, "Limit bounds must not be negative");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigurationException(id, "Limit min " + min + " exceeds max " + max);
        }
    }

    private void validateScope(String id, LimitScope scope, Set<String> staffIds, Set<String> groupNames) {
        switch (scope.type()) {
            case GROUP -> {
                if (!groupNames.contains(scope.groupName())) {
                    throw new ConfigurationException(id, "Unknown staff group " + scope.groupName());
                }
            }
            case STAFF -> {
                if (scope.staffIds().isEmpty()) {
                    throw new ConfigurationException(id, "Staff scope lists no staff");
                }
                requireKnown(id, scope.staffIds(), staffIds);
            }
            case CATEGORY -> {
                if (scope.category() == null) {
                    throw new ConfigurationException(id, "Category scope needs an employment category");
                }
            }
            case ALL -> {
                // every non-backup staff member
            }
        }
    }

    private void validateDaily(DailyLimit limit, RosterContext scopes, Set<String> staffIds, Set<String> groupNames) {
        validateBounds(limit.id(), limit.shift(), limit.min(), limit.max());
        validateScope(limit.id(), limit.scope(), staffIds, groupNames);
        if (limit.min() != null) {
            long eligible = scopes.resolveScope(limit.scope()).stream()
                    .filter(id -> scopes.staff(id).mayWork(limit.shift()))
                    .count();
            if (limit.min() > eligible) {
                throw new ConfigurationException(limit.id(), "Daily min " + limit.min() + " exceeds the "
                        + eligible + " staff in scope allowed to work " + limit.shift());
            }
        }
    }

    /** Per-staff minimums need every scoped staff member to be allowed the shift. */
    private void requireEligibleForMin(String id, Integer min, ShiftValue shift, LimitScope scope,
                                       RosterContext scopes) {
        if (min == null || min == 0) {
            return;
        }
        List<String> ineligible = scopes.resolveScope(scope).stream()
                .filter(staffId -> !scopes.staff(staffId).mayWork(shift))
                .toList();
        if (!ineligible.isEmpty()) {
            throw new ConfigurationException(id, "Min " + min + " " + shift + " applies to staff not allowed to work it: "
                    + ineligible);
        }
    }

    private void validateWeekly(WeeklyLimit limit, RosterContext scopes, Set<String> staffIds,
                                Set<String> groupNames) {
        validateBounds(limit.id(), limit.shift(), limit.min(), limit.max());
        validateScope(limit.id(), limit.scope(), staffIds, groupNames);
        requireEligibleForMin(limit.id(), limit.min(), limit.shift(), limit.scope(), scopes);
        if (limit.windowDays() < 1) {
            throw new ConfigurationException(limit.id(), "Window must be at least one day");
        }
        if (limit.min() != null && limit.min() > limit.windowDays()) {
            throw new ConfigurationException(limit.id(),
                    "Weekly min " + limit.min() + " exceeds the " + limit.windowDays() + "-day window");
        }
    }

    private void validateMonthly(MonthlyLimit limit, DateRange horizon, RosterContext scopes, Set<String> staffIds,
                                 Set<String> groupNames) {
        validateBounds(limit.id(), limit.shift(), limit.min(), limit.max());
        validateScope(limit.id(), limit.scope(), staffIds, groupNames);
        requireEligibleForMin(limit.id(), limit.min(), limit.shift(), limit.scope(), scopes);
        if (limit.min() != null && limit.min() > horizon.length()) {
            throw new ConfigurationException(limit.id(),
                    "Monthly min " + limit.min() + " exceeds the " + horizon.length() + "-day period");
        }
    }

    private void validateConsecutive(ConsecutiveWorkLimit limit, DateRange horizon, CalendarMandates mandates,
                                     Set<String> staffIds, Set<String> groupNames) {
        validateScope(limit.id(), limit.scope(), staffIds, groupNames);
        if (limit.maxConsecutiveDays() < 1) {
            throw new ConfigurationException(limit.id(), "Consecutive limit must be at least one day");
        }
        int run = 0;
        LocalDate runStart = null;
        for (LocalDate date : horizon.dates()) {
            if (mandates.mustWork().contains(date)) {
                runStart = run == 0 ? date : runStart;
                run++;
                if (run > limit.maxConsecutiveDays()) {
                    throw new ConfigurationException(limit.id(), "Must-work dates from " + runStart
                            + " exceed " + limit.maxConsecutiveDays() + " consecutive days");
                }
            } else {
                run = 0;
            }
        }
    }

    private void validateGroup(StaffGroupRule group, Set<String> staffIds) {
        if (group.members().isEmpty()) {
            throw new ConfigurationException(group.id(), "Staff group " + group.name() + " has no members");
        }
        requireKnown(group.id(), group.members(), staffIds);
        if (group.maxSimultaneousOff() != null && group.maxSimultaneousOff() < 0) {
            throw new ConfigurationException(group.id(), "maxSimultaneousOff must not be negative");
        }
        CoverageRule coverage = group.coverage();
        if (coverage != null) {
            requireKnown(group.id(), List.of(String.valueOf(coverage.backupStaffId())), staffIds);
            if (group.members().contains(coverage.backupStaffId())) {
                throw new ConfigurationException(group.id(),
                        "Backup " + coverage.backupStaffId() + " cannot be a member of the group it covers");
            }
        }
        ProximityPattern proximity = group.proximity();
        if (proximity != null) {
            requireKnown(group.id(), List.of(String.valueOf(proximity.triggerStaffId()),
                    String.valueOf(proximity.targetStaffId())), staffIds);
            if (proximity.withinDays() < 0) {
                throw new ConfigurationException(group.id(), "withinDays must not be negative");
            }
        }
    }

    private void validatePriorityRule(PriorityRule rule, Set<String> staffIds) {
        if (rule.ruleType() == null) {
            throw new ConfigurationException(rule.id(), "Priority rule needs a rule type");
        }
        if (rule.staffIds().isEmpty()) {
            throw new ConfigurationException(rule.id(), "Priority rule lists no staff");
        }
        requireKnown(rule.id(), rule.staffIds(), staffIds);
        if (rule.ruleType() != PriorityRuleType.REQUIRED_OFF && rule.shifts().isEmpty()) {
            throw new ConfigurationException(rule.id(), rule.ruleType() + " rule lists no shifts");
        }
        if (rule.ruleType() == PriorityRuleType.AVOID_SHIFT_WITH_EXCEPTIONS) {
            if (rule.allowedShifts().isEmpty()) {
                throw new ConfigurationException(rule.id(), "Avoid-with-exceptions rule lists no exceptions");
            }
            List<ShiftValue> overlap = rule.allowedShifts().stream().filter(rule.shifts()::contains).toList();
            if (!overlap.isEmpty()) {
                throw new ConfigurationException(rule.id(), "Exceptions repeat the avoided shift(s) " + overlap);
            }
        }
    }

    private void requireKnown(String constraintId, List<String> ids, Set<String> staffIds) {
        for (String id : ids) {
            if (!staffIds.contains(id)) {
                throw new ConfigurationException(constraintId, "Unknown staff id " + id);
            }
        }
    }
}
