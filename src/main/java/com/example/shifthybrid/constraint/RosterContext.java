package com.example.shifthybrid.constraint;

import com.example.shifthybrid.lock.LockedCells;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.DateRange;
import com.example.shifthybrid.staff.Staff;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything about a run that constraints need besides the grid itself: the roster in
 * order, the horizon, mandate dates, group membership and locked cells.
 */
public final class RosterContext {

    private final Map<String, Staff> staffById;
    private final List<String> staffIds;
    private final DateRange horizon;
    private final List<LocalDate> dates;
    private final ConstraintSnapshot snapshot;
    private final Set<LocalDate> mandateDates;
    private final Map<String, List<String>> groupMembers;
    private final Set<String> backupStaffIds;
    private final Map<Constraint, Integer> declarationIndex;
    private final LockedCells lockedCells;

    public RosterContext(List<Staff> roster, DateRange horizon, ConstraintSnapshot snapshot, LockedCells lockedCells) {
        Map<String, Staff> byId = new LinkedHashMap<>();
        for (Staff staff : roster) {
            byId.put(staff.id(), staff);
        }
        this.staffById = Collections.unmodifiableMap(byId);
        this.staffIds = List.copyOf(byId.keySet());
        this.horizon = horizon;
        this.dates = List.copyOf(horizon.dates());
        this.snapshot = snapshot;
        this.lockedCells = lockedCells == null ? LockedCells.none() : lockedCells;

        Set<LocalDate> mandates = new LinkedHashSet<>();
        for (LocalDate date : snapshot.mandates().mandateDates()) {
            if (horizon.contains(date)) {
                mandates.add(date);
            }
        }
        this.mandateDates = Collections.unmodifiableSet(mandates);

        Map<String, List<String>> groups = new LinkedHashMap<>();
        Set<String> backups = new LinkedHashSet<>();
        for (StaffGroupRule rule : snapshot.ofType(StaffGroupRule.class)) {
            groups.put(rule.name(), rule.members());
            if (rule.coverage() != null && rule.coverage().backupStaffId() != null) {
                backups.add(rule.coverage().backupStaffId());
            }
        }
        this.groupMembers = Collections.unmodifiableMap(groups);
        this.backupStaffIds = Collections.unmodifiableSet(backups);

        Map<Constraint, Integer> index = new IdentityHashMap<>();
        List<Constraint> constraints = snapshot.constraints();
        for (int i = 0; i < constraints.size(); i++) {
            index.put(constraints.get(i), i);
        }
        this.declarationIndex = index;
    }

    public List<Staff> roster() {
        return List.copyOf(staffById.values());
    }

    public List<String> staffIds() {
        return staffIds;
    }

    public Staff staff(String staffId) {
        return staffById.get(staffId);
    }

    public boolean hasStaff(String staffId) {
        return staffById.containsKey(staffId);
    }

    public DateRange horizon() {
        return horizon;
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public ConstraintSnapshot snapshot() {
        return snapshot;
    }

    public List<Constraint> constraints() {
        return snapshot.constraints();
    }

    public Optional<Constraint> constraint(String id) {
        return snapshot.constraints().stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public boolean isMandateDate(LocalDate date) {
        return mandateDates.contains(date);
    }

    public Set<LocalDate> mandateDates() {
        return mandateDates;
    }

    public List<String> groupMembers(String name) {
        return groupMembers.getOrDefault(name, List.of());
    }

    public LockedCells lockedCells() {
        return lockedCells;
    }

    public boolean isLocked(String staffId, LocalDate date) {
        return lockedCells.isLocked(DateCell.of(staffId, date));
    }

    /** Position of the constraint in the snapshot, or -1 for one that is not part of it. */
    public int declarationIndex(Constraint constraint) {
        return declarationIndex.getOrDefault(constraint, -1);
    }

    /**
     * Staff counted by a limit, in roster order. Unknown ids are dropped here; the
     * snapshot validator rejects them before a run starts.
     */
    public List<String> resolveScope(LimitScope scope) {
        LimitScope effective = scope == null ? LimitScope.all() : scope;
        List<String> result = new ArrayList<>();
        switch (effective.type()) {
            case ALL -> staffById.keySet().stream()
                    .filter(id -> !backupStaffIds.contains(id))
                    .forEach(result::add);
            case GROUP -> {
                Set<String> members = new LinkedHashSet<>(groupMembers(effective.groupName()));
                staffById.keySet().stream().filter(members::contains).forEach(result::add);
            }
            case STAFF -> {
                Set<String> ids = new LinkedHashSet<>(effective.staffIds());
                staffById.keySet().stream().filter(ids::contains).forEach(result::add);
            }
            case CATEGORY -> staffById.values().stream()
                    .filter(s -> s.employmentCategory() == effective.category())
                    .map(Staff::id)
                    .forEach(result::add);
        }
        return result;
    }
}
