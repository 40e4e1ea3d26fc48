package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

/**
 * Mutable state of one generation run: the schedule, the cell claims and the seeded
 * random source.
 * <p>
 * A claim records the highest-precedence constraint kind that has written (or settled)
 * a cell. A later write is refused when its kind has a higher priority number than the
 * claim, so the registry order decides every contended cell.
 */
public final class GenerationContext {

    private final Schedule schedule;
    private final RosterContext roster;
    private final Random random;
    private final int weeklyRestDays;
    private final Map<DateCell, ConstraintKind> claims = new HashMap<>();

    public GenerationContext(Schedule schedule, RosterContext roster, long seed, int weeklyRestDays) {
        this.schedule = schedule;
        this.roster = roster;
        this.random = new Random(seed);
        this.weeklyRestDays = weeklyRestDays;
    }

    public Schedule schedule() {
        return schedule;
    }

    public RosterContext roster() {
        return roster;
    }

    public Random random() {
        return random;
    }

    public int weeklyRestDays() {
        return weeklyRestDays;
    }

    public Staff staff(String staffId) {
        return roster.staff(staffId);
    }

    public ConstraintKind claim(DateCell cell) {
        return claims.get(cell);
    }

    /** Priority number of the claim, past the last kind for unclaimed cells. */
    public int claimPriority(DateCell cell) {
        ConstraintKind kind = claims.get(cell);
        return kind == null ? Integer.MAX_VALUE : kind.priority();
    }

    public boolean canWrite(DateCell cell, ConstraintKind kind) {
        if (schedule.isLocked(cell)) {
            return false;
        }
        ConstraintKind existing = claims.get(cell);
        return existing == null || kind.priority() <= existing.priority();
    }

    /**
     * Claims the cell for {@code kind} and writes the value. Refused for locked cells,
     * cells claimed by a higher-precedence kind and values the staff member may not work.
     *
     * @return true when the value changed
     */
    public boolean write(DateCell cell, ShiftValue value, ConstraintKind kind) {
        if (!canWrite(cell, kind) || !staff(cell.staffId()).mayWork(value)) {
            return false;
        }
        claims.put(cell, kind);
        return schedule.assign(cell, value);
    }

    /**
     * Applies all changes under {@code kind}, then keeps them only if {@code accept} holds.
     * Rejected changes are rolled back together with their claims.
     */
    public boolean tryApply(List<CellChange> changes, ConstraintKind kind, BooleanSupplier accept) {
        boolean anyChange = false;
        for (CellChange change : changes) {
            if (!canWrite(change.cell(), kind) || !staff(change.cell().staffId()).mayWork(change.value())) {
                return false;
            }
            anyChange |= schedule.valueAt(change.cell()) != change.value();
        }
        if (!anyChange) {
            return false;
        }
        List<ShiftValue> previousValues = new ArrayList<>();
        List<ConstraintKind> previousClaims = new ArrayList<>();
        for (CellChange change : changes) {
            previousValues.add(schedule.valueAt(change.cell()));
            previousClaims.add(claims.get(change.cell()));
            claims.put(change.cell(), kind);
            schedule.assign(change.cell(), change.value());
        }
        if (accept.getAsBoolean()) {
            return true;
        }
        for (int i = changes.size() - 1; i >= 0; i--) {
            DateCell cell = changes.get(i).cell();
            schedule.assign(cell, previousValues.get(i));
            if (previousClaims.get(i) == null) {
                claims.remove(cell);
            } else {
                claims.put(cell, previousClaims.get(i));
            }
        }
        return false;
    }

    /**
     * Total number of cells named by violations matching {@code filter}, over every
     * constraint except {@code excluded}. Grows with the amount of breakage, so it can
     * compare two states of the grid.
     */
    public long violationMass(Predicate<Violation> filter, Constraint excluded) {
        long mass = 0;
        for (Constraint constraint : roster.constraints()) {
            if (constraint == excluded) {
                continue;
            }
            for (Violation violation : constraint.evaluate(schedule, roster)) {
                if (filter.test(violation)) {
                    mass += Math.max(1, violation.cells().size());
                }
            }
        }
        return mass;
    }

    public long ownMass(Constraint constraint) {
        long mass = 0;
        for (Violation violation : constraint.evaluate(schedule, roster)) {
            mass += Math.max(1, violation.cells().size());
        }
        return mass;
    }
}
