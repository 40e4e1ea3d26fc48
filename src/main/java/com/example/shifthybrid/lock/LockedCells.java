package com.example.shifthybrid.lock;

import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ShiftValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cells fixed by calendar mandates before generation. Only {@link PreGenerationLocker}
 * creates non-empty instances.
 */
public final class LockedCells {

    private static final LockedCells NONE = new LockedCells(Map.of(), Map.of());

    private final Map<DateCell, ShiftValue> values;
    private final Map<DateCell, ConstraintKind> reasons;

    LockedCells(Map<DateCell, ShiftValue> values, Map<DateCell, ConstraintKind> reasons) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public static LockedCells none() {
        return NONE;
    }

    public boolean isLocked(DateCell cell) {
        return values.containsKey(cell);
    }

    public ShiftValue lockedValue(DateCell cell) {
        return values.get(cell);
    }

    /** The calendar kind that produced the lock, or null for an unlocked cell. */
    public ConstraintKind reason(DateCell cell) {
        return reasons.get(cell);
    }

    public Set<DateCell> cells() {
        return values.keySet();
    }

    public Map<DateCell, ShiftValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public List<DateCell> cellsFor(ConstraintKind kind) {
        return reasons.entrySet().stream()
                .filter(e -> e.getValue() == kind)
                .map(Map.Entry::getKey)
                .toList();
    }
}
