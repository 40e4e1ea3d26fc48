package com.example.shifthybrid.schedule;

import com.example.shifthybrid.exception.InvariantViolationException;
import com.example.shifthybrid.lock.LockedCells;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working grid of a single run. Every cell holds a value from construction on:
 * locked cells their locked value, all others {@link ShiftValue#NORMAL}.
 * <p>
 * Not thread-safe; owned by one run.
 */
public final class Schedule implements ScheduleView {

    private final List<String> staffIds;
    private final List<LocalDate> dates;
    private final Map<DateCell, ShiftValue> cells;
    private final LockedCells lockedCells;

    public Schedule(List<String> staffIds, List<LocalDate> dates, LockedCells lockedCells) {
        this.staffIds = List.copyOf(staffIds);
        this.dates = List.copyOf(dates);
        this.lockedCells = lockedCells == null ? LockedCells.none() : lockedCells;
        this.cells = new LinkedHashMap<>();
        for (String staffId : this.staffIds) {
            for (LocalDate date : this.dates) {
                DateCell cell = DateCell.of(staffId, date);
                ShiftValue locked = this.lockedCells.lockedValue(cell);
                cells.put(cell, locked != null ? locked : ShiftValue.NORMAL);
            }
        }
    }

    @Override
    public ShiftValue valueAt(String staffId, LocalDate date) {
        ShiftValue value = cells.get(DateCell.of(staffId, date));
        if (value == null) {
            throw new IllegalArgumentException("No cell " + staffId + " on " + date);
        }
        return value;
    }

    /**
     * Writes a cell. Writing a different value into a locked cell is an engine bug.
     *
     * @return true when the value changed
     */
    public boolean assign(DateCell cell, ShiftValue value) {
        ShiftValue current = cells.get(cell);
        if (current == null) {
            throw new IllegalArgumentException("No cell " + cell);
        }
        if (current == value) {
            return false;
        }
        if (lockedCells.isLocked(cell)) {
            throw new InvariantViolationException(String.valueOf(lockedCells.reason(cell)),
                    "Attempt to overwrite locked cell " + cell + " with " + value, List.of(cell));
        }
        cells.put(cell, value);
        return true;
    }

    public boolean assign(String staffId, LocalDate date, ShiftValue value) {
        return assign(DateCell.of(staffId, date), value);
    }

    public boolean isLocked(DateCell cell) {
        return lockedCells.isLocked(cell);
    }

    public LockedCells lockedCells() {
        return lockedCells;
    }

    @Override
    public List<String> staffIds() {
        return staffIds;
    }

    @Override
    public List<LocalDate> dates() {
        return dates;
    }

    public int count(String staffId, ShiftValue value) {
        int count = 0;
        for (LocalDate date : dates) {
            if (valueAt(staffId, date) == value) {
                count++;
            }
        }
        return count;
    }

    public int countOn(LocalDate date, ShiftValue value) {
        int count = 0;
        for (String staffId : staffIds) {
            if (valueAt(staffId, date) == value) {
                count++;
            }
        }
        return count;
    }

    public ScheduleSnapshot snapshot() {
        Map<String, List<ShiftValue>> rows = new LinkedHashMap<>();
        for (String staffId : staffIds) {
            List<ShiftValue> row = new ArrayList<>(dates.size());
            for (LocalDate date : dates) {
                row.add(valueAt(staffId, date));
            }
            rows.put(staffId, row);
        }
        return new ScheduleSnapshot(dates, rows);
    }
}
