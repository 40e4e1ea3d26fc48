package com.example.shifthybrid.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable schedule handed back to callers. Rows follow roster order, columns date order.
 */
public record ScheduleSnapshot(List<LocalDate> dates, Map<String, List<ShiftValue>> rows) implements ScheduleView {

    public ScheduleSnapshot {
        dates = List.copyOf(dates);
        Map<String, List<ShiftValue>> copy = new LinkedHashMap<>();
        rows.forEach((staffId, values) -> copy.put(staffId, List.copyOf(values)));
        rows = Collections.unmodifiableMap(copy);
    }

    @Override
    public ShiftValue valueAt(String staffId, LocalDate date) {
        List<ShiftValue> row = rows.get(staffId);
        int index = dates.indexOf(date);
        if (row == null || index < 0) {
            throw new IllegalArgumentException("No cell " + staffId + " on " + date);
        }
        return row.get(index);
    }

    @Override
    @JsonIgnore
    public List<String> staffIds() {
        return List.copyOf(rows.keySet());
    }

    /** Row of display symbols, as printed on the paper roster. */
    public List<String> symbols(String staffId) {
        return rows.get(staffId).stream().map(ShiftValue::symbol).toList();
    }

    public long count(String staffId, ShiftValue value) {
        return rows.get(staffId).stream().filter(v -> v == value).count();
    }
}
