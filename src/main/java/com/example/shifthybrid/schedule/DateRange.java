package com.example.shifthybrid.schedule;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inclusive generation horizon.
 */
public record DateRange(@NotNull LocalDate start, @NotNull LocalDate end) {

    public List<LocalDate> dates() {
        if (start == null || end == null || end.isBefore(start)) {
            return Collections.emptyList();
        }
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            days.add(d);
        }
        return days;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public int length() {
        if (start == null || end == null || end.isBefore(start)) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean wellFormed() {
        return start != null && end != null && !end.isBefore(start);
    }
}
