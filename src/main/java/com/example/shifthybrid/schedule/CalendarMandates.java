package com.example.shifthybrid.schedule;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Calendar rules for the run: dates everybody works and dates everybody is off.
 */
public record CalendarMandates(List<LocalDate> mustWork, List<LocalDate> mustOff) {

    public CalendarMandates {
        mustWork = mustWork == null ? List.of() : List.copyOf(new TreeSet<>(mustWork));
        mustOff = mustOff == null ? List.of() : List.copyOf(new TreeSet<>(mustOff));
    }

    public static CalendarMandates none() {
        return new CalendarMandates(List.of(), List.of());
    }

    public Set<LocalDate> mandateDates() {
        Set<LocalDate> dates = new TreeSet<>(mustWork);
        dates.addAll(mustOff);
        return dates;
    }
}
