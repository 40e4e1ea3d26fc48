package com.example.shifthybrid.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to a schedule grid, used by validation and constraint evaluation.
 */
public interface ScheduleView {

    ShiftValue valueAt(String staffId, LocalDate date);

    default ShiftValue valueAt(DateCell cell) {
        return valueAt(cell.staffId(), cell.date());
    }

    List<String> staffIds();

    List<LocalDate> dates();
}
