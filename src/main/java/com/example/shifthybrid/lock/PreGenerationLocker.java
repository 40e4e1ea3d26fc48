package com.example.shifthybrid.lock;

import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.exception.ConfigurationException;
import com.example.shifthybrid.schedule.CalendarMandates;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.DateRange;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns calendar mandates into locked cells.
 * <p>
 * Must-work dates lock every staff member to a normal shift. Must-day-off dates lock
 * early-eligible staff to an early shift and everybody else to off.
 */
@Component
public class PreGenerationLocker {

    private static final Logger logger = LoggerFactory.getLogger(PreGenerationLocker.class);

    public LockedCells lock(CalendarMandates mandates, List<Staff> roster, DateRange horizon) {
        if (mandates == null) {
            return LockedCells.none();
        }
        List<LocalDate> conflicting = mandates.mustWork().stream()
                .filter(mandates.mustOff()::contains)
                .toList();
        if (!conflicting.isEmpty()) {
            throw new ConfigurationException("calendar", "Dates are both must-work and must-day-off: " + conflicting);
        }

        Map<DateCell, ShiftValue> values = new LinkedHashMap<>();
        Map<DateCell, ConstraintKind> reasons = new LinkedHashMap<>();
        for (Staff staff : roster) {
            for (LocalDate date : horizon.dates()) {
                DateCell cell = DateCell.of(staff.id(), date);
                if (mandates.mustWork().contains(date)) {
                    values.put(cell, ShiftValue.NORMAL);
                    reasons.put(cell, ConstraintKind.CALENDAR_MUST_WORK);
                } else if (mandates.mustOff().contains(date)) {
                    values.put(cell, mustOffValue(staff));
                    reasons.put(cell, ConstraintKind.CALENDAR_MUST_DAY_OFF);
                }
            }
        }
        logger.debug("Locked {} cells for {} staff between {} and {}", values.size(), roster.size(),
                horizon.start(), horizon.end());
        return new LockedCells(values, reasons);
    }

    /** Value a must-day-off date gets for the staff member. */
    public static ShiftValue mustOffValue(Staff staff) {
        return staff.mayWorkEarly() ? ShiftValue.EARLY : ShiftValue.OFF;
    }
}
