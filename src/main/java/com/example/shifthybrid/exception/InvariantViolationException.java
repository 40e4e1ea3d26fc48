package com.example.shifthybrid.exception;

import com.example.shifthybrid.schedule.DateCell;

import java.util.List;

/**
 * Engine bug: a locked cell was written or a tier-1 violation survived repair.
 * Always aborts the run.
 */
public class InvariantViolationException extends ScheduleGenerationException {

    public InvariantViolationException(String constraintId, String message, List<DateCell> affectedCells) {
        super("INVARIANT_VIOLATION", message, constraintId, affectedCells);
    }
}
