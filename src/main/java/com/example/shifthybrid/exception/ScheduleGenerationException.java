package com.example.shifthybrid.exception;

import com.example.shifthybrid.schedule.DateCell;

import java.util.List;

/**
 * Base of every failure a caller can receive instead of a report.
 * Carries the offending constraint id and the affected cells when known.
 */
public class ScheduleGenerationException extends RuntimeException {

    private final String errorCode;
    private final String constraintId;
    private final List<DateCell> affectedCells;

    public ScheduleGenerationException(String message) {
        this("SCHEDULE_GENERATION_ERROR", message, null, List.of());
    }

    public ScheduleGenerationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCHEDULE_GENERATION_ERROR";
        this.constraintId = null;
        this.affectedCells = List.of();
    }

    public ScheduleGenerationException(String errorCode, String message, String constraintId, List<DateCell> affectedCells) {
        super(message);
        this.errorCode = errorCode;
        this.constraintId = constraintId;
        this.affectedCells = affectedCells == null ? List.of() : List.copyOf(affectedCells);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getConstraintId() {
        return constraintId;
    }

    public List<DateCell> getAffectedCells() {
        return affectedCells;
    }
}
