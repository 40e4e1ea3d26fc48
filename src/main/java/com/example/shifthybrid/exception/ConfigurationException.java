package com.example.shifthybrid.exception;

import com.example.shifthybrid.schedule.DateCell;

import java.util.List;

/**
 * Contradictory or malformed constraint snapshot, detected before generation starts.
 */
public class ConfigurationException extends ScheduleGenerationException {

    public ConfigurationException(String constraintId, String message) {
        super("CONFIGURATION_ERROR", message, constraintId, List.of());
    }

    public ConfigurationException(String constraintId, String message, List<DateCell> affectedCells) {
        super("CONFIGURATION_ERROR", message, constraintId, affectedCells);
    }
}
