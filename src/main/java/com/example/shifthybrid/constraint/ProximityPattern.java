package com.example.shifthybrid.constraint;

/**
 * A day off of {@code triggerStaffId} needs a day off of {@code targetStaffId}
 * no more than {@code withinDays} days away.
 */
public record ProximityPattern(String triggerStaffId, String targetStaffId, int withinDays) {
}
