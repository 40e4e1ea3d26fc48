package com.example.shifthybrid.constraint;

/**
 * Static catalog of constraint kinds. Lower priority number wins a contended cell.
 * <p>
 * Tier 1 kinds must never be violated in returned output, tier 2 kinds are
 * repaired when possible, tier 3 kinds are best effort.
 */
public enum ConstraintKind {
    // Tier 1
    CALENDAR_MUST_WORK(1, 1, true, "All staff work a normal shift on must-work dates"),
    CALENDAR_MUST_DAY_OFF(2, 1, true, "Staff are off (or early when eligible) on must-day-off dates"),
    SHIFT_ELIGIBILITY(3, 1, true, "Early and late shifts only for staff permitted to work them"),
    CONSECUTIVE_WORK_LIMIT(4, 1, true, "Maximum number of consecutive working days"),
    MONTHLY_LIMIT(5, 1, true, "Per-staff shift count over the period"),
    DAILY_LIMIT(6, 1, true, "Per-date shift count across staff"),
    STAFF_GROUP_CONFLICT(7, 1, true, "Group members may not be off or early together"),
    // Tier 2
    WEEKLY_LIMIT(8, 2, false, "Per-staff shift count in rolling windows"),
    BACKUP_COVERAGE(9, 2, false, "Backup staff works the required shift when a group member is off"),
    PROXIMITY_PATTERN(10, 2, false, "Target staff takes a day off near the trigger staff's day off"),
    ALLOW_ONLY_SHIFTS(11, 2, false, "Only the listed shifts are permitted"),
    AVOID_SHIFT_WITH_EXCEPTIONS(12, 2, false, "Avoid a shift, replacing it with one of the allowed exceptions"),
    AVOID_SHIFT(13, 2, false, "Avoid the listed shifts"),
    // Tier 3
    PREFERRED_SHIFT(14, 3, false, "Preferred shift on the listed days"),
    REQUIRED_OFF(15, 3, false, "Day off on the listed days"),
    FAIR_DISTRIBUTION(16, 3, false, "Off days spread evenly across staff");

    private final int priority;
    private final int defaultTier;
    private final boolean hardByDefault;
    private final String description;

    ConstraintKind(int priority, int defaultTier, boolean hardByDefault, String description) {
        this.priority = priority;
        this.defaultTier = defaultTier;
        this.hardByDefault = hardByDefault;
        this.description = description;
    }

    public int priority() {
        return priority;
    }

    public int defaultTier() {
        return defaultTier;
    }

    public boolean hardByDefault() {
        return hardByDefault;
    }

    public String description() {
        return description;
    }
}
