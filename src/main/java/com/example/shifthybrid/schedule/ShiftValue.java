package com.example.shifthybrid.schedule;

/**
 * Value held by every (staff, date) cell.
 * <p>
 * The symbols are the ones printed on the paper roster: △ early, ◇ late, × off
 * and an empty cell for a normal shift.
 */
public enum ShiftValue {
    EARLY("△"),
    LATE("◇"),
    OFF("×"),
    NORMAL("");

    private final String symbol;

    ShiftValue(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isWorking() {
        return this != OFF;
    }

    /** Off and early both take the staff member away from the normal line. */
    public boolean isOffOrEarly() {
        return this == OFF || this == EARLY;
    }
}
