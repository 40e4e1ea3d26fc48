package com.example.shifthybrid.constraint;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static Severity of(int tier, boolean hard) {
        if (tier <= 1) {
            return hard ? CRITICAL : HIGH;
        }
        return tier == 2 ? MEDIUM : LOW;
    }
}
