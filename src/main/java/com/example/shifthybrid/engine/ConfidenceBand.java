package com.example.shifthybrid.engine;

public enum ConfidenceBand {
    HIGH,
    MEDIUM,
    LOW,
    UNAVAILABLE
}
