package com.example.shifthybrid.schedule;

/**
 * Cells changed by one stage in one pass. No timing, so reports of identical runs are identical.
 */
public record StageReport(String stage, int pass, int cellsChanged) {
}
