package com.example.shifthybrid.repair;

import com.example.shifthybrid.schedule.CellChange;

import java.util.List;

/**
 * One candidate correction: a single cell change or a pair changed together.
 */
public record RepairMove(List<CellChange> changes, String description) {

    public RepairMove {
        changes = List.copyOf(changes);
    }

    public static RepairMove single(CellChange change, String description) {
        return new RepairMove(List.of(change), description);
    }

    public static RepairMove pair(CellChange first, CellChange second, String description) {
        return new RepairMove(List.of(first, second), description);
    }
}
