package com.example.shifthybrid.repair;

import com.example.shifthybrid.constraint.Violation;

import java.util.List;

/**
 * Outcome of the repair loop. {@code unresolved} holds what was left after the last pass.
 */
public record RepairSummary(int passes, int attempts, int repaired, List<RepairAction> actions,
                            List<Violation> unresolved) {

    public RepairSummary {
        actions = List.copyOf(actions);
        unresolved = List.copyOf(unresolved);
    }

    public static RepairSummary nothingToRepair() {
        return new RepairSummary(0, 0, 0, List.of(), List.of());
    }
}
