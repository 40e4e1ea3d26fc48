package com.example.shifthybrid.repair;

import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.schedule.CellChange;

import java.util.List;

/**
 * An accepted move, kept for the report.
 */
public record RepairAction(int pass, String constraintId, ConstraintKind kind, List<CellChange> changes,
                           long scoreBefore, long scoreAfter) {
}
