package com.example.shifthybrid.schedule;

import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.engine.ConfidenceBand;
import com.example.shifthybrid.engine.GenerationMethod;
import com.example.shifthybrid.repair.RepairSummary;
import com.example.shifthybrid.validation.FairnessMetrics;

import java.util.List;

/**
 * Everything a run produced. Carries no timestamps, so identical requests with the
 * same seed serialise to identical JSON.
 */
public record GenerationReport(
        ScheduleSnapshot schedule,
        GenerationMethod method,
        ConfidenceBand band,
        Double confidence,
        String predictorNote,
        List<Violation> preRepairViolations,
        RepairSummary repairSummary,
        List<Violation> finalViolations,
        FairnessMetrics metrics,
        List<StageReport> stageReports,
        boolean converged,
        int lockedCellCount,
        String snapshotVersion,
        long rngSeed
) {
    public GenerationReport {
        preRepairViolations = List.copyOf(preRepairViolations);
        finalViolations = List.copyOf(finalViolations);
        stageReports = List.copyOf(stageReports);
    }
}
