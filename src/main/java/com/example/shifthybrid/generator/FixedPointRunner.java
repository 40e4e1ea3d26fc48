package com.example.shifthybrid.generator;

import com.example.shifthybrid.schedule.CancellationToken;
import com.example.shifthybrid.schedule.StageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-runs a sequence of stages until one full pass changes no cell, or the iteration
 * bound is hit.
 */
public class FixedPointRunner {

    private static final Logger logger = LoggerFactory.getLogger(FixedPointRunner.class);

    private final int maxIterations;

    public FixedPointRunner(int maxIterations) {
        this.maxIterations = Math.max(1, maxIterations);
    }

    public Result run(List<GenerationStage> stages, GenerationContext context, CancellationToken token) {
        List<StageReport> reports = new ArrayList<>();
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            int changedInPass = 0;
            for (GenerationStage stage : stages) {
                token.throwIfCancelled(stage.name());
                long started = System.nanoTime();
                int changed = stage.apply(context);
                logger.debug("Stage {} (pass {}) changed {} cells in {} us", stage.name(), iteration, changed,
                        (System.nanoTime() - started) / 1_000);
                reports.add(new StageReport(stage.name(), iteration, changed));
                changedInPass += changed;
            }
            if (changedInPass == 0) {
                return new Result(reports, iteration, true);
            }
        }
        logger.info("Generator stopped after {} passes without reaching a fixed point", maxIterations);
        return new Result(reports, maxIterations, false);
    }

    public record Result(List<StageReport> reports, int iterations, boolean converged) {
    }
}
