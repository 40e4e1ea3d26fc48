package com.example.shifthybrid.repair;

import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.validation.ScheduleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Works through violations in priority order and keeps a candidate move only when it
 * touches no locked cell, adds no tier-1 violation and strictly lowers the weighted
 * violation score counted per affected cell. Stops after {@code engine.repair.max-passes} passes or the first
 * pass that repairs nothing.
 */
@Component
public class ViolationRepairEngine {

    private static final Logger logger = LoggerFactory.getLogger(ViolationRepairEngine.class);

    private final ScheduleValidator validator;
    private final EngineSettings settings;
    private final RepairMoveFactory moveFactory = new RepairMoveFactory();

    public ViolationRepairEngine(ScheduleValidator validator, EngineSettings settings) {
        this.validator = validator;
        this.settings = settings;
    }

    /**
     * @param tierOneOnly repair only tier-1 violations, leaving softer ones as they are
     */
    public RepairSummary repair(Schedule schedule, RosterContext context, boolean tierOneOnly) {
        List<Violation> current = validator.violations(schedule, context);
        if (current.isEmpty()) {
            return RepairSummary.nothingToRepair();
        }
        List<RepairAction> actions = new ArrayList<>();
        int attempts = 0;
        int passes = 0;
        for (int pass = 1; pass <= settings.getRepairMaxPasses(); pass++) {
            passes = pass;
            int repairedThisPass = 0;
            List<Violation> targets = current.stream()
                    .filter(v -> !tierOneOnly || v.mandatory())
                    .toList();
            for (Violation queued : targets) {
                Violation target = reshaped(queued, current);
                // a limit over by several cells takes one move per cell
                int budget = Math.max(1, queued.cells().size());
                while (target != null && budget-- > 0) {
                    RepairMove kept = null;
                    List<Violation> after = null;
                    for (RepairMove move : moveFactory.candidates(target, schedule, context)) {
                        attempts++;
                        after = tryMove(schedule, context, move, current);
                        if (after != null) {
                            kept = move;
                            break;
                        }
                    }
                    if (kept == null) {
                        break;
                    }
                    actions.add(new RepairAction(pass, target.constraintId(), target.kind(), kept.changes(),
                            validator.weightedMass(current), validator.weightedMass(after)));
                    logger.debug("Repaired {}: {}", target.constraintId(), kept.description());
                    current = after;
                    repairedThisPass++;
                    target = reshaped(target, current);
                }
            }
            if (repairedThisPass == 0 || current.isEmpty()) {
                break;
            }
        }
        logger.debug("Repair: {} move(s) kept out of {} tried in {} pass(es), {} violation(s) left",
                actions.size(), attempts, passes, current.size());
        return new RepairSummary(passes, attempts, actions.size(), actions, current);
    }

    /** Applies the move and returns the new violations, or rolls back and returns null. */
    private List<Violation> tryMove(Schedule schedule, RosterContext context, RepairMove move, List<Violation> before) {
        for (CellChange change : move.changes()) {
            if (schedule.isLocked(change.cell())) {
                return null;
            }
        }
        List<CellChange> undo = new ArrayList<>();
        for (CellChange change : move.changes()) {
            undo.add(new CellChange(change.cell(), schedule.valueAt(change.cell())));
            schedule.assign(change.cell(), change.value());
        }
        List<Violation> after = validator.violations(schedule, context);
        if (tierOneCount(after) <= tierOneCount(before)
                && validator.weightedMass(after) < validator.weightedMass(before)) {
            return after;
        }
        for (int i = undo.size() - 1; i >= 0; i--) {
            schedule.assign(undo.get(i).cell(), undo.get(i).value());
        }
        return null;
    }

    /** The target as it stands now: unchanged, narrowed by an earlier move, or gone. */
    private static Violation reshaped(Violation target, List<Violation> current) {
        if (current.contains(target)) {
            return target;
        }
        return current.stream().filter(target::sameIssueAs).findFirst().orElse(null);
    }

    private static long tierOneCount(List<Violation> violations) {
        return violations.stream().filter(Violation::mandatory).count();
    }
}
