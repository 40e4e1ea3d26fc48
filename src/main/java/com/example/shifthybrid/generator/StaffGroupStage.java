package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.CoverageRule;
import com.example.shifthybrid.constraint.ProximityPattern;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.StaffGroupRule;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ShiftValue;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Group conflict, backup coverage and proximity clauses of every staff group rule.
 */
public class StaffGroupStage implements GenerationStage {

    @Override
    public String name() {
        return "staff-groups";
    }

    @Override
    public int apply(GenerationContext context) {
        RosterContext roster = context.roster();
        int changed = 0;
        for (StaffGroupRule rule : roster.snapshot().ofType(StaffGroupRule.class)) {
            for (LocalDate date : roster.dates()) {
                if (roster.isMandateDate(date)) {
                    continue;
                }
                if (rule.maxSimultaneousOff() != null) {
                    changed += resolveConflict(context, rule, date);
                }
                if (rule.coverage() != null) {
                    changed += cover(context, rule, date);
                }
                if (rule.proximity() != null) {
                    changed += pairDaysOff(context, rule, date);
                }
            }
        }
        return changed;
    }

    /** Sends members back to a normal shift, lowest-precedence claims first, until the cap holds. */
    private int resolveConflict(GenerationContext context, StaffGroupRule rule, LocalDate date) {
        List<DateCell> away = rule.absentMembers(context.schedule(), date);
        int excess = away.size() - rule.maxSimultaneousOff();
        if (excess <= 0) {
            return 0;
        }
        List<DateCell> candidates = away.stream()
                .sorted(Comparator.comparingInt((DateCell c) -> context.claimPriority(c)).reversed())
                .toList();
        int changed = 0;
        for (DateCell cell : candidates) {
            if (changed == excess) {
                break;
            }
            if (context.write(cell, ShiftValue.NORMAL, ConstraintKind.STAFF_GROUP_CONFLICT)) {
                changed++;
            }
        }
        return changed;
    }

    private int cover(GenerationContext context, StaffGroupRule rule, LocalDate date) {
        if (!rule.coverageNeeded(context.schedule(), date)) {
            return 0;
        }
        CoverageRule coverage = rule.coverage();
        DateCell backup = DateCell.of(coverage.backupStaffId(), date);
        return context.write(backup, coverage.requiredShift(), ConstraintKind.BACKUP_COVERAGE) ? 1 : 0;
    }

    /** Gives the target the nearest day off that keeps tier-1 rules intact. */
    private int pairDaysOff(GenerationContext context, StaffGroupRule rule, LocalDate date) {
        ProximityPattern proximity = rule.proximity();
        if (context.schedule().valueAt(proximity.triggerStaffId(), date) != ShiftValue.OFF
                || rule.targetOffNear(context.schedule(), context.roster(), date)) {
            return 0;
        }
        long tierOneBefore = context.violationMass(v -> v.tier() == 1, null);
        for (DateCell cell : rule.proximityCandidates(context.roster(), date)) {
            boolean applied = context.tryApply(List.of(new CellChange(cell, ShiftValue.OFF)),
                    ConstraintKind.PROXIMITY_PATTERN,
                    () -> context.violationMass(v -> v.tier() == 1, null) <= tierOneBefore);
            if (applied) {
                return 1;
            }
        }
        return 0;
    }
}
