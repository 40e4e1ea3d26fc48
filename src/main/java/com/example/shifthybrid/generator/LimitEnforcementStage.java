package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.Constraint;
import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.ConsecutiveWorkLimit;
import com.example.shifthybrid.constraint.DailyLimit;
import com.example.shifthybrid.constraint.MonthlyLimit;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.constraint.WeeklyLimit;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Consecutive, monthly, daily and weekly limits, in that order.
 * <p>
 * Each violation is fixed one cell (or one pair of cells) at a time. A change is kept
 * only if it shrinks the limit's own violations without adding tier-1 violations
 * elsewhere. Over-quota cells of a daily limit are moved to the least-loaded other day
 * of the same staff member when possible, so per-staff totals stay put.
 */
public class LimitEnforcementStage implements GenerationStage {

    private static final int REDISTRIBUTION_CANDIDATES = 5;

    @Override
    public String name() {
        return "limits";
    }

    @Override
    public int apply(GenerationContext context) {
        int changed = 0;
        for (Constraint limit : inEnforcementOrder(context.roster())) {
            changed += enforce(context, limit);
        }
        return changed;
    }

    static List<Constraint> inEnforcementOrder(RosterContext roster) {
        List<Constraint> limits = new ArrayList<>();
        limits.addAll(roster.snapshot().ofType(ConsecutiveWorkLimit.class));
        limits.addAll(roster.snapshot().ofType(MonthlyLimit.class));
        limits.addAll(roster.snapshot().ofType(DailyLimit.class));
        limits.addAll(roster.snapshot().ofType(WeeklyLimit.class));
        return limits;
    }

    private int enforce(GenerationContext context, Constraint limit) {
        int changed = 0;
        int guard = context.roster().staffIds().size() * context.roster().dates().size();
        while (guard-- > 0) {
            List<Violation> violations = limit.evaluate(context.schedule(), context.roster());
            int fixed = 0;
            for (Violation violation : violations) {
                fixed = fix(context, limit, violation);
                if (fixed > 0) {
                    break;
                }
            }
            if (fixed == 0) {
                break;
            }
            changed += fixed;
        }
        return changed;
    }

    private int fix(GenerationContext context, Constraint limit, Violation violation) {
        long ownBefore = context.ownMass(limit);
        long othersBefore = context.violationMass(v -> v.tier() == 1, limit);
        for (List<CellChange> move : candidateMoves(context, limit, violation)) {
            int size = changedCells(context.schedule(), move);
            boolean applied = context.tryApply(move, limit.primaryKind(),
                    () -> context.ownMass(limit) < ownBefore
                            && context.violationMass(v -> v.tier() == 1, limit) <= othersBefore);
            if (applied) {
                return size;
            }
        }
        return 0;
    }

    private List<List<CellChange>> candidateMoves(GenerationContext context, Constraint limit, Violation violation) {
        if (violation.cells().isEmpty()) {
            return List.of();
        }
        if (limit instanceof ConsecutiveWorkLimit consecutive) {
            return breakStreak(context, consecutive, violation.cells());
        }
        ShiftValue shift = shiftOf(limit);
        Schedule schedule = context.schedule();
        boolean overMax = schedule.valueAt(violation.cells().get(0)) == shift;
        if (overMax) {
            return reduce(context, limit, shift, violation.cells());
        }
        return raise(context, limit, shift, violation.cells());
    }

    private List<List<CellChange>> breakStreak(GenerationContext context, ConsecutiveWorkLimit limit,
                                               List<DateCell> streak) {
        int pivot = Math.min(limit.maxConsecutiveDays(), streak.size() - 1);
        List<List<CellChange>> moves = new ArrayList<>();
        streak.stream()
                .sorted(Comparator.comparingInt((DateCell c) -> context.claimPriority(c)).reversed()
                        .thenComparingInt(c -> Math.abs(streak.indexOf(c) - pivot)))
                .forEach(c -> moves.add(List.of(new CellChange(c, ShiftValue.OFF))));
        return moves;
    }

    /** Over-quota cells: move to another day first (daily limits), then plain replacement. */
    private List<List<CellChange>> reduce(GenerationContext context, Constraint limit, ShiftValue shift,
                                          List<DateCell> cells) {
        Schedule schedule = context.schedule();
        List<DateCell> ordered = cells.stream()
                .sorted(Comparator.comparingInt((DateCell c) -> context.claimPriority(c)).reversed()
                        .thenComparing(Comparator.comparingInt(
                                (DateCell c) -> schedule.count(c.staffId(), shift)).reversed()))
                .toList();
        List<List<CellChange>> moves = new ArrayList<>();
        for (DateCell cell : ordered) {
            Staff staff = context.staff(cell.staffId());
            Optional<ShiftValue> replacement = replacementFor(shift, staff);
            if (replacement.isEmpty()) {
                continue;
            }
            CellChange release = new CellChange(cell, replacement.get());
            if (limit instanceof DailyLimit) {
                for (LocalDate target : leastLoadedDays(context, cell, shift)) {
                    moves.add(List.of(release, CellChange.of(cell.staffId(), target, shift)));
                }
            }
            moves.add(List.of(release));
        }
        return moves;
    }

    /** Under-quota: hand the shift to the least-loaded staff (daily) or the least-loaded day (per staff). */
    private List<List<CellChange>> raise(GenerationContext context, Constraint limit, ShiftValue shift,
                                         List<DateCell> cells) {
        Schedule schedule = context.schedule();
        Comparator<DateCell> load = limit instanceof DailyLimit
                ? Comparator.comparingInt((DateCell c) -> schedule.count(c.staffId(), shift))
                : Comparator.comparingInt((DateCell c) -> schedule.countOn(c.date(), shift));
        return cells.stream()
                .filter(c -> context.staff(c.staffId()).mayWork(shift))
                .sorted(Comparator.comparingInt((DateCell c) -> context.claimPriority(c)).reversed()
                        .thenComparing(load))
                .map(c -> List.of(new CellChange(c, shift)))
                .toList();
    }

    private List<LocalDate> leastLoadedDays(GenerationContext context, DateCell from, ShiftValue shift) {
        Schedule schedule = context.schedule();
        RosterContext roster = context.roster();
        return roster.dates().stream()
                .filter(d -> !d.equals(from.date()) && !roster.isMandateDate(d))
                .filter(d -> schedule.valueAt(from.staffId(), d) != shift)
                .filter(d -> context.canWrite(DateCell.of(from.staffId(), d), ConstraintKind.DAILY_LIMIT))
                .sorted(Comparator.comparingInt((LocalDate d) -> context.claimPriority(DateCell.of(from.staffId(), d)))
                        .reversed()
                        .thenComparingInt(d -> schedule.countOn(d, shift)))
                .limit(REDISTRIBUTION_CANDIDATES)
                .toList();
    }

    static Optional<ShiftValue> replacementFor(ShiftValue shift, Staff staff) {
        if (shift != ShiftValue.NORMAL) {
            return Optional.of(ShiftValue.NORMAL);
        }
        for (ShiftValue candidate : List.of(ShiftValue.LATE, ShiftValue.EARLY, ShiftValue.OFF)) {
            if (staff.mayWork(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static ShiftValue shiftOf(Constraint limit) {
        if (limit instanceof DailyLimit daily) {
            return daily.shift();
        }
        if (limit instanceof WeeklyLimit weekly) {
            return weekly.shift();
        }
        return ((MonthlyLimit) limit).shift();
    }

    private static int changedCells(Schedule schedule, List<CellChange> move) {
        return (int) move.stream().filter(c -> schedule.valueAt(c.cell()) != c.value()).count();
    }
}
