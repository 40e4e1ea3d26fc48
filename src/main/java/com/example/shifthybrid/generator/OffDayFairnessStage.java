package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.ConstraintKind;
import com.example.shifthybrid.constraint.MonthlyLimit;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.schedule.CellChange;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.Schedule;
import com.example.shifthybrid.schedule.ShiftValue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreads days off so every staff member ends near the same number of them.
 * <p>
 * Target per staff member is {@code round(days * weeklyRestDays / 7)}, clamped to any
 * monthly off limit covering them. Walking the dates in order, a day off goes to whoever
 * has fallen a full day behind their pro-rata share. Surplus days off (from a predictor
 * seed, say) are given back from the end of the period. A change is only made when it
 * adds no tier-1 or tier-2 violation, and claimed cells are never touched.
 */
public class OffDayFairnessStage implements GenerationStage {

    @Override
    public String name() {
        return "off-day-fairness";
    }

    @Override
    public int apply(GenerationContext context) {
        RosterContext roster = context.roster();
        List<String> staffIds = roster.staffIds();
        List<LocalDate> dates = roster.dates();
        if (staffIds.isEmpty() || dates.isEmpty()) {
            return 0;
        }
        Map<String, Integer> targets = targets(context);
        int changed = place(context, staffIds, dates, targets);
        changed += giveBack(context, staffIds, dates, targets);
        return changed;
    }

    Map<String, Integer> targets(GenerationContext context) {
        RosterContext roster = context.roster();
        int days = roster.dates().size();
        int base = (int) Math.round(days * context.weeklyRestDays() / 7.0);
        Map<String, Integer> targets = new LinkedHashMap<>();
        for (String staffId : roster.staffIds()) {
            int target = base;
            for (MonthlyLimit limit : roster.snapshot().ofType(MonthlyLimit.class)) {
                if (limit.shift() != ShiftValue.OFF || !roster.resolveScope(limit.scope()).contains(staffId)) {
                    continue;
                }
                if (limit.max() != null) {
                    target = Math.min(target, limit.max());
                }
                if (limit.min() != null) {
                    target = Math.max(target, limit.min());
                }
            }
            targets.put(staffId, target);
        }
        return targets;
    }

    private int place(GenerationContext context, List<String> staffIds, List<LocalDate> dates,
                      Map<String, Integer> targets) {
        Schedule schedule = context.schedule();
        int days = dates.size();
        int changed = 0;
        long protectedMass = protectedMass(context);
        for (int i = 0; i < days; i++) {
            LocalDate date = dates.get(i);
            if (context.roster().isMandateDate(date)) {
                continue;
            }
            List<String> behind = new ArrayList<>();
            Map<String, Double> deficits = new LinkedHashMap<>();
            for (int s = 0; s < staffIds.size(); s++) {
                String staffId = staffIds.get(s);
                int target = targets.get(staffId);
                if (schedule.count(staffId, ShiftValue.OFF) >= target) {
                    continue;
                }
                // staggered so that staff do not all fall behind on the same day
                double phase = (double) s / staffIds.size();
                double deficit = target * (i + 1) / (double) days + phase - offsUpTo(schedule, staffId, dates, i);
                if (deficit >= 1.0) {
                    behind.add(staffId);
                    deficits.put(staffId, deficit);
                }
            }
            behind.sort(Comparator.comparingDouble((String id) -> deficits.get(id)).reversed());
            for (String staffId : behind) {
                DateCell cell = DateCell.of(staffId, date);
                if (schedule.valueAt(cell) == ShiftValue.OFF) {
                    continue;
                }
                long before = protectedMass;
                if (context.tryApply(List.of(new CellChange(cell, ShiftValue.OFF)), ConstraintKind.FAIR_DISTRIBUTION,
                        () -> protectedMass(context) <= before)) {
                    changed++;
                    protectedMass = protectedMass(context);
                }
            }
        }
        return changed;
    }

    private int giveBack(GenerationContext context, List<String> staffIds, List<LocalDate> dates,
                         Map<String, Integer> targets) {
        Schedule schedule = context.schedule();
        int changed = 0;
        long protectedMass = protectedMass(context);
        for (String staffId : staffIds) {
            int surplus = schedule.count(staffId, ShiftValue.OFF) - targets.get(staffId);
            for (int i = dates.size() - 1; i >= 0 && surplus > 0; i--) {
                DateCell cell = DateCell.of(staffId, dates.get(i));
                if (schedule.valueAt(cell) != ShiftValue.OFF || context.claim(cell) != null) {
                    continue;
                }
                long before = protectedMass;
                if (context.tryApply(List.of(new CellChange(cell, ShiftValue.NORMAL)), ConstraintKind.FAIR_DISTRIBUTION,
                        () -> protectedMass(context) <= before)) {
                    changed++;
                    surplus--;
                    protectedMass = protectedMass(context);
                }
            }
        }
        return changed;
    }

    private static int offsUpTo(Schedule schedule, String staffId, List<LocalDate> dates, int lastIndex) {
        int count = 0;
        for (int i = 0; i <= lastIndex; i++) {
            if (schedule.valueAt(staffId, dates.get(i)) == ShiftValue.OFF) {
                count++;
            }
        }
        return count;
    }

    private static long protectedMass(GenerationContext context) {
        return context.violationMass(v -> v.tier() <= 2, null);
    }
}
