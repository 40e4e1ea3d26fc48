package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.PriorityRule;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies priority rules cell by cell. On a cell several rules apply to, the
 * highest-precedence rule decides first and a lower one may only change the value to
 * something every higher rule still accepts. The cell is claimed for the
 * highest-precedence kind.
 */
public class PriorityRuleStage implements GenerationStage {

    private final String name;

    public PriorityRuleStage(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int apply(GenerationContext context) {
        RosterContext roster = context.roster();
        List<PriorityRule> rules = inPrecedenceOrder(roster);
        if (rules.isEmpty()) {
            return 0;
        }
        int changed = 0;
        for (String staffId : roster.staffIds()) {
            Staff staff = roster.staff(staffId);
            for (LocalDate date : roster.dates()) {
                DateCell cell = DateCell.of(staffId, date);
                if (context.schedule().isLocked(cell)) {
                    continue;
                }
                List<PriorityRule> applicable = rules.stream()
                        .filter(r -> r.appliesTo(staffId, date))
                        .toList();
                if (applicable.isEmpty()) {
                    continue;
                }
                ShiftValue value = resolve(applicable, context.schedule().valueAt(cell), staff, context);
                if (context.write(cell, value, applicable.get(0).primaryKind())) {
                    changed++;
                }
            }
        }
        return changed;
    }

    private ShiftValue resolve(List<PriorityRule> applicable, ShiftValue current, Staff staff, GenerationContext context) {
        ShiftValue value = current;
        List<PriorityRule> decided = new ArrayList<>();
        for (PriorityRule rule : applicable) {
            value = rule.enforce(value, staff, context.random(),
                    candidate -> decided.stream().allMatch(r -> r.satisfiedBy(candidate)));
            decided.add(rule);
        }
        return value;
    }

    /** Highest precedence first; declaration order within a kind. */
    static List<PriorityRule> inPrecedenceOrder(RosterContext roster) {
        return roster.snapshot().ofType(PriorityRule.class).stream()
                .filter(r -> r.ruleType() != null)
                .sorted(Comparator.comparingInt((PriorityRule r) -> r.primaryKind().priority())
                        .thenComparingInt(roster::declarationIndex))
                .toList();
    }
}
