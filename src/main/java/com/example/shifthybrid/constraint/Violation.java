package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.DateCell;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * One broken constraint clause and the cells it concerns.
 * <p>
 * Built-in checks (calendar mandates, shift eligibility) use a declaration index of -1.
 */
public record Violation(
        String constraintId,
        ConstraintKind kind,
        int tier,
        boolean hardConstraint,
        Severity severity,
        int priority,
        int declarationIndex,
        int penaltyWeight,
        List<DateCell> cells,
        String message
) {
    public static final Comparator<Violation> PRIORITY_ORDER = Comparator
            .comparingInt(Violation::tier)
            .thenComparingInt(Violation::priority)
            .thenComparingInt(Violation::declarationIndex)
            .thenComparing(Violation::constraintId)
            .thenComparing(v -> v.cells().isEmpty() ? "" : v.cells().get(0).toString())
            .thenComparing(Violation::message);

    private static final int BUILT_IN_WEIGHT = 10;

    public Violation {
        cells = cells == null ? List.of() : List.copyOf(cells);
        message = message == null ? "" : message;
    }

    public static Violation of(Constraint constraint, int declarationIndex, ConstraintKind kind,
                               List<DateCell> cells, String message) {
        int tier = constraint.effectiveTier(kind);
        boolean hard = constraint.effectiveHard(kind);
        return new Violation(constraint.id(), kind, tier, hard, Severity.of(tier, hard), kind.priority(),
                declarationIndex, constraint.effectivePenaltyWeight(), cells, message);
    }

    public static Violation builtIn(ConstraintKind kind, List<DateCell> cells, String message) {
        return new Violation(kind.name().toLowerCase(Locale.ROOT), kind, kind.defaultTier(), kind.hardByDefault(),
                Severity.of(kind.defaultTier(), kind.hardByDefault()), kind.priority(), -1, BUILT_IN_WEIGHT,
                cells, message);
    }

    public boolean mandatory() {
        return tier == 1;
    }

    /** Contribution to the weighted violation score used by repair. */
    public long weight() {
        long tierMultiplier = switch (tier) {
            case 1 -> 10_000L;
            case 2 -> 100L;
            default -> 1L;
        };
        return tierMultiplier * Math.max(1, penaltyWeight);
    }

    /** Weight per affected cell, so a partial fix of a limit still lowers it. */
    public long mass() {
        return weight() * Math.max(1, cells.size());
    }

    /** Same constraint and kind with at least one cell in common. */
    public boolean sameIssueAs(Violation other) {
        return constraintId.equals(other.constraintId) && kind == other.kind
                && other.cells.stream().anyMatch(cells::contains);
    }
}
