package com.example.shifthybrid.constraint;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Conflict resolution over the static {@link ConstraintKind} catalog. Stateless and
 * shared by concurrent runs.
 */
@Component
public class ConstraintPriorityRegistry {

    private static final Comparator<Violation> RESOLUTION_ORDER = Comparator
            .comparingInt((Violation v) -> v.kind().priority())
            .thenComparingInt(Violation::declarationIndex);

    private final List<KindDescriptor> catalog = Arrays.stream(ConstraintKind.values())
            .map(KindDescriptor::of)
            .toList();

    /**
     * Of several violations on the same cell, the one whose kind wins: lowest priority
     * number, then earliest declaration.
     */
    public Optional<Violation> resolve(List<Violation> violationsOnSameCell) {
        if (violationsOnSameCell == null) {
            return Optional.empty();
        }
        return violationsOnSameCell.stream().min(RESOLUTION_ORDER);
    }

    public boolean isHardConstraint(ConstraintKind kind) {
        return kind.hardByDefault();
    }

    public int tierOf(ConstraintKind kind) {
        return kind.defaultTier();
    }

    public Severity severity(int tier, boolean hard) {
        return Severity.of(tier, hard);
    }

    public Severity severity(ConstraintKind kind) {
        return Severity.of(kind.defaultTier(), kind.hardByDefault());
    }

    public List<KindDescriptor> catalog() {
        return catalog;
    }

    public record KindDescriptor(ConstraintKind kind, int priority, int tier, boolean hardConstraint,
                                 Severity severity, String description) {

        static KindDescriptor of(ConstraintKind kind) {
            return new KindDescriptor(kind, kind.priority(), kind.defaultTier(), kind.hardByDefault(),
                    Severity.of(kind.defaultTier(), kind.hardByDefault()), kind.description());
        }
    }
}
