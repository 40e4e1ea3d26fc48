package com.example.shifthybrid.constraint;

public enum PriorityRuleType {
    PREFERRED_SHIFT(ConstraintKind.PREFERRED_SHIFT),
    AVOID_SHIFT(ConstraintKind.AVOID_SHIFT),
    AVOID_SHIFT_WITH_EXCEPTIONS(ConstraintKind.AVOID_SHIFT_WITH_EXCEPTIONS),
    ALLOW_ONLY_SHIFTS(ConstraintKind.ALLOW_ONLY_SHIFTS),
    REQUIRED_OFF(ConstraintKind.REQUIRED_OFF);

    private final ConstraintKind kind;

    PriorityRuleType(ConstraintKind kind) {
        this.kind = kind;
    }

    public ConstraintKind kind() {
        return kind;
    }
}
