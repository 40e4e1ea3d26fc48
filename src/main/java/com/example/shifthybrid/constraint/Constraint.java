package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.ScheduleView;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Closed set of rule kinds the engine understands. Instances are data-driven and
 * read-only for the duration of a run.
 * <p>
 * {@code tier}, {@code hardConstraint} and {@code penaltyWeight} may be left null,
 * in which case the registry defaults of the kind apply.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DailyLimit.class, name = "DAILY_LIMIT"),
        @JsonSubTypes.Type(value = WeeklyLimit.class, name = "WEEKLY_LIMIT"),
        @JsonSubTypes.Type(value = MonthlyLimit.class, name = "MONTHLY_LIMIT"),
        @JsonSubTypes.Type(value = ConsecutiveWorkLimit.class, name = "CONSECUTIVE_WORK_LIMIT"),
        @JsonSubTypes.Type(value = StaffGroupRule.class, name = "STAFF_GROUP_RULE"),
        @JsonSubTypes.Type(value = PriorityRule.class, name = "PRIORITY_RULE")
})
public sealed interface Constraint
        permits DailyLimit, WeeklyLimit, MonthlyLimit, ConsecutiveWorkLimit, StaffGroupRule, PriorityRule {

    int DEFAULT_PENALTY_WEIGHT = 10;

    String id();

    Integer tier();

    Boolean hardConstraint();

    Integer penaltyWeight();

    /** The registry kind this constraint is ranked by when it contends for a cell. */
    ConstraintKind primaryKind();

    List<Violation> evaluate(ScheduleView schedule, RosterContext context);

    default int effectiveTier(ConstraintKind kind) {
        return tier() != null ? tier() : kind.defaultTier();
    }

    default boolean effectiveHard(ConstraintKind kind) {
        if (hardConstraint() != null) {
            return hardConstraint();
        }
        return effectiveTier(kind) == 1 && kind.hardByDefault();
    }

    default int effectivePenaltyWeight() {
        Integer weight = penaltyWeight();
        return weight == null || weight <= 0 ? DEFAULT_PENALTY_WEIGHT : weight;
    }
}
