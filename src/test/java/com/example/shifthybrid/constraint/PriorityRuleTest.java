package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityRuleTest {

    private final Staff flexible = Staff.of("s1", true);
    private final Staff noEarly = Staff.of("s2", false);
    private final Random random = new Random(7);

    @Test
    void enforce_satisfiedValue_isKept() {
        PriorityRule avoid = rule(PriorityRuleType.AVOID_SHIFT, List.of(ShiftValue.LATE), List.of());

        assertThat(avoid.enforce(ShiftValue.OFF, flexible, random)).isEqualTo(ShiftValue.OFF);
    }

    @Test
    void enforce_preferred_skipsIneligibleShifts() {
        PriorityRule preferred = rule(PriorityRuleType.PREFERRED_SHIFT,
                List.of(ShiftValue.EARLY, ShiftValue.LATE), List.of());

        assertThat(preferred.enforce(ShiftValue.NORMAL, noEarly, random)).isEqualTo(ShiftValue.LATE);
        assertThat(preferred.enforce(ShiftValue.NORMAL, flexible, random)).isEqualTo(ShiftValue.EARLY);
    }

    @Test
    void enforce_avoid_fallsBackToNormal() {
        PriorityRule avoid = rule(PriorityRuleType.AVOID_SHIFT, List.of(ShiftValue.LATE), List.of());

        assertThat(avoid.enforce(ShiftValue.LATE, flexible, random)).isEqualTo(ShiftValue.NORMAL);
    }

    @Test
    void enforce_avoidWithExceptions_picksAnEligibleException() {
        PriorityRule rule = rule(PriorityRuleType.AVOID_SHIFT_WITH_EXCEPTIONS, List.of(ShiftValue.OFF),
                List.of(ShiftValue.EARLY, ShiftValue.LATE));

        assertThat(rule.enforce(ShiftValue.OFF, noEarly, random)).isEqualTo(ShiftValue.LATE);
        assertThat(rule.enforce(ShiftValue.OFF, flexible, random)).isIn(ShiftValue.EARLY, ShiftValue.LATE);
    }

    @Test
    void enforce_acceptableFilter_narrowsChoices() {
        PriorityRule rule = rule(PriorityRuleType.AVOID_SHIFT_WITH_EXCEPTIONS, List.of(ShiftValue.OFF),
                List.of(ShiftValue.EARLY, ShiftValue.LATE));

        for (int i = 0; i < 10; i++) {
            assertThat(rule.enforce(ShiftValue.OFF, flexible, random, v -> v != ShiftValue.LATE))
                    .isEqualTo(ShiftValue.EARLY);
        }
    }

    @Test
    void enforce_requiredOff_setsOff() {
        PriorityRule rule = rule(PriorityRuleType.REQUIRED_OFF, List.of(), List.of());

        assertThat(rule.enforce(ShiftValue.LATE, noEarly, random)).isEqualTo(ShiftValue.OFF);
        assertThat(rule.primaryKind()).isEqualTo(ConstraintKind.REQUIRED_OFF);
    }

    private static PriorityRule rule(PriorityRuleType type, List<ShiftValue> shifts, List<ShiftValue> allowed) {
        return new PriorityRule("r", null, null, null, type, List.of("s1", "s2"), List.of(), shifts, allowed);
    }
}
