package com.example.shifthybrid.staff;

import com.example.shifthybrid.schedule.ShiftValue;
import jakarta.validation.constraints.NotBlank;

/**
 * Roster entry as supplied by the caller. Read-only to the engine.
 * <p>
 * Normal and off are always permitted; early and late need the matching flag.
 */
public record Staff(
        @NotBlank String id,
        String name,
        EmploymentCategory employmentCategory,
        boolean mayWorkEarly,
        boolean mayWorkLate
) {
    public Staff {
        name = name == null ? id : name;
        employmentCategory = employmentCategory == null ? EmploymentCategory.REGULAR : employmentCategory;
    }

    public static Staff of(String id, boolean mayWorkEarly) {
        return new Staff(id, id, EmploymentCategory.REGULAR, mayWorkEarly, true);
    }

    public boolean mayWork(ShiftValue value) {
        if (value == null) {
            return false;
        }
        return switch (value) {
            case EARLY -> mayWorkEarly;
            case LATE -> mayWorkLate;
            case OFF, NORMAL -> true;
        };
    }
}
