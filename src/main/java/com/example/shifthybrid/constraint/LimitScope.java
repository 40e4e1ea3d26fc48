package com.example.shifthybrid.constraint;

import com.example.shifthybrid.staff.EmploymentCategory;

import java.util.List;

/**
 * Which staff a limit counts. {@code ALL} leaves out coverage backup staff.
 */
public record LimitScope(ScopeType type, String groupName, List<String> staffIds, EmploymentCategory category) {

    public enum ScopeType {
        ALL,
        GROUP,
        STAFF,
        CATEGORY
    }

    public LimitScope {
        type = type == null ? ScopeType.ALL : type;
        staffIds = staffIds == null ? List.of() : List.copyOf(staffIds);
    }

    public static LimitScope all() {
        return new LimitScope(ScopeType.ALL, null, null, null);
    }

    public static LimitScope group(String groupName) {
        return new LimitScope(ScopeType.GROUP, groupName, null, null);
    }

    public static LimitScope staff(String... staffIds) {
        return new LimitScope(ScopeType.STAFF, null, List.of(staffIds), null);
    }

    public static LimitScope category(EmploymentCategory category) {
        return new LimitScope(ScopeType.CATEGORY, null, null, category);
    }
}
