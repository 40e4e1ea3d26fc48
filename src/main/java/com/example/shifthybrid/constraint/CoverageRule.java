package com.example.shifthybrid.constraint;

import com.example.shifthybrid.schedule.ShiftValue;

/**
 * When any member of the group is off, {@code backupStaffId} works {@code requiredShift}.
 */
public record CoverageRule(String backupStaffId, ShiftValue requiredShift) {

    public CoverageRule {
        requiredShift = requiredShift == null ? ShiftValue.NORMAL : requiredShift;
    }
}
