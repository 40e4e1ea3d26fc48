package com.example.shifthybrid.schedule;

import java.time.LocalDate;

public record CellChange(DateCell cell, ShiftValue value) {

    public static CellChange of(String staffId, LocalDate date, ShiftValue value) {
        return new CellChange(DateCell.of(staffId, date), value);
    }
}
