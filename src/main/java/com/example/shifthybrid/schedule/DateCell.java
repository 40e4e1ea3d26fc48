package com.example.shifthybrid.schedule;

import java.time.LocalDate;
import java.util.Objects;

public record DateCell(String staffId, LocalDate date) {
    public DateCell {
        Objects.requireNonNull(staffId, "staffId");
        Objects.requireNonNull(date, "date");
    }

    public static DateCell of(String staffId, LocalDate date) {
        return new DateCell(staffId, date);
    }

    @Override
    public String toString() {
        return staffId + ":" + date;
    }
}
