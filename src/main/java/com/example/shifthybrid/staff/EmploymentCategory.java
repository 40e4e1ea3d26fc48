package com.example.shifthybrid.staff;

public enum EmploymentCategory {
    REGULAR,
    PART_TIME
}
