package com.example.shiftplanner.employee;

public enum AbsenceType {
    VACATION,
    SICK,
    TRAINING,
    PERSONAL
}
