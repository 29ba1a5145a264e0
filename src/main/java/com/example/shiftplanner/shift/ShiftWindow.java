package com.example.shiftplanner.shift;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A shift's working window measured in minutes from midnight of its work date.
 * When the end time is not after the start time the shift crosses midnight and
 * the end is pushed into the next day by 24h. All overlap and duration
 * arithmetic goes through this type.
 */
public record ShiftWindow(int startMinute, int endMinute) {

    public static final int MINUTES_PER_DAY = 24 * 60;

    public static ShiftWindow of(LocalTime start, LocalTime end) {
        int s = start.getHour() * 60 + start.getMinute();
        int e = end.getHour() * 60 + end.getMinute();
        if (e <= s) {
            e += MINUTES_PER_DAY;
        }
        return new ShiftWindow(s, e);
    }

    public boolean overlaps(ShiftWindow other) {
        return startMinute < other.endMinute && endMinute > other.startMinute;
    }

    public int durationMinutes() {
        return endMinute - startMinute;
    }

    public double durationHours() {
        return durationMinutes() / 60.0;
    }

    public boolean crossesMidnight() {
        return endMinute > MINUTES_PER_DAY;
    }

    public LocalDateTime startOn(LocalDate date) {
        return date.atStartOfDay().plusMinutes(startMinute);
    }

    public LocalDateTime endOn(LocalDate date) {
        return date.atStartOfDay().plusMinutes(endMinute);
    }
}
