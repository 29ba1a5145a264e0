package com.example.shiftplanner.constraint;

import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.employee.WorkingHourRule;

/**
 * Effective labor limits for one employee: the active rule of the employee's
 * contract type, else the employee's own fields.
 */
public record LaborLimits(
        int maxConsecutiveDays,
        int maxHoursPerWeek,
        int maxHoursPerDay,
        int minRestHours,
        boolean weekendWorkAllowed,
        int maxConsecutiveNights,
        int maxNightsPerWeek
) {
    private static final int DEFAULT_CONSECUTIVE_DAYS = 6;
    private static final int DEFAULT_WEEKLY_HOURS = 40;
    private static final int DEFAULT_DAILY_HOURS = 10;
    private static final int DEFAULT_REST_HOURS = 11;
    private static final int DEFAULT_CONSECUTIVE_NIGHTS = 3;
    private static final int DEFAULT_NIGHTS_PER_WEEK = 4;

    public static LaborLimits resolve(Employee employee, WorkingHourRule rule) {
        if (rule != null) {
            return new LaborLimits(
                    orDefault(rule.getMaxConsecutiveDays(), DEFAULT_CONSECUTIVE_DAYS),
                    orDefault(rule.getMaxHoursPerWeek(), DEFAULT_WEEKLY_HOURS),
                    orDefault(rule.getMaxHoursPerDay(), DEFAULT_DAILY_HOURS),
                    orDefault(rule.getMinHoursBetweenShifts(), DEFAULT_REST_HOURS),
                    !Boolean.FALSE.equals(rule.getWeekendWorkAllowed()),
                    orDefault(rule.getMaxConsecutiveNights(), DEFAULT_CONSECUTIVE_NIGHTS),
                    orDefault(rule.getMaxNightsPerWeek(), DEFAULT_NIGHTS_PER_WEEK));
        }
        return new LaborLimits(
                orDefault(employee.getMaxConsecutiveDays(), DEFAULT_CONSECUTIVE_DAYS),
                orDefault(employee.getWeeklyHours(), DEFAULT_WEEKLY_HOURS),
                orDefault(employee.getMaxHoursPerDay(), DEFAULT_DAILY_HOURS),
                orDefault(employee.getMinRestHours(), DEFAULT_REST_HOURS),
                true,
                DEFAULT_CONSECUTIVE_NIGHTS,
                DEFAULT_NIGHTS_PER_WEEK);
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
