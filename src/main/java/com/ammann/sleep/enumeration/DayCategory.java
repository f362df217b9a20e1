package com.ammann.sleep.enumeration;

import java.time.DayOfWeek;

/**
 * Weekday / weekend partition of nights, decided by the local day of week of the night's end.
 */
public enum DayCategory
{
    WEEKDAY,
    WEEKEND;

    public static DayCategory of(DayOfWeek dayOfWeek) {
        return dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY ? WEEKEND : WEEKDAY;
    }
}
