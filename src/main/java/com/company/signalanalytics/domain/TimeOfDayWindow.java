package com.company.signalanalytics.domain;

import lombok.Value;

import java.time.LocalTime;

/**
 * Inclusive time-of-day window with minute precision.
 */
@Value
public class TimeOfDayWindow {

    public static final LocalTime DAY_START = LocalTime.MIDNIGHT;
    public static final LocalTime DAY_END = LocalTime.of(23, 59);
    public static final TimeOfDayWindow FULL_DAY = new TimeOfDayWindow(DAY_START, DAY_END);

    LocalTime start;
    LocalTime end;

    public static TimeOfDayWindow of(int startHour, int startMinute, int endHour, int endMinute) {
        return new TimeOfDayWindow(LocalTime.of(startHour, startMinute), LocalTime.of(endHour, endMinute));
    }

    public boolean isFullDay() {
        return !start.isAfter(DAY_START) && !end.isBefore(DAY_END);
    }

    /**
     * True when the window covers whole hours only, e.g. 06:00-18:59.
     */
    public boolean isHourAligned() {
        return start.getMinute() == 0 && end.getMinute() == 59;
    }
}
