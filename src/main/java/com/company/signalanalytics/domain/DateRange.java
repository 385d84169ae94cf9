package com.company.signalanalytics.domain;

import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive calendar date range.
 */
@Value
public class DateRange {
    LocalDate start;
    LocalDate end;

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    /**
     * Span in days, end minus start. A single-day range spans 0 days.
     */
    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public DateRange envelope(DateRange other) {
        LocalDate first = start.isBefore(other.start) ? start : other.start;
        LocalDate last = end.isAfter(other.end) ? end : other.end;
        return new DateRange(first, last);
    }
}
