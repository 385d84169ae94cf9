package com.company.signalanalytics.domain;

import lombok.Value;

/**
 * Before and after date ranges that share every other predicate.
 */
@Value
public class ComparisonWindows {
    DateRange before;
    DateRange after;

    public DateRange longer() {
        return after.days() > before.days() ? after : before;
    }

    public DateRange envelope() {
        return before.envelope(after);
    }
}
