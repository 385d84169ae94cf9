package com.company.signalanalytics.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Normalized dashboard filter state for one request.
 */
@Value
@Builder(toBuilder = true)
public class FilterSpec {

    DateRange dateRange;

    // null or FULL_DAY both mean no time-of-day restriction
    TimeOfDayWindow timeOfDay;

    // ISO weekdays 1-7, empty means every day
    @Builder.Default
    Set<Integer> daysOfWeek = Set.of();

    @Builder.Default
    EntitySelection entities = EntitySelection.unrestricted();

    boolean removeAnomalies;

    public FilterSpec withDateRange(DateRange range) {
        return toBuilder().dateRange(range).build();
    }

    public boolean hasTimeOfDayRestriction() {
        return timeOfDay != null && !timeOfDay.isFullDay();
    }
}
