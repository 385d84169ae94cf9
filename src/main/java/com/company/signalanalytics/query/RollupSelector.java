package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.DateRange;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.TimeOfDayWindow;
import com.company.signalanalytics.domain.enums.RollupTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Maps a query span to the storage tier that answers it.
 */
@Component
@Slf4j
public class RollupSelector {

    static final int HOURLY_MIN_DAYS = 4;
    static final int DAILY_MIN_DAYS = 8;

    /**
     * Span rule: fewer than 4 days reads raw facts, 4 to 7 days hourly
     * rollups, anything longer daily rollups.
     */
    public RollupTier select(LocalDate startDate, LocalDate endDate) {
        long days = DateRange.of(startDate, endDate).days();
        if (days < HOURLY_MIN_DAYS) {
            return RollupTier.RAW;
        }
        if (days < DAILY_MIN_DAYS) {
            return RollupTier.HOURLY;
        }
        return RollupTier.DAILY;
    }

    /**
     * Same rule for ISO date strings; unparsable input selects RAW.
     * Request validation rejects such dates before any query is built, so
     * this only picks the least aggregated tier and never widens a filter.
     */
    public RollupTier select(String startDate, String endDate) {
        if (startDate == null || endDate == null) {
            log.warn("Missing date span {}..{}, selecting RAW tier", startDate, endDate);
            return RollupTier.RAW;
        }
        try {
            return select(LocalDate.parse(startDate), LocalDate.parse(endDate));
        } catch (DateTimeParseException e) {
            log.warn("Unparsable date span {}..{}, selecting RAW tier", startDate, endDate);
            return RollupTier.RAW;
        }
    }

    public RollupTier select(FilterSpec spec) {
        return select(spec.getDateRange(), spec, false);
    }

    /**
     * Tier for a span under the rest of a filter. The span tier is stepped
     * down to a finer one while it cannot honor the filter: a sub-day window
     * the tier's buckets would split, a time-of-day axis on daily rows, or an
     * anomaly exclusion that only raw rows carry a flag for.
     */
    public RollupTier select(DateRange span, FilterSpec spec, boolean timeOfDayAxis) {
        RollupTier spanTier = select(span.getStart(), span.getEnd());
        RollupTier tier = spanTier;

        TimeOfDayWindow window = spec.getTimeOfDay();
        while (!tier.supports(window)) {
            tier = tier.finer();
        }
        if (timeOfDayAxis && !tier.hasTimeOfDay()) {
            tier = tier.finer();
        }
        if (spec.isRemoveAnomalies()) {
            tier = RollupTier.RAW;
        }

        if (tier != spanTier) {
            log.debug("Stepped tier down from {} to {} for span {}..{}", spanTier, tier,
                    span.getStart(), span.getEnd());
        }
        return tier;
    }
}
