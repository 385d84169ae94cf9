package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ChangeThreshold;
import com.company.signalanalytics.domain.ChangepointRef;
import com.company.signalanalytics.domain.ChangepointTableOptions;
import com.company.signalanalytics.domain.ComparisonWindows;
import com.company.signalanalytics.domain.DateRange;
import com.company.signalanalytics.domain.EntitySelection;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.TimeOfDayWindow;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.ChangepointSort;
import com.company.signalanalytics.domain.enums.GeometryValidity;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.Maintainer;
import com.company.signalanalytics.dto.request.RawFilterParams;
import com.company.signalanalytics.exception.InvalidFilterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validates raw request parameters into a {@link FilterSpec}.
 * Malformed input fails the request with {@link InvalidFilterException};
 * it is never coerced into a wider filter.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FilterRequestParser {

    private static final int ALL_WEEKDAYS = 7;

    // longer digit strings are epoch milliseconds
    private static final int MAX_EPOCH_SECONDS_DIGITS = 11;

    private final SignalAnalyticsProperties properties;

    public FilterSpec parse(RawFilterParams params) {
        DateRange range = dateRange("start_date", params.getStartDate(), "end_date", params.getEndDate());
        return filter(params, range);
    }

    public ComparisonWindows parseComparisonWindows(RawFilterParams params) {
        DateRange before = dateRange("before_start_date", params.getBeforeStartDate(),
                "before_end_date", params.getBeforeEndDate());
        DateRange after = dateRange("after_start_date", params.getAfterStartDate(),
                "after_end_date", params.getAfterEndDate());
        return new ComparisonWindows(before, after);
    }

    /**
     * Filter shared by both comparison windows; its own date range is the
     * envelope of the two and is replaced per window when queries are built.
     */
    public FilterSpec parseForComparison(RawFilterParams params, ComparisonWindows windows) {
        return filter(params, windows.envelope());
    }

    public LegendField parseLegend(String value) {
        if (!StringUtils.hasText(value) || "none".equalsIgnoreCase(value.trim())) {
            return null;
        }
        try {
            return LegendField.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("legend", value, "unknown legend field");
        }
    }

    public AnomalyType parseAnomalyType(String value) {
        if (!StringUtils.hasText(value)) {
            return AnomalyType.ALL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        try {
            return AnomalyType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("anomaly_type", value, "expected 'All' or 'Point Source'");
        }
    }

    /**
     * Percent-change thresholds, defaulted from configuration. Negative input
     * is read as its magnitude.
     */
    public ChangeThreshold parseChangeThreshold(RawFilterParams params) {
        SignalAnalyticsProperties.Changepoints defaults = properties.getChangepoints();
        return ChangeThreshold.of(
                fraction("pct_change_improvement", params.getPctChangeImprovement(), defaults.getDefaultImprovement()),
                fraction("pct_change_degradation", params.getPctChangeDegradation(), defaults.getDefaultDegradation()));
    }

    public ChangepointTableOptions parseChangepointTableOptions(RawFilterParams params) {
        List<String> signals = new ArrayList<>();
        if (params.getSelectedSignals() != null) {
            params.getSelectedSignals().stream()
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .forEach(signals::add);
        }
        return ChangepointTableOptions.builder()
                .selectedSignals(signals)
                .selectedXds(segmentIds("selected_xds", params.getSelectedXds()))
                .sortBy(changepointSort(params.getSortBy()))
                .ascending(ascending(params.getSortDir()))
                .build();
    }

    public ChangepointRef parseChangepoint(RawFilterParams params) {
        if (!StringUtils.hasText(params.getXd())) {
            throw new InvalidFilterException("xd", params.getXd(), "required");
        }
        long xd;
        try {
            xd = Long.parseLong(params.getXd().trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException("xd", params.getXd(), "not a segment id");
        }
        return new ChangepointRef(xd, changeTimestamp(params.getTimestamp()));
    }

    /**
     * Epoch seconds or milliseconds, an ISO instant with offset, or a naive
     * ISO date-time already in warehouse-local time.
     */
    LocalDateTime changeTimestamp(String value) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidFilterException("timestamp", value, "required");
        }
        String trimmed = value.trim();
        ZoneId zone = properties.getTimezone();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                long epoch = Long.parseLong(trimmed);
                Instant instant = trimmed.length() > MAX_EPOCH_SECONDS_DIGITS
                        ? Instant.ofEpochMilli(epoch)
                        : Instant.ofEpochSecond(epoch);
                return LocalDateTime.ofInstant(instant, zone);
            } catch (NumberFormatException | DateTimeException e) {
                throw new InvalidFilterException("timestamp", value, "epoch value out of range");
            }
        }
        String isoText = trimmed.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(isoText).atZoneSameInstant(zone).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(isoText);
            } catch (DateTimeParseException ignored) {
                throw new InvalidFilterException("timestamp", value, "expected epoch seconds or ISO date-time");
            }
        }
    }

    private FilterSpec filter(RawFilterParams params, DateRange range) {
        return FilterSpec.builder()
                .dateRange(range)
                .timeOfDay(timeOfDay(params))
                .daysOfWeek(daysOfWeek(params.getDayOfWeek()))
                .entities(entitySelection(params))
                .removeAnomalies(flag("remove_anomalies", params.getRemoveAnomalies()))
                .build();
    }

    DateRange dateRange(String startName, String startValue, String endName, String endValue) {
        LocalDate start = date(startName, startValue);
        LocalDate end = date(endName, endValue);
        if (end.isBefore(start)) {
            throw new InvalidFilterException(endName, endValue, "before " + startName + " " + start);
        }
        return DateRange.of(start, end);
    }

    private LocalDate date(String name, String value) {
        if (!StringUtils.hasText(value)) {
            throw new InvalidFilterException(name, value, "required");
        }
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed).toLocalDate();
            } catch (DateTimeParseException ignored) {
                throw new InvalidFilterException(name, value, "expected yyyy-MM-dd");
            }
        }
    }

    private TimeOfDayWindow timeOfDay(RawFilterParams params) {
        if (!StringUtils.hasText(params.getStartHour()) && !StringUtils.hasText(params.getStartMinute())
                && !StringUtils.hasText(params.getEndHour()) && !StringUtils.hasText(params.getEndMinute())) {
            return null;
        }
        int startHour = number("start_hour", params.getStartHour(), 0, 23, 0);
        int startMinute = number("start_minute", params.getStartMinute(), 0, 59, 0);
        int endHour = number("end_hour", params.getEndHour(), 0, 23, 23);
        int endMinute = number("end_minute", params.getEndMinute(), 0, 59, 59);

        TimeOfDayWindow window = TimeOfDayWindow.of(startHour, startMinute, endHour, endMinute);
        if (window.getEnd().isBefore(window.getStart())) {
            throw new InvalidFilterException("end_hour", params.getEndHour(), "window ends before it starts");
        }
        return window.isFullDay() ? null : window;
    }

    private Set<Integer> daysOfWeek(List<String> values) {
        Set<Integer> days = new TreeSet<>();
        if (values == null) {
            return days;
        }
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                days.add(number("day_of_week", value, 1, 7, 0));
            }
        }
        // every weekday selected restricts nothing
        return days.size() == ALL_WEEKDAYS ? new TreeSet<>() : days;
    }

    private EntitySelection entitySelection(RawFilterParams params) {
        List<Long> xdIds = segmentIds("xd_segments", params.getXdSegments());

        List<String> signalIds = new ArrayList<>();
        if (params.getSignalIds() != null) {
            params.getSignalIds().stream()
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .forEach(signalIds::add);
        }

        return EntitySelection.builder()
                .xdIds(xdIds)
                .signalIds(signalIds)
                .maintainer(maintainer(params.getMaintainedBy()))
                .approach(optionalFlag("approach", params.getApproach()))
                .geometryValidity(geometryValidity(params.getValidGeometry()))
                .build();
    }

    private List<Long> segmentIds(String name, List<String> values) {
        List<Long> ids = new ArrayList<>();
        if (values == null) {
            return ids;
        }
        for (String value : values) {
            if (!StringUtils.hasText(value)) {
                continue;
            }
            try {
                ids.add(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidFilterException(name, value, "not a segment id");
            }
        }
        return ids;
    }

    private ChangepointSort changepointSort(String value) {
        if (!StringUtils.hasText(value)) {
            return ChangepointSort.TIMESTAMP;
        }
        try {
            return ChangepointSort.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("sort_by", value, "expected timestamp, pct_change, avg_diff or score");
        }
    }

    private boolean ascending(String value) {
        if (!StringUtils.hasText(value) || "desc".equalsIgnoreCase(value.trim())) {
            return false;
        }
        if ("asc".equalsIgnoreCase(value.trim())) {
            return true;
        }
        throw new InvalidFilterException("sort_dir", value, "expected asc or desc");
    }

    private double fraction(String name, String value, double defaultValue) {
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(name, value, "not a number");
        }
        if (!Double.isFinite(parsed)) {
            throw new InvalidFilterException(name, value, "not a finite number");
        }
        return Math.abs(parsed);
    }

    private Maintainer maintainer(String value) {
        if (!StringUtils.hasText(value)) {
            return Maintainer.ALL;
        }
        try {
            return Maintainer.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("maintained_by", value, "expected all, odot or others");
        }
    }

    private GeometryValidity geometryValidity(String value) {
        if (!StringUtils.hasText(value)) {
            return GeometryValidity.ALL;
        }
        try {
            return GeometryValidity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException("valid_geometry", value, "expected all, valid or invalid");
        }
    }

    private boolean flag(String name, String value) {
        Boolean parsed = optionalFlag(name, value);
        return parsed != null && parsed;
    }

    private Boolean optionalFlag(String name, String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return Boolean.FALSE;
        }
        throw new InvalidFilterException(name, value, "expected true or false");
    }

    private int number(String name, String value, int min, int max, int defaultValue) {
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException(name, value, "not a number");
        }
        if (parsed < min || parsed > max) {
            throw new InvalidFilterException(name, value, "outside " + min + ".." + max);
        }
        return parsed;
    }
}
