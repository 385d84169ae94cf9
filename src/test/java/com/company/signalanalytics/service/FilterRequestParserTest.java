package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ChangeThreshold;
import com.company.signalanalytics.domain.ChangepointRef;
import com.company.signalanalytics.domain.ChangepointTableOptions;
import com.company.signalanalytics.domain.ComparisonWindows;
import com.company.signalanalytics.domain.DateRange;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.TimeOfDayWindow;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.ChangepointSort;
import com.company.signalanalytics.domain.enums.GeometryValidity;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.Maintainer;
import com.company.signalanalytics.dto.request.RawFilterParams;
import com.company.signalanalytics.exception.InvalidFilterException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterRequestParserTest {

    private final FilterRequestParser parser = new FilterRequestParser(new SignalAnalyticsProperties());

    @Test
    void shouldParseCompleteFilter() {
        RawFilterParams params = week()
                .xdSegments(List.of("1236893704", " 449524735 "))
                .maintainedBy("odot")
                .approach("true")
                .validGeometry("valid")
                .startHour("6").startMinute("0").endHour("9").endMinute("59")
                .dayOfWeek(List.of("1", "2", "3"))
                .removeAnomalies("true")
                .build();

        FilterSpec spec = parser.parse(params);

        assertEquals(DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 7)), spec.getDateRange());
        assertEquals(TimeOfDayWindow.of(6, 0, 9, 59), spec.getTimeOfDay());
        assertEquals(Set.of(1, 2, 3), spec.getDaysOfWeek());
        assertEquals(List.of(1236893704L, 449524735L), spec.getEntities().getXdIds());
        assertEquals(Maintainer.ODOT, spec.getEntities().getMaintainer());
        assertEquals(Boolean.TRUE, spec.getEntities().getApproach());
        assertEquals(GeometryValidity.VALID, spec.getEntities().getGeometryValidity());
        assertTrue(spec.isRemoveAnomalies());
    }

    @Test
    void shouldDefaultToUnrestrictedFilter() {
        FilterSpec spec = parser.parse(week().build());

        assertNull(spec.getTimeOfDay());
        assertTrue(spec.getDaysOfWeek().isEmpty());
        assertFalse(spec.getEntities().hasExplicitIds());
        assertFalse(spec.getEntities().hasDimensionFilters());
        assertFalse(spec.isRemoveAnomalies());
    }

    @Test
    void shouldTreatFullDayAndEveryWeekdayAsNoRestriction() {
        FilterSpec spec = parser.parse(week()
                .startHour("0").startMinute("0").endHour("23").endMinute("59")
                .dayOfWeek(List.of("1", "2", "3", "4", "5", "6", "7"))
                .build());

        assertNull(spec.getTimeOfDay());
        assertTrue(spec.getDaysOfWeek().isEmpty());
    }

    @Test
    void shouldAcceptDateTimeInput() {
        FilterSpec spec = parser.parse(RawFilterParams.builder()
                .startDate("2024-03-01T00:00:00")
                .endDate("2024-03-02")
                .build());

        assertEquals(LocalDate.of(2024, 3, 1), spec.getDateRange().getStart());
    }

    @Test
    void shouldRejectMalformedOrInvertedDates() {
        assertInvalid("start_date", RawFilterParams.builder().startDate("01/02/2024").endDate("2024-01-07").build());
        assertInvalid("end_date", RawFilterParams.builder().startDate("2024-01-07").endDate("2024-01-01").build());
        assertInvalid("end_date", RawFilterParams.builder().startDate("2024-01-07").build());
    }

    @Test
    void shouldRejectBadTimeOfDay() {
        assertInvalid("start_hour", week().startHour("six").build());
        assertInvalid("end_hour", week().endHour("24").build());
        assertInvalid("start_minute", week().startMinute("-1").build());
        assertInvalid("end_hour", week().startHour("10").endHour("8").build());
    }

    @Test
    void shouldRejectBadDayOfWeekAndSegmentIds() {
        assertInvalid("day_of_week", week().dayOfWeek(List.of("1", "8")).build());
        assertInvalid("day_of_week", week().dayOfWeek(List.of("Mon")).build());
        assertInvalid("xd_segments", week().xdSegments(List.of("12", "abc")).build());
    }

    @Test
    void shouldRejectUnknownEnumValues() {
        assertInvalid("maintained_by", week().maintainedBy("county").build());
        assertInvalid("valid_geometry", week().validGeometry("maybe").build());
        assertInvalid("approach", week().approach("yes").build());
        assertInvalid("remove_anomalies", week().removeAnomalies("1").build());
    }

    @Test
    void shouldParseLegendAndAnomalyType() {
        assertNull(parser.parseLegend(null));
        assertNull(parser.parseLegend("None"));
        assertEquals(LegendField.ROADNAME, parser.parseLegend("roadname"));
        assertEquals(AnomalyType.ALL, parser.parseAnomalyType("All"));
        assertEquals(AnomalyType.POINT_SOURCE, parser.parseAnomalyType("Point Source"));

        InvalidFilterException legend = assertThrows(InvalidFilterException.class, () -> parser.parseLegend("city"));
        assertEquals("legend", legend.getParameter());
        assertThrows(InvalidFilterException.class, () -> parser.parseAnomalyType("Sensor"));
    }

    @Test
    void shouldParseComparisonWindows() {
        RawFilterParams params = RawFilterParams.builder()
                .beforeStartDate("2024-01-01").beforeEndDate("2024-01-07")
                .afterStartDate("2024-02-01").afterEndDate("2024-02-07")
                .signalIds(List.of("02020", ""))
                .build();

        ComparisonWindows windows = parser.parseComparisonWindows(params);
        FilterSpec spec = parser.parseForComparison(params, windows);

        assertEquals(LocalDate.of(2024, 2, 7), windows.getAfter().getEnd());
        assertEquals(DateRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 7)), spec.getDateRange());
        assertEquals(List.of("02020"), spec.getEntities().getSignalIds());
        assertInvalid("after_end_date", RawFilterParams.builder()
                .beforeStartDate("2024-01-01").beforeEndDate("2024-01-07")
                .afterStartDate("2024-02-07").afterEndDate("2024-02-01")
                .build(), true);
    }

    @Test
    void shouldDefaultChangeThresholdFromConfigurationAndTakeMagnitudes() {
        assertEquals(ChangeThreshold.of(0.01, 0.01), parser.parseChangeThreshold(RawFilterParams.builder().build()));

        ChangeThreshold threshold = parser.parseChangeThreshold(RawFilterParams.builder()
                .pctChangeImprovement("-0.05")
                .pctChangeDegradation("0")
                .build());

        assertEquals(0.05, threshold.getImprovement());
        assertEquals(0.0, threshold.getDegradation());
        assertFalse(threshold.isUnbounded());
    }

    @Test
    void shouldRejectNonNumericChangeThreshold() {
        InvalidFilterException error = assertThrows(InvalidFilterException.class, () ->
                parser.parseChangeThreshold(RawFilterParams.builder().pctChangeImprovement("five").build()));
        assertEquals("pct_change_improvement", error.getParameter());

        InvalidFilterException nan = assertThrows(InvalidFilterException.class, () ->
                parser.parseChangeThreshold(RawFilterParams.builder().pctChangeDegradation("NaN").build()));
        assertEquals("pct_change_degradation", nan.getParameter());
    }

    @Test
    void shouldParseChangepointTableOptions() {
        ChangepointTableOptions defaults = parser.parseChangepointTableOptions(RawFilterParams.builder().build());
        assertEquals(ChangepointSort.TIMESTAMP, defaults.getSortBy());
        assertFalse(defaults.isAscending());

        ChangepointTableOptions options = parser.parseChangepointTableOptions(RawFilterParams.builder()
                .selectedSignals(List.of(" 02020 ", ""))
                .selectedXds(List.of("449524735"))
                .sortBy("pct_change")
                .sortDir("ASC")
                .build());

        assertEquals(List.of("02020"), options.getSelectedSignals());
        assertEquals(List.of(449524735L), options.getSelectedXds());
        assertEquals(ChangepointSort.PCT_CHANGE, options.getSortBy());
        assertTrue(options.isAscending());
    }

    @Test
    void shouldRejectUnknownSortAndSelectedSegments() {
        assertEquals("sort_by", assertThrows(InvalidFilterException.class, () -> parser.parseChangepointTableOptions(
                RawFilterParams.builder().sortBy("roadname").build())).getParameter());
        assertEquals("sort_dir", assertThrows(InvalidFilterException.class, () -> parser.parseChangepointTableOptions(
                RawFilterParams.builder().sortDir("up").build())).getParameter());
        assertEquals("selected_xds", assertThrows(InvalidFilterException.class, () -> parser.parseChangepointTableOptions(
                RawFilterParams.builder().selectedXds(List.of("x1")).build())).getParameter());
    }

    @Test
    void shouldReadChangeTimestampsInWarehouseZone() {
        LocalDateTime local = LocalDateTime.of(2024, 3, 5, 0, 15);

        assertEquals(local, parser.changeTimestamp("2024-03-05T08:15:00Z"));
        assertEquals(local, parser.changeTimestamp("2024-03-05 09:15:00+01:00"));
        assertEquals(local, parser.changeTimestamp("1709626500"));
        assertEquals(local, parser.changeTimestamp("1709626500000"));
        assertEquals(local, parser.changeTimestamp("2024-03-05 00:15:00"));
    }

    @Test
    void shouldRequireSegmentAndTimestampForChangepoint() {
        ChangepointRef changepoint = parser.parseChangepoint(RawFilterParams.builder()
                .xd("449524735").timestamp("2024-03-05T00:15:00").build());
        assertEquals(new ChangepointRef(449524735L, LocalDateTime.of(2024, 3, 5, 0, 15)), changepoint);

        assertEquals("xd", assertThrows(InvalidFilterException.class, () -> parser.parseChangepoint(
                RawFilterParams.builder().timestamp("2024-03-05T00:15:00").build())).getParameter());
        assertEquals("xd", assertThrows(InvalidFilterException.class, () -> parser.parseChangepoint(
                RawFilterParams.builder().xd("12a").timestamp("2024-03-05T00:15:00").build())).getParameter());
        assertEquals("timestamp", assertThrows(InvalidFilterException.class, () -> parser.parseChangepoint(
                RawFilterParams.builder().xd("12").build())).getParameter());
        assertEquals("timestamp", assertThrows(InvalidFilterException.class, () -> parser.parseChangepoint(
                RawFilterParams.builder().xd("12").timestamp("March 5th").build())).getParameter());
    }

    private void assertInvalid(String parameter, RawFilterParams params) {
        assertInvalid(parameter, params, false);
    }

    private void assertInvalid(String parameter, RawFilterParams params, boolean comparison) {
        InvalidFilterException error = assertThrows(InvalidFilterException.class, () -> {
            if (comparison) {
                parser.parseComparisonWindows(params);
            } else {
                parser.parse(params);
            }
        });
        assertEquals(parameter, error.getParameter());
    }

    private static RawFilterParams.RawFilterParamsBuilder week() {
        return RawFilterParams.builder().startDate("2024-01-01").endDate("2024-01-07");
    }
}
