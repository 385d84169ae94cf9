package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ChangeThreshold;
import com.company.signalanalytics.domain.ChangepointRef;
import com.company.signalanalytics.domain.ChangepointTableOptions;
import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.Period;
import com.company.signalanalytics.query.EntityFilterResolver;
import com.company.signalanalytics.query.PredicateComposer;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.repository.ChangepointRepository;
import com.company.signalanalytics.repository.DimensionRepository;
import com.company.signalanalytics.util.RowValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Changepoint views: where travel time shifted, how much, and what it
 * looked like around the shift.
 * <p>
 * Changepoints are detected over whole days, so time-of-day and day-of-week
 * restrictions are dropped from the incoming filter.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChangepointQueryService {

    static final String PERIOD_COLUMN = "PERIOD";
    static final String ASSOCIATED_SIGNALS = "ASSOCIATED_SIGNALS";

    static final List<ColumnSpec> SEGMENT_STAT_COLUMNS = List.of(
            ColumnSpec.nonNull("XD", ColumnType.INTEGER),
            ColumnSpec.nonNull("ABS_PCT_SUM", ColumnType.DECIMAL),
            ColumnSpec.nonNull("AVG_PCT_CHANGE", ColumnType.DECIMAL),
            ColumnSpec.nonNull("CHANGEPOINT_COUNT", ColumnType.INTEGER),
            ColumnSpec.nonNull("TOP_TIMESTAMP", ColumnType.TIMESTAMP),
            ColumnSpec.nullable("TOP_PCT_CHANGE", ColumnType.DECIMAL),
            ColumnSpec.nullable("TOP_AVG_DIFF", ColumnType.DECIMAL));

    static final List<ColumnSpec> CHANGEPOINT_COLUMNS = List.of(
            ColumnSpec.nonNull("XD", ColumnType.INTEGER),
            ColumnSpec.nonNull("TIMESTAMP", ColumnType.TIMESTAMP),
            ColumnSpec.nullable("PCT_CHANGE", ColumnType.DECIMAL),
            ColumnSpec.nullable("AVG_DIFF", ColumnType.DECIMAL),
            ColumnSpec.nullable("AVG_BEFORE", ColumnType.DECIMAL),
            ColumnSpec.nullable("AVG_AFTER", ColumnType.DECIMAL),
            ColumnSpec.nullable("SCORE", ColumnType.DECIMAL));

    static final List<ColumnSpec> SEGMENT_ATTRIBUTE_COLUMNS = List.of(
            ColumnSpec.nullable("ROADNAME", ColumnType.STRING),
            ColumnSpec.nullable("BEARING", ColumnType.STRING));

    static final List<ColumnSpec> TABLE_ATTRIBUTE_COLUMNS = List.of(
            ColumnSpec.nullable("ROADNAME", ColumnType.STRING),
            ColumnSpec.nullable("BEARING", ColumnType.STRING),
            ColumnSpec.nullable(ASSOCIATED_SIGNALS, ColumnType.STRING));

    private final EntityFilterResolver entityFilterResolver;
    private final PredicateComposer predicateComposer;
    private final DimensionRepository dimensionRepository;
    private final ChangepointRepository changepointRepository;
    private final ResultAssembler resultAssembler;
    private final SignalAnalyticsProperties properties;

    public Table getSignalMap(FilterSpec spec, ChangeThreshold threshold) {
        Table signals = changepointRepository.signalStats(
                predicateComposer.composeChangepoints(wholeDays(spec), threshold));
        log.debug("{} signals with changepoints", signals.rowCount());
        return signals;
    }

    /**
     * Per-segment changepoint totals tagged with road name and bearing.
     */
    public Table getSegmentMap(FilterSpec spec, ChangeThreshold threshold) {
        FilterSpec filter = wholeDays(spec);
        Table dimensions = dimensionRepository.findDimensionRows(entityFilterResolver.resolve(filter.getEntities()));
        if (dimensions.isEmpty()) {
            return Table.empty(concat(SEGMENT_STAT_COLUMNS, SEGMENT_ATTRIBUTE_COLUMNS));
        }

        Table segments = changepointRepository.segmentStats(predicateComposer.composeChangepoints(filter, threshold));
        return resultAssembler.enrich(segments,
                resultAssembler.indexByKey(dimensions, TravelTimeQueryService.JOIN_KEY),
                TravelTimeQueryService.JOIN_KEY, SEGMENT_ATTRIBUTE_COLUMNS);
    }

    /**
     * The top changepoints under the configured row limit. Each row lists
     * the selected signals its segment belongs to.
     */
    public Table getChangepointTable(FilterSpec spec, ChangeThreshold threshold, ChangepointTableOptions options) {
        FilterSpec filter = wholeDays(spec);
        Table dimensions = dimensionRepository.findDimensionRows(entityFilterResolver.resolve(filter.getEntities()));
        if (dimensions.isEmpty()) {
            return Table.empty(concat(CHANGEPOINT_COLUMNS, TABLE_ATTRIBUTE_COLUMNS));
        }

        PredicateSet predicates = predicateComposer.composeChangepoints(filter, threshold);
        Table rows = changepointRepository.changepoints(predicates, options,
                properties.getChangepoints().getTableLimit());
        return resultAssembler.enrich(rows,
                resultAssembler.indexWithMembers(dimensions, TravelTimeQueryService.JOIN_KEY, "ID", ASSOCIATED_SIGNALS),
                TravelTimeQueryService.JOIN_KEY, TABLE_ATTRIBUTE_COLUMNS);
    }

    /**
     * Raw travel times of the changepoint's segment within the configured
     * window on either side, each labelled with the period it falls in. The
     * change instant itself counts as after.
     */
    public Table getChangepointDetail(ChangepointRef changepoint) {
        Duration window = properties.getChangepoints().getDetailWindow();
        LocalDateTime changedAt = changepoint.getTimestamp();
        Table travelTimes = changepointRepository.travelTimesAround(
                changepoint.getXd(), changedAt.minus(window), changedAt.plus(window));

        List<ColumnSpec> columns = new ArrayList<>(travelTimes.getColumns());
        columns.add(ColumnSpec.nonNull(PERIOD_COLUMN, ColumnType.STRING));
        List<Map<String, Object>> rows = new ArrayList<>(travelTimes.rowCount());
        for (Map<String, Object> travelTime : travelTimes.getRows()) {
            LocalDateTime at = RowValues.asLocalDateTime(travelTime.get("TIMESTAMP"));
            Period period = at != null && at.isBefore(changedAt) ? Period.BEFORE : Period.AFTER;
            Map<String, Object> row = new LinkedHashMap<>(travelTime);
            row.put(PERIOD_COLUMN, period.getLabel());
            rows.add(row);
        }
        log.debug("{} travel times around changepoint {} at {}", rows.size(), changepoint.getXd(), changedAt);
        return new Table(columns, rows);
    }

    private static FilterSpec wholeDays(FilterSpec spec) {
        return spec.toBuilder().timeOfDay(null).daysOfWeek(Set.of()).removeAnomalies(false).build();
    }

    private static List<ColumnSpec> concat(List<ColumnSpec> first, List<ColumnSpec> second) {
        List<ColumnSpec> columns = new ArrayList<>(first);
        columns.addAll(second);
        return columns;
    }
}
