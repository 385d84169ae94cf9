package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.LegendSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.EntityFilterResolver;
import com.company.signalanalytics.query.LegendCap;
import com.company.signalanalytics.query.LegendCapper;
import com.company.signalanalytics.query.PredicateComposer;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RollupSelector;
import com.company.signalanalytics.repository.DimensionRepository;
import com.company.signalanalytics.repository.TravelTimeAggregateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anomaly views. Anomaly exclusion is meaningless here and is dropped from
 * the incoming filter.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyQueryService {

    static final List<ColumnSpec> SUMMARY_COLUMNS = List.of(
            ColumnSpec.nonNull("ANOMALY_COUNT", ColumnType.INTEGER),
            ColumnSpec.nonNull("POINT_SOURCE_COUNT", ColumnType.INTEGER));

    static final List<ColumnSpec> DETAIL_ATTRIBUTE_COLUMNS = List.of(
            ColumnSpec.nullable("ID", ColumnType.STRING),
            ColumnSpec.nullable("LATITUDE", ColumnType.DECIMAL),
            ColumnSpec.nullable("LONGITUDE", ColumnType.DECIMAL),
            ColumnSpec.nullable("APPROACH", ColumnType.BOOLEAN),
            ColumnSpec.nullable("VALID_GEOMETRY", ColumnType.BOOLEAN));

    static final List<ColumnSpec> DETAIL_FACT_COLUMNS = List.of(
            ColumnSpec.nonNull("XD", ColumnType.INTEGER),
            ColumnSpec.nonNull("TIMESTAMP", ColumnType.TIMESTAMP),
            ColumnSpec.nullable("TRAVEL_TIME_SECONDS", ColumnType.DECIMAL),
            ColumnSpec.nullable("PREDICTION", ColumnType.DECIMAL),
            ColumnSpec.nullable("ANOMALY", ColumnType.BOOLEAN),
            ColumnSpec.nullable("ORIGINATED_ANOMALY", ColumnType.BOOLEAN));

    private final EntityFilterResolver entityFilterResolver;
    private final RollupSelector rollupSelector;
    private final PredicateComposer predicateComposer;
    private final LegendCapper legendCapper;
    private final DimensionRepository dimensionRepository;
    private final TravelTimeAggregateRepository aggregateRepository;
    private final ResultAssembler resultAssembler;
    private final SignalAnalyticsProperties properties;

    public Table getAnomalySummary(FilterSpec spec, AnomalyType anomalyType) {
        FilterSpec filter = keepAnomalies(spec);
        Table dimensions = dimensionRepository.findDimensionRows(entityFilterResolver.resolve(filter.getEntities()));
        if (dimensions.isEmpty()) {
            return resultAssembler.assemble(dimensions, Map.of(), TravelTimeQueryService.JOIN_KEY, SUMMARY_COLUMNS);
        }

        RollupTier tier = rollupSelector.select(filter);
        Table counts = aggregateRepository.anomalyCountsByXd(predicateComposer.compose(filter, tier), anomalyType);
        log.debug("{} segments with {} anomalies", counts.rowCount(), anomalyType);
        return resultAssembler.assemble(dimensions,
                resultAssembler.indexByKey(counts, TravelTimeQueryService.JOIN_KEY),
                TravelTimeQueryService.JOIN_KEY, SUMMARY_COLUMNS);
    }

    /**
     * Summed actual against summed predicted travel time per timestamp.
     */
    public Table getAnomalySeries(FilterSpec spec, LegendField legend) {
        FilterSpec filter = keepAnomalies(spec);
        RollupTier tier = rollupSelector.select(filter);
        PredicateSet predicates = predicateComposer.compose(filter, tier);

        LegendCap cap = null;
        if (legend != null) {
            cap = legendCapper.cap(new LegendSpec(legend, properties.getLegend().getMaxAnomalyEntities()),
                    predicates, tier);
        }
        return aggregateRepository.anomalySeries(TravelTimeQueryService.withLegend(predicates, cap), cap);
    }

    /**
     * Raw rows with their predictions and anomaly flags, each tagged with the
     * signal attributes of its segment. Always read from the raw tier, since
     * only raw rows carry per-row flags. A segment shared by several signals
     * is tagged with the last of them in dimension order.
     */
    public Table getTravelTimeDetail(FilterSpec spec) {
        FilterSpec filter = keepAnomalies(spec);
        Table dimensions = dimensionRepository.findDimensionRows(entityFilterResolver.resolve(filter.getEntities()));
        if (dimensions.isEmpty()) {
            List<ColumnSpec> columns = new ArrayList<>(DETAIL_FACT_COLUMNS);
            columns.addAll(DETAIL_ATTRIBUTE_COLUMNS);
            return Table.empty(columns);
        }

        Table rows = aggregateRepository.rawRows(predicateComposer.compose(filter, RollupTier.RAW));
        log.debug("{} raw rows over {} located signal/segment pairs", rows.rowCount(), dimensions.rowCount());
        return resultAssembler.enrich(rows,
                resultAssembler.indexByKey(dimensions, TravelTimeQueryService.JOIN_KEY),
                TravelTimeQueryService.JOIN_KEY, DETAIL_ATTRIBUTE_COLUMNS);
    }

    private static FilterSpec keepAnomalies(FilterSpec spec) {
        return spec.isRemoveAnomalies() ? spec.toBuilder().removeAnomalies(false).build() : spec;
    }
}
