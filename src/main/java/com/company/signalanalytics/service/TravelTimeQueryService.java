package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.LegendSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.EntityFilterResolver;
import com.company.signalanalytics.query.LegendCap;
import com.company.signalanalytics.query.LegendCapper;
import com.company.signalanalytics.query.PredicateComposer;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.ResolvedEntities;
import com.company.signalanalytics.query.RollupSelector;
import com.company.signalanalytics.repository.DimensionRepository;
import com.company.signalanalytics.repository.TravelTimeAggregateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Travel-time views: the per-segment map summary and the two chart series.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TravelTimeQueryService {

    static final String JOIN_KEY = "XD";

    static final List<ColumnSpec> SUMMARY_COLUMNS = List.of(
            ColumnSpec.nonNull("TOTAL_TRAVEL_TIME", ColumnType.DECIMAL),
            ColumnSpec.nonNull("AVG_TRAVEL_TIME", ColumnType.DECIMAL),
            ColumnSpec.nonNull("RECORD_COUNT", ColumnType.INTEGER));

    private final EntityFilterResolver entityFilterResolver;
    private final RollupSelector rollupSelector;
    private final PredicateComposer predicateComposer;
    private final LegendCapper legendCapper;
    private final DimensionRepository dimensionRepository;
    private final TravelTimeAggregateRepository aggregateRepository;
    private final ResultAssembler resultAssembler;
    private final SignalAnalyticsProperties properties;

    /**
     * One row per located signal/segment pair of the selection, with its
     * travel-time aggregates or zeros where the window has no facts.
     */
    public Table getTravelTimeSummary(FilterSpec spec) {
        ResolvedEntities entities = entityFilterResolver.resolve(spec.getEntities());
        Table dimensions = dimensionRepository.findDimensionRows(entities);
        if (dimensions.isEmpty()) {
            log.info("No located segments match the selection, skipping fact query");
            return resultAssembler.assemble(dimensions, Map.of(), JOIN_KEY, SUMMARY_COLUMNS);
        }

        RollupTier tier = rollupSelector.select(spec);
        Table aggregates = aggregateRepository.aggregateByXd(predicateComposer.compose(spec, tier));
        return resultAssembler.assemble(dimensions,
                resultAssembler.indexByKey(aggregates, JOIN_KEY), JOIN_KEY, SUMMARY_COLUMNS);
    }

    public Table getAggregatedSeries(FilterSpec spec, LegendField legend) {
        RollupTier tier = rollupSelector.select(spec);
        PredicateSet predicates = predicateComposer.compose(spec, tier);
        LegendCap cap = capLegend(legend, predicates, tier);
        return aggregateRepository.seriesByTimestamp(withLegend(predicates, cap), cap);
    }

    public Table getTimeOfDaySeries(FilterSpec spec, LegendField legend) {
        RollupTier tier = rollupSelector.select(spec.getDateRange(), spec, true);
        PredicateSet predicates = predicateComposer.compose(spec, tier);
        LegendCap cap = capLegend(legend, predicates, tier);
        return aggregateRepository.seriesByTimeOfDay(withLegend(predicates, cap), cap);
    }

    private LegendCap capLegend(LegendField legend, PredicateSet predicates, RollupTier tier) {
        if (legend == null) {
            return null;
        }
        return legendCapper.cap(new LegendSpec(legend, properties.getLegend().getMaxEntities()), predicates, tier);
    }

    static PredicateSet withLegend(PredicateSet predicates, LegendCap cap) {
        return cap == null ? predicates : predicates.with(cap.toFragment());
    }
}
