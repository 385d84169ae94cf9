package com.company.signalanalytics.service;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.domain.ComparisonWindows;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.LegendSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ComparisonMetric;
import com.company.signalanalytics.domain.enums.ComparisonMode;
import com.company.signalanalytics.domain.enums.EntityKey;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.domain.enums.TimeAxis;
import com.company.signalanalytics.query.ComparisonOptions;
import com.company.signalanalytics.query.ComparisonQuery;
import com.company.signalanalytics.query.ComparisonQueryBuilder;
import com.company.signalanalytics.query.LegendCap;
import com.company.signalanalytics.query.LegendCapper;
import com.company.signalanalytics.query.PredicateComposer;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RollupSelector;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Before/after travel time index comparisons.
 * <p>
 * Both windows travel in one statement. Summaries come back paired per
 * entity with a delta; series come back as period-tagged rows on a shared
 * axis. A legend for a series is ranked over the envelope of both windows so
 * the two periods show the same groups.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BeforeAfterQueryService {

    private final RollupSelector rollupSelector;
    private final PredicateComposer predicateComposer;
    private final LegendCapper legendCapper;
    private final ComparisonQueryBuilder comparisonQueryBuilder;
    private final ComparisonMerger comparisonMerger;
    private final SqlRenderer sqlRenderer;
    private final WarehouseQueryExecutor queryExecutor;
    private final SignalAnalyticsProperties properties;

    public Table getSummary(ComparisonWindows windows, FilterSpec spec, EntityKey entityKey) {
        ComparisonQuery query = comparisonQueryBuilder.build(windows, spec, ComparisonMetric.TRAVEL_TIME_INDEX,
                ComparisonMode.SUMMARY, ComparisonOptions.builder().entityKey(entityKey).build());

        Table periodRows = queryExecutor.execute("before-after-summary", sqlRenderer.render(query.getStatement()));
        Table merged = comparisonMerger.merge(periodRows, query);
        log.debug("Before/after summary on {} paired {} {} keys", query.getTier(), merged.rowCount(), entityKey);
        return merged;
    }

    public Table getSeries(ComparisonWindows windows, FilterSpec spec, TimeAxis axis, LegendField legend) {
        LegendCap cap = null;
        if (legend != null) {
            RollupTier tier = rollupSelector.select(windows.longer(), spec, axis == TimeAxis.TIME_OF_DAY);
            PredicateSet envelope = predicateComposer.compose(spec.withDateRange(windows.envelope()), tier);
            cap = legendCapper.cap(new LegendSpec(legend, properties.getLegend().getMaxBeforeAfterEntities()),
                    envelope, tier);
        }

        ComparisonOptions options = ComparisonOptions.builder()
                .axis(axis)
                .legend(cap)
                .build();
        ComparisonQuery query = comparisonQueryBuilder.build(windows, spec, ComparisonMetric.TRAVEL_TIME_INDEX,
                ComparisonMode.SERIES, options);
        return queryExecutor.execute("before-after-series", sqlRenderer.render(query.getStatement()));
    }
}
