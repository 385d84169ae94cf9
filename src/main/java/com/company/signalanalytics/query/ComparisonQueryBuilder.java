package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.ComparisonWindows;
import com.company.signalanalytics.domain.DateRange;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.enums.ComparisonMetric;
import com.company.signalanalytics.domain.enums.ComparisonMode;
import com.company.signalanalytics.domain.enums.EntityKey;
import com.company.signalanalytics.domain.enums.Period;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.domain.enums.TimeAxis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;
import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.FREEFLOW;
import static com.company.signalanalytics.query.WarehouseTables.FREEFLOW_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.KEY_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.KEY_SIGNAL_ALIAS;

/**
 * Builds matched before/after aggregates.
 * <p>
 * Both windows are read from the same tier, picked from the longer window,
 * and composed from the same filter; only the date range differs between
 * them. Summary mode yields one value per entity and window, series mode a
 * time-indexed value per window. Either way the windows are unioned and
 * discriminated by a PERIOD tag; summary rows are paired per entity by
 * {@link com.company.signalanalytics.service.ComparisonMerger}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComparisonQueryBuilder {

    public static final String PERIOD_COLUMN = "PERIOD";
    public static final String VALUE_COLUMN = "VALUE";

    private final RollupSelector rollupSelector;
    private final PredicateComposer predicateComposer;

    public ComparisonQuery build(DateRange before, DateRange after, FilterSpec spec,
                                 ComparisonMetric metric, ComparisonMode mode) {
        return build(new ComparisonWindows(before, after), spec, metric, mode, ComparisonOptions.defaults());
    }

    public ComparisonQuery build(ComparisonWindows windows, FilterSpec spec, ComparisonMetric metric,
                                 ComparisonMode mode, ComparisonOptions options) {
        boolean timeOfDayAxis = mode == ComparisonMode.SERIES && options.getAxis() == TimeAxis.TIME_OF_DAY;
        RollupTier tier = rollupSelector.select(windows.longer(), spec, timeOfDayAxis);

        PredicateSet beforeSet = predicatesFor(windows.getBefore(), spec, tier, options);
        PredicateSet afterSet = predicatesFor(windows.getAfter(), spec, tier, options);

        List<SelectQuery> parts = new ArrayList<>(2);
        List<String> orderings = new ArrayList<>();
        if (mode == ComparisonMode.SUMMARY) {
            parts.add(summaryBlock(Period.BEFORE, beforeSet, metric, options.getEntityKey()));
            parts.add(summaryBlock(Period.AFTER, afterSet, metric, options.getEntityKey()));
            orderings.add(options.getEntityKey().getColumn());
            orderings.add(PERIOD_COLUMN);
        } else {
            parts.add(seriesBlock(Period.BEFORE, beforeSet, metric, options));
            parts.add(seriesBlock(Period.AFTER, afterSet, metric, options));
            orderings.add(options.getAxis().name());
            orderings.add(PERIOD_COLUMN);
            if (options.getLegend() != null) {
                orderings.add(LegendCap.GROUP_COLUMN);
            }
        }

        log.debug("Built {} comparison of {} on {} keyed by {}", mode, metric, tier, options.getEntityKey());
        return new ComparisonQuery(mode, metric, tier, options, beforeSet, afterSet,
                new UnionQuery(parts, orderings));
    }

    private PredicateSet predicatesFor(DateRange window, FilterSpec spec, RollupTier tier, ComparisonOptions options) {
        PredicateSet set = predicateComposer.compose(spec.withDateRange(window), tier);
        if (options.getLegend() != null) {
            set = set.with(options.getLegend().toFragment());
        }
        return set;
    }

    private SelectQuery summaryBlock(Period period, PredicateSet predicates, ComparisonMetric metric, EntityKey key) {
        SelectQuery.SelectQueryBuilder query = baseBlock(period, predicates, metric);
        String keyExpression = keyExpression(key, predicates, query);
        return query
                .column(keyExpression + " AS " + key.getColumn())
                .column(metricColumn(predicates.getTier(), metric))
                .groupBy(keyExpression)
                .build();
    }

    private SelectQuery seriesBlock(Period period, PredicateSet predicates, ComparisonMetric metric,
                                    ComparisonOptions options) {
        RollupTier tier = predicates.getTier();
        String axisExpression = options.getAxis() == TimeAxis.TIME_OF_DAY
                ? FACT_ALIAS + "." + tier.getTimeOfDayColumn()
                : FACT_ALIAS + "." + tier.getTimestampColumn();

        SelectQuery.SelectQueryBuilder query = baseBlock(period, predicates, metric)
                .column(axisExpression + " AS " + options.getAxis().name())
                .groupBy(axisExpression);
        if (options.getLegend() != null) {
            String legendExpression = options.getLegend().groupColumn().qualified();
            query.column(legendExpression + " AS " + LegendCap.GROUP_COLUMN).groupBy(legendExpression);
        }
        return query.column(metricColumn(tier, metric)).build();
    }

    private SelectQuery.SelectQueryBuilder baseBlock(Period period, PredicateSet predicates, ComparisonMetric metric) {
        SelectQuery.SelectQueryBuilder query = SelectQuery.builder()
                .column("'" + period.getLabel() + "' AS " + PERIOD_COLUMN)
                .fromTable(predicates.getTier().getSourceTable())
                .fromAlias(FACT_ALIAS)
                .joins(predicates.joins())
                .where(predicates.where());
        if (metric.isFreeflowRequired()) {
            query.join(Join.inner(FREEFLOW, FREEFLOW_ALIAS,
                    ColumnRef.of(FREEFLOW_ALIAS, "XD"), ColumnRef.of(FACT_ALIAS, "XD")));
        }
        return query;
    }

    /**
     * Keyed rows cover the located segments only. An attribute selection
     * already carries that restriction in its semi-join; otherwise it is
     * added here. Signal-level keys join each fact row to the signals its
     * segment belongs to, and an attribute selection is applied to that join
     * as well so only selected signals form groups.
     */
    private String keyExpression(EntityKey key, PredicateSet predicates, SelectQuery.SelectQueryBuilder query) {
        ResolvedEntities entities = predicates.getEntities();
        if (key == EntityKey.XD) {
            entities.locatedRestriction(ColumnRef.of(FACT_ALIAS, "XD"))
                    .ifPresent(located -> query.where(AndPredicate.of(predicates.where(), located)));
            return FACT_ALIAS + ".XD";
        }
        query.join(Join.inner(DIM_SIGNALS_XD, KEY_ALIAS,
                ColumnRef.of(KEY_ALIAS, "XD"), ColumnRef.of(FACT_ALIAS, "XD")));
        query.joins(entities.dimensionJoins(KEY_ALIAS, KEY_SIGNAL_ALIAS));
        query.where(AndPredicate.of(predicates.where(), entities.keyJoinCondition(KEY_ALIAS, KEY_SIGNAL_ALIAS)));
        return KEY_ALIAS + ".ID";
    }

    private String metricColumn(RollupTier tier, ComparisonMetric metric) {
        return metric.expression(tier, FACT_ALIAS, FREEFLOW_ALIAS) + " AS " + VALUE_COLUMN;
    }
}
