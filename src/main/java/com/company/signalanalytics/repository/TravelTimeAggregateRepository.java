package com.company.signalanalytics.repository;

import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.AndPredicate;
import com.company.signalanalytics.query.ColumnRef;
import com.company.signalanalytics.query.EqualsPredicate;
import com.company.signalanalytics.query.LegendCap;
import com.company.signalanalytics.query.Predicate;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RangePredicate;
import com.company.signalanalytics.query.SelectQuery;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;

/**
 * Fact aggregations over whichever tier a predicate set was composed for.
 */
@Repository
@RequiredArgsConstructor
public class TravelTimeAggregateRepository {

    public static final String TIMESTAMP = "TIMESTAMP";
    public static final String TIME_OF_DAY = "TIME_OF_DAY";

    static final List<String> RAW_DETAIL_COLUMNS = List.of(
            "XD", "TIMESTAMP", "TRAVEL_TIME_SECONDS", "PREDICTION", "ANOMALY", "ORIGINATED_ANOMALY");

    private final WarehouseQueryExecutor queryExecutor;
    private final SqlRenderer sqlRenderer;

    /**
     * Per-segment totals, keyed by XD, for the map summary.
     */
    public Table aggregateByXd(PredicateSet predicates) {
        RollupTier tier = predicates.getTier();
        String travelTime = fact(tier.getTravelTimeColumn());
        SelectQuery query = base(predicates, predicates.where())
                .column(fact("XD") + " AS XD")
                .column(tier.weightedSum(travelTime, FACT_ALIAS) + " AS TOTAL_TRAVEL_TIME")
                .column(tier.weightedAverage(travelTime, FACT_ALIAS) + " AS AVG_TRAVEL_TIME")
                .column(tier.recordCountExpression(FACT_ALIAS) + " AS RECORD_COUNT")
                .groupBy(fact("XD"))
                .build();
        return queryExecutor.execute("travel-time-by-xd", sqlRenderer.render(query));
    }

    public Table seriesByTimestamp(PredicateSet predicates, LegendCap legend) {
        RollupTier tier = predicates.getTier();
        String travelTime = fact(tier.getTravelTimeColumn());
        SelectQuery query = series(predicates, legend, fact(tier.getTimestampColumn()), TIMESTAMP)
                .column(tier.weightedSum(travelTime, FACT_ALIAS) + " AS TOTAL_TRAVEL_TIME_SECONDS")
                .column(tier.weightedAverage(travelTime, FACT_ALIAS) + " AS AVG_TRAVEL_TIME")
                .build();
        return queryExecutor.execute("travel-time-series", sqlRenderer.render(query));
    }

    public Table seriesByTimeOfDay(PredicateSet predicates, LegendCap legend) {
        RollupTier tier = predicates.getTier();
        if (!tier.hasTimeOfDay()) {
            throw new IllegalStateException("Tier " + tier + " has no time-of-day column");
        }
        String travelTime = fact(tier.getTravelTimeColumn());
        SelectQuery query = series(predicates, legend, fact(tier.getTimeOfDayColumn()), TIME_OF_DAY)
                .column(tier.weightedAverage(travelTime, FACT_ALIAS) + " AS AVG_TRAVEL_TIME")
                .column(tier.recordCountExpression(FACT_ALIAS) + " AS RECORD_COUNT")
                .build();
        return queryExecutor.execute("travel-time-by-time-of-day", sqlRenderer.render(query));
    }

    /**
     * Per-segment anomaly counts. Only segments with at least one anomaly of
     * the requested type come back.
     */
    public Table anomalyCountsByXd(PredicateSet predicates, AnomalyType anomalyType) {
        RollupTier tier = predicates.getTier();
        Predicate anomalyFilter = tier.isRaw()
                ? EqualsPredicate.eq(ColumnRef.of(FACT_ALIAS, anomalyType.getRawFlagColumn()), Boolean.TRUE)
                : RangePredicate.between(ColumnRef.of(FACT_ALIAS, anomalyType.getRollupCountColumn()), 1, null);

        SelectQuery query = base(predicates, AndPredicate.of(predicates.where(), anomalyFilter))
                .column(fact("XD") + " AS XD")
                .column(tier.anomalyCountExpression(FACT_ALIAS) + " AS ANOMALY_COUNT")
                .column(tier.pointSourceCountExpression(FACT_ALIAS) + " AS POINT_SOURCE_COUNT")
                .groupBy(fact("XD"))
                .build();
        return queryExecutor.execute("anomaly-counts-by-xd", sqlRenderer.render(query));
    }

    /**
     * Summed actual against summed predicted travel time per timestamp.
     */
    public Table anomalySeries(PredicateSet predicates, LegendCap legend) {
        RollupTier tier = predicates.getTier();
        SelectQuery query = series(predicates, legend, fact(tier.getTimestampColumn()), TIMESTAMP)
                .column(tier.weightedSum(fact(tier.getTravelTimeColumn()), FACT_ALIAS) + " AS TOTAL_ACTUAL_TRAVEL_TIME")
                .column(tier.weightedSum(fact(tier.getPredictionColumn()), FACT_ALIAS) + " AS TOTAL_PREDICTION")
                .build();
        return queryExecutor.execute("anomaly-series", sqlRenderer.render(query));
    }

    /**
     * Unaggregated rows with their anomaly flags, oldest first. Rows outside
     * the located segments are left out.
     */
    public Table rawRows(PredicateSet predicates) {
        if (!predicates.getTier().isRaw()) {
            throw new IllegalStateException("Row detail needs the raw tier, got " + predicates.getTier());
        }
        Predicate where = predicates.getEntities().locatedRestriction(ColumnRef.of(FACT_ALIAS, "XD"))
                .<Predicate>map(located -> AndPredicate.of(predicates.where(), located))
                .orElse(predicates.where());
        SelectQuery.SelectQueryBuilder query = base(predicates, where);
        RAW_DETAIL_COLUMNS.forEach(c -> query.column(fact(c)));
        query.orderBy(fact(TIMESTAMP)).orderBy(fact("XD"));
        return queryExecutor.execute("travel-time-rows", sqlRenderer.render(query.build()));
    }

    private SelectQuery.SelectQueryBuilder series(PredicateSet predicates, LegendCap legend,
                                                  String axisExpression, String axisColumn) {
        SelectQuery.SelectQueryBuilder query = base(predicates, predicates.where())
                .column(axisExpression + " AS " + axisColumn)
                .groupBy(axisExpression)
                .orderBy(axisColumn);
        if (legend != null) {
            String group = legend.groupColumn().qualified();
            query.joins(legend.joins())
                    .column(group + " AS " + LegendCap.GROUP_COLUMN)
                    .groupBy(group)
                    .orderBy(LegendCap.GROUP_COLUMN);
        }
        return query;
    }

    private SelectQuery.SelectQueryBuilder base(PredicateSet predicates, Predicate where) {
        return SelectQuery.builder()
                .fromTable(predicates.getTier().getSourceTable())
                .fromAlias(FACT_ALIAS)
                .joins(predicates.joins())
                .where(where);
    }

    private static String fact(String column) {
        return FACT_ALIAS + "." + column;
    }
}
