package com.company.signalanalytics.repository;

import com.company.signalanalytics.domain.ChangepointTableOptions;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.AndPredicate;
import com.company.signalanalytics.query.ColumnRef;
import com.company.signalanalytics.query.DimensionPredicate;
import com.company.signalanalytics.query.EqualsPredicate;
import com.company.signalanalytics.query.FragmentKind;
import com.company.signalanalytics.query.InPredicate;
import com.company.signalanalytics.query.Join;
import com.company.signalanalytics.query.Predicate;
import com.company.signalanalytics.query.PredicateFragment;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RangePredicate;
import com.company.signalanalytics.query.ResolvedEntities;
import com.company.signalanalytics.query.SelectQuery;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

import static com.company.signalanalytics.query.WarehouseTables.CHANGEPOINTS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;
import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.KEY_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.KEY_SIGNAL_ALIAS;

/**
 * Reads over the changepoint table, restricted by a set from
 * {@code PredicateComposer#composeChangepoints}. Only changepoints of located
 * segments are returned.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ChangepointRepository {

    static final List<String> CHANGEPOINT_COLUMNS = List.of(
            "XD", "TIMESTAMP", "PCT_CHANGE", "AVG_DIFF", "AVG_BEFORE", "AVG_AFTER", "SCORE");

    private final WarehouseQueryExecutor queryExecutor;
    private final SqlRenderer sqlRenderer;

    /**
     * One row per signal: totals over all its changepoints plus the largest
     * one, later timestamps first on ties. Strongest signals first.
     */
    public Table signalStats(PredicateSet predicates) {
        ResolvedEntities entities = predicates.getEntities();
        String signal = KEY_ALIAS + ".ID";
        SelectQuery.SelectQueryBuilder query = base(predicates,
                AndPredicate.of(predicates.where(), entities.keyJoinCondition(KEY_ALIAS, KEY_SIGNAL_ALIAS)))
                .join(Join.inner(DIM_SIGNALS_XD, KEY_ALIAS,
                        ColumnRef.of(KEY_ALIAS, "XD"), ColumnRef.of(FACT_ALIAS, "XD")))
                .joins(entities.dimensionJoins(KEY_ALIAS, KEY_SIGNAL_ALIAS))
                .column(signal + " AS ID");
        statistics(query, signal)
                .column(fact("XD") + " AS TOP_XD")
                .column(fact("TIMESTAMP") + " AS TOP_TIMESTAMP")
                .column(fact("PCT_CHANGE") + " AS TOP_PCT_CHANGE")
                .column(fact("AVG_DIFF") + " AS TOP_AVG_DIFF")
                .column(KEY_ALIAS + ".ROADNAME AS TOP_ROADNAME")
                .column(KEY_ALIAS + ".BEARING AS TOP_BEARING")
                .qualify(strongestFirst(signal))
                .orderBy("ABS_PCT_SUM DESC")
                .orderBy("ID");
        return queryExecutor.execute("changepoints-by-signal", sqlRenderer.render(query.build()));
    }

    /**
     * One row per segment, shaped like {@link #signalStats} without the
     * dimension attributes. Each changepoint counts once however many signals
     * share its segment.
     */
    public Table segmentStats(PredicateSet predicates) {
        String segment = fact("XD");
        SelectQuery.SelectQueryBuilder query = base(predicates, located(predicates))
                .column(segment + " AS XD");
        statistics(query, segment)
                .column(fact("TIMESTAMP") + " AS TOP_TIMESTAMP")
                .column(fact("PCT_CHANGE") + " AS TOP_PCT_CHANGE")
                .column(fact("AVG_DIFF") + " AS TOP_AVG_DIFF")
                .qualify(strongestFirst(segment))
                .orderBy("ABS_PCT_SUM DESC")
                .orderBy("XD");
        return queryExecutor.execute("changepoints-by-xd", sqlRenderer.render(query.build()));
    }

    /**
     * Individual changepoints, optionally narrowed to picked signals or
     * segments, sorted server side and capped at {@code limit} rows.
     */
    public Table changepoints(PredicateSet predicates, ChangepointTableOptions options, int limit) {
        PredicateSet narrowed = predicates;
        if (!options.getSelectedSignals().isEmpty()) {
            Predicate bySignal = DimensionPredicate.builder()
                    .signalIds(options.getSelectedSignals())
                    .build()
                    .semiJoin(ColumnRef.of(FACT_ALIAS, "XD"));
            narrowed = narrowed.with(PredicateFragment.of(FragmentKind.SELECTION, bySignal));
        }
        if (!options.getSelectedXds().isEmpty()) {
            narrowed = narrowed.with(PredicateFragment.of(FragmentKind.SELECTION,
                    InPredicate.in(ColumnRef.of(FACT_ALIAS, "XD"), options.getSelectedXds())));
        }

        String direction = options.isAscending() ? " ASC" : " DESC";
        SelectQuery.SelectQueryBuilder query = base(narrowed, located(narrowed));
        CHANGEPOINT_COLUMNS.forEach(c -> query.column(fact(c) + " AS " + c));
        query.orderBy(fact(options.getSortBy().getColumn()) + direction)
                .orderBy(fact("XD"))
                .limit(limit);
        log.debug("Changepoint table sorted by {}{} with limit {}", options.getSortBy(), direction, limit);
        return queryExecutor.execute("changepoint-rows", sqlRenderer.render(query.build()));
    }

    /**
     * Raw travel times of one segment within an inclusive window, oldest first.
     */
    public Table travelTimesAround(long xd, LocalDateTime from, LocalDateTime to) {
        RollupTier raw = RollupTier.RAW;
        SelectQuery query = SelectQuery.builder()
                .fromTable(raw.getSourceTable())
                .fromAlias(FACT_ALIAS)
                .column(fact("XD") + " AS XD")
                .column(fact(raw.getTimestampColumn()) + " AS TIMESTAMP")
                .column(fact(raw.getTravelTimeColumn()) + " AS TRAVEL_TIME_SECONDS")
                .where(AndPredicate.of(
                        EqualsPredicate.eq(ColumnRef.of(FACT_ALIAS, "XD"), xd),
                        RangePredicate.between(ColumnRef.of(FACT_ALIAS, raw.getTimestampColumn()), from, to)))
                .orderBy(fact(raw.getTimestampColumn()))
                .build();
        return queryExecutor.execute("changepoint-travel-times", sqlRenderer.render(query));
    }

    private static SelectQuery.SelectQueryBuilder statistics(SelectQuery.SelectQueryBuilder query, String partition) {
        String window = " OVER (PARTITION BY " + partition + ")";
        return query
                .column("SUM(ABS(" + fact("PCT_CHANGE") + "))" + window + " AS ABS_PCT_SUM")
                .column("AVG(" + fact("PCT_CHANGE") + ")" + window + " AS AVG_PCT_CHANGE")
                .column("COUNT(*)" + window + " AS CHANGEPOINT_COUNT");
    }

    private static String strongestFirst(String partition) {
        return "ROW_NUMBER() OVER (PARTITION BY " + partition + " ORDER BY ABS(" + fact("PCT_CHANGE")
                + ") DESC, " + fact("TIMESTAMP") + " DESC, " + fact("XD") + ") = 1";
    }

    private static Predicate located(PredicateSet predicates) {
        return predicates.getEntities().locatedRestriction(ColumnRef.of(FACT_ALIAS, "XD"))
                .<Predicate>map(located -> AndPredicate.of(predicates.where(), located))
                .orElse(predicates.where());
    }

    private static SelectQuery.SelectQueryBuilder base(PredicateSet predicates, Predicate where) {
        return SelectQuery.builder()
                .fromTable(CHANGEPOINTS)
                .fromAlias(FACT_ALIAS)
                .joins(predicates.joins())
                .where(where);
    }

    private static String fact(String column) {
        return FACT_ALIAS + "." + column;
    }
}
