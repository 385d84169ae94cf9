package com.company.signalanalytics.repository;

import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.LegendField;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.query.AndPredicate;
import com.company.signalanalytics.query.ColumnRef;
import com.company.signalanalytics.query.NotNullPredicate;
import com.company.signalanalytics.query.PredicateSet;
import com.company.signalanalytics.query.RankedCandidate;
import com.company.signalanalytics.query.ResolvedEntities;
import com.company.signalanalytics.query.SelectQuery;
import com.company.signalanalytics.query.SqlRenderer;
import com.company.signalanalytics.util.RowValues;
import com.company.signalanalytics.warehouse.WarehouseQueryExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.company.signalanalytics.query.WarehouseTables.DIMENSION_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;
import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.SIGNAL_ALIAS;

/**
 * Ranking queries behind legend capping.
 */
@Repository
@RequiredArgsConstructor
public class LegendCandidateRepository {

    private final WarehouseQueryExecutor queryExecutor;
    private final SqlRenderer sqlRenderer;

    /**
     * Top segments by fact record count under the full predicate set.
     */
    public List<RankedCandidate> rankByFactVolume(PredicateSet predicates, RollupTier tier, int limit) {
        String xd = FACT_ALIAS + ".XD";
        SelectQuery query = SelectQuery.builder()
                .column(xd + " AS CANDIDATE")
                .column(tier.recordCountExpression(FACT_ALIAS) + " AS WEIGHT")
                .fromTable(tier.getSourceTable())
                .fromAlias(FACT_ALIAS)
                .joins(predicates.joins())
                .where(predicates.where())
                .groupBy(xd)
                .orderBy("WEIGHT DESC")
                .orderBy(xd)
                .limit(limit)
                .build();
        return toCandidates(queryExecutor.execute("legend-fact-volume", sqlRenderer.render(query)));
    }

    /**
     * Every value of a descriptive attribute among the selected segments,
     * weighted by how many distinct segments carry it.
     */
    public List<RankedCandidate> rankByDimensionMembership(LegendField field, ResolvedEntities entities) {
        ColumnRef attribute = ColumnRef.of(DIMENSION_ALIAS, field.getColumn());
        SelectQuery query = SelectQuery.builder()
                .column(attribute.qualified() + " AS CANDIDATE")
                .column("COUNT(DISTINCT " + DIMENSION_ALIAS + ".XD) AS WEIGHT")
                .fromTable(DIM_SIGNALS_XD)
                .fromAlias(DIMENSION_ALIAS)
                .joins(entities.dimensionJoins(DIMENSION_ALIAS, SIGNAL_ALIAS))
                .where(AndPredicate.of(
                        NotNullPredicate.notNull(attribute),
                        entities.dimensionCondition(DIMENSION_ALIAS, SIGNAL_ALIAS)))
                .groupBy(attribute.qualified())
                .orderBy("WEIGHT DESC")
                .orderBy(attribute.qualified())
                .build();
        return toCandidates(queryExecutor.execute("legend-dimension-membership", sqlRenderer.render(query)));
    }

    private static List<RankedCandidate> toCandidates(Table rows) {
        List<RankedCandidate> candidates = new ArrayList<>(rows.rowCount());
        for (Map<String, Object> row : rows.getRows()) {
            Long weight = RowValues.asLong(row.get("WEIGHT"));
            candidates.add(new RankedCandidate(row.get("CANDIDATE"), weight == null ? 0L : weight));
        }
        return candidates;
    }
}
