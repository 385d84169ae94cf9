package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.enums.LegendField;
import lombok.Value;

import java.util.List;

import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;
import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.LEGEND_ALIAS;

/**
 * The legend values kept for a chart, usable both as a containment filter
 * and as the grouping expression of the series query.
 */
@Value
public class LegendCap {

    public static final String GROUP_COLUMN = "LEGEND_GROUP";

    LegendField field;
    List<Object> values;

    public PredicateFragment toFragment() {
        return PredicateFragment.of(FragmentKind.LEGEND, joins(), InPredicate.in(groupColumn(), values));
    }

    public List<Join> joins() {
        if (field.isEntityIdentifier()) {
            return List.of();
        }
        return List.of(Join.inner(DIM_SIGNALS_XD, LEGEND_ALIAS,
                ColumnRef.of(LEGEND_ALIAS, "XD"), ColumnRef.of(FACT_ALIAS, "XD")));
    }

    public ColumnRef groupColumn() {
        return field.isEntityIdentifier()
                ? ColumnRef.of(FACT_ALIAS, "XD")
                : ColumnRef.of(LEGEND_ALIAS, field.getColumn());
    }

    public int size() {
        return values.size();
    }
}
