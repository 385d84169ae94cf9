package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.enums.ComparisonMetric;
import com.company.signalanalytics.domain.enums.ComparisonMode;
import com.company.signalanalytics.domain.enums.RollupTier;
import lombok.Value;

/**
 * Before/after query over one tier. Both windows' rows come back in a single
 * result, tagged by the PERIOD column.
 */
@Value
public class ComparisonQuery {
    ComparisonMode mode;
    ComparisonMetric metric;
    RollupTier tier;
    ComparisonOptions options;
    PredicateSet beforePredicates;
    PredicateSet afterPredicates;
    UnionQuery statement;

    public String keyColumn() {
        return options.getEntityKey().getColumn();
    }
}
