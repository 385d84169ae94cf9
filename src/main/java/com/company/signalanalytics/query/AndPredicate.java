package com.company.signalanalytics.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Conjunction. With no operands it is constant true.
 */
@Value
public class AndPredicate implements Predicate {

    static final String TRUE_SQL = "1 = 1";

    List<Predicate> operands;

    public static AndPredicate of(Predicate... operands) {
        return new AndPredicate(Arrays.asList(operands));
    }

    public static AndPredicate of(List<Predicate> operands) {
        return new AndPredicate(List.copyOf(operands));
    }

    public boolean isEmpty() {
        return operands.isEmpty();
    }

    @Override
    public String render(List<Object> params) {
        if (operands.isEmpty()) {
            return TRUE_SQL;
        }
        List<String> parts = new ArrayList<>(operands.size());
        for (Predicate operand : operands) {
            String sql = operand.render(params);
            parts.add(operand instanceof AndPredicate ? sql : "(" + sql + ")");
        }
        return String.join(" AND ", parts);
    }
}
