package com.company.signalanalytics.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Disjunction. With no operands it is constant false.
 */
@Value
public class OrPredicate implements Predicate {

    static final String FALSE_SQL = "1 = 0";

    List<Predicate> operands;

    public static OrPredicate of(Predicate... operands) {
        return new OrPredicate(Arrays.asList(operands));
    }

    public static OrPredicate of(List<Predicate> operands) {
        return new OrPredicate(List.copyOf(operands));
    }

    @Override
    public String render(List<Object> params) {
        if (operands.isEmpty()) {
            return FALSE_SQL;
        }
        List<String> parts = new ArrayList<>(operands.size());
        for (Predicate operand : operands) {
            parts.add("(" + operand.render(params) + ")");
        }
        return String.join(" OR ", parts);
    }
}
