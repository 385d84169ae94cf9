package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

/**
 * One named filter: the joins it needs plus the condition it adds.
 */
@Value
public class PredicateFragment {
    FragmentKind kind;
    List<Join> joins;
    Predicate predicate;

    public static PredicateFragment of(FragmentKind kind, Predicate predicate) {
        return new PredicateFragment(kind, List.of(), predicate);
    }

    public static PredicateFragment of(FragmentKind kind, List<Join> joins, Predicate predicate) {
        return new PredicateFragment(kind, List.copyOf(joins), predicate);
    }
}
