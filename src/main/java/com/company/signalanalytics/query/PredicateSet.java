package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.enums.RollupTier;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, AND-ed fragments bound to the tier they were composed for.
 * An absent fragment is constant true.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PredicateSet {

    private final RollupTier tier;
    private final ResolvedEntities entities;
    private final List<PredicateFragment> fragments;

    public PredicateSet(RollupTier tier, ResolvedEntities entities, List<PredicateFragment> fragments) {
        this.tier = tier;
        this.entities = entities;
        this.fragments = List.copyOf(fragments);
    }

    public boolean has(FragmentKind kind) {
        return fragment(kind).isPresent();
    }

    public Optional<PredicateFragment> fragment(FragmentKind kind) {
        return fragments.stream().filter(f -> f.getKind() == kind).findFirst();
    }

    public List<FragmentKind> kinds() {
        List<FragmentKind> kinds = new ArrayList<>(fragments.size());
        fragments.forEach(f -> kinds.add(f.getKind()));
        return kinds;
    }

    /**
     * Layers an extra fragment on top; the existing fragments are kept as is.
     */
    public PredicateSet with(PredicateFragment fragment) {
        List<PredicateFragment> extended = new ArrayList<>(fragments);
        extended.add(fragment);
        return new PredicateSet(tier, entities, extended);
    }

    /**
     * Joins required by all fragments, each alias once, in fragment order.
     */
    public List<Join> joins() {
        LinkedHashSet<Join> joins = new LinkedHashSet<>();
        fragments.forEach(f -> joins.addAll(f.getJoins()));
        return new ArrayList<>(joins);
    }

    public AndPredicate where() {
        List<Predicate> predicates = new ArrayList<>(fragments.size());
        fragments.forEach(f -> predicates.add(f.getPredicate()));
        return AndPredicate.of(predicates);
    }
}
