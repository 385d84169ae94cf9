package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.DimensionEntity;
import com.company.signalanalytics.domain.enums.EntityStrategy;
import lombok.Value;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of entity resolution. UNRESTRICTED means "no filter", never
 * "matches nothing". Evaluated against the dimension table, every strategy
 * stays within the located rows.
 */
@Value
public class ResolvedEntities {
    EntityStrategy strategy;
    List<Long> xdIds;
    DimensionPredicate predicate;

    private static final ResolvedEntities UNRESTRICTED =
            new ResolvedEntities(EntityStrategy.UNRESTRICTED, List.of(), null);

    public static ResolvedEntities unrestricted() {
        return UNRESTRICTED;
    }

    public static ResolvedEntities directList(List<Long> xdIds) {
        return new ResolvedEntities(EntityStrategy.DIRECT_LIST, List.copyOf(xdIds), null);
    }

    public static ResolvedEntities joinPredicate(DimensionPredicate predicate) {
        return new ResolvedEntities(EntityStrategy.JOIN_PREDICATE, List.of(), predicate);
    }

    public boolean isRestricted() {
        return strategy != EntityStrategy.UNRESTRICTED;
    }

    public boolean matches(DimensionEntity entity) {
        switch (strategy) {
            case DIRECT_LIST:
                return DimensionPredicate.isLocated(entity) && xdIds.contains(entity.getXd());
            case JOIN_PREDICATE:
                return predicate.matches(entity);
            default:
                return DimensionPredicate.isLocated(entity);
        }
    }

    /**
     * Segment ids this resolution selects out of a dimension universe.
     */
    public Set<Long> selectFrom(Collection<DimensionEntity> universe) {
        Set<Long> selected = new LinkedHashSet<>();
        for (DimensionEntity entity : universe) {
            if (matches(entity)) {
                selected.add(entity.getXd());
            }
        }
        return selected;
    }

    /**
     * ENTITY fragment against a fact table's segment column; empty when
     * unrestricted.
     */
    public Optional<PredicateFragment> toFragment(ColumnRef factXd) {
        switch (strategy) {
            case DIRECT_LIST:
                return Optional.of(PredicateFragment.of(FragmentKind.ENTITY, InPredicate.in(factXd, xdIds)));
            case JOIN_PREDICATE:
                return Optional.of(PredicateFragment.of(FragmentKind.ENTITY, predicate.semiJoin(factXd)));
            default:
                return Optional.empty();
        }
    }

    /**
     * Keeps a fact column within the located segments where the entity
     * fragment does not already; attribute semi-joins carry that restriction
     * themselves.
     */
    public Optional<Predicate> locatedRestriction(ColumnRef factXd) {
        return strategy == EntityStrategy.JOIN_PREDICATE
                ? Optional.empty()
                : Optional.of(DimensionPredicate.locatedSegments(factXd));
    }

    /**
     * Joins needed to evaluate this resolution directly on the dimension table.
     */
    public List<Join> dimensionJoins(String dimensionAlias, String signalAlias) {
        return strategy == EntityStrategy.JOIN_PREDICATE
                ? predicate.signalJoins(dimensionAlias, signalAlias)
                : List.of();
    }

    /**
     * Condition on a dimension table joined to facts by segment: the
     * attribute filter where there is one, otherwise the located rows.
     * Explicit ids are already enforced on the fact side.
     */
    public AndPredicate keyJoinCondition(String dimensionAlias, String signalAlias) {
        return strategy == EntityStrategy.JOIN_PREDICATE
                ? predicate.conditions(dimensionAlias, signalAlias)
                : DimensionPredicate.located(dimensionAlias);
    }

    public AndPredicate dimensionCondition(String dimensionAlias, String signalAlias) {
        switch (strategy) {
            case DIRECT_LIST:
                return AndPredicate.of(DimensionPredicate.located(dimensionAlias),
                        InPredicate.in(ColumnRef.of(dimensionAlias, "XD"), xdIds));
            case JOIN_PREDICATE:
                return predicate.conditions(dimensionAlias, signalAlias);
            default:
                return DimensionPredicate.located(dimensionAlias);
        }
    }
}
