package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.DimensionEntity;
import com.company.signalanalytics.domain.EntitySelection;
import com.company.signalanalytics.domain.enums.GeometryValidity;
import com.company.signalanalytics.domain.enums.Maintainer;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_SIGNALS_XD;

/**
 * Attribute filter over the signal/segment dimension. A segment is selected
 * when any of its located dimension rows satisfies every attribute condition.
 * <p>
 * Only rows with both coordinates belong to the dimension universe; every
 * rendering of this predicate carries that restriction, and so does
 * {@link #matches}.
 */
@Value
@Builder
public class DimensionPredicate {

    @Builder.Default
    List<String> signalIds = List.of();

    @Builder.Default
    Maintainer maintainer = Maintainer.ALL;

    Boolean approach;

    @Builder.Default
    GeometryValidity geometryValidity = GeometryValidity.ALL;

    public static DimensionPredicate from(EntitySelection selection) {
        return DimensionPredicate.builder()
                .signalIds(selection.getSignalIds() == null ? List.of() : List.copyOf(selection.getSignalIds()))
                .maintainer(selection.getMaintainer())
                .approach(selection.getApproach())
                .geometryValidity(selection.getGeometryValidity())
                .build();
    }

    public boolean requiresSignalJoin() {
        return maintainer != Maintainer.ALL;
    }

    public static AndPredicate located(String dimensionAlias) {
        return AndPredicate.of(
                NotNullPredicate.notNull(ColumnRef.of(dimensionAlias, "LATITUDE")),
                NotNullPredicate.notNull(ColumnRef.of(dimensionAlias, "LONGITUDE")));
    }

    public static boolean isLocated(DimensionEntity entity) {
        return entity.getLatitude() != null && entity.getLongitude() != null;
    }

    /**
     * Restricts a fact column to the located segments of the dimension table.
     */
    public static Predicate locatedSegments(ColumnRef factXd) {
        return segmentsIn(factXd, List.of(), located("fx"));
    }

    public boolean matches(DimensionEntity entity) {
        if (!isLocated(entity)) {
            return false;
        }
        if (!signalIds.isEmpty() && !signalIds.contains(entity.getSignalId())) {
            return false;
        }
        if (approach != null && !approach.equals(entity.getApproach())) {
            return false;
        }
        if (geometryValidity == GeometryValidity.VALID && !Boolean.TRUE.equals(entity.getValidGeometry())) {
            return false;
        }
        if (geometryValidity == GeometryValidity.INVALID && !Boolean.FALSE.equals(entity.getValidGeometry())) {
            return false;
        }
        if (maintainer == Maintainer.ODOT && !Boolean.TRUE.equals(entity.getOdotMaintained())) {
            return false;
        }
        return maintainer != Maintainer.OTHERS || Boolean.FALSE.equals(entity.getOdotMaintained());
    }

    public List<Join> signalJoins(String dimensionAlias, String signalAlias) {
        if (!requiresSignalJoin()) {
            return List.of();
        }
        return List.of(Join.inner(DIM_SIGNALS, signalAlias,
                ColumnRef.of(signalAlias, "ID"), ColumnRef.of(dimensionAlias, "ID")));
    }

    public AndPredicate conditions(String dimensionAlias, String signalAlias) {
        List<Predicate> conditions = new ArrayList<>();
        conditions.add(located(dimensionAlias));
        if (!signalIds.isEmpty()) {
            conditions.add(InPredicate.in(ColumnRef.of(dimensionAlias, "ID"), signalIds));
        }
        if (approach != null) {
            conditions.add(EqualsPredicate.eq(ColumnRef.of(dimensionAlias, "APPROACH"), approach));
        }
        if (geometryValidity != GeometryValidity.ALL) {
            conditions.add(EqualsPredicate.eq(ColumnRef.of(dimensionAlias, "VALID_GEOMETRY"),
                    geometryValidity == GeometryValidity.VALID));
        }
        if (requiresSignalJoin()) {
            conditions.add(EqualsPredicate.eq(ColumnRef.of(signalAlias, "ODOT_MAINTAINED"),
                    maintainer == Maintainer.ODOT));
        }
        return AndPredicate.of(conditions);
    }

    /**
     * Restricts a fact column to the segments this predicate selects, letting
     * the warehouse evaluate the dimension join instead of shipping an id list.
     */
    public Predicate semiJoin(ColumnRef factXd) {
        return segmentsIn(factXd, signalJoins("fx", "fs"), conditions("fx", "fs"));
    }

    private static Predicate segmentsIn(ColumnRef factXd, List<Join> joins, Predicate where) {
        SelectQuery segments = SelectQuery.builder()
                .distinct(true)
                .column("fx.XD")
                .fromTable(DIM_SIGNALS_XD)
                .fromAlias("fx")
                .joins(joins)
                .where(where)
                .build();
        return new SubqueryInPredicate(factXd, segments);
    }
}
