package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.ChangeThreshold;
import com.company.signalanalytics.domain.FilterSpec;
import com.company.signalanalytics.domain.TimeOfDayWindow;
import com.company.signalanalytics.domain.enums.AnomalyType;
import com.company.signalanalytics.domain.enums.RollupTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static com.company.signalanalytics.query.WarehouseTables.CALENDAR_ALIAS;
import static com.company.signalanalytics.query.WarehouseTables.DIM_DATE;
import static com.company.signalanalytics.query.WarehouseTables.FACT_ALIAS;

/**
 * Turns a filter into the ordered fragments that restrict a fact source.
 * Fragments that would be no-ops are left out rather than rendered as
 * always-true conditions.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PredicateComposer {

    static final String CALENDAR_DATE_COLUMN = "CALENDAR_DATE";
    static final String ISO_WEEKDAY_COLUMN = "ISO_DAY_OF_WEEK";
    static final String CHANGEPOINT_TIMESTAMP_COLUMN = "TIMESTAMP";
    static final String PCT_CHANGE_COLUMN = "PCT_CHANGE";

    private final EntityFilterResolver entityFilterResolver;

    public PredicateSet compose(FilterSpec spec, RollupTier tier) {
        ResolvedEntities entities = entityFilterResolver.resolve(spec.getEntities());
        List<PredicateFragment> fragments = new ArrayList<>(5);

        fragments.add(PredicateFragment.of(FragmentKind.DATE_RANGE, RangePredicate.between(
                fact(RollupTier.DATE_COLUMN),
                spec.getDateRange().getStart(),
                spec.getDateRange().getEnd())));

        if (spec.hasTimeOfDayRestriction()) {
            fragments.add(timeOfDay(spec.getTimeOfDay(), tier));
        }

        if (spec.getDaysOfWeek() != null && !spec.getDaysOfWeek().isEmpty()) {
            Join calendar = Join.inner(DIM_DATE, CALENDAR_ALIAS,
                    ColumnRef.of(CALENDAR_ALIAS, CALENDAR_DATE_COLUMN), fact(RollupTier.DATE_COLUMN));
            fragments.add(PredicateFragment.of(FragmentKind.DAY_OF_WEEK, List.of(calendar),
                    InPredicate.in(ColumnRef.of(CALENDAR_ALIAS, ISO_WEEKDAY_COLUMN),
                            new ArrayList<>(new TreeSet<>(spec.getDaysOfWeek())))));
        }

        entities.toFragment(fact(RollupTier.XD_COLUMN)).ifPresent(fragments::add);

        if (spec.isRemoveAnomalies()) {
            if (!tier.isRaw()) {
                throw new IllegalStateException("Anomaly exclusion needs per-row flags, tier " + tier + " has none");
            }
            fragments.add(PredicateFragment.of(FragmentKind.ANOMALY_EXCLUSION,
                    EqualsPredicate.eq(fact(AnomalyType.ALL.getRawFlagColumn()), Boolean.FALSE)));
        }

        PredicateSet set = new PredicateSet(tier, entities, fragments);
        log.debug("Composed {} over {} with entity strategy {}", set.kinds(), tier, entities.getStrategy());
        return set;
    }

    /**
     * Fragments over the changepoint table, which is not part of any rollup
     * tier: the resulting set carries no tier. Changepoints are matched by
     * calendar day of their timestamp and by relative change; time-of-day,
     * day-of-week and anomaly exclusion do not apply to them.
     */
    public PredicateSet composeChangepoints(FilterSpec spec, ChangeThreshold threshold) {
        ResolvedEntities entities = entityFilterResolver.resolve(spec.getEntities());
        List<PredicateFragment> fragments = new ArrayList<>(3);

        fragments.add(PredicateFragment.of(FragmentKind.DATE_RANGE, RangePredicate.between(
                fact(CHANGEPOINT_TIMESTAMP_COLUMN),
                spec.getDateRange().getStart().atStartOfDay(),
                spec.getDateRange().getEnd().atTime(LocalTime.MAX))));

        if (!threshold.isUnbounded()) {
            List<Predicate> sides = new ArrayList<>(2);
            if (threshold.getImprovement() > 0) {
                sides.add(RangePredicate.between(fact(PCT_CHANGE_COLUMN), null, -threshold.getImprovement()));
            }
            if (threshold.getDegradation() > 0) {
                sides.add(RangePredicate.between(fact(PCT_CHANGE_COLUMN), threshold.getDegradation(), null));
            }
            fragments.add(PredicateFragment.of(FragmentKind.CHANGE_THRESHOLD, OrPredicate.of(sides)));
        }

        entities.toFragment(fact(RollupTier.XD_COLUMN)).ifPresent(fragments::add);

        PredicateSet set = new PredicateSet(null, entities, fragments);
        log.debug("Composed changepoint {} with entity strategy {}", set.kinds(), entities.getStrategy());
        return set;
    }

    private PredicateFragment timeOfDay(TimeOfDayWindow window, RollupTier tier) {
        if (!tier.supports(window)) {
            throw new IllegalStateException("Tier " + tier + " cannot evaluate time-of-day window "
                    + window.getStart() + "-" + window.getEnd());
        }
        return PredicateFragment.of(FragmentKind.TIME_OF_DAY, RangePredicate.between(
                fact(tier.getTimeOfDayColumn()), window.getStart(), window.getEnd()));
    }

    static ColumnRef fact(String column) {
        return ColumnRef.of(FACT_ALIAS, column);
    }
}
