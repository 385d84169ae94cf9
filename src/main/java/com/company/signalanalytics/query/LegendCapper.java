package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.LegendSpec;
import com.company.signalanalytics.domain.enums.RollupTier;
import com.company.signalanalytics.repository.LegendCandidateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bounds the number of groups a chart legend shows.
 * <p>
 * Grouping by segment id ranks segments by how many fact records they
 * contribute under the active filter. Grouping by a descriptive attribute
 * ranks attribute values by how many distinct segments of the selection
 * carry them; fact volume is not consulted for those.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LegendCapper {

    private static final Comparator<RankedCandidate> BY_WEIGHT_DESC =
            Comparator.comparingLong(RankedCandidate::getWeight).reversed()
                    .thenComparing(c -> String.valueOf(c.getValue()));

    private final LegendCandidateRepository candidateRepository;

    public LegendCap cap(LegendSpec legend, PredicateSet predicates, RollupTier tier) {
        if (legend.getMaxEntities() < 1) {
            throw new IllegalArgumentException("Legend cap must be at least 1, got " + legend.getMaxEntities());
        }

        List<RankedCandidate> pool = legend.getField().isEntityIdentifier()
                ? candidateRepository.rankByFactVolume(predicates, tier, legend.getMaxEntities())
                : candidateRepository.rankByDimensionMembership(legend.getField(), predicates.getEntities());

        List<RankedCandidate> kept = capCandidates(pool, legend.getMaxEntities());
        List<Object> values = new ArrayList<>(kept.size());
        kept.forEach(c -> values.add(c.getValue()));

        log.debug("Legend {} capped to {} of {} candidates", legend.getField(), values.size(), pool.size());
        return new LegendCap(legend.getField(), values);
    }

    /**
     * Keeps the {@code maxEntities} heaviest candidates. A pool that already
     * fits is returned unchanged, order included.
     */
    static List<RankedCandidate> capCandidates(List<RankedCandidate> pool, int maxEntities) {
        if (pool.size() <= maxEntities) {
            return pool;
        }
        List<RankedCandidate> sorted = new ArrayList<>(pool);
        sorted.sort(BY_WEIGHT_DESC);
        return List.copyOf(sorted.subList(0, maxEntities));
    }
}
