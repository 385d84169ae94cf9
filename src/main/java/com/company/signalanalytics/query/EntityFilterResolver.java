package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.EntitySelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses how an entity selection reaches the warehouse.
 * <p>
 * Explicit segment ids (a map click, a short pick list) are shipped as a
 * literal id list and skip the dimension round trip. Attribute filters, which
 * may select thousands of segments, are pushed into a join against the
 * dimension table instead.
 */
@Component
@Slf4j
public class EntityFilterResolver {

    public ResolvedEntities resolve(EntitySelection selection) {
        if (selection == null) {
            return ResolvedEntities.unrestricted();
        }
        if (selection.hasExplicitIds()) {
            if (selection.hasDimensionFilters()) {
                log.debug("Explicit XD list of {} overrides dimension filters", selection.getXdIds().size());
            }
            return ResolvedEntities.directList(selection.getXdIds());
        }
        if (selection.hasDimensionFilters()) {
            return ResolvedEntities.joinPredicate(DimensionPredicate.from(selection));
        }
        return ResolvedEntities.unrestricted();
    }
}
