package com.company.signalanalytics.domain;

import com.company.signalanalytics.domain.enums.GeometryValidity;
import com.company.signalanalytics.domain.enums.Maintainer;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * User-facing selection of segments: explicit XD ids, or dimension
 * attribute filters. Explicit ids win when both are present.
 */
@Value
@Builder
public class EntitySelection {

    @Builder.Default
    List<Long> xdIds = List.of();

    @Builder.Default
    List<String> signalIds = List.of();

    @Builder.Default
    Maintainer maintainer = Maintainer.ALL;

    Boolean approach;

    @Builder.Default
    GeometryValidity geometryValidity = GeometryValidity.ALL;

    public static EntitySelection unrestricted() {
        return EntitySelection.builder().build();
    }

    public boolean hasExplicitIds() {
        return xdIds != null && !xdIds.isEmpty();
    }

    public boolean hasDimensionFilters() {
        return (signalIds != null && !signalIds.isEmpty())
                || maintainer != Maintainer.ALL
                || approach != null
                || geometryValidity != GeometryValidity.ALL;
    }
}
