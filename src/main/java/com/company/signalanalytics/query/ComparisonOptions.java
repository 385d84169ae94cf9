package com.company.signalanalytics.query;

import com.company.signalanalytics.domain.enums.EntityKey;
import com.company.signalanalytics.domain.enums.TimeAxis;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComparisonOptions {

    @Builder.Default
    EntityKey entityKey = EntityKey.XD;

    @Builder.Default
    TimeAxis axis = TimeAxis.TIMESTAMP;

    // series only, null when the chart has no legend
    LegendCap legend;

    public static ComparisonOptions defaults() {
        return ComparisonOptions.builder().build();
    }
}
