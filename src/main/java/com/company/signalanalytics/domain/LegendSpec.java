package com.company.signalanalytics.domain;

import com.company.signalanalytics.domain.enums.LegendField;
import lombok.Value;

@Value
public class LegendSpec {
    LegendField field;
    int maxEntities;
}
