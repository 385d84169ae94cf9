package com.company.signalanalytics.domain;

import lombok.Value;

/**
 * Minimum relative change a changepoint needs to be shown, as fractions:
 * an improvement is a drop in travel time of at least {@code improvement},
 * a degradation a rise of at least {@code degradation}. A zero side selects
 * nothing on that side; both zero selects every changepoint.
 */
@Value
public class ChangeThreshold {
    double improvement;
    double degradation;

    public static ChangeThreshold of(double improvement, double degradation) {
        return new ChangeThreshold(Math.abs(improvement), Math.abs(degradation));
    }

    public boolean isUnbounded() {
        return improvement == 0.0 && degradation == 0.0;
    }
}
