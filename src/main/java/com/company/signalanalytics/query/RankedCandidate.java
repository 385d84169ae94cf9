package com.company.signalanalytics.query;

import lombok.Value;

/**
 * Legend candidate with the weight it is ranked by.
 */
@Value
public class RankedCandidate {
    Object value;
    long weight;
}
