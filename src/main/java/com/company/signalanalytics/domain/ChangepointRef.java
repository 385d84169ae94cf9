package com.company.signalanalytics.domain;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * One detected changepoint: the segment and the warehouse-local instant
 * its travel time shifted.
 */
@Value
public class ChangepointRef {
    long xd;
    LocalDateTime timestamp;
}
