package com.company.signalanalytics.domain;

import com.company.signalanalytics.domain.enums.ChangepointSort;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Table-only narrowing and ordering on top of the changepoint filter:
 * signals or segments picked on the map, and the sort column.
 */
@Value
@Builder
public class ChangepointTableOptions {

    @Builder.Default
    List<String> selectedSignals = List.of();

    @Builder.Default
    List<Long> selectedXds = List.of();

    @Builder.Default
    ChangepointSort sortBy = ChangepointSort.TIMESTAMP;

    boolean ascending;

    public static ChangepointTableOptions defaults() {
        return ChangepointTableOptions.builder().build();
    }
}
