package com.company.signalanalytics.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Dashboard filter parameters exactly as the request layer received them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFilterParams {

    private String startDate;
    private String endDate;

    private String beforeStartDate;
    private String beforeEndDate;
    private String afterStartDate;
    private String afterEndDate;

    @Builder.Default
    private List<String> xdSegments = new ArrayList<>();

    @Builder.Default
    private List<String> signalIds = new ArrayList<>();

    private String maintainedBy;
    private String approach;
    private String validGeometry;

    private String startHour;
    private String startMinute;
    private String endHour;
    private String endMinute;

    @Builder.Default
    private List<String> dayOfWeek = new ArrayList<>();

    private String removeAnomalies;
    private String legend;
    private String anomalyType;

    private String pctChangeImprovement;
    private String pctChangeDegradation;

    @Builder.Default
    private List<String> selectedSignals = new ArrayList<>();

    @Builder.Default
    private List<String> selectedXds = new ArrayList<>();

    private String sortBy;
    private String sortDir;

    // a single changepoint
    private String xd;
    private String timestamp;
}
