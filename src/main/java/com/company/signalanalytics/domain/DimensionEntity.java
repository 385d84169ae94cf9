package com.company.signalanalytics.domain;

import com.company.signalanalytics.domain.enums.LegendField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One signal/segment row of the dimension table.
 * A segment belonging to several signals appears once per signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionEntity {
    private String signalId;
    private Long xd;
    private Double latitude;
    private Double longitude;
    private String roadName;
    private String bearing;
    private String county;
    private Double miles;
    private Boolean approach;
    private Boolean extended;
    private Boolean validGeometry;
    private Boolean odotMaintained;

    public Object attribute(LegendField field) {
        switch (field) {
            case XD:
                return xd;
            case ID:
                return signalId;
            case BEARING:
                return bearing;
            case COUNTY:
                return county;
            case ROADNAME:
                return roadName;
            default:
                throw new IllegalArgumentException("Unsupported legend field: " + field);
        }
    }
}
