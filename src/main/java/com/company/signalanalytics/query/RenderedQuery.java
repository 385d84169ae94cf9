package com.company.signalanalytics.query;

import lombok.Value;

import java.util.List;

/**
 * Query text with {@code ?} placeholders and the values bound to them, in order.
 */
@Value
public class RenderedQuery {
    String sql;
    List<Object> params;

    public Object[] paramArray() {
        return params.toArray();
    }
}
