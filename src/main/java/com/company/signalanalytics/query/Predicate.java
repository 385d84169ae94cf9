package com.company.signalanalytics.query;

import java.util.List;

/**
 * Node of the filter AST. Rendering appends bound values to {@code params}
 * in the order their placeholders appear in the returned text.
 */
public interface Predicate {

    String render(List<Object> params);
}
