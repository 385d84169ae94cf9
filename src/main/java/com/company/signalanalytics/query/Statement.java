package com.company.signalanalytics.query;

import java.util.List;

/**
 * A complete query that can be rendered to parameterized text.
 */
public interface Statement {

    String render(List<Object> params);
}
