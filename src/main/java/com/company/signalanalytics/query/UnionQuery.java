package com.company.signalanalytics.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * UNION ALL of several select blocks with an outer ordering.
 */
@Value
public class UnionQuery implements Statement {
    List<SelectQuery> parts;
    List<String> orderings;

    @Override
    public String render(List<Object> params) {
        List<String> rendered = new ArrayList<>(parts.size());
        for (SelectQuery part : parts) {
            rendered.add(part.render(params));
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM (\n")
                .append(String.join("\nUNION ALL\n", rendered))
                .append("\n) u");
        if (!orderings.isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", orderings));
        }
        return sql.toString();
    }
}
