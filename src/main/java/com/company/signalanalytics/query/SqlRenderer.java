package com.company.signalanalytics.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
@Slf4j
public class SqlRenderer {

    public RenderedQuery render(Statement statement) {
        List<Object> params = new ArrayList<>();
        String sql = statement.render(params);
        log.debug("Rendered query with {} bound parameters:\n{}", params.size(), sql);
        return new RenderedQuery(sql, Collections.unmodifiableList(params));
    }

    /**
     * Renders a bare predicate, mostly useful for inspecting fragments.
     */
    public RenderedQuery render(Predicate predicate) {
        List<Object> params = new ArrayList<>();
        String sql = predicate.render(params);
        return new RenderedQuery(sql, Collections.unmodifiableList(params));
    }
}
