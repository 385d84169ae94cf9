package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.exception.WarehouseAccessException;
import com.company.signalanalytics.query.RenderedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Session backed by one JDBC connection shared through a
 * {@link SingleConnectionDataSource}.
 */
@Slf4j
public class JdbcWarehouseSession implements WarehouseSession {

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final WarehouseErrorClassifier classifier;

    public JdbcWarehouseSession(SingleConnectionDataSource dataSource, int queryTimeoutSeconds,
                                WarehouseErrorClassifier classifier) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        this.classifier = classifier;
    }

    @Override
    public Table execute(RenderedQuery query) {
        try {
            return jdbcTemplate.query(query.getSql(), new TableResultSetExtractor(), bindable(query.paramArray()));
        } catch (DataAccessException e) {
            throw new WarehouseAccessException(classifier.classify(e), "Warehouse statement failed", e);
        }
    }

    @Override
    public void close() {
        dataSource.destroy();
        log.info("Warehouse session closed");
    }

    /**
     * java.time values are bound as their java.sql counterparts, which every
     * driver accepts.
     */
    static Object[] bindable(Object[] params) {
        Object[] converted = new Object[params.length];
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            if (value instanceof LocalDate) {
                converted[i] = java.sql.Date.valueOf((LocalDate) value);
            } else if (value instanceof LocalTime) {
                converted[i] = java.sql.Time.valueOf((LocalTime) value);
            } else if (value instanceof LocalDateTime) {
                converted[i] = java.sql.Timestamp.valueOf((LocalDateTime) value);
            } else {
                converted[i] = value;
            }
        }
        return converted;
    }
}
