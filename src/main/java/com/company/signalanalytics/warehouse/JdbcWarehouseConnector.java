package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import com.company.signalanalytics.exception.WarehouseAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens sessions over plain JDBC using the configured warehouse coordinates.
 * The driver itself is supplied at deployment.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcWarehouseConnector implements WarehouseConnector {

    private final SignalAnalyticsProperties properties;
    private final WarehouseErrorClassifier classifier;

    @Override
    public WarehouseSession open() {
        SignalAnalyticsProperties.Warehouse warehouse = properties.getWarehouse();

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setUrl(warehouse.getUrl());
        dataSource.setUsername(warehouse.getUsername());
        dataSource.setPassword(warehouse.getPassword());
        dataSource.setSuppressClose(true);
        if (StringUtils.hasText(warehouse.getDriverClassName())) {
            dataSource.setDriverClassName(warehouse.getDriverClassName());
        }
        Properties connectionProperties = new Properties();
        connectionProperties.putAll(warehouse.getConnectionProperties());
        dataSource.setConnectionProperties(connectionProperties);

        try {
            // fail here rather than on the first statement
            Connection connection = dataSource.getConnection();
            log.info("Opened warehouse session to {} (catalog {})", warehouse.getUrl(), connection.getCatalog());
        } catch (SQLException | RuntimeException e) {
            dataSource.destroy();
            throw new WarehouseAccessException(classifier.classify(e), "Failed to open warehouse session", e);
        }
        return new JdbcWarehouseSession(dataSource, warehouse.getQueryTimeoutSeconds(), classifier);
    }
}
