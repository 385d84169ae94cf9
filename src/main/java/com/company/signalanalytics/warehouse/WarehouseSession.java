package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.query.RenderedQuery;

/**
 * An authenticated connection to the analytical warehouse.
 * Implementations raise {@link com.company.signalanalytics.exception.WarehouseAccessException}
 * tagged with the failure kind.
 */
public interface WarehouseSession extends AutoCloseable {

    Table execute(RenderedQuery query);

    @Override
    void close();
}
