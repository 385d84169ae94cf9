package com.company.signalanalytics.warehouse;

/**
 * Opens warehouse sessions. A failed attempt raises
 * {@link com.company.signalanalytics.exception.WarehouseAccessException}.
 */
public interface WarehouseConnector {

    WarehouseSession open();
}
