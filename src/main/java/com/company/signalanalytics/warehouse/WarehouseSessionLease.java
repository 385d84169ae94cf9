package com.company.signalanalytics.warehouse;

import lombok.Value;

/**
 * A session handed out by {@link WarehouseSessionManager}, stamped with the
 * generation it belongs to so that a stale invalidation cannot tear down a
 * session that was established after it.
 */
@Value
public class WarehouseSessionLease {
    WarehouseSession session;
    long generation;
}
