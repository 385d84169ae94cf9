package com.company.signalanalytics.domain.enums;

public enum WarehouseErrorKind {
    CONNECTIVITY,
    AUTH_EXPIRED,
    QUERY_EXECUTION
}
