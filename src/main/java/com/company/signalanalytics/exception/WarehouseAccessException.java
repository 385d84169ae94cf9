package com.company.signalanalytics.exception;

import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import lombok.Getter;

/**
 * Failure raised by a warehouse session, tagged with its structural kind.
 */
@Getter
public class WarehouseAccessException extends RuntimeException {

    private final WarehouseErrorKind kind;

    public WarehouseAccessException(WarehouseErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
