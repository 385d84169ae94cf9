package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import com.company.signalanalytics.exception.WarehouseAccessException;

import java.util.function.Predicate;

/**
 * Retry predicate for connection attempts: only connectivity failures are
 * worth another attempt, bad credentials are not.
 */
public class ConnectivityFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof WarehouseAccessException
                && ((WarehouseAccessException) throwable).getKind() == WarehouseErrorKind.CONNECTIVITY;
    }
}
