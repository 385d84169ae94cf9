package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Classifies driver failures by SQLState class, vendor code and exception
 * type along the cause chain. Message text is never inspected.
 */
@Component
public class WarehouseErrorClassifier {

    // Snowflake: session no longer exists, authentication token expired
    static final Set<Integer> AUTH_EXPIRED_VENDOR_CODES = Set.of(390112, 390114);

    static final String CONNECTION_SQL_STATE_CLASS = "08";
    static final String AUTHORIZATION_SQL_STATE_CLASS = "28";

    public WarehouseErrorKind classify(Throwable error) {
        WarehouseErrorKind kind = WarehouseErrorKind.QUERY_EXECUTION;
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof SQLException) {
                SQLException sqlException = (SQLException) current;
                if (AUTH_EXPIRED_VENDOR_CODES.contains(sqlException.getErrorCode())
                        || current instanceof SQLInvalidAuthorizationSpecException
                        || hasStateClass(sqlException, AUTHORIZATION_SQL_STATE_CLASS)) {
                    return WarehouseErrorKind.AUTH_EXPIRED;
                }
                if (current instanceof SQLNonTransientConnectionException
                        || current instanceof SQLTransientConnectionException
                        || hasStateClass(sqlException, CONNECTION_SQL_STATE_CLASS)) {
                    kind = WarehouseErrorKind.CONNECTIVITY;
                }
            } else if (current instanceof CannotGetJdbcConnectionException
                    || current instanceof ConnectException
                    || current instanceof UnknownHostException
                    || current instanceof SocketTimeoutException) {
                kind = WarehouseErrorKind.CONNECTIVITY;
            }
        }
        return kind;
    }

    private static boolean hasStateClass(SQLException e, String stateClass) {
        return e.getSQLState() != null && e.getSQLState().startsWith(stateClass);
    }

    private static Throwable next(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }
}
