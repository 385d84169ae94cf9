package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.enums.WarehouseErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WarehouseErrorClassifierTest {

    private final WarehouseErrorClassifier classifier = new WarehouseErrorClassifier();

    @Test
    void shouldDetectExpiredSessionByVendorCode() {
        SQLException expired = new SQLException("Authentication token has expired.", "08001", 390114);

        assertEquals(WarehouseErrorKind.AUTH_EXPIRED, classifier.classify(expired));
        assertEquals(WarehouseErrorKind.AUTH_EXPIRED,
                classifier.classify(new UncategorizedSQLException("query", "SELECT 1", expired)));
    }

    @Test
    void shouldDetectAuthorizationStateClass() {
        assertEquals(WarehouseErrorKind.AUTH_EXPIRED,
                classifier.classify(new SQLException("denied", "28000", 0)));
    }

    @Test
    void shouldDetectConnectivityFailures() {
        assertEquals(WarehouseErrorKind.CONNECTIVITY,
                classifier.classify(new SQLException("link failure", "08S01", 0)));
        assertEquals(WarehouseErrorKind.CONNECTIVITY,
                classifier.classify(new RuntimeException(new ConnectException("refused"))));
        assertEquals(WarehouseErrorKind.CONNECTIVITY,
                classifier.classify(new CannotGetJdbcConnectionException("no connection")));
    }

    @Test
    void shouldTreatEverythingElseAsQueryFailure() {
        SQLSyntaxErrorException syntax = new SQLSyntaxErrorException("invalid identifier 'FOO'", "42000", 904);

        assertEquals(WarehouseErrorKind.QUERY_EXECUTION, classifier.classify(syntax));
        assertEquals(WarehouseErrorKind.QUERY_EXECUTION, classifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void shouldIgnoreMessageText() {
        SQLException misleading = new SQLException("Authentication token has expired", "22018", 100038);

        assertEquals(WarehouseErrorKind.QUERY_EXECUTION, classifier.classify(misleading));
    }
}
