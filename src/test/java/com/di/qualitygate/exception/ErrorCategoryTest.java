package com.di.qualitygate.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.BatchUpdateException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // SQL Exception Categorization
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "08001, CONNECTION_ERROR",
            "08006, CONNECTION_ERROR",
            "22001, DATA_ERROR",
            "23505, CONSTRAINT_VIOLATION",
            "23502, CONSTRAINT_VIOLATION",
            "28P01, AUTHENTICATION_ERROR",
            "40001, TRANSACTION_ROLLBACK",
            "42P01, SQL_SYNTAX_ERROR",
            "53300, RESOURCE_ERROR",
            "57P01, CONNECTION_ERROR"
    })
    @DisplayName("Should categorize SQL exceptions by SQLState class")
    void testCategorize_BySqlState(String sqlState, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(new SQLException("boom", sqlState)));
    }

    @Test
    @DisplayName("Should treat pool acquisition timeouts as connection errors")
    void testCategorize_PoolTimeout() {
        SQLException e = new SQLTransientConnectionException("QualityGatePool-1 - Connection is not available");
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(e));
        assertTrue(ErrorCategory.categorize(e).isTransient());
    }

    @Test
    @DisplayName("Should fall back to message keywords when SQLState is missing")
    void testCategorize_SqlMessageFallback() {
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(new SQLException("Connection refused")));
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION,
                ErrorCategory.categorize(new SQLException("violates not null constraint")));
        assertEquals(ErrorCategory.DATABASE_ERROR, ErrorCategory.categorize(new SQLException("something odd")));
    }

    @Test
    @DisplayName("Should categorize batch failures by their SQLState")
    void testCategorize_BatchUpdateException() {
        BatchUpdateException e = new BatchUpdateException("NULL not allowed", "23502", new int[]{1, 1});
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, ErrorCategory.categorize(e));
    }

    // ============================================================================
    // Non-SQL Categorization
    // ============================================================================

    @Test
    @DisplayName("Should categorize network and timeout exceptions")
    void testCategorize_NetworkAndTimeout() {
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new ConnectException("refused")));
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new SocketTimeoutException("read")));
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new TimeoutException()));
    }

    @Test
    @DisplayName("Should categorize bad input as validation errors")
    void testCategorize_Validation() {
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalArgumentException("bad")));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new ArithmeticException("/ by zero")));
    }

    @Test
    @DisplayName("Should unwrap pipeline exceptions to their cause")
    void testCategorize_UnwrapsEtlException() {
        ExtractionException e = new ExtractionException("suppliers", "read failed",
                new SQLException("gone", "08003"));
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(e));
        assertEquals(ErrorCategory.CONNECTION_ERROR, e.getCategory());
    }

    @Test
    @DisplayName("Should return UNKNOWN for null and APPLICATION_ERROR for anything unrecognised")
    void testCategorize_Fallbacks() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("huh")));
    }

    // ============================================================================
    // Transience
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "CONNECTION_ERROR, true",
            "NETWORK_ERROR, true",
            "TIMEOUT_ERROR, true",
            "TRANSACTION_ROLLBACK, true",
            "CONSTRAINT_VIOLATION, false",
            "AUTHENTICATION_ERROR, false",
            "SQL_SYNTAX_ERROR, false"
    })
    @DisplayName("Should mark only retryable categories as transient")
    void testIsTransient(ErrorCategory category, boolean expected) {
        assertEquals(expected, category.isTransient());
    }

    @Test
    @DisplayName("Should carry kind, table and stage on pipeline exceptions")
    void testEtlExceptionAttributes() {
        TransformationException e = new TransformationException("orders",
                com.di.qualitygate.transform.TransformStage.DERIVED_COLUMNS, "column exists");
        assertEquals(ErrorKind.TRANSFORMATION_ERROR, e.getKind());
        assertEquals("orders", e.getTable());
        assertEquals(com.di.qualitygate.model.EtlStage.TRANSFORM, e.getStage());
        assertTrue(e.getMessage().startsWith("[DERIVED_COLUMNS]"));
    }
}
