package com.di.qualitygate.exception;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories used to decide retries, to label row and batch failures and to build error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection", true),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed", false),
    DATA_ERROR("Data error", "Value rejected by the database (type, range or format)", false),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or semantic error", false),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back", true),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to perform operation", false),
    AUTHENTICATION_ERROR("Authentication error", "Authentication or authorization failure", false),
    DATABASE_ERROR("Database error", "General database operation error", false),
    NETWORK_ERROR("Network error", "Network communication failure", true),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit", true),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation", false),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability", false),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure", false),
    APPLICATION_ERROR("Application error", "General application error", false),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", false);

    private final String name;
    private final String description;
    private final boolean transientFailure;

    ErrorCategory(String name, String description, boolean transientFailure) {
        this.name = name;
        this.description = description;
        this.transientFailure = transientFailure;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Whether an operation failing with this category may succeed when retried. */
    public boolean isTransient() {
        return transientFailure;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "22", DATA_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "28", AUTHENTICATION_ERROR,
            "40", TRANSACTION_ROLLBACK,
            "42", SQL_SYNTAX_ERROR,
            "53", RESOURCE_ERROR,
            "57", CONNECTION_ERROR
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof EtlException etl && etl.getCause() != null && etl.getCause() != etl) {
            return categorize(etl.getCause());
        }
        if (exception instanceof SQLException sqlEx) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && !sqlState.isEmpty()) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        // Pool acquisition timeouts surface without an SQLState
        if (sqlEx instanceof SQLTransientConnectionException) {
            return CONNECTION_ERROR;
        }
        if (sqlEx instanceof SQLTransientException) {
            return TIMEOUT_ERROR;
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "timed out", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "password authentication", "login failed")) return AUTHENTICATION_ERROR;
            if (containsAny(lower, "permission", "access denied", "unauthorized", "forbidden")) return PERMISSION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key", "check constraint", "not null")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "parse error")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException
                || t instanceof ArithmeticException
                || t instanceof ClassCastException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean isAuthenticationError(Throwable t) {
        return messageContains(t, "authentication", "unauthorized", "invalid credentials", "login failed");
    }

    private static boolean isSerializationError(Throwable t) {
        String cn = t.getClass().getName();
        return t instanceof java.io.NotSerializableException
                || cn.startsWith("com.fasterxml.jackson");
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
