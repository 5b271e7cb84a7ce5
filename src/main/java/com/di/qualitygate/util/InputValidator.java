package com.di.qualitygate.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Guards every identifier and free-form statement that reaches the database.
 * Values are always bound as parameters; only identifiers are ever concatenated into SQL, and only after passing here.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation Patterns
    // ============================================================================

    /**
     * Valid unquoted identifier: starts with a letter or underscore, followed by letters, digits,
     * underscores or dollar signs, at most 63 characters.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$"
    );

    /**
     * Whole-word SQL keywords and statement punctuation that never belong in an identifier.
     * Word boundaries keep names such as {@code order_date} or {@code quantity_on_hand} valid.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b|--|/\\*|\\*/|;|'|\")"
    );

    /** Statement prefixes accepted by {@link #validateReadOnlyQuery(String)}. */
    private static final Pattern READ_ONLY_PREFIX = Pattern.compile("^(SELECT|WITH)\\b.*", Pattern.DOTALL);

    private static final Pattern WRITE_KEYWORDS = Pattern.compile(
            "(?i)\\b(INSERT|UPDATE|DELETE|MERGE|DROP|CREATE|ALTER|TRUNCATE|GRANT|REVOKE|CALL|EXEC|EXECUTE)\\b"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /**
     * Validates a SQL identifier (table, schema or column name).
     *
     * @param identifier     the identifier to validate
     * @param identifierType type of identifier for error messages (e.g. "table name")
     * @return the validated identifier (trimmed)
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns", identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. " +
                            "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates a table name ({@code schema.table} or {@code table}).
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", 2);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }
        return trimmed;
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "Column name");
    }

    /**
     * Accepts only a single read-only statement: it must start with SELECT or WITH, contain no
     * statement separator and no data-modifying keyword.
     *
     * @return the trimmed statement
     * @throws IllegalArgumentException when the statement could modify data
     */
    public static String validateReadOnlyQuery(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Query cannot be null or empty");
        }
        String trimmed = sql.trim();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        if (!READ_ONLY_PREFIX.matcher(trimmed.toUpperCase(Locale.ROOT)).matches()) {
            throw new IllegalArgumentException("Only SELECT/WITH queries are allowed: " + abbreviate(trimmed));
        }
        if (trimmed.contains(";")) {
            throw new IllegalArgumentException("Multiple statements are not allowed: " + abbreviate(trimmed));
        }
        if (WRITE_KEYWORDS.matcher(trimmed).find()) {
            log.warn("Rejected query containing data-modifying keyword: {}", abbreviate(trimmed));
            throw new IllegalArgumentException("Query contains a data-modifying keyword: " + abbreviate(trimmed));
        }
        return trimmed;
    }

    // ============================================================================
    // Numeric Input Validation
    // ============================================================================

    public static int validateBatchSize(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException(
                    String.format("Batch size must be at least 1, got: %d", batchSize));
        }
        return batchSize;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
