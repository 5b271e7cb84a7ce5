package com.di.qualitygate.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Identifiers
    // ============================================================================

    @ParameterizedTest
    @ValueSource(strings = {"suppliers", "order_date", "quantity_on_hand", "price_history", "_tmp$1", "orders"})
    @DisplayName("Should accept ordinary identifiers, including ones that embed keywords")
    void testValidateIdentifier_Valid(String identifier) {
        assertEquals(identifier, InputValidator.validateIdentifier(identifier, "Column name"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"users; DROP TABLE x", "a--b", "name'", "id OR 1", "1abc", "col-name", "select"})
    @DisplayName("Should reject identifiers with SQL syntax or invalid characters")
    void testValidateIdentifier_Invalid(String identifier) {
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateIdentifier(identifier, "Column name"));
    }

    @Test
    @DisplayName("Should trim identifiers and reject empty or oversized ones")
    void testValidateIdentifier_TrimAndLength() {
        assertEquals("sales", InputValidator.validateIdentifier("  sales ", "Table name"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateIdentifier("   ", "Table name"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateIdentifier(null, "Table name"));
        assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validateIdentifier("a".repeat(64), "Table name"));
    }

    @Test
    @DisplayName("Should accept schema-qualified table names and validate both parts")
    void testValidateTableName_SchemaQualified() {
        assertEquals("public.inventory", InputValidator.validateTableName("public.inventory"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTableName("public.inv;x"));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateTableName(""));
    }

    // ============================================================================
    // Read-only Queries
    // ============================================================================

    @Test
    @DisplayName("Should accept SELECT and WITH statements and strip a trailing semicolon")
    void testValidateReadOnlyQuery_Accepted() {
        assertEquals("SELECT * FROM sales", InputValidator.validateReadOnlyQuery("  SELECT * FROM sales; "));
        assertEquals("with t as (select 1) select * from t",
                InputValidator.validateReadOnlyQuery("with t as (select 1) select * from t"));
        assertEquals("SELECT updated_at FROM orders",
                InputValidator.validateReadOnlyQuery("SELECT updated_at FROM orders"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM sales",
            "SELECT 1; DROP TABLE sales",
            "WITH d AS (DELETE FROM sales RETURNING *) SELECT * FROM d",
            "UPDATE sales SET revenue = 0",
            "   "
    })
    @DisplayName("Should reject statements that could modify data")
    void testValidateReadOnlyQuery_Rejected(String sql) {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateReadOnlyQuery(sql));
    }

    // ============================================================================
    // Numeric Inputs
    // ============================================================================

    @Test
    @DisplayName("Should validate batch sizes")
    void testNumericValidation() {
        assertEquals(500, InputValidator.validateBatchSize(500));
        assertThrows(IllegalArgumentException.class, () -> InputValidator.validateBatchSize(0));
    }
}
