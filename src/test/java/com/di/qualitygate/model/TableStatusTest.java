package com.di.qualitygate.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.sql.Types;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableStatus Tests")
class TableStatusTest {

    @ParameterizedTest
    @CsvSource({
            "PENDING, EXTRACTED, true",
            "EXTRACTED, TRANSFORMED, true",
            "TRANSFORMED, VALIDATED, true",
            "VALIDATED, LOADED, true",
            "PENDING, TRANSFORMED, false",
            "VALIDATED, EXTRACTED, false",
            "PENDING, FAILED, true",
            "VALIDATED, FAILED, true",
            "LOADED, FAILED, false",
            "FAILED, PENDING, false"
    })
    @DisplayName("Should only allow forward single steps or failure from non-terminal states")
    void testCanTransitionTo(TableStatus from, TableStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    @DisplayName("Should treat LOADED and FAILED as terminal")
    void testIsTerminal() {
        assertTrue(TableStatus.LOADED.isTerminal());
        assertTrue(TableStatus.FAILED.isTerminal());
        assertFalse(TableStatus.VALIDATED.isTerminal());
    }

    @ParameterizedTest
    @CsvSource({
            "4, INTEGER",
            "-5, INTEGER",
            "2, DECIMAL",
            "8, DECIMAL",
            "16, BOOLEAN",
            "91, DATE",
            "93, TIMESTAMP",
            "12, STRING",
            "1111, STRING"
    })
    @DisplayName("Should map JDBC type codes to logical column types")
    void testColumnTypeFromJdbcType(int sqlType, ColumnType expected) {
        assertEquals(expected, ColumnType.fromJdbcType(sqlType));
    }

    @Test
    @DisplayName("Should bind nulls with a matching JDBC type")
    void testColumnTypeJdbcType() {
        assertEquals(Types.BIGINT, ColumnType.INTEGER.jdbcType());
        assertEquals(Types.VARCHAR, ColumnType.STRING.jdbcType());
        assertTrue(ColumnType.DECIMAL.isNumeric());
        assertTrue(ColumnType.TIMESTAMP.isTemporal());
    }
}
