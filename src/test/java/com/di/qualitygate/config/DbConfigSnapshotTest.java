package com.di.qualitygate.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DbConfigSnapshot Tests")
class DbConfigSnapshotTest {

    private static DbConfigSnapshot snapshot(String url, int maxPool, int minIdle) {
        return new DbConfigSnapshot(url, "etl", "s3cret", "org.postgresql.Driver",
                maxPool, minIdle, 600_000L, 30_000L, 1_800_000L);
    }

    // ============================================================================
    // Construction
    // ============================================================================

    @Test
    @DisplayName("Should keep valid settings as given")
    void testConstruction_Valid() {
        DbConfigSnapshot s = snapshot("jdbc:postgresql://localhost:5432/inventory", 10, 2);

        assertEquals(10, s.maximumPoolSize());
        assertEquals(2, s.minimumIdle());
        assertEquals("etl", s.username());
    }

    @Test
    @DisplayName("Should reject a blank JDBC URL")
    void testConstruction_BlankUrl() {
        assertThrows(IllegalArgumentException.class, () -> snapshot(" ", 10, 2));
        assertThrows(IllegalArgumentException.class, () -> snapshot(null, 10, 2));
    }

    @Test
    @DisplayName("Should reject a pool smaller than one connection")
    void testConstruction_PoolTooSmall() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> snapshot("jdbc:postgresql://localhost/db", 0, 0));
        assertTrue(e.getMessage().contains("maximumPoolSize"));
    }

    @Test
    @DisplayName("Should clamp minimum idle into [0, maximumPoolSize]")
    void testConstruction_ClampsMinIdle() {
        assertEquals(5, snapshot("jdbc:postgresql://localhost/db", 5, 50).minimumIdle());
        assertEquals(0, snapshot("jdbc:postgresql://localhost/db", 5, -3).minimumIdle());
    }

    // ============================================================================
    // Secrets
    // ============================================================================

    @Test
    @DisplayName("Should mask inline passwords in the sanitized URL")
    void testSanitizedUrl_MasksPassword() {
        DbConfigSnapshot s = snapshot("jdbc:postgresql://localhost/db?user=etl&password=hunter2&ssl=true", 4, 1);

        assertEquals("jdbc:postgresql://localhost/db?user=etl&password=***&ssl=true", s.sanitizedUrl());
    }

    @Test
    @DisplayName("Should never expose the password through toString")
    void testToString_ExcludesPassword() {
        DbConfigSnapshot s = snapshot("jdbc:postgresql://localhost/db", 4, 1);

        assertFalse(s.toString().contains("s3cret"));
        assertTrue(s.toString().contains("maximumPoolSize=4"));
    }
}
