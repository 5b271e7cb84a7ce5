package com.di.qualitygate.config;

import java.io.Serializable;

/**
 * Immutable copy of the connection settings a pool is built from. Secrets are never part of {@link #toString()}.
 */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {

    public DbConfigSnapshot {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        if (maximumPoolSize < 1) {
            throw new IllegalArgumentException("maximumPoolSize must be >= 1, was " + maximumPoolSize);
        }
        minimumIdle = Math.max(0, Math.min(minimumIdle, maximumPoolSize));
    }

    /** JDBC URL with any inline password masked, safe for logs. */
    public String sanitizedUrl() {
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }

    @Override
    public String toString() {
        return "DbConfigSnapshot[jdbcUrl=" + sanitizedUrl() + ", username=" + username
                + ", maximumPoolSize=" + maximumPoolSize + ", minimumIdle=" + minimumIdle
                + ", connectionTimeoutMs=" + connectionTimeoutMs + "]";
    }
}
