package com.di.qualitygate.connection;

/**
 * Point-in-time HikariCP pool statistics, for logs and the pool endpoint.
 * {@code initFailure} is non-null when the pool could not be created.
 */
public record PoolStatsSnapshot(
        String poolName,
        int maxPoolSize,
        int minIdle,
        int activeConnections,
        int idleConnections,
        int totalConnections,
        int threadsAwaitingConnection,
        String initFailure
) {

    public static PoolStatsSnapshot unavailable(String poolName, String reason) {
        return new PoolStatsSnapshot(poolName, 0, 0, 0, 0, 0, 0, reason);
    }
}
