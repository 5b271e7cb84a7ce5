package com.di.qualitygate.connection;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Reads and logs HikariCP pool statistics. Non-Hikari data sources (test doubles, plain drivers)
 * yield an "unavailable" snapshot instead of failing.
 */
@Slf4j
public final class ConnectionPoolLogger {

    public static final String CONNECTION_LOG_SEPARATOR =
            "================================================================================";

    private ConnectionPoolLogger() {}

    public static void logDatasourceSectionStart(String title) {
        log.info(CONNECTION_LOG_SEPARATOR);
        log.info("[POOL] DATASOURCE / CONNECTION POOL  |  {}", title != null ? title : "");
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    public static PoolStatsSnapshot snapshot(DataSource dataSource) {
        if (!(dataSource instanceof HikariDataSource hikari)) {
            return PoolStatsSnapshot.unavailable(
                    dataSource == null ? "none" : dataSource.getClass().getSimpleName(), null);
        }
        HikariPoolMXBean mx = hikari.getHikariPoolMXBean();
        if (mx == null) {
            // pool not started yet (lazy initialization)
            return new PoolStatsSnapshot(hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                    0, 0, 0, 0, null);
        }
        return new PoolStatsSnapshot(hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                mx.getActiveConnections(), mx.getIdleConnections(), mx.getTotalConnections(),
                mx.getThreadsAwaitingConnection(), null);
    }

    /**
     * Logs pool statistics for the given phase (e.g. "created", "before close").
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        PoolStatsSnapshot s = snapshot(dataSource);
        log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                phase, s.poolName(), s.maxPoolSize(), s.minIdle(), s.activeConnections(),
                s.idleConnections(), s.totalConnections(), s.threadsAwaitingConnection());
    }
}
