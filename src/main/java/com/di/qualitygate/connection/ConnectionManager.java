package com.di.qualitygate.connection;

import com.di.qualitygate.config.DbConfigSnapshot;
import com.di.qualitygate.config.RetryPolicy;
import com.di.qualitygate.exception.ConnectionFailureException;
import com.di.qualitygate.exception.ErrorCategory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pooled, retrying access to the relational store.
 * <p>
 * One manager owns one pool, sized by the configuration it was created from. Acquisition beyond
 * the pool size queues inside HikariCP for up to the configured connection timeout. Transient
 * failures (see {@link ErrorCategory#isTransient()}) are retried with bounded exponential backoff;
 * anything else, or exhausting the attempts, raises {@link ConnectionFailureException}.
 * <pre>
 *   acquire() ──► getConnection() ──ok──► Connection
 *                      │ transient
 *                      ▼
 *                sleep(base·2^(n-1), capped) ──► retry (≤ maxAttempts) ──► ConnectionFailureException
 * </pre>
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    private static final AtomicInteger POOL_IDS = new AtomicInteger(0);

    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final String initFailure;
    private volatile Runnable retryListener = () -> { };

    /**
     * Creates a manager with its own HikariCP pool.
     */
    public ConnectionManager(DbConfigSnapshot snapshot, RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        this.sleeper = Sleeper.THREAD;
        this.ownsDataSource = true;
        DataSource created = null;
        String failure = null;
        ConnectionPoolLogger.logDatasourceSectionStart("creating pool for " + snapshot.sanitizedUrl());
        try {
            created = new HikariDataSource(toHikariConfig(snapshot));
            ConnectionPoolLogger.logPoolStats(created, "created");
        } catch (RuntimeException e) {
            failure = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[POOL] Pool creation failed for {}: {}", snapshot.sanitizedUrl(), failure, e);
        }
        this.dataSource = created;
        this.initFailure = failure;
    }

    /**
     * Wraps an existing data source. The caller keeps ownership: {@link #close()} does not close it.
     */
    public ConnectionManager(DataSource dataSource, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.dataSource = dataSource;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.ownsDataSource = false;
        this.initFailure = null;
    }

    private static HikariConfig toHikariConfig(DbConfigSnapshot snapshot) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(snapshot.jdbcUrl());
        config.setUsername(snapshot.username());
        config.setPassword(snapshot.password());
        if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
            config.setDriverClassName(snapshot.driverClassName());
        }
        config.setMaximumPoolSize(snapshot.maximumPoolSize());
        config.setMinimumIdle(snapshot.minimumIdle());
        config.setIdleTimeout(snapshot.idleTimeoutMs());
        config.setConnectionTimeout(snapshot.connectionTimeoutMs());
        config.setMaxLifetime(snapshot.maxLifetimeMs());
        // Transactions are demarcated explicitly per batch
        config.setAutoCommit(false);
        // Do not fail construction when the store is down; acquire() retries instead
        config.setInitializationFailTimeout(-1);
        if (snapshot.jdbcUrl().contains("postgresql")) {
            config.addDataSourceProperty("tcpKeepAlive", "true");
        }
        config.setPoolName("QualityGatePool-" + POOL_IDS.incrementAndGet());
        return config;
    }

    /** Called once per retry, e.g. to count retries in metrics. */
    public ConnectionManager onRetry(Runnable listener) {
        this.retryListener = listener != null ? listener : () -> { };
        return this;
    }

    /**
     * Acquires a connection, retrying transient failures.
     *
     * @throws ConnectionFailureException after the last attempt fails, or at once for non-transient failures
     */
    public Connection acquire() {
        if (dataSource == null) {
            throw new ConnectionFailureException("Connection pool unavailable: " + initFailure, 0, null);
        }
        SQLException last = null;
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Connection connection = dataSource.getConnection();
                if (attempt > 1) {
                    log.info("[POOL] Connection acquired on attempt {}/{}", attempt, maxAttempts);
                }
                return connection;
            } catch (SQLException e) {
                last = e;
                ErrorCategory category = ErrorCategory.categorize(e);
                if (!category.isTransient()) {
                    log.error("[POOL] Non-transient connection failure ({}): {}", category, e.getMessage());
                    throw new ConnectionFailureException(
                            "Connection failed with non-transient error: " + e.getMessage(), attempt, e);
                }
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = retryPolicy.delayAfterAttempt(attempt);
                log.warn("[POOL] Connection attempt {}/{} failed ({}): {}. Retrying in {} ms",
                        attempt, maxAttempts, category, e.getMessage(), delay.toMillis());
                retryListener.run();
                pause(delay, attempt, e);
            }
        }
        log.error("[POOL] Connection retries exhausted after {} attempts", maxAttempts);
        throw new ConnectionFailureException(
                String.format("Could not acquire connection after %d attempts: %s",
                        maxAttempts, last != null ? last.getMessage() : "unknown"),
                maxAttempts, last);
    }

    private void pause(Duration delay, int attempt, SQLException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ConnectionFailureException("Interrupted while waiting to retry connection", attempt, cause);
        }
    }

    /**
     * Leases a connection for a try-with-resources block.
     */
    public ScopedConnection lease() {
        return new ScopedConnection(this, acquire());
    }

    /**
     * Runs {@code work} on a leased connection. Uncommitted work is rolled back when the callback
     * fails; a connection-level failure poisons the lease so the pool discards the connection.
     */
    public <T> T execute(ConnectionCallback<T> work) throws SQLException {
        try (ScopedConnection lease = lease()) {
            Connection connection = lease.connection();
            try {
                return work.doInConnection(connection);
            } catch (SQLException | RuntimeException e) {
                if (ErrorCategory.categorize(e) == ErrorCategory.CONNECTION_ERROR) {
                    lease.markPoisoned();
                } else {
                    rollbackAfterFailure(connection, e);
                }
                throw e;
            }
        }
    }

    private static void rollbackAfterFailure(Connection connection, Exception original) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException rollbackError) {
            original.addSuppressed(rollbackError);
        }
    }

    /** Returns a connection to the pool. */
    public void release(Connection connection) {
        release(connection, false);
    }

    /**
     * Returns a connection to the pool, or evicts it when {@code poisoned}.
     */
    public void release(Connection connection, boolean poisoned) {
        if (connection == null) {
            return;
        }
        if (poisoned && dataSource instanceof HikariDataSource hikari) {
            log.warn("[POOL] Evicting poisoned connection from {}", hikari.getPoolName());
            hikari.evictConnection(connection);
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[POOL] Failed to release connection: {}", e.getMessage());
        }
    }

    public PoolStatsSnapshot poolStats() {
        if (dataSource == null) {
            return PoolStatsSnapshot.unavailable("none", initFailure);
        }
        return ConnectionPoolLogger.snapshot(dataSource);
    }

    public String getInitFailure() {
        return initFailure;
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            ConnectionPoolLogger.logPoolStats(hikari, "before close");
            hikari.close();
            log.info("[POOL] Closed pool {}", hikari.getPoolName());
        }
    }
}
