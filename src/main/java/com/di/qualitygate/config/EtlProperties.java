package com.di.qualitygate.config;

import com.di.qualitygate.load.LoadMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline configuration bound from {@code qualitygate.etl.*}.
 * <p>
 * Example (application.yml):
 * <pre>
 * qualitygate:
 *   etl:
 *     db-host: localhost
 *     db-port: 5432
 *     db-name: supply_chain_db
 *     pool-size: 5
 *     max-retries: 3
 *     retry-backoff-base: 500ms
 *     batch-size: 1000
 *     reject-on-critical: true
 *     critical-reject-mode: ROWS
 *     anomaly-columns:
 *       sales: [quantity_sold, revenue]
 * </pre>
 * Components receive this object (or values derived from it) through their constructors; nothing reads it statically.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "qualitygate.etl")
public class EtlProperties {

    // --- store ---
    private String dbHost = "localhost";
    private int dbPort = 5432;
    private String dbName = "supply_chain_db";
    private String dbUser;
    private String dbPassword;
    private String jdbcSubprotocol = "postgresql";
    /** Overrides host/port/name when set. */
    private String jdbcUrl;
    private String driverClassName;

    // --- pool / retry ---
    @Min(1)
    private int poolSize = 5;
    private long connectionTimeoutMs = 30_000L;
    private long idleTimeoutMs = 600_000L;
    private long maxLifetimeMs = 1_800_000L;
    @Min(1)
    private int maxRetries = 3;
    private Duration retryBackoffBase = Duration.ofMillis(500);
    private Duration retryBackoffMax = Duration.ofSeconds(10);

    // --- stages ---
    @Min(1)
    private int batchSize = 1000;
    private boolean enableValidation = true;
    private boolean enableTransformation = true;
    private boolean enableLoad = true;
    private boolean backupBeforeLoad = true;
    private boolean backupMandatory = false;
    private LoadMode loadMode = LoadMode.APPEND;
    private String destinationSuffix = "_processed";

    // --- quality policy ---
    private boolean rejectOnCritical = false;
    private CriticalRejectMode criticalRejectMode = CriticalRejectMode.TABLE;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double nullThreshold = 0.05;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.01;

    // --- anomaly detection ---
    private double iqrMultiplier = 1.5;
    private double zscoreThreshold = 3.0;
    private long isolationForestSeed = 42L;
    @Min(1)
    private int isolationForestTrees = 100;
    @DecimalMin("0.0")
    @DecimalMax("0.5")
    private double contamination = 0.1;
    @Min(1)
    private int minDistinctValues = 2;
    /** Per-table column list for the multivariate method; tables not listed use every eligible numeric column. */
    private Map<String, List<String>> anomalyColumns = new LinkedHashMap<>();

    // --- orchestration ---
    @Min(1)
    private int parallelism = 1;
    @NotBlank
    private String reportDir = "reports";
    private List<String> tables = new ArrayList<>(
            List.of("suppliers", "products", "warehouses", "inventory", "orders", "sales"));
    private boolean runOnStartup = false;

    public String resolveJdbcUrl() {
        if (jdbcUrl != null && !jdbcUrl.isBlank()) {
            return jdbcUrl;
        }
        return String.format("jdbc:%s://%s:%d/%s", jdbcSubprotocol, dbHost, dbPort, dbName);
    }

    public DbConfigSnapshot toDbConfigSnapshot() {
        return new DbConfigSnapshot(resolveJdbcUrl(), dbUser, dbPassword, driverClassName,
                poolSize, Math.min(1, poolSize), idleTimeoutMs, connectionTimeoutMs, maxLifetimeMs);
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxRetries, retryBackoffBase, retryBackoffMax);
    }

    public String destinationFor(String table) {
        return table + (destinationSuffix == null ? "" : destinationSuffix);
    }
}
