package com.di.qualitygate.web;

import com.di.qualitygate.H2TestDatabase;
import com.di.qualitygate.anomaly.AnomalyDetector;
import com.di.qualitygate.config.EtlProperties;
import com.di.qualitygate.config.PoolInitFailureRecorder;
import com.di.qualitygate.connection.ConnectionManager;
import com.di.qualitygate.connection.PoolStatsSnapshot;
import com.di.qualitygate.extract.DataExtractor;
import com.di.qualitygate.load.DataLoader;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.model.TableStatus;
import com.di.qualitygate.pipeline.EtlPipeline;
import com.di.qualitygate.pipeline.ExecutionStats;
import com.di.qualitygate.profile.DataProfiler;
import com.di.qualitygate.report.DataQualityReporter;
import com.di.qualitygate.rules.DataQualityRulesEngine;
import com.di.qualitygate.transform.DataTransformer;
import com.di.qualitygate.util.EtlMetricsCollector;
import com.di.qualitygate.util.StageEventLogger;
import com.di.qualitygate.validate.DataQualityValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineController Tests")
class PipelineControllerTest {

    @TempDir
    Path reportDir;

    private H2TestDatabase db;
    private EtlPipeline pipeline;
    private PoolInitFailureRecorder recorder;
    private PipelineController controller;

    @BeforeEach
    void setUp() {
        db = H2TestDatabase.create("controller");
        db.execute(
                "CREATE TABLE warehouses (warehouse_id INT PRIMARY KEY, warehouse_name VARCHAR(100) NOT NULL)",
                "CREATE TABLE warehouses_processed (warehouse_id INT PRIMARY KEY, warehouse_name VARCHAR(100) NOT NULL)",
                "INSERT INTO warehouses VALUES (1, 'North'), (2, 'South'), (3, 'East')");

        EtlProperties properties = new EtlProperties();
        properties.setTables(List.of("warehouses"));
        properties.setReportDir(reportDir.toString());
        properties.setBackupBeforeLoad(false);

        Clock clock = Clock.systemUTC();
        ConnectionManager connectionManager = db.connectionManager();
        DataQualityRulesEngine rulesEngine = new DataQualityRulesEngine(clock);
        rulesEngine.defineStandardRules();
        pipeline = new EtlPipeline(properties,
                new DataExtractor(connectionManager),
                new DataTransformer(),
                new DataQualityValidator(0.05, 0.01, clock),
                rulesEngine,
                new DataProfiler(),
                new AnomalyDetector(),
                new DataLoader(connectionManager, 100, false, false, properties.getLoadMode(), clock),
                new DataQualityReporter(clock),
                new StageEventLogger("test"),
                new EtlMetricsCollector(new SimpleMeterRegistry()),
                clock);
        recorder = new PoolInitFailureRecorder();
        controller = new PipelineController(pipeline, rulesEngine, connectionManager, recorder, properties);
    }

    @AfterEach
    void tearDown() {
        db.drop();
    }

    // ============================================================================
    // Runs
    // ============================================================================

    @Test
    @DisplayName("Should run the configured tables when the body is empty")
    void testRun_DefaultsFromConfiguration() {
        ResponseEntity<ExecutionStats> response = controller.run(null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ExecutionStats stats = response.getBody();
        assertNotNull(stats);
        assertEquals(List.of("warehouses"), stats.getTablesRequested());
        assertEquals(TableStatus.LOADED, stats.getTables().get("warehouses").getStatus());
        assertEquals(3, db.count("warehouses_processed"));
    }

    @Test
    @DisplayName("Should honour stage toggles from the request")
    void testRun_RequestOverrides() {
        RunRequest request = new RunRequest();
        request.setTables(List.of("warehouses"));
        request.setEnableValidation(false);

        ExecutionStats stats = controller.run(request).getBody();

        assertTrue(stats.getTables().get("warehouses").getValidationResults().isEmpty());
        assertEquals(3, stats.getRowsLoaded());
    }

    @Test
    @DisplayName("Should reject unsafe table names before running")
    void testRun_InvalidTableName() {
        RunRequest request = new RunRequest();
        request.setTables(List.of("warehouses; DROP TABLE warehouses"));

        assertThrows(IllegalArgumentException.class, () -> controller.run(request));
        assertEquals(0, db.count("warehouses_processed"));
    }

    @Test
    @DisplayName("Should accept a cancellation request with no run in progress")
    void testCancel() {
        ResponseEntity<Map<String, Object>> response = controller.cancel();

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals(true, response.getBody().get("cancellationRequested"));
        assertEquals(0, response.getBody().get("runsSignalled"));
        assertFalse(pipeline.isCancellationRequested());
    }

    // ============================================================================
    // Rules and Pool
    // ============================================================================

    @Test
    @DisplayName("Should list the registered rules of a table")
    void testRules() {
        List<RuleView> rules = controller.rules("suppliers").getBody();

        assertEquals(3, rules.size());
        assertEquals("supplier_id_unique", rules.get(0).name());
        assertEquals(Severity.CRITICAL, rules.get(0).severity());
        assertEquals("Supplier IDs must be unique", rules.get(0).description());
        assertTrue(controller.rules("warehouses").getBody().isEmpty());
    }

    @Test
    @DisplayName("Should report pool statistics and startup failures")
    void testPool() {
        assertFalse(controller.pool().getBody().containsKey("initFailures"));

        recorder.record("source", "Connection refused");
        Map<String, Object> body = controller.pool().getBody();

        assertTrue(body.get("stats") instanceof PoolStatsSnapshot);
        assertEquals(Map.of("source", "Connection refused"), body.get("initFailures"));
    }
}
