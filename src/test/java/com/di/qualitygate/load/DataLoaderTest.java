package com.di.qualitygate.load;

import com.di.qualitygate.H2TestDatabase;
import com.di.qualitygate.exception.ErrorCategory;
import com.di.qualitygate.exception.LoadException;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.LoadOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.BatchUpdateException;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataLoader Tests")
class DataLoaderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:30:00Z"), ZoneOffset.UTC);

    private static final List<Column> COLUMNS = List.of(
            Column.required("id", ColumnType.INTEGER),
            Column.of("name", ColumnType.STRING),
            Column.of("amount", ColumnType.DECIMAL));

    private H2TestDatabase db;

    @BeforeEach
    void setUp() {
        db = H2TestDatabase.create("loader");
        db.execute("CREATE TABLE orders_processed (id BIGINT PRIMARY KEY, name VARCHAR(50) NOT NULL, amount NUMERIC(10,2))");
    }

    @AfterEach
    void tearDown() {
        db.drop();
    }

    private static Map<String, Object> row(long id, String name, String amount) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("name", name);
        row.put("amount", amount == null ? null : new BigDecimal(amount));
        return row;
    }

    /** Five rows; the fourth (index 3) breaks the NOT NULL constraint on name. */
    private static Dataset ordersWithBadRow() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row(1, "alpha", "10.50"));
        rows.add(row(2, "beta", null));
        rows.add(row(3, "gamma", "7.25"));
        rows.add(row(4, null, "3.00"));
        rows.add(row(5, "epsilon", "1.00"));
        return new Dataset(COLUMNS, rows, List.of("id"));
    }

    private DataLoader loader(LoadMode mode, boolean backup, boolean backupMandatory) {
        return new DataLoader(db.connectionManager(), 2, backup, backupMandatory, mode, CLOCK);
    }

    // ============================================================================
    // Batching
    // ============================================================================

    @Test
    @DisplayName("Should load every row when all batches succeed")
    void testLoadData_AllBatchesCommit() {
        Dataset data = ordersWithBadRow();
        List<Map<String, Object>> rows = new ArrayList<>(data.rows());
        rows.set(3, row(4, "delta", "3.00"));

        LoadResult result = loader(LoadMode.APPEND, false, false).loadData(data.withRows(rows), "orders_processed");

        assertEquals(LoadOutcome.FULL, result.outcome());
        assertEquals(5, result.getRowsLoaded());
        assertEquals(3, result.getBatchesCommitted());
        assertTrue(result.getRowFailures().isEmpty());
        assertEquals(5, db.count("orders_processed"));
        assertEquals(0, db.queryLong("SELECT COUNT(*) FROM orders_processed WHERE id = 2 AND amount IS NOT NULL"));
    }

    @Test
    @DisplayName("Should roll back only the failing batch and keep the others")
    void testLoadData_PartialBatchFailure() {
        LoadResult result = loader(LoadMode.APPEND, false, false).loadData(ordersWithBadRow(), "orders_processed");

        assertEquals(LoadOutcome.PARTIAL, result.outcome());
        assertEquals(3, result.getRowsLoaded());
        assertEquals(2, result.getRowsFailed());
        assertEquals(2, result.getBatchesCommitted());
        assertEquals(1, result.getBatchesFailed());
        assertEquals(3, db.count("orders_processed"));
        assertEquals(0, db.queryLong("SELECT COUNT(*) FROM orders_processed WHERE id IN (3, 4)"));
        assertEquals(1, db.queryLong("SELECT COUNT(*) FROM orders_processed WHERE id = 5"));
    }

    @Test
    @DisplayName("Should name the culprit row and mark its batch mates as rolled back")
    void testLoadData_RowFailureDetails() {
        LoadResult result = loader(LoadMode.APPEND, false, false).loadData(ordersWithBadRow(), "orders_processed");

        RowFailure bystander = result.getRowFailures().get(0);
        RowFailure culprit = result.getRowFailures().get(1);

        assertEquals(2, bystander.rowIndex());
        assertEquals("id=3", bystander.rowIdentifier());
        assertEquals(2, bystander.batchIndex());
        assertEquals("rolled back with batch 2", bystander.reason());

        assertEquals(3, culprit.rowIndex());
        assertEquals("id=4", culprit.rowIdentifier());
        assertTrue(culprit.reason().toUpperCase().contains("NULL"), culprit.reason());
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, culprit.category());
        assertEquals(ErrorCategory.CONSTRAINT_VIOLATION, bystander.category());
    }

    @Test
    @DisplayName("Should report every row when the destination does not exist")
    void testLoadData_MissingDestination() {
        LoadResult result = loader(LoadMode.APPEND, false, false).loadData(ordersWithBadRow(), "ghost_table");

        assertEquals(LoadOutcome.NONE, result.outcome());
        assertEquals(5, result.getRowsFailed());
        assertEquals(3, result.getBatchesFailed());
        assertTrue(result.getRowFailures().stream().noneMatch(f -> f.reason().startsWith("rolled back")));
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, result.getRowFailures().get(0).category());
    }

    @Test
    @DisplayName("Should treat an empty dataset as a full load")
    void testLoadData_EmptyDataset() {
        LoadResult result = loader(LoadMode.APPEND, false, false).loadData(Dataset.empty(COLUMNS), "orders_processed");

        assertEquals(LoadOutcome.FULL, result.outcome());
        assertEquals(0, result.getRowsLoaded());
        assertEquals(0, result.getBatchesCommitted());
    }

    // ============================================================================
    // Modes and Backups
    // ============================================================================

    @Test
    @DisplayName("Should append after existing rows")
    void testLoadData_Append() {
        db.execute("INSERT INTO orders_processed VALUES (100, 'old', 1.00)");

        loader(LoadMode.APPEND, false, false).loadData(ordersWithBadRow(), "orders_processed");

        assertEquals(4, db.count("orders_processed"));
    }

    @Test
    @DisplayName("Should clear existing rows in replace mode")
    void testLoadData_Replace() {
        db.execute("INSERT INTO orders_processed VALUES (100, 'old', 1.00)",
                "INSERT INTO orders_processed VALUES (101, 'older', 2.00)");

        LoadResult result = loader(LoadMode.REPLACE, false, false).loadData(ordersWithBadRow(), "orders_processed");

        assertEquals(3, result.getRowsLoaded());
        assertEquals(3, db.count("orders_processed"));
        assertEquals(0, db.queryLong("SELECT COUNT(*) FROM orders_processed WHERE id >= 100"));
    }

    @Test
    @DisplayName("Should snapshot the destination under a timestamped name before loading")
    void testLoadData_Backup() {
        db.execute("INSERT INTO orders_processed VALUES (100, 'old', 1.00)");

        LoadResult result = loader(LoadMode.REPLACE, true, true).loadData(ordersWithBadRow(), "orders_processed");

        assertEquals("orders_processed_backup_20240615_103000", result.getBackupTable());
        assertNull(result.getBackupError());
        assertTrue(db.tableExists("orders_processed_backup_20240615_103000"));
        assertEquals(1, db.count("orders_processed_backup_20240615_103000"));
    }

    @Test
    @DisplayName("Should continue without a backup when it is optional")
    void testLoadData_OptionalBackupFails() {
        LoadResult result = loader(LoadMode.APPEND, true, false).loadData(ordersWithBadRow(), "ghost_table");

        assertNull(result.getBackupTable());
        assertNotNull(result.getBackupError());
    }

    @Test
    @DisplayName("Should abort the load when a mandatory backup fails")
    void testLoadData_MandatoryBackupFails() {
        DataLoader loader = loader(LoadMode.APPEND, true, true);

        LoadException ex = assertThrows(LoadException.class, () -> loader.loadData(ordersWithBadRow(), "ghost_table"));

        assertTrue(ex.getMessage().contains("Mandatory backup failed"));
        assertEquals("ghost_table", ex.getTable());
    }

    @Test
    @DisplayName("Should reject a batch size below one")
    void testConstructor_InvalidBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new DataLoader(db.connectionManager(), 0, false, false, LoadMode.APPEND, CLOCK));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    @Test
    @DisplayName("Should locate the failing row from driver update counts")
    void testCulpritOffset() {
        assertEquals(1, DataLoader.culpritOffset(new BatchUpdateException("x", new int[]{1, Statement.EXECUTE_FAILED, 1}), 3));
        assertEquals(1, DataLoader.culpritOffset(new BatchUpdateException("x", new int[]{1}), 3));
        assertEquals(-1, DataLoader.culpritOffset(new BatchUpdateException("x", new int[]{1, 1}), 2));
        assertEquals(0, DataLoader.culpritOffset(
                new RuntimeException(new BatchUpdateException("x", new int[]{Statement.EXECUTE_FAILED})), 1));
        assertEquals(-1, DataLoader.culpritOffset(new SQLException("plain"), 2));
    }

    @Test
    @DisplayName("Should build a positional insert statement")
    void testInsertSql() {
        assertEquals("INSERT INTO orders_processed (id, name, amount) VALUES (?, ?, ?)",
                DataLoader.insertSql("orders_processed", COLUMNS));
    }
}
