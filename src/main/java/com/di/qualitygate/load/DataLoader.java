package com.di.qualitygate.load;

import com.di.qualitygate.connection.ConnectionManager;
import com.di.qualitygate.exception.ErrorCategory;
import com.di.qualitygate.exception.LoadException;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.util.InputValidator;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.sql.BatchUpdateException;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a dataset into a destination table in fixed-size batches, one transaction per batch.
 * <p>
 * A failing batch is rolled back as a whole and every row in it is reported. The row that caused
 * the failure carries the driver's message; the others are marked as rolled back with the batch.
 * Batches committed earlier stay committed.
 */
@Slf4j
public class DataLoader {

    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ConnectionManager connectionManager;
    private final int batchSize;
    private final boolean backupBeforeLoad;
    private final boolean backupMandatory;
    private final LoadMode loadMode;
    private final Clock clock;

    public DataLoader(ConnectionManager connectionManager, int batchSize, boolean backupBeforeLoad,
                      boolean backupMandatory, LoadMode loadMode, Clock clock) {
        InputValidator.validateBatchSize(batchSize);
        this.connectionManager = connectionManager;
        this.batchSize = batchSize;
        this.backupBeforeLoad = backupBeforeLoad;
        this.backupMandatory = backupMandatory;
        this.loadMode = loadMode;
        this.clock = clock;
    }

    /**
     * Loads {@code dataset} into {@code destination}.
     *
     * @throws LoadException when a mandatory backup or the REPLACE delete fails; batch failures are reported in the result instead
     */
    public LoadResult loadData(Dataset dataset, String destination) {
        long start = System.currentTimeMillis();
        InputValidator.validateTableName(destination);
        dataset.columnNames().forEach(InputValidator::validateColumnName);
        log.info("[LOAD] Loading {} rows into {} | mode={} | batchSize={}",
                dataset.rowCount(), destination, loadMode, batchSize);

        String backupTable = null;
        String backupError = null;
        if (backupBeforeLoad) {
            String candidate = destination + "_backup_" + LocalDateTime.now(clock).format(BACKUP_SUFFIX);
            try {
                createBackup(destination, candidate);
                backupTable = candidate;
            } catch (SQLException | RuntimeException e) {
                backupError = e.getMessage();
                if (backupMandatory) {
                    throw new LoadException(destination, "Mandatory backup failed: " + e.getMessage(), e);
                }
                log.warn("[LOAD] Backup of {} failed, continuing without it: {}", destination, e.getMessage());
            }
        }

        if (loadMode == LoadMode.REPLACE) {
            deleteExisting(destination);
        }

        String sql = insertSql(destination, dataset.columns());
        List<Map<String, Object>> rows = dataset.rows();
        long loaded = 0;
        int committed = 0;
        int failedBatches = 0;
        List<RowFailure> failures = new ArrayList<>();
        int batchNumber = 0;
        for (int from = 0; from < rows.size(); from += batchSize) {
            batchNumber++;
            int to = Math.min(from + batchSize, rows.size());
            try {
                writeBatch(sql, dataset, from, to);
                loaded += to - from;
                committed++;
                log.debug("[LOAD] {} batch {} committed ({} rows)", destination, batchNumber, to - from);
            } catch (SQLException | RuntimeException e) {
                failedBatches++;
                failures.addAll(describeFailure(dataset, from, to, batchNumber, e));
                log.error("[LOAD] {} batch {} rolled back ({} rows): {}",
                        destination, batchNumber, to - from, e.getMessage());
            }
        }

        LoadResult result = LoadResult.builder()
                .destination(destination)
                .rowsLoaded(loaded)
                .rowsFailed(failures.size())
                .batchesCommitted(committed)
                .batchesFailed(failedBatches)
                .rowFailures(List.copyOf(failures))
                .backupTable(backupTable)
                .backupError(backupError)
                .durationMs(System.currentTimeMillis() - start)
                .build();
        log.info("[LOAD] {} | loaded={} | failed={} | batches committed={} failed={} | outcome={}",
                destination, loaded, failures.size(), committed, failedBatches, result.outcome());
        return result;
    }

    /** Snapshot of the destination as {@code <dest>_backup_<yyyyMMdd_HHmmss>}. */
    void createBackup(String destination, String backupTable) throws SQLException {
        InputValidator.validateTableName(backupTable);
        connectionManager.execute(connection -> {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE " + backupTable + " AS SELECT * FROM " + destination);
            }
            connection.commit();
            return null;
        });
        log.info("[LOAD] Created backup table {}", backupTable);
    }

    private void deleteExisting(String destination) {
        try {
            int deleted = connectionManager.execute(connection -> {
                connection.setAutoCommit(false);
                int count;
                try (Statement statement = connection.createStatement()) {
                    count = statement.executeUpdate("DELETE FROM " + destination);
                }
                connection.commit();
                return count;
            });
            log.info("[LOAD] REPLACE mode: deleted {} existing rows from {}", deleted, destination);
        } catch (SQLException | RuntimeException e) {
            throw new LoadException(destination, "Could not clear destination before replace: " + e.getMessage(), e);
        }
    }

    private void writeBatch(String sql, Dataset dataset, int from, int to) throws SQLException {
        List<Column> columns = dataset.columns();
        connectionManager.execute(connection -> {
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = from; i < to; i++) {
                    Map<String, Object> row = dataset.rows().get(i);
                    for (int c = 0; c < columns.size(); c++) {
                        Column column = columns.get(c);
                        Object value = TypeConverter.toJdbcValue(row.get(column.name()));
                        if (value == null) {
                            ps.setNull(c + 1, column.type().jdbcType());
                        } else {
                            ps.setObject(c + 1, value);
                        }
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            connection.commit();
            return null;
        });
    }

    private static List<RowFailure> describeFailure(Dataset dataset, int from, int to, int batchNumber,
                                                    Exception e) {
        int culprit = culpritOffset(e, to - from);
        ErrorCategory category = ErrorCategory.categorize(e);
        String rolledBack = "rolled back with batch " + batchNumber;
        List<RowFailure> failures = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            boolean isCulprit = culprit < 0 || i - from == culprit;
            String reason = isCulprit ? reasonOf(e) : rolledBack;
            failures.add(new RowFailure(i, dataset.rowIdentifier(i), batchNumber, reason, category));
        }
        return failures;
    }

    /**
     * Offset of the failing row inside the batch, or -1 when the driver did not say.
     * Drivers either stop at the failing statement (fewer update counts than rows) or mark it
     * {@link Statement#EXECUTE_FAILED}.
     */
    static int culpritOffset(Throwable e, int batchRows) {
        BatchUpdateException bue = findBatchUpdateException(e);
        if (bue == null || bue.getUpdateCounts() == null) {
            return -1;
        }
        int[] counts = bue.getUpdateCounts();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == Statement.EXECUTE_FAILED) {
                return i;
            }
        }
        return counts.length < batchRows ? counts.length : -1;
    }

    private static BatchUpdateException findBatchUpdateException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof BatchUpdateException bue) {
                return bue;
            }
            current = current.getCause();
        }
        return null;
    }

    private static String reasonOf(Exception e) {
        if (e instanceof SQLException sql && sql.getNextException() != null) {
            return sql.getNextException().getMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String insertSql(String destination, List<Column> columns) {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + destination + " (" + names + ") VALUES (" + placeholders + ")";
    }
}
