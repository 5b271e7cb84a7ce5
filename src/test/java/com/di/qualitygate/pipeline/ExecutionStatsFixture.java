package com.di.qualitygate.pipeline;

import com.di.qualitygate.exception.ExtractionException;
import com.di.qualitygate.load.LoadResult;
import com.di.qualitygate.model.AnomalyMethod;
import com.di.qualitygate.model.AnomalyReport;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.model.ResultSource;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.model.TableAnomalies;
import com.di.qualitygate.model.TableStatus;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.profile.DataProfiler;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Builds finished {@link ExecutionStats} without running the pipeline: {@code suppliers} loaded with
 * three checks (one passed, one CRITICAL and one WARNING failure) and {@code orders} failed at extract.
 */
public final class ExecutionStatsFixture {

    public static final String FAILURE_CAUSE = "relation <orders> does not exist";

    private ExecutionStatsFixture() {
    }

    public static ExecutionStats finishedRun(Clock clock) {
        ExecutionStats stats = new ExecutionStats("run-1", List.of("suppliers", "orders"), clock);
        stats.start();

        TableExecution suppliers = stats.table("suppliers");
        suppliers.start();
        suppliers.recordExtracted(3);
        suppliers.transitionTo(TableStatus.EXTRACTED);
        suppliers.transitionTo(TableStatus.TRANSFORMED);
        suppliers.recordValidation(
                List.of(result("required_columns", true, Severity.CRITICAL, ResultSource.BUILT_IN, 0)),
                List.of(result("reliability_score_range", false, Severity.CRITICAL, ResultSource.RULE, 1),
                        result("lead_time_positive", false, Severity.WARNING, ResultSource.RULE, 1)));
        suppliers.recordProfile(new DataProfiler().profileDataset(suppliersDataset(), "suppliers"));
        suppliers.recordAnomalies(TableAnomalies.builder()
                .table("suppliers")
                .reports(List.of(AnomalyReport.builder()
                        .table("suppliers")
                        .columns(List.of("reliability_score"))
                        .method(AnomalyMethod.IQR)
                        .outlierCount(2)
                        .outlierPercentage(66.67)
                        .outlierRowIndices(List.of(0, 1))
                        .sampleValues(List.of(150, 170))
                        .threshold(1.5)
                        .build()))
                .build());
        suppliers.transitionTo(TableStatus.VALIDATED);
        suppliers.recordLoad(LoadResult.builder()
                .destination("suppliers_processed")
                .rowsLoaded(3)
                .batchesCommitted(1)
                .build());
        suppliers.transitionTo(TableStatus.LOADED);
        suppliers.finish();

        TableExecution orders = stats.table("orders");
        orders.start();
        orders.fail(EtlStage.EXTRACT, new ExtractionException("orders", FAILURE_CAUSE, null));
        orders.finish();

        stats.finish();
        return stats;
    }

    /** A run over no tables. */
    public static ExecutionStats emptyRun(Clock clock) {
        ExecutionStats stats = new ExecutionStats("run-empty", List.of(), clock);
        stats.start();
        stats.finish();
        return stats;
    }

    private static Dataset suppliersDataset() {
        List<Column> columns = List.of(
                Column.required("supplier_id", ColumnType.INTEGER),
                Column.of("reliability_score", ColumnType.DECIMAL));
        return Dataset.of(columns, List.of(
                Map.<String, Object>of("supplier_id", 1L, "reliability_score", new BigDecimal("150")),
                Map.<String, Object>of("supplier_id", 2L, "reliability_score", new BigDecimal("90")),
                Map.<String, Object>of("supplier_id", 3L, "reliability_score", new BigDecimal("75"))));
    }

    private static ValidationResult result(String name, boolean passed, Severity severity, ResultSource source,
                                           long failing) {
        return ValidationResult.builder()
                .ruleName(name)
                .table("suppliers")
                .passed(passed)
                .failingRowCount(failing)
                .failingPercentage(failing * 100.0 / 3)
                .severity(severity)
                .message(passed ? "PASS" : "FAIL: " + failing + " of 3 rows")
                .source(source)
                .build();
    }
}
