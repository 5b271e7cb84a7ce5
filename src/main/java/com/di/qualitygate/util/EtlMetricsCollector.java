package com.di.qualitygate.util;

import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.model.TableStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for pipeline runs: row counters per outcome, per-stage timers and table outcomes.
 * Observability only; nothing reads these back to make decisions.
 */
@Slf4j
@Component
public class EtlMetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter rowsExtracted;
    private final Counter rowsLoaded;
    private final Counter rowsRejected;
    private final Counter rowsFailed;
    private final Counter rowsDroppedByTransform;
    private final Counter connectionRetries;
    private final DistributionSummary criticalFailuresPerTable;

    public EtlMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rowsExtracted = rowCounter("extracted");
        this.rowsLoaded = rowCounter("loaded");
        this.rowsRejected = rowCounter("rejected");
        this.rowsFailed = rowCounter("failed");
        this.rowsDroppedByTransform = rowCounter("dropped");

        this.connectionRetries = Counter.builder("etl.connection.retries")
                .description("Connection acquisition retries after transient failures")
                .register(meterRegistry);

        this.criticalFailuresPerTable = DistributionSummary.builder("etl.validation.critical.failures")
                .description("CRITICAL quality check failures per validated table")
                .register(meterRegistry);
    }

    private Counter rowCounter(String outcome) {
        return Counter.builder("etl.rows")
                .description("Rows processed by outcome")
                .tag("outcome", outcome)
                .baseUnit("rows")
                .register(meterRegistry);
    }

    public void recordExtracted(long rows) {
        rowsExtracted.increment(rows);
    }

    public void recordLoaded(long rows) {
        rowsLoaded.increment(rows);
    }

    public void recordRejected(long rows) {
        rowsRejected.increment(rows);
    }

    public void recordFailed(long rows) {
        rowsFailed.increment(rows);
    }

    public void recordDroppedByTransform(long rows) {
        rowsDroppedByTransform.increment(rows);
    }

    public void recordConnectionRetry() {
        connectionRetries.increment();
    }

    public void recordCriticalFailures(int count) {
        criticalFailuresPerTable.record(count);
    }

    public void recordStageDuration(EtlStage stage, long durationMs) {
        Timer.builder("etl.stage.duration")
                .description("Time spent in a pipeline stage")
                .tag("stage", stage.name())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordTableOutcome(TableStatus status) {
        Counter.builder("etl.tables")
                .description("Tables by final status")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        log.debug("Recorded table outcome: {}", status);
    }

    public double rowsLoadedTotal() {
        return rowsLoaded.count();
    }
}
