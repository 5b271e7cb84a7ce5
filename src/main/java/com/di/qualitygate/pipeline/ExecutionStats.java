package com.di.qualitygate.pipeline;

import com.di.qualitygate.model.LoadOutcome;
import com.di.qualitygate.model.ResultSource;
import com.di.qualitygate.model.TableStatus;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.rules.RulesSummary;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Aggregate record of one pipeline run. Only the orchestrator mutates it; row totals are sums
 * over the per-table records, so they can never drift from them.
 */
public class ExecutionStats {

    private final String runId;
    private final List<String> tablesRequested;
    private final Map<String, TableExecution> tables = new LinkedHashMap<>();
    private final Clock clock;
    private Instant startTime;
    private Instant endTime;
    private boolean cancelled;

    ExecutionStats(String runId, List<String> tablesRequested, Clock clock) {
        this.runId = runId;
        this.tablesRequested = List.copyOf(tablesRequested);
        this.clock = clock;
        for (String table : tablesRequested) {
            tables.put(table, new TableExecution(table, clock));
        }
    }

    synchronized void start() {
        startTime = Instant.now(clock);
    }

    synchronized void finish() {
        endTime = Instant.now(clock);
    }

    synchronized void markCancelled() {
        cancelled = true;
    }

    synchronized TableExecution table(String table) {
        return tables.get(table);
    }

    public String getRunId() {
        return runId;
    }

    public List<String> getTablesRequested() {
        return tablesRequested;
    }

    public synchronized Map<String, TableExecution> getTables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    /** Tables that reached a terminal status. */
    public synchronized int getTablesProcessed() {
        return (int) tables.values().stream().filter(t -> t.getStatus().isTerminal()).count();
    }

    /** Tables loaded in full, or passed through with loading disabled. */
    public synchronized List<String> getLoadedTables() {
        return loadedTables(false);
    }

    public synchronized List<String> getPartiallyLoadedTables() {
        return loadedTables(true);
    }

    public synchronized List<String> getFailedTables() {
        List<String> failed = new ArrayList<>();
        tables.forEach((name, t) -> {
            if (t.getStatus() == TableStatus.FAILED) {
                failed.add(name);
            }
        });
        return failed;
    }

    private List<String> loadedTables(boolean partial) {
        List<String> matching = new ArrayList<>();
        tables.forEach((name, t) -> {
            if (t.getStatus() == TableStatus.LOADED && (t.getLoadOutcome() == LoadOutcome.PARTIAL) == partial) {
                matching.add(name);
            }
        });
        return matching;
    }

    public long getRowsExtracted() {
        return sum(TableExecution::getRowsExtracted);
    }

    public long getRowsTransformed() {
        return sum(TableExecution::getRowsAfterTransform);
    }

    public long getRowsDroppedByTransform() {
        return sum(TableExecution::getRowsDroppedByTransform);
    }

    public long getRowsRejected() {
        return sum(TableExecution::getRowsRejected);
    }

    public long getRowsLoaded() {
        return sum(TableExecution::getRowsLoaded);
    }

    public long getRowsFailed() {
        return sum(TableExecution::getRowsFailed);
    }

    /** Totals over the rule-engine results of this run, across all tables. */
    public synchronized RulesSummary rulesSummary() {
        List<ValidationResult> ruleResults = new ArrayList<>();
        tables.values().forEach(t -> t.getValidationResults().stream()
                .filter(r -> r.getSource() == ResultSource.RULE)
                .forEach(ruleResults::add));
        return RulesSummary.of(ruleResults);
    }

    private synchronized long sum(ToLongFunction<TableExecution> field) {
        return tables.values().stream().mapToLong(field).sum();
    }

    public synchronized Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized Long getDurationMs() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return endTime.toEpochMilli() - startTime.toEpochMilli();
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    @Override
    public synchronized String toString() {
        return String.format("ExecutionStats{runId=%s, tables=%d, processed=%d, loaded=%s, partial=%s, failed=%s, "
                        + "rows extracted=%d, dropped=%d, rejected=%d, loaded=%d, failed=%d, cancelled=%s}",
                runId, tablesRequested.size(), getTablesProcessed(), getLoadedTables(), getPartiallyLoadedTables(),
                getFailedTables(), getRowsExtracted(), getRowsDroppedByTransform(), getRowsRejected(),
                getRowsLoaded(), getRowsFailed(), cancelled);
    }
}
