package com.di.qualitygate.pipeline;

import com.di.qualitygate.exception.ErrorCategory;
import com.di.qualitygate.exception.EtlException;
import com.di.qualitygate.exception.ErrorKind;
import com.di.qualitygate.load.LoadResult;
import com.di.qualitygate.load.RowFailure;
import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.model.LoadOutcome;
import com.di.qualitygate.model.TableAnomalies;
import com.di.qualitygate.model.TableProfile;
import com.di.qualitygate.model.TableStatus;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.transform.StageStats;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Execution record of one table within a run.
 * <p>
 * Written by the thread processing the table, read once the run has finished. Mutators are
 * synchronized so a concurrent reader (the REST endpoint, a log line) sees consistent values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableExecution {

    private final String table;
    private final Clock clock;
    private TableStatus status = TableStatus.PENDING;
    private final List<StageTransition> history = new ArrayList<>();
    private EtlStage failureStage;
    private ErrorKind failureKind;
    private String failureCause;
    private String failureCategory;

    private long rowsExtracted;
    private long rowsAfterTransform;
    private long rowsDroppedByTransform;
    private long rowsRejected;
    private long rowsLoaded;
    private long rowsFailed;
    private List<StageStats> transformStats = List.of();

    private long ruleCriticalFailures;
    private long ruleWarningFailures;
    private long builtInFailures;
    private long builtInCriticalFailures;

    private LoadOutcome loadOutcome = LoadOutcome.SKIPPED;
    private List<RowFailure> rowFailures = List.of();
    private String backupTable;
    private final List<String> warnings = new ArrayList<>();
    private boolean cancelled;

    private Instant startTime;
    private Instant endTime;

    private List<ValidationResult> validationResults = List.of();
    private TableProfile profile;
    private TableAnomalies anomalies;

    TableExecution(String table, Clock clock) {
        this.table = table;
        this.clock = clock;
        this.history.add(new StageTransition(TableStatus.PENDING, Instant.now(clock)));
    }

    /**
     * Moves the table forward one state.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    synchronized void transitionTo(TableStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for " + table + ": " + status + " -> " + next);
        }
        status = next;
        history.add(new StageTransition(next, Instant.now(clock)));
    }

    synchronized void start() {
        startTime = Instant.now(clock);
    }

    synchronized void finish() {
        endTime = Instant.now(clock);
    }

    synchronized void fail(EtlStage stage, Throwable cause) {
        failureStage = stage;
        failureCause = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof EtlException etl) {
            failureKind = etl.getKind();
            failureCategory = etl.getCategory().getName();
        } else {
            failureCategory = ErrorCategory.categorize(cause).getName();
        }
        transitionTo(TableStatus.FAILED);
    }

    synchronized void markCancelled() {
        cancelled = true;
    }

    synchronized void addWarning(String warning) {
        warnings.add(warning);
    }

    synchronized void recordExtracted(long rows) {
        rowsExtracted = rows;
        rowsAfterTransform = rows;
    }

    synchronized void recordTransform(long rowsAfter, long dropped, List<StageStats> stats) {
        rowsAfterTransform = rowsAfter;
        rowsDroppedByTransform = dropped;
        transformStats = List.copyOf(stats);
    }

    synchronized void recordValidation(List<ValidationResult> builtIn, List<ValidationResult> rules) {
        List<ValidationResult> all = new ArrayList<>(builtIn);
        all.addAll(rules);
        validationResults = List.copyOf(all);
        ruleCriticalFailures = rules.stream().filter(ValidationResult::isCriticalFailure).count();
        ruleWarningFailures = rules.stream().filter(ValidationResult::isWarningFailure).count();
        builtInFailures = builtIn.stream().filter(r -> !r.isPassed()).count();
        builtInCriticalFailures = builtIn.stream().filter(ValidationResult::isCriticalFailure).count();
    }

    synchronized void recordProfile(TableProfile tableProfile) {
        profile = tableProfile;
    }

    synchronized void recordAnomalies(TableAnomalies tableAnomalies) {
        anomalies = tableAnomalies;
    }

    synchronized void recordRejected(long rows) {
        rowsRejected = rows;
    }

    synchronized void recordLoad(LoadResult result) {
        rowsLoaded = result.getRowsLoaded();
        rowsFailed = result.getRowsFailed();
        rowFailures = result.getRowFailures();
        backupTable = result.getBackupTable();
        loadOutcome = result.outcome();
        if (result.getBackupError() != null) {
            warnings.add("Backup failed: " + result.getBackupError());
        }
    }

    public String getTable() {
        return table;
    }

    public synchronized TableStatus getStatus() {
        return status;
    }

    public synchronized List<StageTransition> getHistory() {
        return List.copyOf(history);
    }

    public synchronized EtlStage getFailureStage() {
        return failureStage;
    }

    public synchronized ErrorKind getFailureKind() {
        return failureKind;
    }

    public synchronized String getFailureCause() {
        return failureCause;
    }

    public synchronized String getFailureCategory() {
        return failureCategory;
    }

    public synchronized long getRowsExtracted() {
        return rowsExtracted;
    }

    public synchronized long getRowsAfterTransform() {
        return rowsAfterTransform;
    }

    public synchronized long getRowsDroppedByTransform() {
        return rowsDroppedByTransform;
    }

    public synchronized long getRowsRejected() {
        return rowsRejected;
    }

    public synchronized long getRowsLoaded() {
        return rowsLoaded;
    }

    public synchronized long getRowsFailed() {
        return rowsFailed;
    }

    public synchronized List<StageStats> getTransformStats() {
        return transformStats;
    }

    public synchronized long getRuleCriticalFailures() {
        return ruleCriticalFailures;
    }

    public synchronized long getRuleWarningFailures() {
        return ruleWarningFailures;
    }

    public synchronized long getBuiltInFailures() {
        return builtInFailures;
    }

    public synchronized long getBuiltInCriticalFailures() {
        return builtInCriticalFailures;
    }

    public synchronized LoadOutcome getLoadOutcome() {
        return loadOutcome;
    }

    public synchronized List<RowFailure> getRowFailures() {
        return rowFailures;
    }

    public synchronized String getBackupTable() {
        return backupTable;
    }

    public synchronized List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
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

    @JsonIgnore
    public synchronized List<ValidationResult> getValidationResults() {
        return validationResults;
    }

    @JsonIgnore
    public synchronized TableProfile getProfile() {
        return profile;
    }

    @JsonIgnore
    public synchronized TableAnomalies getAnomalies() {
        return anomalies;
    }
}
