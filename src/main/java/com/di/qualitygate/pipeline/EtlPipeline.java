package com.di.qualitygate.pipeline;

import com.di.qualitygate.anomaly.AnomalyDetector;
import com.di.qualitygate.config.CriticalRejectMode;
import com.di.qualitygate.config.EtlProperties;
import com.di.qualitygate.exception.EtlException;
import com.di.qualitygate.exception.LoadException;
import com.di.qualitygate.exception.ReportingException;
import com.di.qualitygate.exception.ValidationFailureException;
import com.di.qualitygate.extract.DataExtractor;
import com.di.qualitygate.load.DataLoader;
import com.di.qualitygate.load.LoadResult;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.model.TableAnomalies;
import com.di.qualitygate.model.TableProfile;
import com.di.qualitygate.model.TableStatus;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.profile.DataProfiler;
import com.di.qualitygate.report.DataQualityReporter;
import com.di.qualitygate.rules.DataQualityRulesEngine;
import com.di.qualitygate.transform.DataTransformer;
import com.di.qualitygate.transform.StandardTransforms;
import com.di.qualitygate.transform.TransformResult;
import com.di.qualitygate.util.EtlMetricsCollector;
import com.di.qualitygate.util.MdcPropagation;
import com.di.qualitygate.util.StageEventLogger;
import com.di.qualitygate.validate.DataQualityReport;
import com.di.qualitygate.validate.DataQualityValidator;
import com.di.qualitygate.validate.ForeignKey;
import com.di.qualitygate.validate.ReferenceData;
import com.di.qualitygate.validate.StandardValidationSpecs;
import com.di.qualitygate.validate.TableValidationSpec;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the quality-gated ETL flow over a list of tables.
 *
 * <pre>
 * for each table (isolated; one failure never aborts the run):
 *   PENDING ──extract──► EXTRACTED ──transform──► TRANSFORMED ──validate/profile/anomalies/policy──► VALIDATED ──load──► LOADED
 *       └────────────────────────── any stage error ──────────────────────────────────────────────────► FAILED
 * then: JSON + HTML reports
 * </pre>
 *
 * Disabled stages still record their transition. Each run carries its own cancellation flag, checked
 * before each table starts; tables not started stay PENDING and are flagged cancelled.
 */
@Slf4j
public class EtlPipeline {

    private final EtlProperties properties;
    private final DataExtractor extractor;
    private final DataTransformer transformer;
    private final DataQualityValidator validator;
    private final DataQualityRulesEngine rulesEngine;
    private final DataProfiler profiler;
    private final AnomalyDetector anomalyDetector;
    private final DataLoader loader;
    private final DataQualityReporter reporter;
    private final StageEventLogger eventLogger;
    private final EtlMetricsCollector metrics;
    private final Clock clock;

    private final Set<RunContext> activeRuns = ConcurrentHashMap.newKeySet();

    public EtlPipeline(EtlProperties properties,
                       DataExtractor extractor,
                       DataTransformer transformer,
                       DataQualityValidator validator,
                       DataQualityRulesEngine rulesEngine,
                       DataProfiler profiler,
                       AnomalyDetector anomalyDetector,
                       DataLoader loader,
                       DataQualityReporter reporter,
                       StageEventLogger eventLogger,
                       EtlMetricsCollector metrics,
                       Clock clock) {
        this.properties = properties;
        this.extractor = extractor;
        this.transformer = transformer;
        this.validator = validator;
        this.rulesEngine = rulesEngine;
        this.profiler = profiler;
        this.anomalyDetector = anomalyDetector;
        this.loader = loader;
        this.reporter = reporter;
        this.eventLogger = eventLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    /** Runs the configured tables with the configured stage toggles. */
    public ExecutionStats runFullPipeline() {
        return runFullPipeline(properties.getTables(), properties.isEnableValidation(),
                properties.isEnableTransformation());
    }

    public ExecutionStats runFullPipeline(List<String> tables, boolean enableValidation, boolean enableTransformation) {
        String runId = UUID.randomUUID().toString();
        ExecutionStats stats = new ExecutionStats(runId, tables, clock);
        RunContext run = new RunContext(stats, enableValidation, enableTransformation);
        activeRuns.add(run);

        try (MdcPropagation.AutoCloseableMdc ignored = MdcPropagation.scoped(MdcPropagation.RUN_ID, runId)) {
            stats.start();
            log.info("[PIPELINE] Run {} started | tables={} | validation={} | transformation={} | load={} | parallelism={}",
                    runId, tables, enableValidation, enableTransformation, properties.isEnableLoad(),
                    properties.getParallelism());
            eventLogger.logEvent(StageEventLogger.RUN_STARTED, null,
                    Map.of("tables", tables, "parallelism", properties.getParallelism()), null);

            if (properties.getParallelism() > 1 && tables.size() > 1) {
                runParallel(run, tables);
            } else {
                for (String table : tables) {
                    processTable(run, table);
                }
            }

            stats.finish();
            writeReports(stats);
            log.info("[PIPELINE] Run {} finished | {} | rules: {}", runId, stats, stats.rulesSummary());
            eventLogger.logEvent(StageEventLogger.RUN_COMPLETED, null, Map.of(
                    "loaded", stats.getLoadedTables(),
                    "partial", stats.getPartiallyLoadedTables(),
                    "failed", stats.getFailedTables(),
                    "rowsLoaded", stats.getRowsLoaded(),
                    "cancelled", stats.isCancelled()), null);
        } finally {
            activeRuns.remove(run);
        }
        return stats;
    }

    /**
     * Asks every run in progress to stop. Takes effect before each run's next table starts; tables in
     * flight complete. Runs started afterwards are unaffected.
     *
     * @return number of runs signalled
     */
    public int requestCancellation() {
        int signalled = 0;
        for (RunContext run : activeRuns) {
            run.cancelled.set(true);
            signalled++;
        }
        log.warn("[PIPELINE] Cancellation requested | runs signalled={}", signalled);
        return signalled;
    }

    /** Whether any run in progress has been asked to stop. */
    public boolean isCancellationRequested() {
        return activeRuns.stream().anyMatch(run -> run.cancelled.get());
    }

    private void runParallel(RunContext run, List<String> tables) {
        AtomicInteger threadIds = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(properties.getParallelism(), r -> {
            Thread t = new Thread(r, "etl-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<Void>> futures = new HashMap<>();
            for (String table : tables) {
                futures.put(table, executor.submit(MdcPropagation.wrapCallable(() -> {
                    processTable(run, table);
                    return null;
                })));
            }
            for (String table : tables) {
                try {
                    futures.get(table).get();
                } catch (ExecutionException e) {
                    log.error("[PIPELINE] Worker for table {} died: {}", table, e.getCause().toString(), e.getCause());
                    TableExecution exec = run.stats.table(table);
                    if (!exec.getStatus().isTerminal()) {
                        exec.fail(EtlStage.EXTRACT, e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    run.cancelled.set(true);
                    log.warn("[PIPELINE] Interrupted while waiting for table {}", table);
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    /* ==================================================================== */
    /* Per-table flow                                                        */
    /* ==================================================================== */

    void processTable(RunContext run, String table) {
        TableExecution exec = run.stats.table(table);
        if (run.cancelled.get()) {
            exec.markCancelled();
            run.stats.markCancelled();
            log.warn("[PIPELINE] table={} skipped: run cancelled", table);
            return;
        }

        try (MdcPropagation.AutoCloseableMdc ignored = MdcPropagation.scoped(MdcPropagation.TABLE, table)) {
            exec.start();
            EtlStage[] current = {EtlStage.EXTRACT};
            try {
                Dataset dataset = stage(EtlStage.EXTRACT, current, () -> extractor.extractTable(table));
                exec.recordExtracted(dataset.rowCount());
                metrics.recordExtracted(dataset.rowCount());
                exec.transitionTo(TableStatus.EXTRACTED);

                if (run.enableTransformation) {
                    Dataset input = dataset;
                    TransformResult result = stage(EtlStage.TRANSFORM, current,
                            () -> transformer.transform(input, StandardTransforms.forTable(table)));
                    dataset = result.dataset();
                    exec.recordTransform(dataset.rowCount(), result.rowsDropped(), result.stageStats());
                    metrics.recordDroppedByTransform(result.rowsDropped());
                }
                exec.transitionTo(TableStatus.TRANSFORMED);

                if (run.enableValidation) {
                    dataset = validateAndApplyPolicy(run, table, dataset, exec, current);
                }
                exec.transitionTo(TableStatus.VALIDATED);

                if (properties.isEnableLoad()) {
                    Dataset toLoad = dataset;
                    String destination = properties.destinationFor(table);
                    LoadResult result = stage(EtlStage.LOAD, current, () -> loader.loadData(toLoad, destination));
                    exec.recordLoad(result);
                    metrics.recordLoaded(result.getRowsLoaded());
                    metrics.recordFailed(result.getRowsFailed());
                    if (result.getBatchesCommitted() == 0 && result.getBatchesFailed() > 0) {
                        throw new LoadException(table, String.format("All %d batches failed loading into %s",
                                result.getBatchesFailed(), destination));
                    }
                } else {
                    log.info("[LOAD] table={} | load disabled, {} rows not written", table, dataset.rowCount());
                }
                exec.transitionTo(TableStatus.LOADED);
                log.info("[PIPELINE] table={} LOADED | extracted={} | dropped={} | rejected={} | loaded={} | failed={} | outcome={}",
                        table, exec.getRowsExtracted(), exec.getRowsDroppedByTransform(), exec.getRowsRejected(),
                        exec.getRowsLoaded(), exec.getRowsFailed(), exec.getLoadOutcome());
            } catch (EtlException e) {
                EtlStage failedAt = e.getStage() != null ? e.getStage() : current[0];
                exec.fail(failedAt, e);
                log.error("[PIPELINE] table={} FAILED at {} ({}): {}", table, failedAt, e.getKind(), e.getMessage());
            } catch (RuntimeException e) {
                exec.fail(current[0], e);
                log.error("[PIPELINE] table={} FAILED at {}: {}", table, current[0], e.getMessage(), e);
            } finally {
                exec.finish();
                metrics.recordTableOutcome(exec.getStatus());
            }
        }
    }

    private Dataset validateAndApplyPolicy(RunContext run, String table, Dataset dataset, TableExecution exec,
                                           EtlStage[] current) {
        TableValidationSpec spec = StandardValidationSpecs.forTable(table);
        List<ValidationResult> ruleResults = new ArrayList<>();
        DataQualityReport report = stage(EtlStage.VALIDATE, current, () -> {
            ReferenceData referenceData = run.referenceDataFor(spec, exec);
            DataQualityReport builtIn = validator.validateTable(dataset, table, spec, referenceData);
            ruleResults.addAll(rulesEngine.executeRules(dataset, table));
            return builtIn;
        });
        exec.recordValidation(report.getResults(), ruleResults);

        List<ValidationResult> critical = new ArrayList<>();
        report.getResults().stream().filter(ValidationResult::isCriticalFailure).forEach(critical::add);
        ruleResults.stream().filter(ValidationResult::isCriticalFailure).forEach(critical::add);
        metrics.recordCriticalFailures(critical.size());

        optionalStage(EtlStage.PROFILE, exec, () -> {
            TableProfile profile = profiler.profileDataset(dataset, table);
            exec.recordProfile(profile);
            return profile;
        });
        optionalStage(EtlStage.ANOMALY, exec, () -> {
            TableAnomalies anomalies = anomalyDetector.analyzeTableAnomalies(dataset, table);
            exec.recordAnomalies(anomalies);
            return anomalies;
        });

        if (critical.isEmpty()) {
            return dataset;
        }
        if (!properties.isRejectOnCritical()) {
            log.warn("[VALIDATE] table={} | {} CRITICAL failure(s), reject-on-critical is off: {}",
                    table, critical.size(), names(critical));
            return dataset;
        }

        boolean structural = critical.stream().anyMatch(r -> r.getFailingRowIndices().isEmpty());
        if (properties.getCriticalRejectMode() == CriticalRejectMode.TABLE || structural) {
            exec.recordRejected(dataset.rowCount());
            metrics.recordRejected(dataset.rowCount());
            throw new ValidationFailureException(table, critical);
        }

        Set<Integer> rejected = new TreeSet<>();
        critical.forEach(r -> rejected.addAll(r.getFailingRowIndices()));
        List<Map<String, Object>> kept = new ArrayList<>(dataset.rowCount() - rejected.size());
        for (int i = 0; i < dataset.rowCount(); i++) {
            if (!rejected.contains(i)) {
                kept.add(dataset.rows().get(i));
            }
        }
        exec.recordRejected(rejected.size());
        metrics.recordRejected(rejected.size());
        log.warn("[VALIDATE] table={} | rejected {} row(s) failing CRITICAL checks {}",
                table, rejected.size(), names(critical));
        return dataset.withRows(kept);
    }

    /* ==================================================================== */
    /* Stage plumbing                                                        */
    /* ==================================================================== */

    private <T> T stage(EtlStage stage, EtlStage[] current, Supplier<T> work) {
        current[0] = stage;
        long start = System.currentTimeMillis();
        try (MdcPropagation.AutoCloseableMdc ignored = MdcPropagation.scoped(MdcPropagation.STAGE, stage.name())) {
            eventLogger.stageStarted(stage, null);
            try {
                T result = work.get();
                long elapsed = System.currentTimeMillis() - start;
                metrics.recordStageDuration(stage, elapsed);
                eventLogger.stageCompleted(stage, Map.of("durationMs", elapsed));
                return result;
            } catch (RuntimeException e) {
                metrics.recordStageDuration(stage, System.currentTimeMillis() - start);
                eventLogger.stageFailed(stage, Map.of("durationMs", System.currentTimeMillis() - start), e);
                throw e;
            }
        }
    }

    /** A stage whose failure is recorded as a warning instead of failing the table. */
    private void optionalStage(EtlStage stage, TableExecution exec, Supplier<?> work) {
        long start = System.currentTimeMillis();
        try (MdcPropagation.AutoCloseableMdc ignored = MdcPropagation.scoped(MdcPropagation.STAGE, stage.name())) {
            try {
                work.get();
                metrics.recordStageDuration(stage, System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                exec.addWarning(stage + " failed: " + e.getMessage());
                eventLogger.stageWarning(stage, Map.of("durationMs", System.currentTimeMillis() - start), e);
                log.warn("{} table={} | stage failed, continuing: {}", stage.logTag(), exec.getTable(), e.getMessage());
            }
        }
    }

    private void writeReports(ExecutionStats stats) {
        try (MdcPropagation.AutoCloseableMdc ignored =
                     MdcPropagation.scoped(MdcPropagation.STAGE, EtlStage.REPORT.name())) {
            reporter.writeReports(stats, Path.of(properties.getReportDir()));
        } catch (ReportingException e) {
            eventLogger.stageWarning(EtlStage.REPORT, null, e);
            log.warn("[REPORT] Report generation failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            eventLogger.stageWarning(EtlStage.REPORT, null, e);
            log.error("[REPORT] Unexpected error writing reports to {}: {}", properties.getReportDir(), e.toString(), e);
        }
    }

    private static List<String> names(List<ValidationResult> results) {
        return results.stream().map(ValidationResult::getRuleName).toList();
    }

    /** State shared by the tables of one run. */
    final class RunContext {
        final ExecutionStats stats;
        final boolean enableValidation;
        final boolean enableTransformation;
        final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final Map<String, Optional<Set<Object>>> referenceIds = new ConcurrentHashMap<>();

        RunContext(ExecutionStats stats, boolean enableValidation, boolean enableTransformation) {
            this.stats = stats;
            this.enableValidation = enableValidation;
            this.enableTransformation = enableTransformation;
        }

        /** Parent id sets for the table's foreign keys, read once per run. Unreadable parents are skipped. */
        ReferenceData referenceDataFor(TableValidationSpec spec, TableExecution exec) {
            ReferenceData data = ReferenceData.empty();
            for (ForeignKey fk : spec.getForeignKeys()) {
                Optional<Set<Object>> ids = referenceIds.computeIfAbsent(fk.referenceKey(), key -> load(fk));
                if (ids.isPresent()) {
                    data.put(fk.parentTable(), fk.parentColumn(), ids.get());
                } else {
                    exec.addWarning("Reference ids " + fk.referenceKey() + " unavailable; FK check on "
                            + fk.column() + " skipped");
                }
            }
            return data;
        }

        private Optional<Set<Object>> load(ForeignKey fk) {
            try {
                return Optional.of(extractor.extractReferenceIds(fk.parentTable(), fk.parentColumn()));
            } catch (RuntimeException e) {
                log.warn("[VALIDATE] Could not load reference ids {}: {}", fk.referenceKey(), e.getMessage());
                return Optional.empty();
            }
        }
    }
}
