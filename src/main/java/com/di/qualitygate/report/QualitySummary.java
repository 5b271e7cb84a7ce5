package com.di.qualitygate.report;

import java.time.Instant;
import java.util.List;

/**
 * Run-level roll-up of validation, data volume, anomalies and execution outcome.
 *
 * @param passRate percentage of passed checks, 0 when nothing was validated
 */
public record QualitySummary(Instant generatedAt,
                             String runId,
                             long totalChecks,
                             long passedChecks,
                             long failedChecks,
                             long criticalFailures,
                             long warningFailures,
                             double passRate,
                             int totalTables,
                             long totalRows,
                             long totalColumns,
                             long totalOutliers,
                             List<String> loadedTables,
                             List<String> partiallyLoadedTables,
                             List<String> failedTables) {
}
