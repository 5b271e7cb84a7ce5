package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one quality check over one dataset.
 */
@Value
@Builder
public class ValidationResult {

    String ruleName;
    String table;
    boolean passed;
    long failingRowCount;
    double failingPercentage;
    Severity severity;
    String message;
    @Builder.Default
    List<Integer> failingRowIndices = List.of();
    ResultSource source;
    @Builder.Default
    Instant evaluatedAt = Instant.now();

    public boolean isCriticalFailure() {
        return !passed && severity == Severity.CRITICAL;
    }

    public boolean isWarningFailure() {
        return !passed && severity == Severity.WARNING;
    }
}
