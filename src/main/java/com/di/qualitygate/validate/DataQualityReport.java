package com.di.qualitygate.validate;

import com.di.qualitygate.model.ValidationResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the built-in checks for one table.
 */
@Value
@Builder
public class DataQualityReport {

    String table;
    long totalRows;
    Map<String, Long> nullCounts;
    long duplicateRowCount;
    long duplicateKeyCount;
    Map<String, Long> typeViolations;
    Map<String, Long> missingForeignKeys;
    List<String> issues;
    List<ValidationResult> results;
    Instant timestamp;

    /** No CRITICAL built-in check failed. */
    public boolean isValidationPassed() {
        return results.stream().noneMatch(ValidationResult::isCriticalFailure);
    }
}
