package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.model.ValidationResult;

import java.util.List;

/**
 * Raised by the reject-on-critical policy when a table has CRITICAL failures.
 */
public class ValidationFailureException extends EtlException {

    private final List<ValidationResult> criticalFailures;

    public ValidationFailureException(String table, List<ValidationResult> criticalFailures) {
        super(ErrorKind.VALIDATION_FAILURE, table, EtlStage.VALIDATE,
                String.format("%d critical quality check(s) failed for table %s: %s",
                        criticalFailures.size(), table,
                        criticalFailures.stream().map(ValidationResult::getRuleName).toList()),
                null);
        this.criticalFailures = List.copyOf(criticalFailures);
    }

    public List<ValidationResult> getCriticalFailures() {
        return criticalFailures;
    }
}
