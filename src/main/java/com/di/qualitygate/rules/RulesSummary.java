package com.di.qualitygate.rules;

import com.di.qualitygate.model.ValidationResult;

import java.util.Collection;

/**
 * Pass/fail totals over a set of rule results.
 *
 * @param passRate percentage of passed results, 0 when nothing ran
 */
public record RulesSummary(long totalRules, long passed, long failed, long criticalFailures,
                           long warningFailures, double passRate) {

    public static RulesSummary of(Collection<ValidationResult> results) {
        long total = results.size();
        long passed = results.stream().filter(ValidationResult::isPassed).count();
        long critical = results.stream().filter(ValidationResult::isCriticalFailure).count();
        long warnings = results.stream().filter(ValidationResult::isWarningFailure).count();
        double passRate = total == 0 ? 0.0 : passed * 100.0 / total;
        return new RulesSummary(total, passed, total - passed, critical, warnings, passRate);
    }
}
