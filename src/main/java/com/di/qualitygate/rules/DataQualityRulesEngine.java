package com.di.qualitygate.rules;

import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.ResultSource;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry and executor of table-scoped quality rules.
 * <p>
 * Rules run in registration order against the same, unchanged dataset. Every rule always runs:
 * a CRITICAL failure does not short-circuit, and a rule that cannot be evaluated (missing column,
 * unexpected value) yields a failed CRITICAL result carrying the error message.
 * <p>
 * Registration and execution are safe to interleave across threads.
 */
@Slf4j
public class DataQualityRulesEngine {

    private final Map<String, List<ValidationRule>> rulesByTable = new ConcurrentHashMap<>();
    private final List<ValidationResult> history = Collections.synchronizedList(new ArrayList<>());
    private final Clock clock;

    public DataQualityRulesEngine(Clock clock) {
        this.clock = clock;
    }

    public DataQualityRulesEngine() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Appends a rule to a table's list.
     *
     * @throws IllegalArgumentException if the table already has a rule with that name
     */
    public void addRule(String table, ValidationRule rule) {
        List<ValidationRule> rules = rulesByTable.computeIfAbsent(table, t -> new CopyOnWriteArrayList<>());
        synchronized (rules) {
            if (rules.stream().anyMatch(r -> r.getName().equals(rule.getName()))) {
                throw new IllegalArgumentException("Rule '" + rule.getName() + "' already registered for table " + table);
            }
            rules.add(rule);
        }
        log.debug("[RULES] Registered rule {} ({}) for table {}", rule.getName(), rule.getSeverity(), table);
    }

    /**
     * Registers the supply-chain rule catalog. Rules already registered under the same name are left alone.
     */
    public void defineStandardRules() {
        int added = 0;
        for (Map.Entry<String, List<ValidationRule>> e : StandardRules.catalog(clock).entrySet()) {
            for (ValidationRule rule : e.getValue()) {
                boolean exists = getRules(e.getKey()).stream().anyMatch(r -> r.getName().equals(rule.getName()));
                if (!exists) {
                    addRule(e.getKey(), rule);
                    added++;
                }
            }
        }
        log.info("[RULES] Standard rules defined | added={} | tables={}", added, rulesByTable.keySet());
    }

    public List<ValidationRule> getRules(String table) {
        List<ValidationRule> rules = rulesByTable.get(table);
        return rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Runs every rule registered for {@code table}, one result per rule in registration order.
     */
    public List<ValidationResult> executeRules(Dataset dataset, String table) {
        List<ValidationRule> rules = getRules(table);
        List<ValidationResult> results = new ArrayList<>(rules.size());
        for (ValidationRule rule : rules) {
            results.add(evaluate(rule, dataset, table));
        }
        history.addAll(results);

        long failed = results.stream().filter(r -> !r.isPassed()).count();
        long critical = results.stream().filter(ValidationResult::isCriticalFailure).count();
        log.info("[RULES] table={} | rules={} | passed={} | failed={} | critical={}",
                table, results.size(), results.size() - failed, failed, critical);
        return results;
    }

    private ValidationResult evaluate(ValidationRule rule, Dataset dataset, String table) {
        int total = dataset.rowCount();
        try {
            boolean[] mask = rule.getCheck().evaluate(dataset);
            List<Integer> failing = new ArrayList<>();
            for (int i = 0; i < mask.length; i++) {
                if (!mask[i]) {
                    failing.add(i);
                }
            }
            boolean passed = rule.getCheck().passes(mask);
            double pct = total == 0 ? 0.0 : failing.size() * 100.0 / total;
            String message = passed
                    ? String.format("PASS: %s", rule.getCheck().describe())
                    : String.format("FAIL: %d of %d rows (%.2f%%) violate %s", failing.size(), total, pct,
                            rule.getCheck().describe());
            if (!passed) {
                log.warn("[RULES] table={} | rule={} | severity={} | {}", table, rule.getName(), rule.getSeverity(), message);
            }
            return ValidationResult.builder()
                    .ruleName(rule.getName())
                    .table(table)
                    .passed(passed)
                    .failingRowCount(failing.size())
                    .failingPercentage(pct)
                    .severity(rule.getSeverity())
                    .message(message)
                    .failingRowIndices(List.copyOf(failing))
                    .source(ResultSource.RULE)
                    .evaluatedAt(Instant.now(clock))
                    .build();
        } catch (RuntimeException e) {
            log.error("[RULES] table={} | rule={} could not be evaluated: {}", table, rule.getName(), e.getMessage());
            return ValidationResult.builder()
                    .ruleName(rule.getName())
                    .table(table)
                    .passed(false)
                    .failingRowCount(0)
                    .failingPercentage(0.0)
                    .severity(Severity.CRITICAL)
                    .message("Rule evaluation error: " + e.getMessage())
                    .source(ResultSource.RULE)
                    .evaluatedAt(Instant.now(clock))
                    .build();
        }
    }

    /**
     * Totals over all results this engine has produced since creation or the last {@link #clearHistory()}.
     * For the results of a single run use {@code ExecutionStats#rulesSummary()}.
     */
    public RulesSummary getSummary() {
        List<ValidationResult> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        return RulesSummary.of(snapshot);
    }

    public void clearHistory() {
        history.clear();
    }
}
