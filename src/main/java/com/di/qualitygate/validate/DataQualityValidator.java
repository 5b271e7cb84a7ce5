package com.di.qualitygate.validate;

import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.ResultSource;
import com.di.qualitygate.model.Severity;
import com.di.qualitygate.model.ValidationResult;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in structural checks that run before the rule engine.
 * <p>
 * Checks and severities:
 * <ul>
 *   <li>required columns present: CRITICAL</li>
 *   <li>per-column null rate within the null threshold: WARNING</li>
 *   <li>non-null values conform to the declared column type: CRITICAL</li>
 *   <li>primary key values unique: CRITICAL</li>
 *   <li>full-row duplicate rate within the duplicate threshold: WARNING</li>
 *   <li>foreign key values present in the parent id set: CRITICAL, skipped without a parent set</li>
 * </ul>
 * Result names start with {@code builtin_} so they never clash with rule names.
 */
@Slf4j
public class DataQualityValidator {

    private final double nullThreshold;
    private final double duplicateThreshold;
    private final Clock clock;

    public DataQualityValidator(double nullThreshold, double duplicateThreshold, Clock clock) {
        if (nullThreshold < 0 || nullThreshold > 1 || duplicateThreshold < 0 || duplicateThreshold > 1) {
            throw new IllegalArgumentException("Thresholds must be fractions between 0 and 1");
        }
        this.nullThreshold = nullThreshold;
        this.duplicateThreshold = duplicateThreshold;
        this.clock = clock;
    }

    public DataQualityValidator(double nullThreshold, double duplicateThreshold) {
        this(nullThreshold, duplicateThreshold, Clock.systemDefaultZone());
    }

    public DataQualityReport validateTable(Dataset dataset, String table) {
        return validateTable(dataset, table, StandardValidationSpecs.forTable(table), ReferenceData.empty());
    }

    public DataQualityReport validateTable(Dataset dataset, String table, TableValidationSpec spec,
                                           ReferenceData referenceData) {
        Instant now = Instant.now(clock);
        long total = dataset.rowCount();
        List<ValidationResult> results = new ArrayList<>();
        List<String> issues = new ArrayList<>();

        // Required columns
        List<String> missing = new ArrayList<>();
        for (String required : spec.getRequiredColumns()) {
            if (!dataset.hasColumn(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            issues.add("Missing required columns: " + missing);
        }
        results.add(result(table, "builtin_required_columns", missing.isEmpty(), 0, total, Severity.CRITICAL,
                missing.isEmpty() ? "PASS: all required columns present" : "FAIL: missing required columns " + missing,
                List.of(), now));

        // Null rates
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        for (Column column : dataset.columns()) {
            List<Integer> nullRows = new ArrayList<>();
            List<Object> values = dataset.columnValues(column.name());
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) == null) {
                    nullRows.add(i);
                }
            }
            nullCounts.put(column.name(), (long) nullRows.size());
            if (nullRows.isEmpty()) {
                continue;
            }
            double rate = (double) nullRows.size() / total;
            boolean passed = rate <= nullThreshold;
            if (!passed) {
                issues.add(String.format("Column %s has %.2f%% nulls (threshold %.2f%%)",
                        column.name(), rate * 100, nullThreshold * 100));
            }
            results.add(result(table, "builtin_null_rate_" + column.name(), passed, nullRows.size(), total,
                    Severity.WARNING,
                    String.format("%s: %d null values in %s (%.2f%%, threshold %.2f%%)",
                            passed ? "PASS" : "FAIL", nullRows.size(), column.name(), rate * 100, nullThreshold * 100),
                    passed ? List.of() : nullRows, now));
        }

        // Type conformance
        Map<String, Long> typeViolations = new LinkedHashMap<>();
        Set<Integer> badTypeRows = new HashSet<>();
        for (Column column : dataset.columns()) {
            long violations = 0;
            List<Object> values = dataset.columnValues(column.name());
            for (int i = 0; i < values.size(); i++) {
                if (!TypeConverter.conformsTo(values.get(i), column.type())) {
                    violations++;
                    badTypeRows.add(i);
                }
            }
            if (violations > 0) {
                typeViolations.put(column.name(), violations);
                issues.add("Column " + column.name() + " has " + violations + " values not of type " + column.type());
            }
        }
        results.add(result(table, "builtin_type_conformance", typeViolations.isEmpty(), badTypeRows.size(), total,
                Severity.CRITICAL,
                typeViolations.isEmpty() ? "PASS: all values match declared types"
                        : "FAIL: type violations " + typeViolations,
                sorted(badTypeRows), now));

        // Primary key duplicates
        List<String> pk = spec.getPrimaryKey().isEmpty() ? dataset.keyColumns() : spec.getPrimaryKey();
        long duplicateKeyCount = 0;
        if (!pk.isEmpty() && pk.stream().allMatch(dataset::hasColumn)) {
            List<Integer> dupKeyRows = repeatedRows(dataset, pk);
            duplicateKeyCount = dupKeyRows.size();
            if (duplicateKeyCount > 0) {
                issues.add("Found " + duplicateKeyCount + " duplicate key values in " + pk);
            }
            results.add(result(table, "builtin_primary_key_unique", dupKeyRows.isEmpty(), dupKeyRows.size(), total,
                    Severity.CRITICAL,
                    dupKeyRows.isEmpty() ? "PASS: key " + pk + " is unique"
                            : "FAIL: " + dupKeyRows.size() + " rows repeat key " + pk,
                    dupKeyRows, now));
        }

        // Full-row duplicates
        List<Integer> dupRows = repeatedRows(dataset, dataset.columnNames());
        double dupRate = total == 0 ? 0.0 : (double) dupRows.size() / total;
        boolean dupPassed = dupRate <= duplicateThreshold;
        if (!dupRows.isEmpty()) {
            issues.add("Found " + dupRows.size() + " duplicate rows");
        }
        results.add(result(table, "builtin_duplicate_rows", dupPassed, dupRows.size(), total, Severity.WARNING,
                String.format("%s: %d duplicate rows (%.2f%%, threshold %.2f%%)",
                        dupPassed ? "PASS" : "FAIL", dupRows.size(), dupRate * 100, duplicateThreshold * 100),
                dupPassed ? List.of() : dupRows, now));

        // Referential plausibility
        Map<String, Long> missingForeignKeys = new LinkedHashMap<>();
        for (ForeignKey fk : spec.getForeignKeys()) {
            if (!dataset.hasColumn(fk.column())) {
                continue;
            }
            if (!referenceData.has(fk)) {
                log.warn("[VALIDATE] table={} | no reference ids for {} -> {}, check skipped",
                        table, fk.column(), fk.referenceKey());
                continue;
            }
            List<Integer> orphans = new ArrayList<>();
            List<Object> values = dataset.columnValues(fk.column());
            for (int i = 0; i < values.size(); i++) {
                Object v = values.get(i);
                if (v != null && !referenceData.contains(fk, v)) {
                    orphans.add(i);
                }
            }
            missingForeignKeys.put(fk.column(), (long) orphans.size());
            if (!orphans.isEmpty()) {
                issues.add(orphans.size() + " values of " + fk.column() + " not found in " + fk.referenceKey());
            }
            results.add(result(table, "builtin_fk_" + fk.column(), orphans.isEmpty(), orphans.size(), total,
                    Severity.CRITICAL,
                    orphans.isEmpty() ? "PASS: every " + fk.column() + " exists in " + fk.referenceKey()
                            : "FAIL: " + orphans.size() + " " + fk.column() + " values missing from " + fk.referenceKey(),
                    orphans, now));
        }

        DataQualityReport report = DataQualityReport.builder()
                .table(table)
                .totalRows(total)
                .nullCounts(nullCounts)
                .duplicateRowCount(dupRows.size())
                .duplicateKeyCount(duplicateKeyCount)
                .typeViolations(typeViolations)
                .missingForeignKeys(missingForeignKeys)
                .issues(issues)
                .results(List.copyOf(results))
                .timestamp(now)
                .build();

        if (report.isValidationPassed()) {
            log.info("[VALIDATE] table={} | rows={} | checks={} | issues={} | passed",
                    table, total, results.size(), issues.size());
        } else {
            log.warn("[VALIDATE] table={} | rows={} | checks={} | issues={}", table, total, results.size(), issues);
        }
        return report;
    }

    /** Indices of rows whose values over {@code columns} repeat an earlier row. */
    static List<Integer> repeatedRows(Dataset dataset, List<String> columns) {
        Set<List<Object>> seen = new HashSet<>();
        List<Integer> repeated = new ArrayList<>();
        List<Map<String, Object>> rows = dataset.rows();
        for (int i = 0; i < rows.size(); i++) {
            List<Object> key = new ArrayList<>(columns.size());
            for (String c : columns) {
                key.add(TypeConverter.valueKey(rows.get(i).get(c)));
            }
            if (!seen.add(key)) {
                repeated.add(i);
            }
        }
        return repeated;
    }

    private static List<Integer> sorted(Set<Integer> indices) {
        List<Integer> list = new ArrayList<>(indices);
        list.sort(null);
        return list;
    }

    private static ValidationResult result(String table, String name, boolean passed, long failing, long total,
                                           Severity severity, String message, List<Integer> indices, Instant at) {
        return ValidationResult.builder()
                .ruleName(name)
                .table(table)
                .passed(passed)
                .failingRowCount(failing)
                .failingPercentage(total == 0 ? 0.0 : failing * 100.0 / total)
                .severity(severity)
                .message(message)
                .failingRowIndices(List.copyOf(indices))
                .source(ResultSource.BUILT_IN)
                .evaluatedAt(at)
                .build();
    }
}
