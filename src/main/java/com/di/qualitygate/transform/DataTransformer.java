package com.di.qualitygate.transform;

import com.di.qualitygate.exception.TransformationException;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.profile.Statistics;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cleans and enriches a dataset in five fixed stages:
 * <pre>
 *   NULL_HANDLING ─► DEDUPLICATION ─► DATE_STANDARDIZATION ─► DERIVED_COLUMNS ─► BUSINESS_RULES
 * </pre>
 * Each stage returns a new dataset; the input is never modified. Later stages can expose work for
 * earlier ones (an unparsable date nulled in a required column, two date spellings collapsing into
 * one row), so the sequence repeats until a pass changes nothing. The output is therefore a fixed
 * point: running the transformer again on it with the same spec changes nothing.
 */
@Slf4j
public class DataTransformer {

    static final int MAX_PASSES = 5;

    /**
     * Runs every enabled stage of {@code spec} in order, repeating the sequence until it settles.
     * Stage statistics are totals over all passes.
     *
     * @throws TransformationException naming the failing stage
     */
    public TransformResult transform(Dataset input, TableTransformSpec spec) {
        String table = spec.getTable();
        Map<TransformStage, StageStats> totals = new EnumMap<>(TransformStage.class);
        Dataset current = input;
        int pass = 0;
        boolean changed;
        do {
            pass++;
            changed = false;
            for (TransformStage stage : TransformStage.values()) {
                if (!spec.isEnabled(stage)) {
                    totals.putIfAbsent(stage, StageStats.skipped(stage));
                    continue;
                }
                StageOutput out;
                try {
                    out = runStage(stage, current, spec);
                } catch (TransformationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new TransformationException(table, stage, e.getMessage(), e);
                }
                totals.merge(stage, out.stats(), StageStats::plus);
                current = out.dataset();
                if (out.stats().changedAnything()) {
                    changed = true;
                    log.info("[TRANSFORM] table={} | pass={} | stage={} | modified={} | dropped={} | nulled={} | rows={}",
                            table, pass, stage, out.stats().rowsModified(), out.stats().rowsDropped(),
                            out.stats().valuesNulled(), current.rowCount());
                }
            }
        } while (changed && pass < MAX_PASSES);
        if (changed) {
            log.warn("[TRANSFORM] table={} | still changing after {} passes; output may not be final", table, pass);
        }
        TransformResult result = new TransformResult(current, new ArrayList<>(totals.values()));
        log.info("[TRANSFORM] table={} | rows in={} | rows out={} | dropped={} | passes={}",
                table, input.rowCount(), current.rowCount(), result.rowsDropped(), pass);
        return result;
    }

    private StageOutput runStage(TransformStage stage, Dataset dataset, TableTransformSpec spec) {
        switch (stage) {
            case NULL_HANDLING:
                return cleanNulls(dataset, spec);
            case DEDUPLICATION:
                return removeDuplicates(dataset, spec.getTable(), spec.getDedupKeys(), spec.getKeep());
            case DATE_STANDARDIZATION:
                return standardizeDates(dataset, spec.getTable(), spec.getDateColumns());
            case DERIVED_COLUMNS:
                return addDerivedColumns(dataset, spec.getTable(), spec.getDerivedColumns());
            case BUSINESS_RULES:
                return applyBusinessRules(dataset, spec.getTable(), spec.getBusinessRules(), spec.getDerivedColumns());
            default:
                throw new IllegalStateException("Unknown transform stage " + stage);
        }
    }

    // ============================================================================
    // Null handling
    // ============================================================================

    /**
     * Drops rows first (every DROP_ROW column), then fills the remaining nulls column by column,
     * so fill statistics are computed over the rows that survive.
     */
    public StageOutput cleanNulls(Dataset dataset, TableTransformSpec spec) {
        for (String configured : spec.getNullStrategies().keySet()) {
            requireColumn(dataset, spec.getTable(), TransformStage.NULL_HANDLING, configured);
        }
        Map<String, NullHandling> resolved = new LinkedHashMap<>();
        for (Column column : dataset.columns()) {
            resolved.put(column.name(), resolveNullHandling(column, spec));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        long dropped = 0;
        for (Map<String, Object> row : dataset.rows()) {
            boolean drop = resolved.entrySet().stream()
                    .anyMatch(e -> e.getValue().strategy() == NullStrategy.DROP_ROW && row.get(e.getKey()) == null);
            if (drop) {
                dropped++;
            } else {
                rows.add(new LinkedHashMap<>(row));
            }
        }

        boolean[] modified = new boolean[rows.size()];
        for (Column column : dataset.columns()) {
            NullHandling handling = resolved.get(column.name());
            switch (handling.strategy()) {
                case NONE:
                case DROP_ROW:
                    break;
                case FORWARD_FILL:
                    forwardFill(rows, column.name(), modified);
                    break;
                default:
                    Object fill = fillValue(rows, column, handling, spec.getTable());
                    if (fill != null) {
                        fillNulls(rows, column.name(), fill, modified);
                    }
            }
        }
        return new StageOutput(dataset.withRows(rows),
                new StageStats(TransformStage.NULL_HANDLING, count(modified), dropped, 0));
    }

    private static NullHandling resolveNullHandling(Column column, TableTransformSpec spec) {
        NullHandling explicit = spec.getNullStrategies().get(column.name());
        if (explicit != null) {
            return explicit;
        }
        if (!column.nullable()) {
            return NullHandling.of(NullStrategy.DROP_ROW);
        }
        return NullHandling.of(spec.getDefaultNullStrategy());
    }

    private Object fillValue(List<Map<String, Object>> rows, Column column, NullHandling handling, String table) {
        String name = column.name();
        switch (handling.strategy()) {
            case FILL_CONSTANT:
                return TypeConverter.normalize(handling.fillValue(), column.type());
            case FILL_MEAN:
            case FILL_MEDIAN: {
                if (!column.type().isNumeric()) {
                    throw new TransformationException(table, TransformStage.NULL_HANDLING,
                            handling.strategy() + " requires a numeric column, '" + name + "' is " + column.type());
                }
                double[] values = numericValues(rows, name);
                Double stat = handling.strategy() == NullStrategy.FILL_MEAN
                        ? Statistics.mean(values) : Statistics.median(values);
                if (stat == null) {
                    log.warn("[TRANSFORM] table={} | column={} has no values to compute {} from; nulls kept",
                            table, name, handling.strategy());
                    return null;
                }
                return TypeConverter.fromDouble(stat, column.type());
            }
            case FILL_MODE:
                return mode(rows, name).orElse(null);
            default:
                return null;
        }
    }

    private static void fillNulls(List<Map<String, Object>> rows, String column, Object fill, boolean[] modified) {
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            if (row.get(column) == null) {
                row.put(column, fill);
                modified[i] = true;
            }
        }
    }

    private static void forwardFill(List<Map<String, Object>> rows, String column, boolean[] modified) {
        Object last = null;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            Object value = row.get(column);
            if (value != null) {
                last = value;
            } else if (last != null) {
                row.put(column, last);
                modified[i] = true;
            }
        }
    }

    /** Most frequent non-null value; ties go to the value seen first. */
    private static Optional<Object> mode(List<Map<String, Object>> rows, String column) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value != null) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static double[] numericValues(List<Map<String, Object>> rows, String column) {
        return rows.stream()
                .map(r -> TypeConverter.toDouble(r.get(column)))
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    // ============================================================================
    // Deduplication
    // ============================================================================

    /**
     * Removes duplicate rows by {@code keys} (the whole row when empty), keeping the first or last
     * occurrence. Surviving rows keep their original relative order.
     */
    public StageOutput removeDuplicates(Dataset dataset, String table, List<String> keys, DuplicateKeep keep) {
        List<String> keyColumns = keys == null || keys.isEmpty() ? dataset.columnNames() : keys;
        for (String key : keyColumns) {
            requireColumn(dataset, table, TransformStage.DEDUPLICATION, key);
        }
        List<Map<String, Object>> source = dataset.rows();
        Map<List<Object>, Integer> chosen = new HashMap<>();
        for (int i = 0; i < source.size(); i++) {
            List<Object> key = keyOf(source.get(i), keyColumns);
            if (keep == DuplicateKeep.LAST || !chosen.containsKey(key)) {
                chosen.put(key, i);
            }
        }
        Set<Integer> survivors = new HashSet<>(chosen.values());
        List<Map<String, Object>> rows = new ArrayList<>(survivors.size());
        for (int i = 0; i < source.size(); i++) {
            if (survivors.contains(i)) {
                rows.add(source.get(i));
            }
        }
        long dropped = source.size() - rows.size();
        return new StageOutput(dataset.withRows(rows),
                new StageStats(TransformStage.DEDUPLICATION, 0, dropped, 0));
    }

    /** Row key with numbers compared by value, so 1, 1L and 1.00 collide. */
    static List<Object> keyOf(Map<String, Object> row, List<String> columns) {
        List<Object> key = new ArrayList<>(columns.size());
        for (String column : columns) {
            key.add(TypeConverter.valueKey(row.get(column)));
        }
        return key;
    }

    // ============================================================================
    // Date standardization
    // ============================================================================

    /**
     * Converts date columns to their canonical value class: {@code LocalDateTime} for TIMESTAMP
     * columns, {@code LocalDate} otherwise (string columns become DATE columns). Unparsable values
     * become null and are counted.
     *
     * @param dateColumns columns to standardize, or {@code null} to detect them
     */
    public StageOutput standardizeDates(Dataset dataset, String table, List<String> dateColumns) {
        List<String> targets = dateColumns != null ? dateColumns : detectDateColumns(dataset);
        for (String column : targets) {
            requireColumn(dataset, table, TransformStage.DATE_STANDARDIZATION, column);
        }
        if (targets.isEmpty()) {
            return new StageOutput(dataset, StageStats.skipped(TransformStage.DATE_STANDARDIZATION));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        dataset.rows().forEach(r -> rows.add(new LinkedHashMap<>(r)));
        boolean[] modified = new boolean[rows.size()];
        long nulled = 0;
        List<Column> columns = new ArrayList<>(dataset.columns());

        for (String name : targets) {
            Column column = dataset.column(name).orElseThrow();
            boolean timestamp = column.type() == ColumnType.TIMESTAMP;
            for (int i = 0; i < rows.size(); i++) {
                Map<String, Object> row = rows.get(i);
                Object value = row.get(name);
                if (value == null) {
                    continue;
                }
                Optional<?> parsed = timestamp
                        ? DateFormatUtils.toLocalDateTime(value)
                        : DateFormatUtils.toLocalDate(value);
                if (parsed.isEmpty()) {
                    row.put(name, null);
                    nulled++;
                    modified[i] = true;
                } else if (!parsed.get().equals(value)) {
                    row.put(name, parsed.get());
                    modified[i] = true;
                }
            }
            if (!timestamp && column.type() != ColumnType.DATE) {
                columns.set(columns.indexOf(column), new Column(name, ColumnType.DATE, column.nullable()));
            }
        }
        if (nulled > 0) {
            log.warn("[TRANSFORM] table={} | {} unparsable date value(s) set to null", table, nulled);
        }
        return new StageOutput(dataset.withColumns(columns, rows),
                new StageStats(TransformStage.DATE_STANDARDIZATION, count(modified), 0, nulled));
    }

    private static List<String> detectDateColumns(Dataset dataset) {
        List<String> detected = new ArrayList<>();
        for (Column column : dataset.columns()) {
            boolean namedLikeDate = column.type() == ColumnType.STRING
                    && column.name().toLowerCase(Locale.ROOT).contains("date");
            if (column.type().isTemporal() || namedLikeDate) {
                detected.add(column.name());
            }
        }
        return detected;
    }

    // ============================================================================
    // Derived columns
    // ============================================================================

    /**
     * Appends computed columns. A column that already exists is accepted only when recomputing it
     * yields exactly the stored values; otherwise the configuration is rejected.
     */
    public StageOutput addDerivedColumns(Dataset dataset, String table, List<DerivedColumn> derived) {
        if (derived == null || derived.isEmpty()) {
            return new StageOutput(dataset, StageStats.skipped(TransformStage.DERIVED_COLUMNS));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        dataset.rows().forEach(r -> rows.add(new LinkedHashMap<>(r)));
        List<Column> columns = new ArrayList<>(dataset.columns());
        boolean[] modified = new boolean[rows.size()];

        for (DerivedColumn dc : derived) {
            boolean exists = columns.stream().anyMatch(c -> c.name().equals(dc.name()));
            List<Object> computed = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                computed.add(TypeConverter.normalize(dc.function().apply(row), dc.type()));
            }
            if (exists) {
                for (int i = 0; i < rows.size(); i++) {
                    if (!sameValue(rows.get(i).get(dc.name()), computed.get(i))) {
                        throw new TransformationException(table, TransformStage.DERIVED_COLUMNS,
                                "Derived column '" + dc.name() + "' already exists with different values (row " + i + ")");
                    }
                }
                log.debug("[TRANSFORM] table={} | derived column {} already present and current", table, dc.name());
                continue;
            }
            columns.add(Column.of(dc.name(), dc.type()));
            for (int i = 0; i < rows.size(); i++) {
                rows.get(i).put(dc.name(), computed.get(i));
                modified[i] = true;
            }
        }
        return new StageOutput(dataset.withColumns(columns, rows),
                new StageStats(TransformStage.DERIVED_COLUMNS, count(modified), 0, 0));
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            BigDecimal x = TypeConverter.asBigDecimal(a);
            BigDecimal y = TypeConverter.asBigDecimal(b);
            return x != null && y != null && x.compareTo(y) == 0;
        }
        return Objects.equals(a, b);
    }

    // ============================================================================
    // Business rules
    // ============================================================================

    public StageOutput applyBusinessRules(Dataset dataset, String table, List<BusinessRuleTransform> rules) {
        return applyBusinessRules(dataset, table, rules, List.of());
    }

    /**
     * Applies filters and clamps in list order. Rules naming a column the dataset lacks are skipped with a warning.
     * Clamped rows get {@code derived} recomputed so derived values always match the final inputs.
     */
    public StageOutput applyBusinessRules(Dataset dataset, String table, List<BusinessRuleTransform> rules,
                                          List<DerivedColumn> derived) {
        if (rules == null || rules.isEmpty()) {
            return new StageOutput(dataset, StageStats.skipped(TransformStage.BUSINESS_RULES));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        dataset.rows().forEach(r -> rows.add(new LinkedHashMap<>(r)));
        Set<Map<String, Object>> touched = Collections.newSetFromMap(new IdentityHashMap<>());
        long dropped = 0;

        for (BusinessRuleTransform rule : rules) {
            Optional<Column> column = dataset.column(rule.column());
            if (column.isEmpty()) {
                log.warn("[TRANSFORM] table={} | business rule {} skipped: column {} not present",
                        table, rule.name(), rule.column());
                continue;
            }
            if (rule.action() == BusinessRuleTransform.Action.FILTER) {
                int before = rows.size();
                rows.removeIf(row -> !rule.keeps(row.get(rule.column())));
                long removed = before - rows.size();
                dropped += removed;
                if (removed > 0) {
                    log.info("[TRANSFORM] table={} | rule={} dropped {} row(s)", table, rule.name(), removed);
                }
            } else {
                Object clampTo = TypeConverter.normalize(rule.bound(), column.get().type());
                for (Map<String, Object> row : rows) {
                    if (rule.needsClamp(row.get(rule.column()))) {
                        row.put(rule.column(), clampTo);
                        touched.add(row);
                    }
                }
            }
        }
        if (derived != null && !touched.isEmpty()) {
            for (DerivedColumn dc : derived) {
                if (!dataset.hasColumn(dc.name())) {
                    continue;
                }
                for (Map<String, Object> row : touched) {
                    row.put(dc.name(), TypeConverter.normalize(dc.function().apply(row), dc.type()));
                }
            }
        }
        long modified = rows.stream().filter(touched::contains).count();
        return new StageOutput(dataset.withRows(rows),
                new StageStats(TransformStage.BUSINESS_RULES, modified, dropped, 0));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private static void requireColumn(Dataset dataset, String table, TransformStage stage, String column) {
        if (!dataset.hasColumn(column)) {
            throw new TransformationException(table, stage, "Unknown column '" + column + "'");
        }
    }

    private static long count(boolean[] flags) {
        long n = 0;
        for (boolean f : flags) {
            if (f) {
                n++;
            }
        }
        return n;
    }
}
