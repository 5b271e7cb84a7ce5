package com.di.qualitygate.rules;

import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The closed family of rule checks.
 * <p>
 * Null semantics: range, comparison and consistency checks treat a row with a null operand as
 * passing. Missing values are reported by completeness rules and the built-in null-rate check.
 */
public final class RuleChecks {

    private RuleChecks() {
    }

    public enum Op {
        GT(">"), GE(">="), LT("<"), LE("<="), EQ("=="), NE("!=");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        boolean test(int cmp) {
            switch (this) {
                case GT:
                    return cmp > 0;
                case GE:
                    return cmp >= 0;
                case LT:
                    return cmp < 0;
                case LE:
                    return cmp <= 0;
                case EQ:
                    return cmp == 0;
                case NE:
                default:
                    return cmp != 0;
            }
        }
    }

    // ============================================================================
    // Factories
    // ============================================================================

    public static RuleCheck unique(String... columns) {
        return new Uniqueness(List.of(columns));
    }

    public static RuleCheck completeness(String column, double maxNullFraction) {
        return new Completeness(column, maxNullFraction);
    }

    /** Inclusive range; either bound may be null for an open side. */
    public static RuleCheck range(String column, Number min, Number max) {
        return new Range(column, toDecimal(min), true, toDecimal(max), true);
    }

    public static RuleCheck greaterThan(String column, Number bound) {
        return new Range(column, toDecimal(bound), false, null, true);
    }

    public static RuleCheck atLeast(String column, Number bound) {
        return new Range(column, toDecimal(bound), true, null, true);
    }

    /** Cross-column comparison: {@code left op right}. */
    public static RuleCheck compare(String left, Op op, String right) {
        return new Comparison(left, op, right);
    }

    /** {@code result ≈ factorA × factorB} within a relative tolerance. */
    public static RuleCheck product(String result, String factorA, String factorB, double relativeTolerance) {
        return new ProductConsistency(result, factorA, factorB, relativeTolerance);
    }

    public static RuleCheck notInFuture(String column, Clock clock) {
        return new NotInFuture(column, clock);
    }

    /** Opaque row predicate. Prefer a structured check when one fits. */
    public static RuleCheck predicate(String description, List<String> columns, Predicate<Map<String, Object>> predicate) {
        return new RowPredicate(description, columns, predicate);
    }

    // ============================================================================
    // Implementations
    // ============================================================================

    /** Every occurrence after the first of a key value fails. */
    static final class Uniqueness implements RuleCheck {
        private final List<String> columns;

        Uniqueness(List<String> columns) {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Uniqueness check needs at least one column");
            }
            this.columns = List.copyOf(columns);
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            columns.forEach(c -> requireColumn(dataset, c));
            boolean[] mask = new boolean[dataset.rowCount()];
            Set<List<Object>> seen = new HashSet<>();
            List<Map<String, Object>> rows = dataset.rows();
            for (int i = 0; i < rows.size(); i++) {
                List<Object> key = new ArrayList<>(columns.size());
                for (String c : columns) {
                    key.add(TypeConverter.valueKey(rows.get(i).get(c)));
                }
                mask[i] = seen.add(key);
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return columns;
        }

        @Override
        public String describe() {
            return "unique(" + String.join(", ", columns) + ")";
        }
    }

    /** Row flags mark null values; the rule passes while the null fraction stays within the threshold. */
    static final class Completeness implements RuleCheck {
        private final String column;
        private final double maxNullFraction;

        Completeness(String column, double maxNullFraction) {
            this.column = column;
            this.maxNullFraction = maxNullFraction;
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            requireColumn(dataset, column);
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                mask[i] = dataset.rows().get(i).get(column) != null;
            }
            return mask;
        }

        @Override
        public boolean passes(boolean[] mask) {
            if (mask.length == 0) {
                return true;
            }
            long nulls = 0;
            for (boolean ok : mask) {
                if (!ok) {
                    nulls++;
                }
            }
            return (double) nulls / mask.length <= maxNullFraction;
        }

        @Override
        public List<String> columns() {
            return List.of(column);
        }

        @Override
        public String describe() {
            return String.format("null fraction of %s <= %.4f", column, maxNullFraction);
        }
    }

    static final class Range implements RuleCheck {
        private final String column;
        private final BigDecimal min;
        private final boolean minInclusive;
        private final BigDecimal max;
        private final boolean maxInclusive;

        Range(String column, BigDecimal min, boolean minInclusive, BigDecimal max, boolean maxInclusive) {
            this.column = column;
            this.min = min;
            this.minInclusive = minInclusive;
            this.max = max;
            this.maxInclusive = maxInclusive;
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            requireColumn(dataset, column);
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                Object raw = dataset.rows().get(i).get(column);
                if (raw == null) {
                    mask[i] = true;
                    continue;
                }
                BigDecimal v = TypeConverter.asBigDecimal(raw);
                if (v == null) {
                    throw new IllegalArgumentException("Non-numeric value '" + raw + "' in column " + column);
                }
                boolean ok = true;
                if (min != null) {
                    int cmp = v.compareTo(min);
                    ok = minInclusive ? cmp >= 0 : cmp > 0;
                }
                if (ok && max != null) {
                    int cmp = v.compareTo(max);
                    ok = maxInclusive ? cmp <= 0 : cmp < 0;
                }
                mask[i] = ok;
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return List.of(column);
        }

        @Override
        public String describe() {
            StringBuilder sb = new StringBuilder(column);
            if (min != null && max != null) {
                sb.append(" in ").append(minInclusive ? '[' : '(').append(min.toPlainString()).append(", ")
                        .append(max.toPlainString()).append(maxInclusive ? ']' : ')');
            } else if (min != null) {
                sb.append(minInclusive ? " >= " : " > ").append(min.toPlainString());
            } else if (max != null) {
                sb.append(maxInclusive ? " <= " : " < ").append(max.toPlainString());
            }
            return sb.toString();
        }
    }

    static final class Comparison implements RuleCheck {
        private final String left;
        private final Op op;
        private final String right;

        Comparison(String left, Op op, String right) {
            this.left = left;
            this.op = Objects.requireNonNull(op);
            this.right = right;
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            requireColumn(dataset, left);
            requireColumn(dataset, right);
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                Map<String, Object> row = dataset.rows().get(i);
                Object a = row.get(left);
                Object b = row.get(right);
                mask[i] = a == null || b == null || op.test(compareValues(a, b));
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return List.of(left, right);
        }

        @Override
        public String describe() {
            return left + " " + op.symbol + " " + right;
        }
    }

    static final class ProductConsistency implements RuleCheck {
        private static final BigDecimal ABSOLUTE_SLACK = new BigDecimal("0.01");

        private final String result;
        private final String factorA;
        private final String factorB;
        private final BigDecimal relativeTolerance;

        ProductConsistency(String result, String factorA, String factorB, double relativeTolerance) {
            this.result = result;
            this.factorA = factorA;
            this.factorB = factorB;
            this.relativeTolerance = BigDecimal.valueOf(relativeTolerance);
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            requireColumn(dataset, result);
            requireColumn(dataset, factorA);
            requireColumn(dataset, factorB);
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                Map<String, Object> row = dataset.rows().get(i);
                BigDecimal r = TypeConverter.asBigDecimal(row.get(result));
                BigDecimal a = TypeConverter.asBigDecimal(row.get(factorA));
                BigDecimal b = TypeConverter.asBigDecimal(row.get(factorB));
                if (r == null || a == null || b == null) {
                    mask[i] = true;
                    continue;
                }
                BigDecimal expected = a.multiply(b);
                BigDecimal allowed = expected.abs().max(r.abs()).multiply(relativeTolerance).add(ABSOLUTE_SLACK);
                mask[i] = r.subtract(expected).abs().compareTo(allowed) <= 0;
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return List.of(result, factorA, factorB);
        }

        @Override
        public String describe() {
            return result + " ≈ " + factorA + " × " + factorB + " (±" + relativeTolerance.movePointRight(2).stripTrailingZeros().toPlainString() + "%)";
        }
    }

    static final class NotInFuture implements RuleCheck {
        private final String column;
        private final Clock clock;

        NotInFuture(String column, Clock clock) {
            this.column = column;
            this.clock = Objects.requireNonNull(clock);
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            requireColumn(dataset, column);
            LocalDate today = LocalDate.now(clock);
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                Object raw = dataset.rows().get(i).get(column);
                Optional<LocalDate> date = DateFormatUtils.toLocalDate(raw);
                mask[i] = raw == null || date.map(d -> !d.isAfter(today)).orElseThrow(
                        () -> new IllegalArgumentException("Unparsable date '" + raw + "' in column " + column));
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return List.of(column);
        }

        @Override
        public String describe() {
            return column + " <= today";
        }
    }

    static final class RowPredicate implements RuleCheck {
        private final String description;
        private final List<String> columns;
        private final Predicate<Map<String, Object>> predicate;

        RowPredicate(String description, List<String> columns, Predicate<Map<String, Object>> predicate) {
            this.description = description;
            this.columns = List.copyOf(columns);
            this.predicate = Objects.requireNonNull(predicate);
        }

        @Override
        public boolean[] evaluate(Dataset dataset) {
            columns.forEach(c -> requireColumn(dataset, c));
            boolean[] mask = new boolean[dataset.rowCount()];
            for (int i = 0; i < mask.length; i++) {
                mask[i] = predicate.test(dataset.rows().get(i));
            }
            return mask;
        }

        @Override
        public List<String> columns() {
            return columns;
        }

        @Override
        public String describe() {
            return description;
        }
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private static void requireColumn(Dataset dataset, String column) {
        if (!dataset.hasColumn(column)) {
            throw new IllegalArgumentException("Column '" + column + "' not found");
        }
    }

    private static BigDecimal toDecimal(Number n) {
        return n == null ? null : TypeConverter.asBigDecimal(n);
    }

    /**
     * Orders two values: numerically when both are numbers, chronologically when both are dates or
     * date-times, otherwise by natural order of same-class values.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object a, Object b) {
        BigDecimal na = a instanceof Number ? TypeConverter.asBigDecimal(a) : null;
        BigDecimal nb = b instanceof Number ? TypeConverter.asBigDecimal(b) : null;
        if (na != null && nb != null) {
            return na.compareTo(nb);
        }
        if (isTemporal(a) || isTemporal(b)) {
            LocalDateTime ta = DateFormatUtils.toLocalDateTime(a).orElseThrow(
                    () -> new IllegalArgumentException("Not a date: " + a));
            LocalDateTime tb = DateFormatUtils.toLocalDateTime(b).orElseThrow(
                    () -> new IllegalArgumentException("Not a date: " + b));
            return ta.compareTo(tb);
        }
        if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
            return ca.compareTo(b);
        }
        throw new IllegalArgumentException("Cannot compare " + a.getClass().getSimpleName()
                + " with " + b.getClass().getSimpleName());
    }

    private static boolean isTemporal(Object v) {
        return v instanceof LocalDate || v instanceof LocalDateTime || v instanceof java.util.Date;
    }
}
