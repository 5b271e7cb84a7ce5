package com.di.qualitygate.transform;

import com.di.qualitygate.util.TypeConverter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A domain rule applied as a transform, after derived columns.
 * <ul>
 *   <li>{@link Action#FILTER} drops rows whose value is below the bound (or equal to it when strict).</li>
 *   <li>{@link Action#CLAMP_MIN} raises values below the bound to the bound.</li>
 * </ul>
 * Nulls are never dropped or clamped; missing values are the business of null handling and validation.
 */
public record BusinessRuleTransform(String name, Action action, String column, BigDecimal bound, boolean strict) {

    public enum Action {
        FILTER,
        CLAMP_MIN
    }

    public BusinessRuleTransform {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(bound, "bound");
    }

    /** Keeps rows with {@code column > 0}. */
    public static BusinessRuleTransform requirePositive(String column) {
        return new BusinessRuleTransform(column + "_positive", Action.FILTER, column, BigDecimal.ZERO, true);
    }

    /** Sets {@code column} to {@code min} wherever it is lower. */
    public static BusinessRuleTransform clampMin(String column, long min) {
        return new BusinessRuleTransform(column + "_min_" + min, Action.CLAMP_MIN, column, BigDecimal.valueOf(min), false);
    }

    /** For FILTER rules: whether the row value is kept. Null and non-numeric values are kept. */
    boolean keeps(Object value) {
        BigDecimal v = TypeConverter.asBigDecimal(value);
        if (v == null) {
            return true;
        }
        int cmp = v.compareTo(bound);
        return strict ? cmp > 0 : cmp >= 0;
    }

    /** For CLAMP_MIN rules: whether the value must be raised to the bound. */
    boolean needsClamp(Object value) {
        BigDecimal v = TypeConverter.asBigDecimal(value);
        return v != null && v.compareTo(bound) < 0;
    }
}
