package com.di.qualitygate.extract;

import com.di.qualitygate.util.InputValidator;

import java.util.List;
import java.util.Objects;

/**
 * A bound predicate on one column. Values are always passed as JDBC parameters; only the column
 * name reaches the SQL text, after identifier validation.
 */
public record TableFilter(String column, Operator operator, Object value, Object upperValue) {

    public enum Operator {
        EQ("="), NE("<>"), GT(">"), GE(">="), LT("<"), LE("<="), BETWEEN("BETWEEN");

        private final String sql;

        Operator(String sql) {
            this.sql = sql;
        }
    }

    public TableFilter {
        column = InputValidator.validateColumnName(column);
        Objects.requireNonNull(operator, "operator");
        if (value == null) {
            throw new IllegalArgumentException("Filter value for column " + column + " must not be null");
        }
        if (operator == Operator.BETWEEN && upperValue == null) {
            throw new IllegalArgumentException("BETWEEN filter on " + column + " needs an upper bound");
        }
    }

    public static TableFilter eq(String column, Object value) {
        return new TableFilter(column, Operator.EQ, value, null);
    }

    public static TableFilter of(String column, Operator operator, Object value) {
        return new TableFilter(column, operator, value, null);
    }

    /** Inclusive range, typically a date window such as {@code sale_date BETWEEN start AND end}. */
    public static TableFilter between(String column, Object from, Object to) {
        return new TableFilter(column, Operator.BETWEEN, from, to);
    }

    String toSql() {
        if (operator == Operator.BETWEEN) {
            return column + " BETWEEN ? AND ?";
        }
        return column + " " + operator.sql + " ?";
    }

    List<Object> parameters() {
        return operator == Operator.BETWEEN ? List.of(value, upperValue) : List.of(value);
    }
}
