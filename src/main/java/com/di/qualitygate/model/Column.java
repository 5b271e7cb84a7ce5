package com.di.qualitygate.model;

import java.util.Objects;

/**
 * Column descriptor: name, logical type and whether nulls are declared acceptable.
 */
public record Column(String name, ColumnType type, boolean nullable) {

    public Column {
        Objects.requireNonNull(name, "column name");
        Objects.requireNonNull(type, "column type");
    }

    public static Column of(String name, ColumnType type) {
        return new Column(name, type, true);
    }

    public static Column required(String name, ColumnType type) {
        return new Column(name, type, false);
    }
}
