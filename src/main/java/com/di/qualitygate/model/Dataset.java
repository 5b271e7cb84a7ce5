package com.di.qualitygate.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory table: ordered columns plus ordered rows keyed by column name.
 * <p>
 * Instances are immutable. Every pipeline stage builds a new dataset instead of mutating the one it
 * received, so ownership moves cleanly from stage to stage. Row values may be {@code null}.
 */
public final class Dataset {

    private final List<Column> columns;
    private final List<Map<String, Object>> rows;
    private final List<String> keyColumns;

    public Dataset(List<Column> columns, List<? extends Map<String, Object>> rows, List<String> keyColumns) {
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
        this.keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
    }

    public static Dataset of(List<Column> columns, List<? extends Map<String, Object>> rows) {
        return new Dataset(columns, rows, List.of());
    }

    public static Dataset empty(List<Column> columns) {
        return new Dataset(columns, List.of(), List.of());
    }

    public List<Column> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public List<String> keyColumns() {
        return keyColumns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).collect(Collectors.toList());
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    public Optional<Column> column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /** Values of one column in row order (nulls included). */
    public List<Object> columnValues(String name) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    public Dataset withRows(List<? extends Map<String, Object>> newRows) {
        return new Dataset(columns, newRows, keyColumns);
    }

    public Dataset withColumns(List<Column> newColumns, List<? extends Map<String, Object>> newRows) {
        return new Dataset(newColumns, newRows, keyColumns);
    }

    public Dataset withKeyColumns(List<String> keys) {
        return new Dataset(columns, rows, keys);
    }

    /**
     * Human-readable identifier of a row: key column values when keys are declared, otherwise {@code row#<index>}.
     */
    public String rowIdentifier(int index) {
        if (keyColumns.isEmpty()) {
            return "row#" + index;
        }
        Map<String, Object> row = rows.get(index);
        return keyColumns.stream()
                .map(k -> k + "=" + row.get(k))
                .collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows) && keyColumns.equals(other.keyColumns);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columnNames() + ", rows=" + rows.size() + "}";
    }
}
