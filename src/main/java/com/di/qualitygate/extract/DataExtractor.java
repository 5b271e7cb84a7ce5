package com.di.qualitygate.extract;

import com.di.qualitygate.connection.ConnectionManager;
import com.di.qualitygate.exception.ConnectionFailureException;
import com.di.qualitygate.exception.ExtractionException;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.util.InputValidator;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterUtils;
import org.springframework.jdbc.core.namedparam.ParsedSql;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reads tables and ad-hoc queries into {@link Dataset}s.
 * <p>
 * Extraction is all-or-nothing: rows are buffered and the dataset is only returned once the whole
 * result set was read and normalized. Column names are lower-cased so datasets look the same
 * whatever case the driver reports.
 */
@Slf4j
public class DataExtractor {

    private final ConnectionManager connectionManager;

    public DataExtractor(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public Dataset extractTable(String tableName, TableFilter... filters) {
        return extractTable(tableName, Arrays.asList(filters));
    }

    /**
     * Reads a whole table, optionally restricted by filters joined with AND.
     * The table's primary key (when the driver reports one) becomes the dataset's key columns.
     *
     * @throws ExtractionException if the table cannot be read
     * @throws IllegalArgumentException for an invalid table or column name
     */
    public Dataset extractTable(String tableName, List<TableFilter> filters) {
        String table = InputValidator.validateTableName(tableName);
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table);
        List<Object> params = new ArrayList<>();
        if (filters != null && !filters.isEmpty()) {
            sql.append(" WHERE ")
                    .append(filters.stream().map(TableFilter::toSql).collect(Collectors.joining(" AND ")));
            filters.forEach(f -> params.addAll(f.parameters()));
        }
        long start = System.currentTimeMillis();
        try {
            Dataset dataset = connectionManager.execute(conn -> {
                Dataset read = runQuery(conn, sql.toString(), params.toArray());
                return read.withKeyColumns(primaryKeyColumns(conn, table, read));
            });
            log.info("[EXTRACT] table={} | filters={} | rows={} | columns={} | {} ms",
                    table, filters == null ? 0 : filters.size(), dataset.rowCount(),
                    dataset.columns().size(), System.currentTimeMillis() - start);
            return dataset;
        } catch (SQLException | ConnectionFailureException e) {
            log.error("[EXTRACT] Failed to extract table {}: {}", table, e.getMessage());
            throw new ExtractionException(table, "Failed to extract table " + table + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException(table, "Unreadable value in table " + table + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs a read-only query (SELECT or WITH) with optional {@code :name} parameters.
     *
     * @param sql    the query; named parameters are bound, never interpolated
     * @param params parameter values by name, may be {@code null}
     * @throws IllegalArgumentException if the statement is not read-only
     * @throws ExtractionException      if the query fails
     */
    public Dataset extractQuery(String sql, Map<String, ?> params) {
        String query = InputValidator.validateReadOnlyQuery(sql);
        ParsedSql parsed = NamedParameterUtils.parseSqlStatement(query);
        MapSqlParameterSource source = new MapSqlParameterSource(params == null ? Map.of() : params);
        String jdbcSql = NamedParameterUtils.substituteNamedParameters(parsed, source);
        Object[] args = NamedParameterUtils.buildValueArray(parsed, source, null);
        long start = System.currentTimeMillis();
        try {
            Dataset dataset = connectionManager.execute(conn -> runQuery(conn, jdbcSql, args));
            log.info("[EXTRACT] query | params={} | rows={} | {} ms",
                    source.getParameterNames().length, dataset.rowCount(), System.currentTimeMillis() - start);
            return dataset;
        } catch (SQLException | ConnectionFailureException e) {
            log.error("[EXTRACT] Query failed: {}", e.getMessage());
            throw new ExtractionException(null, "Query failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException(null, "Unreadable value in query result: " + e.getMessage(), e);
        }
    }

    /**
     * Distinct non-null values of one column, used as the parent id set for referential checks.
     */
    public Set<Object> extractReferenceIds(String tableName, String columnName) {
        String table = InputValidator.validateTableName(tableName);
        String column = InputValidator.validateColumnName(columnName);
        String sql = "SELECT DISTINCT " + column + " FROM " + table + " WHERE " + column + " IS NOT NULL";
        try {
            Dataset ids = connectionManager.execute(conn -> runQuery(conn, sql, new Object[0]));
            String key = ids.columnNames().get(0);
            Set<Object> values = new LinkedHashSet<>();
            for (Map<String, Object> row : ids.rows()) {
                values.add(row.get(key));
            }
            log.debug("[EXTRACT] reference ids {}.{} | count={}", table, column, values.size());
            return values;
        } catch (SQLException | ConnectionFailureException e) {
            throw new ExtractionException(table, "Failed to read reference ids " + table + "." + column
                    + ": " + e.getMessage(), e);
        }
    }

    private Dataset runQuery(Connection conn, String sql, Object[] params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, TypeConverter.toJdbcValue(params[i]));
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<Column> columns = readColumns(rs.getMetaData());
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columns.size(); i++) {
                        Column column = columns.get(i);
                        row.put(column.name(), TypeConverter.normalize(rs.getObject(i + 1), column.type()));
                    }
                    rows.add(row);
                }
                return Dataset.of(columns, rows);
            }
        }
    }

    private static List<Column> readColumns(ResultSetMetaData meta) throws SQLException {
        List<Column> columns = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String name = meta.getColumnLabel(i).toLowerCase(Locale.ROOT);
            ColumnType type = ColumnType.fromJdbcType(meta.getColumnType(i));
            boolean nullable = meta.isNullable(i) != ResultSetMetaData.columnNoNulls;
            columns.add(new Column(name, type, nullable));
        }
        return columns;
    }

    /**
     * Primary key columns as reported by the driver. Catalogs differ in identifier case, so the
     * name is tried as given, upper-cased and lower-cased.
     */
    private static List<String> primaryKeyColumns(Connection conn, String table, Dataset dataset) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String bare = table.contains(".") ? table.substring(table.indexOf('.') + 1) : table;
        for (String candidate : new LinkedHashSet<>(List.of(bare, bare.toUpperCase(Locale.ROOT), bare.toLowerCase(Locale.ROOT)))) {
            Map<Short, String> bySeq = new TreeMap<>();
            try (ResultSet rs = meta.getPrimaryKeys(null, null, candidate)) {
                while (rs.next()) {
                    bySeq.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
            if (!bySeq.isEmpty()) {
                List<String> keys = new ArrayList<>(bySeq.values());
                return keys.stream().allMatch(dataset::hasColumn) ? keys : List.of();
            }
        }
        return List.of();
    }
}
