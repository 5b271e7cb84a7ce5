package com.di.qualitygate.model;

import java.sql.Types;

/**
 * Logical column types carried by a {@link Dataset}. Inferred once from JDBC metadata at extraction
 * and preserved through every later stage.
 */
public enum ColumnType {

    INTEGER,
    DECIMAL,
    STRING,
    BOOLEAN,
    DATE,
    TIMESTAMP;

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /** The {@link java.sql.Types} code used when binding a null of this type. */
    public int jdbcType() {
        switch (this) {
            case INTEGER:
                return Types.BIGINT;
            case DECIMAL:
                return Types.NUMERIC;
            case BOOLEAN:
                return Types.BOOLEAN;
            case DATE:
                return Types.DATE;
            case TIMESTAMP:
                return Types.TIMESTAMP;
            case STRING:
            default:
                return Types.VARCHAR;
        }
    }

    /**
     * Maps a {@link java.sql.Types} code to a logical type. Unknown codes fall back to {@link #STRING}.
     */
    public static ColumnType fromJdbcType(int sqlType) {
        switch (sqlType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return INTEGER;
            case Types.NUMERIC:
            case Types.DECIMAL:
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return DECIMAL;
            case Types.BIT:
            case Types.BOOLEAN:
                return BOOLEAN;
            case Types.DATE:
                return DATE;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return TIMESTAMP;
            default:
                return STRING;
        }
    }
}
