package com.di.qualitygate.util;

import com.di.qualitygate.model.ColumnType;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Conversions between JDBC values and the normalized value classes a {@link com.di.qualitygate.model.Dataset} holds.
 * <p>
 * Normalized forms:
 * <ul>
 *   <li>INTEGER → {@link Long}</li>
 *   <li>DECIMAL → {@link BigDecimal}</li>
 *   <li>STRING → {@link String}</li>
 *   <li>BOOLEAN → {@link Boolean}</li>
 *   <li>DATE → {@link LocalDate}</li>
 *   <li>TIMESTAMP → {@link LocalDateTime}</li>
 * </ul>
 */
public final class TypeConverter {

    private TypeConverter() {
    }

    /**
     * Normalizes a raw JDBC value to the class used for {@code type}.
     *
     * @throws IllegalArgumentException if the value cannot be represented as {@code type}
     */
    public static Object normalize(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return toLong(value);
            case DECIMAL:
                return toBigDecimal(value);
            case BOOLEAN:
                return toBoolean(value);
            case DATE:
                return DateFormatUtils.toLocalDate(value)
                        .orElseThrow(() -> new IllegalArgumentException("Not a date: " + value));
            case TIMESTAMP:
                return DateFormatUtils.toLocalDateTime(value)
                        .orElseThrow(() -> new IllegalArgumentException("Not a timestamp: " + value));
            case STRING:
            default:
                return toStringValue(value);
        }
    }

    /**
     * Whether a non-null value already has the normalized class of {@code type}.
     * Null is conformant for every type.
     */
    public static boolean conformsTo(Object value, ColumnType type) {
        if (value == null) {
            return true;
        }
        switch (type) {
            case INTEGER:
                return value instanceof Long || value instanceof Integer || value instanceof Short
                        || value instanceof Byte || value instanceof BigInteger;
            case DECIMAL:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case DATE:
                return value instanceof LocalDate;
            case TIMESTAMP:
                return value instanceof LocalDateTime;
            case STRING:
            default:
                return value instanceof String;
        }
    }

    /** Numeric view of a value, or {@code null} for null and non-numeric values. */
    public static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Exact numeric view of a value, or {@code null} for null and non-numeric values. */
    public static BigDecimal asBigDecimal(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return toBigDecimal(value);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Equality key for a value: numbers compare by numeric value ({@code 7L} and {@code 7.00} match),
     * everything else by {@code equals}.
     */
    public static Object valueKey(Object value) {
        if (value instanceof Number) {
            BigDecimal bd = asBigDecimal(value);
            return bd == null ? value : bd.stripTrailingZeros();
        }
        return value;
    }

    /**
     * Converts a number to the normalized class of a numeric column: integers are rounded half-up.
     */
    public static Object fromDouble(double value, ColumnType type) {
        if (type == ColumnType.INTEGER) {
            return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        return BigDecimal.valueOf(value);
    }

    /**
     * Value suitable for {@link java.sql.PreparedStatement#setObject(int, Object)}.
     */
    public static Object toJdbcValue(Object value) {
        if (value instanceof LocalDate d) {
            return java.sql.Date.valueOf(d);
        }
        if (value instanceof LocalDateTime dt) {
            return Timestamp.valueOf(dt);
        }
        return value;
    }

    private static Long toLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof BigDecimal bd) {
            try {
                return bd.setScale(0, RoundingMode.HALF_UP).longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Integer out of range: " + value, e);
            }
        }
        if (value instanceof BigInteger bi) {
            try {
                return bi.longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Integer out of range: " + value, e);
            }
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        try {
            return new BigDecimal(value.toString().trim()).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not an integer: " + value, e);
        }
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Not a finite decimal: " + value);
            }
            return BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a decimal: " + value, e);
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "true":
            case "t":
            case "yes":
            case "y":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "f":
            case "no":
            case "n":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean: " + value);
        }
    }

    private static String toStringValue(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Clob clob) {
            return readClob(clob);
        }
        if (value instanceof Time t) {
            return t.toLocalTime().toString();
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, java.nio.charset.StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    private static String readClob(Clob clob) {
        try (Reader reader = clob.getCharacterStream()) {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[4096];
            int n;
            while ((n = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, n);
            }
            return sb.toString();
        } catch (SQLException | IOException e) {
            throw new IllegalArgumentException("Failed to read CLOB value", e);
        }
    }
}
