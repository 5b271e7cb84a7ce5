package com.di.qualitygate.transform;

import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.util.DateFormatUtils;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A column computed from each row. The function sees the row as it stands after the earlier
 * transform stages and returns {@code null} when its inputs are missing.
 */
public record DerivedColumn(String name, ColumnType type, Function<Map<String, Object>, Object> function) {

    public DerivedColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(function, "function");
    }

    /**
     * Year, month, quarter and ISO week-of-year columns for a date column,
     * named {@code <column>_year}, {@code _month}, {@code _quarter}, {@code _week_of_year}.
     */
    public static List<DerivedColumn> calendarFeatures(String dateColumn) {
        return List.of(
                new DerivedColumn(dateColumn + "_year", ColumnType.INTEGER,
                        row -> dateOf(row, dateColumn) == null ? null : (long) dateOf(row, dateColumn).getYear()),
                new DerivedColumn(dateColumn + "_month", ColumnType.INTEGER,
                        row -> dateOf(row, dateColumn) == null ? null : (long) dateOf(row, dateColumn).getMonthValue()),
                new DerivedColumn(dateColumn + "_quarter", ColumnType.INTEGER,
                        row -> dateOf(row, dateColumn) == null ? null
                                : (long) dateOf(row, dateColumn).get(IsoFields.QUARTER_OF_YEAR)),
                new DerivedColumn(dateColumn + "_week_of_year", ColumnType.INTEGER,
                        row -> dateOf(row, dateColumn) == null ? null
                                : (long) dateOf(row, dateColumn).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
        );
    }

    private static LocalDate dateOf(Map<String, Object> row, String column) {
        return DateFormatUtils.toLocalDate(row.get(column)).orElse(null);
    }
}
