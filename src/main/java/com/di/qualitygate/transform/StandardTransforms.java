package com.di.qualitygate.transform;

import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Transform catalog for the supply-chain tables. Tables not listed get {@link TableTransformSpec#defaults(String)}.
 * <p>
 * Deduplication drops whole-row copies only. Rows that merely share a key survive so the uniqueness
 * checks of the validation gate can report them.
 */
public final class StandardTransforms {

    private StandardTransforms() {
    }

    public static TableTransformSpec forTable(String table) {
        switch (table) {
            case "products":
                return TableTransformSpec.builder()
                        .table(table)
                        .businessRules(List.of(
                                BusinessRuleTransform.requirePositive("unit_cost"),
                                BusinessRuleTransform.clampMin("reorder_level", 0)))
                        .build();
            case "inventory":
                return TableTransformSpec.builder()
                        .table(table)
                        .derivedColumns(List.of(quantityAvailable()))
                        .businessRules(List.of(
                                BusinessRuleTransform.clampMin("quantity_on_hand", 0),
                                BusinessRuleTransform.clampMin("quantity_reserved", 0)))
                        .build();
            case "orders":
                return TableTransformSpec.builder()
                        .table(table)
                        .derivedColumns(List.of(deliveryDelayDays(), isLate()))
                        .businessRules(List.of(
                                BusinessRuleTransform.requirePositive("order_quantity"),
                                BusinessRuleTransform.clampMin("order_cost", 0)))
                        .build();
            case "sales":
                return TableTransformSpec.builder()
                        .table(table)
                        .derivedColumns(List.of(unitPrice()))
                        .businessRules(List.of(
                                BusinessRuleTransform.requirePositive("quantity_sold"),
                                BusinessRuleTransform.clampMin("revenue", 0)))
                        .build();
            default:
                return TableTransformSpec.defaults(table);
        }
    }

    /** inventory: {@code quantity_on_hand - quantity_reserved}. */
    public static DerivedColumn quantityAvailable() {
        return new DerivedColumn("quantity_available", ColumnType.INTEGER, row -> {
            BigDecimal onHand = TypeConverter.asBigDecimal(row.get("quantity_on_hand"));
            BigDecimal reserved = TypeConverter.asBigDecimal(row.get("quantity_reserved"));
            return onHand == null || reserved == null ? null : onHand.subtract(reserved).longValue();
        });
    }

    /** orders: days from expected to actual delivery; negative when early. */
    public static DerivedColumn deliveryDelayDays() {
        return new DerivedColumn("delivery_delay_days", ColumnType.INTEGER, StandardTransforms::delayDays);
    }

    /** orders: delivered after the expected date. */
    public static DerivedColumn isLate() {
        return new DerivedColumn("is_late", ColumnType.BOOLEAN, row -> {
            Long delay = delayDays(row);
            return delay == null ? null : delay > 0;
        });
    }

    /** sales: {@code revenue / quantity_sold}, four decimals; null when quantity is missing or zero. */
    public static DerivedColumn unitPrice() {
        return new DerivedColumn("unit_price", ColumnType.DECIMAL, row -> {
            BigDecimal revenue = TypeConverter.asBigDecimal(row.get("revenue"));
            BigDecimal quantity = TypeConverter.asBigDecimal(row.get("quantity_sold"));
            if (revenue == null || quantity == null || quantity.signum() == 0) {
                return null;
            }
            return revenue.divide(quantity, 4, RoundingMode.HALF_UP);
        });
    }

    private static Long delayDays(Map<String, Object> row) {
        LocalDate expected = DateFormatUtils.toLocalDate(row.get("expected_delivery_date")).orElse(null);
        LocalDate actual = DateFormatUtils.toLocalDate(row.get("actual_delivery_date")).orElse(null);
        if (expected == null || actual == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(expected, actual);
    }
}
