package com.di.qualitygate.transform;

import com.di.qualitygate.exception.TransformationException;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataTransformer Tests")
class DataTransformerTest {

    private final DataTransformer transformer = new DataTransformer();

    private static Map<String, Object> row(List<Column> columns, Object... values) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i).name(), values[i]);
        }
        return row;
    }

    private static final List<Column> SALES_COLUMNS = List.of(
            Column.required("sale_id", ColumnType.INTEGER),
            Column.of("sale_date", ColumnType.STRING),
            Column.of("product_id", ColumnType.INTEGER),
            Column.of("quantity_sold", ColumnType.INTEGER),
            Column.of("revenue", ColumnType.DECIMAL));

    private static Dataset rawSales() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row(SALES_COLUMNS, 1L, "2024-01-05", 10L, 3L, new BigDecimal("30.00")));
        rows.add(row(SALES_COLUMNS, 2L, "20/01/2024", 11L, 1L, new BigDecimal("12.50")));
        rows.add(row(SALES_COLUMNS, 2L, "20/01/2024", 11L, 1L, new BigDecimal("12.50")));
        rows.add(row(SALES_COLUMNS, 3L, "2024-02-02", 10L, 0L, new BigDecimal("0.00")));
        rows.add(row(SALES_COLUMNS, 4L, "not a date", 12L, 2L, new BigDecimal("-5.00")));
        rows.add(row(SALES_COLUMNS, null, "2024-03-01", 10L, 1L, new BigDecimal("9.00")));
        return Dataset.of(SALES_COLUMNS, rows);
    }

    // ============================================================================
    // Full Pipeline
    // ============================================================================

    @Test
    @DisplayName("Should run all five stages in order on the sales table")
    void testTransform_SalesEndToEnd() {
        TransformResult result = transformer.transform(rawSales(), StandardTransforms.forTable("sales"));
        Dataset out = result.dataset();

        assertEquals(List.of(1L, 2L, 4L), out.columnValues("sale_id"));
        assertEquals(ColumnType.DATE, out.column("sale_date").orElseThrow().type());
        assertEquals(LocalDate.of(2024, 1, 5), out.rows().get(0).get("sale_date"));
        assertEquals(LocalDate.of(2024, 1, 20), out.rows().get(1).get("sale_date"));
        assertNull(out.rows().get(2).get("sale_date"));
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) out.rows().get(2).get("revenue")));
        assertEquals(0, new BigDecimal("10.0000").compareTo((BigDecimal) out.rows().get(0).get("unit_price")));
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) out.rows().get(2).get("unit_price")));

        List<StageStats> stats = result.stageStats();
        assertEquals(5, stats.size());
        assertEquals(1, stats.get(0).rowsDropped());
        assertEquals(1, stats.get(1).rowsDropped());
        assertEquals(1, stats.get(2).valuesNulled());
        assertEquals(1, stats.get(4).rowsDropped());
        assertEquals(3, result.rowsDropped());
    }

    @Test
    @DisplayName("Should change nothing when run again on its own output")
    void testTransform_Idempotent() {
        TableTransformSpec spec = StandardTransforms.forTable("sales");
        TransformResult first = transformer.transform(rawSales(), spec);

        TransformResult second = transformer.transform(first.dataset(), spec);

        assertEquals(first.dataset(), second.dataset());
        assertEquals(0, second.rowsDropped());
        assertEquals(0, second.rowsModified());
        assertEquals(0, second.valuesNulled());
    }

    @Test
    @DisplayName("Should settle in one call when date standardization exposes nulls and duplicates")
    void testTransform_MessyDatesReachFixedPoint() {
        List<Column> columns = List.of(
                Column.required("event_id", ColumnType.INTEGER),
                Column.required("event_date", ColumnType.STRING));
        Dataset events = Dataset.of(columns, List.of(
                row(columns, 1L, "2024-01-05"),
                row(columns, 1L, "2024/01/05"),
                row(columns, 2L, "garbage")));
        TableTransformSpec spec = TableTransformSpec.defaults("events");

        TransformResult first = transformer.transform(events, spec);
        TransformResult second = transformer.transform(first.dataset(), spec);

        assertEquals(1, first.dataset().rowCount());
        assertEquals(LocalDate.of(2024, 1, 5), first.dataset().rows().get(0).get("event_date"));
        assertEquals(1, first.stageStats().get(0).rowsDropped());
        assertEquals(1, first.stageStats().get(1).rowsDropped());
        assertEquals(1, first.stageStats().get(2).valuesNulled());
        assertEquals(first.dataset(), second.dataset());
        assertEquals(0, second.rowsDropped());
        assertEquals(0, second.rowsModified());
        assertEquals(0, second.valuesNulled());
    }

    @Test
    @DisplayName("Should keep rows that share a key but differ elsewhere")
    void testTransform_StandardSpecKeepsKeyDuplicates() {
        List<Column> columns = List.of(
                Column.required("supplier_id", ColumnType.INTEGER),
                Column.of("supplier_name", ColumnType.STRING));
        Dataset suppliers = Dataset.of(columns, List.of(
                row(columns, 1L, "Acme"),
                row(columns, 1L, "Globex"),
                row(columns, 1L, "Globex")));

        TransformResult result = transformer.transform(suppliers, StandardTransforms.forTable("suppliers"));

        assertEquals(List.of(1L, 1L), result.dataset().columnValues("supplier_id"));
        assertEquals(1, result.stageStats().get(1).rowsDropped());
    }

    @Test
    @DisplayName("Should keep derived values consistent with clamped inputs")
    void testTransform_InventoryClampRefreshesDerived() {
        List<Column> columns = List.of(
                Column.required("inventory_id", ColumnType.INTEGER),
                Column.of("quantity_on_hand", ColumnType.INTEGER),
                Column.of("quantity_reserved", ColumnType.INTEGER));
        Dataset inventory = Dataset.of(columns, List.of(
                row(columns, 1L, 10L, 4L),
                row(columns, 2L, -3L, 2L)));
        TableTransformSpec spec = StandardTransforms.forTable("inventory");

        Dataset out = transformer.transform(inventory, spec).dataset();

        assertEquals(6L, out.rows().get(0).get("quantity_available"));
        assertEquals(0L, out.rows().get(1).get("quantity_on_hand"));
        assertEquals(-2L, out.rows().get(1).get("quantity_available"));
        assertEquals(out, transformer.transform(out, spec).dataset());
    }

    @Test
    @DisplayName("Should skip disabled stages")
    void testTransform_DisabledStage() {
        TableTransformSpec spec = StandardTransforms.forTable("sales").toBuilder()
                .enabledStages(EnumSet.of(TransformStage.NULL_HANDLING))
                .build();

        TransformResult result = transformer.transform(rawSales(), spec);

        assertEquals(5, result.dataset().rowCount());
        assertEquals(StageStats.skipped(TransformStage.DEDUPLICATION), result.stageStats().get(1));
        assertFalse(result.dataset().hasColumn("unit_price"));
    }

    @Test
    @DisplayName("Should never modify the input dataset")
    void testTransform_InputUntouched() {
        Dataset input = rawSales();
        Dataset copy = rawSales();

        transformer.transform(input, StandardTransforms.forTable("sales"));

        assertEquals(copy, input);
    }

    // ============================================================================
    // Null Handling
    // ============================================================================

    private static final List<Column> METRIC_COLUMNS = List.of(
            Column.of("id", ColumnType.INTEGER),
            Column.of("qty", ColumnType.INTEGER),
            Column.of("price", ColumnType.DECIMAL),
            Column.of("region", ColumnType.STRING));

    private static Dataset metrics() {
        return Dataset.of(METRIC_COLUMNS, List.of(
                row(METRIC_COLUMNS, 1L, 10L, new BigDecimal("1.0"), null),
                row(METRIC_COLUMNS, 2L, null, null, "north"),
                row(METRIC_COLUMNS, 3L, 20L, new BigDecimal("3.0"), "south"),
                row(METRIC_COLUMNS, 4L, 31L, new BigDecimal("10.0"), null),
                row(METRIC_COLUMNS, 5L, null, null, "south")));
    }

    private static TableTransformSpec nullSpec(Map<String, NullHandling> strategies) {
        return TableTransformSpec.builder().table("metrics").nullStrategies(strategies).build();
    }

    @Test
    @DisplayName("Should fill numeric nulls with the mean rounded for integers and the median for decimals")
    void testCleanNulls_MeanAndMedian() {
        StageOutput out = transformer.cleanNulls(metrics(), nullSpec(Map.of(
                "qty", NullHandling.of(NullStrategy.FILL_MEAN),
                "price", NullHandling.of(NullStrategy.FILL_MEDIAN))));

        assertEquals(Arrays.asList(10L, 20L, 20L, 31L, 20L), out.dataset().columnValues("qty"));
        assertEquals(0, new BigDecimal("3.0").compareTo((BigDecimal) out.dataset().rows().get(1).get("price")));
        assertEquals(2, out.stats().rowsModified());
    }

    @Test
    @DisplayName("Should fill with the most frequent value, a constant, or the previous value")
    void testCleanNulls_ModeConstantForwardFill() {
        Dataset data = metrics();

        Dataset mode = transformer.cleanNulls(data, nullSpec(Map.of("region", NullHandling.of(NullStrategy.FILL_MODE)))).dataset();
        Dataset constant = transformer.cleanNulls(data, nullSpec(Map.of("region", NullHandling.constant("UNKNOWN")))).dataset();
        Dataset forward = transformer.cleanNulls(data, nullSpec(Map.of("region", NullHandling.of(NullStrategy.FORWARD_FILL)))).dataset();

        assertEquals(Arrays.asList("south", "north", "south", "south", "south"), mode.columnValues("region"));
        assertEquals(Arrays.asList("UNKNOWN", "north", "south", "UNKNOWN", "south"), constant.columnValues("region"));
        assertEquals(Arrays.asList(null, "north", "south", "south", "south"), forward.columnValues("region"));
    }

    @Test
    @DisplayName("Should drop rows with nulls in DROP_ROW columns before computing fills")
    void testCleanNulls_DropRowFirst() {
        StageOutput out = transformer.cleanNulls(metrics(), nullSpec(Map.of(
                "region", NullHandling.of(NullStrategy.DROP_ROW),
                "qty", NullHandling.of(NullStrategy.FILL_MEAN))));

        assertEquals(List.of(2L, 3L, 5L), out.dataset().columnValues("id"));
        assertEquals(Arrays.asList(20L, 20L, 20L), out.dataset().columnValues("qty"));
        assertEquals(2, out.stats().rowsDropped());
    }

    @Test
    @DisplayName("Should reject mean fill on a text column and unknown configured columns")
    void testCleanNulls_ConfigurationErrors() {
        TransformationException wrongType = assertThrows(TransformationException.class, () -> transformer.transform(
                metrics(), nullSpec(Map.of("region", NullHandling.of(NullStrategy.FILL_MEAN)))));
        TransformationException unknown = assertThrows(TransformationException.class, () -> transformer.transform(
                metrics(), nullSpec(Map.of("nope", NullHandling.of(NullStrategy.NONE)))));

        assertEquals(TransformStage.NULL_HANDLING, wrongType.getTransformStage());
        assertEquals("metrics", unknown.getTable());
        assertTrue(unknown.getMessage().contains("nope"));
    }

    @Test
    @DisplayName("Should require a value for constant fills")
    void testNullHandling_ConstantNeedsValue() {
        assertThrows(IllegalArgumentException.class, () -> NullHandling.constant(null));
    }

    // ============================================================================
    // Deduplication
    // ============================================================================

    @Test
    @DisplayName("Should keep the first or last occurrence and preserve order")
    void testRemoveDuplicates_KeepFirstAndLast() {
        List<Column> columns = List.of(Column.of("k", ColumnType.DECIMAL), Column.of("v", ColumnType.STRING));
        Dataset data = Dataset.of(columns, List.of(
                row(columns, 1L, "a"),
                row(columns, 2L, "b"),
                row(columns, new BigDecimal("1.00"), "c"),
                row(columns, 3L, "d")));

        StageOutput first = transformer.removeDuplicates(data, "t", List.of("k"), DuplicateKeep.FIRST);
        StageOutput last = transformer.removeDuplicates(data, "t", List.of("k"), DuplicateKeep.LAST);

        assertEquals(List.of("a", "b", "d"), first.dataset().columnValues("v"));
        assertEquals(List.of("b", "c", "d"), last.dataset().columnValues("v"));
        assertEquals(1, first.stats().rowsDropped());
    }

    @Test
    @DisplayName("Should compare whole rows when no key is configured")
    void testRemoveDuplicates_WholeRow() {
        List<Column> columns = List.of(Column.of("k", ColumnType.INTEGER), Column.of("v", ColumnType.STRING));
        Dataset data = Dataset.of(columns, List.of(
                row(columns, 1L, "a"),
                row(columns, 1L, "b"),
                row(columns, 1L, "a")));

        StageOutput out = transformer.removeDuplicates(data, "t", List.of(), DuplicateKeep.FIRST);

        assertEquals(2, out.dataset().rowCount());
    }

    // ============================================================================
    // Derived Columns and Business Rules
    // ============================================================================

    @Test
    @DisplayName("Should reject a derived column that would overwrite different existing values")
    void testAddDerivedColumns_Clash() {
        List<Column> columns = List.of(
                Column.of("quantity_on_hand", ColumnType.INTEGER),
                Column.of("quantity_reserved", ColumnType.INTEGER),
                Column.of("quantity_available", ColumnType.INTEGER));
        Dataset data = Dataset.of(columns, List.of(row(columns, 10L, 4L, 99L)));

        TransformationException e = assertThrows(TransformationException.class, () ->
                transformer.addDerivedColumns(data, "inventory", List.of(StandardTransforms.quantityAvailable())));

        assertEquals(TransformStage.DERIVED_COLUMNS, e.getTransformStage());
    }

    @Test
    @DisplayName("Should add calendar features for a date column")
    void testAddDerivedColumns_CalendarFeatures() {
        List<Column> columns = List.of(Column.of("order_date", ColumnType.DATE));
        Dataset data = Dataset.of(columns, List.of(row(columns, LocalDate.of(2024, 5, 15))));

        Dataset out = transformer.addDerivedColumns(data, "orders", DerivedColumn.calendarFeatures("order_date")).dataset();

        Map<String, Object> r = out.rows().get(0);
        assertEquals(2024L, r.get("order_date_year"));
        assertEquals(5L, r.get("order_date_month"));
        assertEquals(2L, r.get("order_date_quarter"));
        assertEquals(20L, r.get("order_date_week_of_year"));
    }

    @Test
    @DisplayName("Should compute delivery delay and lateness for orders")
    void testOrdersDerivedColumns() {
        List<Column> columns = List.of(
                Column.of("expected_delivery_date", ColumnType.DATE),
                Column.of("actual_delivery_date", ColumnType.DATE));
        Dataset data = Dataset.of(columns, List.of(
                row(columns, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4)),
                row(columns, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 2, 28)),
                row(columns, LocalDate.of(2024, 3, 1), null)));

        Dataset out = transformer.addDerivedColumns(data, "orders",
                List.of(StandardTransforms.deliveryDelayDays(), StandardTransforms.isLate())).dataset();

        assertEquals(Arrays.asList(3L, -2L, null), out.columnValues("delivery_delay_days"));
        assertEquals(Arrays.asList(true, false, null), out.columnValues("is_late"));
    }

    @Test
    @DisplayName("Should leave nulls alone in business rules and skip rules on missing columns")
    void testApplyBusinessRules_NullsAndMissingColumns() {
        List<Column> columns = List.of(Column.of("unit_cost", ColumnType.DECIMAL));
        Dataset data = Dataset.of(columns, Arrays.asList(
                row(columns, new BigDecimal("2.00")),
                row(columns, (Object) null),
                row(columns, new BigDecimal("0"))));

        StageOutput out = transformer.applyBusinessRules(data, "products", List.of(
                BusinessRuleTransform.requirePositive("unit_cost"),
                BusinessRuleTransform.clampMin("reorder_level", 0)));

        assertEquals(2, out.dataset().rowCount());
        assertNull(out.dataset().rows().get(1).get("unit_cost"));
        assertEquals(1, out.stats().rowsDropped());
    }
}
