package com.di.qualitygate.profile;

import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnKind;
import com.di.qualitygate.model.ColumnProfile;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.TableProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataProfiler Tests")
class DataProfilerTest {

    private final DataProfiler profiler = new DataProfiler();

    private static final List<Column> COLUMNS = List.of(
            Column.of("quantity_sold", ColumnType.INTEGER),
            Column.of("revenue", ColumnType.DECIMAL),
            Column.of("sale_date", ColumnType.DATE),
            Column.of("region", ColumnType.STRING),
            Column.of("ship_date", ColumnType.STRING),
            Column.of("notes", ColumnType.STRING));

    private static Map<String, Object> row(Object qty, Object revenue, Object saleDate, Object region, Object shipDate) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("quantity_sold", qty);
        row.put("revenue", revenue);
        row.put("sale_date", saleDate);
        row.put("region", region);
        row.put("ship_date", shipDate);
        row.put("notes", null);
        return row;
    }

    private static Dataset sales() {
        return Dataset.of(COLUMNS, List.of(
                row(1L, new BigDecimal("10.00"), LocalDate.of(2024, 1, 1), "north", "2024-01-03"),
                row(2L, new BigDecimal("20.00"), LocalDate.of(2024, 1, 11), "south", "2024-01-12"),
                row(3L, new BigDecimal("30.00"), LocalDate.of(2024, 1, 31), "north", null),
                row(4L, null, null, "east", "garbage"),
                row(1L, new BigDecimal("10.00"), LocalDate.of(2024, 1, 1), "north", "2024-01-03")));
    }

    private static ColumnProfile column(TableProfile profile, String name) {
        return profile.getColumns().stream().filter(c -> c.getColumn().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("Should profile table-level counts, duplicates and memory")
    void testProfileDataset_TableLevel() {
        TableProfile profile = profiler.profileDataset(sales(), "sales");

        assertEquals("sales", profile.getTableName());
        assertEquals(5, profile.getRowCount());
        assertEquals(6, profile.getColumnCount());
        assertEquals(1, profile.getDuplicateRowCount());
        assertTrue(profile.getMemoryEstimateBytes() > 5 * 48);
    }

    @Test
    @DisplayName("Should classify columns as numeric, temporal or categorical")
    void testKindOf() {
        TableProfile profile = profiler.profileDataset(sales(), "sales");

        assertEquals(ColumnKind.NUMERIC, column(profile, "quantity_sold").getKind());
        assertEquals(ColumnKind.NUMERIC, column(profile, "revenue").getKind());
        assertEquals(ColumnKind.TEMPORAL, column(profile, "sale_date").getKind());
        assertEquals(ColumnKind.TEMPORAL, column(profile, "ship_date").getKind());
        assertEquals(ColumnKind.CATEGORICAL, column(profile, "region").getKind());
    }

    @Test
    @DisplayName("Should compute numeric statistics over non-null values")
    void testProfileDataset_Numeric() {
        ColumnProfile revenue = column(profiler.profileDataset(sales(), "sales"), "revenue");

        assertEquals(4, revenue.getCount());
        assertEquals(1, revenue.getNullCount());
        assertEquals(20.0, revenue.getNullPercentage(), 1e-9);
        assertEquals(17.5, revenue.getMean(), 1e-9);
        assertEquals(15.0, revenue.getMedian(), 1e-9);
        assertEquals(10.0, revenue.getMin(), 1e-9);
        assertEquals(30.0, revenue.getMax(), 1e-9);
        assertEquals(10.0, revenue.getQ1(), 1e-9);
        assertNotNull(revenue.getStd());
        assertNotNull(revenue.getKurtosis());
    }

    @Test
    @DisplayName("Should compute date ranges and skip unparseable text dates")
    void testProfileDataset_Temporal() {
        TableProfile profile = profiler.profileDataset(sales(), "sales");
        ColumnProfile saleDate = column(profile, "sale_date");
        ColumnProfile shipDate = column(profile, "ship_date");

        assertEquals(LocalDate.of(2024, 1, 1), saleDate.getMinDate());
        assertEquals(LocalDate.of(2024, 1, 31), saleDate.getMaxDate());
        assertEquals(30L, saleDate.getRangeDays());
        assertEquals(LocalDate.of(2024, 1, 12), shipDate.getMaxDate());
        assertEquals(9L, shipDate.getRangeDays());
    }

    @Test
    @DisplayName("Should rank categorical values by frequency with ties in first-seen order")
    void testProfileDataset_Categorical() {
        ColumnProfile region = column(profiler.profileDataset(sales(), "sales"), "region");

        assertEquals(3L, region.getDistinctCount());
        assertEquals("north", region.getTopValue());
        assertEquals(3L, region.getTopFrequency());
        assertEquals(List.of("north", "south", "east"), new ArrayList<>(region.getValueDistribution().keySet()));
    }

    @Test
    @DisplayName("Should keep at most ten values in the distribution")
    void testProfileDataset_TopValuesLimit() {
        List<Column> columns = List.of(Column.of("code", ColumnType.STRING));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            rows.add(Map.of("code", "c" + i));
        }

        ColumnProfile code = profiler.profileDataset(Dataset.of(columns, rows), "codes").getColumns().get(0);

        assertEquals(25L, code.getDistinctCount());
        assertEquals(DataProfiler.TOP_VALUES, code.getValueDistribution().size());
        assertEquals("c0", code.getTopValue());
    }

    @Test
    @DisplayName("Should report an all-null column without statistics")
    void testProfileDataset_AllNullColumn() {
        ColumnProfile notes = column(profiler.profileDataset(sales(), "sales"), "notes");

        assertEquals(0, notes.getCount());
        assertEquals(100.0, notes.getNullPercentage(), 1e-9);
        assertEquals(0L, notes.getDistinctCount());
        assertNull(notes.getTopValue());
    }

    @Test
    @DisplayName("Should profile an empty dataset without errors")
    void testProfileDataset_Empty() {
        TableProfile profile = profiler.profileDataset(Dataset.empty(COLUMNS), "sales");

        assertEquals(0, profile.getRowCount());
        assertEquals(0, profile.getMemoryEstimateBytes());
        ColumnProfile qty = column(profile, "quantity_sold");
        assertNull(qty.getMean());
        assertEquals(0.0, qty.getNullPercentage(), 1e-9);
        assertNull(column(profile, "sale_date").getRangeDays());
    }

    @Test
    @DisplayName("Should give the same profile for the same input")
    void testProfileDataset_Deterministic() {
        assertEquals(profiler.profileDataset(sales(), "sales"), profiler.profileDataset(sales(), "sales"));
    }
}
