package com.di.qualitygate.profile;

import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.ColumnKind;
import com.di.qualitygate.model.ColumnProfile;
import com.di.qualitygate.model.ColumnType;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.TableProfile;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Descriptive profiling of a dataset. Pure: the dataset is only read, and the same input always
 * gives the same profile.
 */
@Slf4j
public class DataProfiler {

    static final int TOP_VALUES = 10;

    private static final long ROW_OVERHEAD_BYTES = 48;

    public TableProfile profileDataset(Dataset dataset, String tableName) {
        List<ColumnProfile> columns = new ArrayList<>(dataset.columns().size());
        for (Column column : dataset.columns()) {
            columns.add(profileColumn(dataset, column));
        }
        TableProfile profile = TableProfile.builder()
                .tableName(tableName)
                .rowCount(dataset.rowCount())
                .columnCount(dataset.columns().size())
                .memoryEstimateBytes(estimateMemory(dataset))
                .duplicateRowCount(countDuplicateRows(dataset))
                .columns(List.copyOf(columns))
                .build();
        log.info("[PROFILE] table={} | rows={} | columns={} | duplicates={} | ~{} bytes",
                tableName, profile.getRowCount(), profile.getColumnCount(), profile.getDuplicateRowCount(),
                profile.getMemoryEstimateBytes());
        return profile;
    }

    static ColumnKind kindOf(Column column) {
        if (column.type().isNumeric()) {
            return ColumnKind.NUMERIC;
        }
        if (column.type().isTemporal() || column.name().toLowerCase(Locale.ROOT).contains("date")) {
            return ColumnKind.TEMPORAL;
        }
        return ColumnKind.CATEGORICAL;
    }

    private ColumnProfile profileColumn(Dataset dataset, Column column) {
        List<Object> values = dataset.columnValues(column.name());
        long nulls = values.stream().filter(v -> v == null).count();
        long count = values.size() - nulls;
        ColumnKind kind = kindOf(column);
        ColumnProfile.ColumnProfileBuilder builder = ColumnProfile.builder()
                .column(column.name())
                .kind(kind)
                .dataType(column.type())
                .count(count)
                .nullCount(nulls)
                .nullPercentage(values.isEmpty() ? 0.0 : nulls * 100.0 / values.size());
        switch (kind) {
            case NUMERIC:
                numeric(builder, values);
                break;
            case TEMPORAL:
                temporal(builder, values);
                break;
            case CATEGORICAL:
            default:
                categorical(builder, values);
                break;
        }
        return builder.build();
    }

    private static void numeric(ColumnProfile.ColumnProfileBuilder builder, List<Object> values) {
        double[] sample = values.stream()
                .map(TypeConverter::toDouble)
                .filter(d -> d != null && !d.isNaN())
                .mapToDouble(Double::doubleValue)
                .toArray();
        builder.mean(Statistics.mean(sample))
                .median(Statistics.median(sample))
                .std(Statistics.sampleStd(sample))
                .min(Statistics.min(sample))
                .max(Statistics.max(sample))
                .q1(Statistics.quantile(sample, 0.25))
                .q3(Statistics.quantile(sample, 0.75))
                .skewness(Statistics.skewness(sample))
                .kurtosis(Statistics.excessKurtosis(sample));
    }

    private static void temporal(ColumnProfile.ColumnProfileBuilder builder, List<Object> values) {
        LocalDate min = null;
        LocalDate max = null;
        for (Object v : values) {
            Optional<LocalDate> date = v == null ? Optional.empty() : DateFormatUtils.toLocalDate(v);
            if (date.isEmpty()) {
                continue;
            }
            LocalDate d = date.get();
            min = min == null || d.isBefore(min) ? d : min;
            max = max == null || d.isAfter(max) ? d : max;
        }
        builder.minDate(min).maxDate(max);
        if (min != null) {
            builder.rangeDays(ChronoUnit.DAYS.between(min, max));
        }
    }

    private static void categorical(ColumnProfile.ColumnProfileBuilder builder, List<Object> values) {
        Map<String, Long> frequencies = new LinkedHashMap<>();
        for (Object v : values) {
            if (v != null) {
                frequencies.merge(String.valueOf(v), 1L, Long::sum);
            }
        }
        if (frequencies.isEmpty()) {
            builder.distinctCount(0L);
            return;
        }
        // stable sort: ties keep first-seen order
        List<Map.Entry<String, Long>> ranked = new ArrayList<>(frequencies.entrySet());
        ranked.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        Map<String, Long> top = new LinkedHashMap<>();
        for (Map.Entry<String, Long> e : ranked.subList(0, Math.min(TOP_VALUES, ranked.size()))) {
            top.put(e.getKey(), e.getValue());
        }
        builder.distinctCount((long) frequencies.size())
                .topValue(ranked.get(0).getKey())
                .topFrequency(ranked.get(0).getValue())
                .valueDistribution(top);
    }

    static long countDuplicateRows(Dataset dataset) {
        Set<List<Object>> seen = new HashSet<>();
        long duplicates = 0;
        List<String> names = dataset.columnNames();
        for (Map<String, Object> row : dataset.rows()) {
            List<Object> key = new ArrayList<>(names.size());
            for (String name : names) {
                key.add(TypeConverter.valueKey(row.get(name)));
            }
            if (!seen.add(key)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    /** Rough heap footprint: fixed per-row overhead plus a per-type estimate for each value. */
    static long estimateMemory(Dataset dataset) {
        long bytes = 0;
        for (Map<String, Object> row : dataset.rows()) {
            bytes += ROW_OVERHEAD_BYTES;
            for (Column column : dataset.columns()) {
                bytes += valueBytes(column.type(), row.get(column.name()));
            }
        }
        return bytes;
    }

    private static long valueBytes(ColumnType type, Object value) {
        if (value == null) {
            return 8;
        }
        switch (type) {
            case INTEGER:
                return 24;
            case DECIMAL:
                return 40;
            case BOOLEAN:
                return 16;
            case DATE:
            case TIMESTAMP:
                return 32;
            case STRING:
            default:
                return 40 + 2L * String.valueOf(value).length();
        }
    }
}
