package com.di.qualitygate.anomaly;

import com.di.qualitygate.model.AnomalyMethod;
import com.di.qualitygate.model.AnomalyReport;
import com.di.qualitygate.model.Column;
import com.di.qualitygate.model.Dataset;
import com.di.qualitygate.model.TableAnomalies;
import com.di.qualitygate.profile.Statistics;
import com.di.qualitygate.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Univariate (IQR, Z-score) and multivariate (isolation forest) outlier detection.
 * Rows whose analysed value is null are skipped and counted, never flagged.
 */
@Slf4j
public class AnomalyDetector {

    static final int SAMPLE_SIZE = 10;

    private final AnomalyConfig config;

    public AnomalyDetector(AnomalyConfig config) {
        this.config = config;
    }

    public AnomalyDetector() {
        this(AnomalyConfig.defaults());
    }

    /**
     * Flags values outside {@code [Q1 - k*IQR, Q3 + k*IQR]}.
     */
    public AnomalyReport detectIqr(Dataset dataset, String table, String column) {
        Sample sample = Sample.of(dataset, column);
        if (sample.values.length == 0) {
            return empty(table, List.of(column), AnomalyMethod.IQR, config.iqrMultiplier(), sample.skipped);
        }
        double[] sorted = sample.values.clone();
        Arrays.sort(sorted);
        double q1 = Statistics.quantileOfSorted(sorted, 0.25);
        double q3 = Statistics.quantileOfSorted(sorted, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - config.iqrMultiplier() * iqr;
        double upper = q3 + config.iqrMultiplier() * iqr;
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < sample.values.length; i++) {
            if (sample.values[i] < lower || sample.values[i] > upper) {
                outliers.add(sample.rowIndices[i]);
            }
        }
        return report(dataset, table, List.of(column), AnomalyMethod.IQR, outliers, lower, upper,
                config.iqrMultiplier(), sample.skipped);
    }

    /**
     * Flags values with {@code |x - mean| / std > threshold}, std being the population standard deviation.
     * A constant column has no outliers.
     */
    public AnomalyReport detectZscore(Dataset dataset, String table, String column) {
        Sample sample = Sample.of(dataset, column);
        Double mean = Statistics.mean(sample.values);
        Double std = Statistics.populationStd(sample.values);
        if (mean == null || std == null || std == 0.0) {
            return empty(table, List.of(column), AnomalyMethod.ZSCORE, config.zscoreThreshold(), sample.skipped);
        }
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < sample.values.length; i++) {
            if (Math.abs(sample.values[i] - mean) / std > config.zscoreThreshold()) {
                outliers.add(sample.rowIndices[i]);
            }
        }
        double reach = config.zscoreThreshold() * std;
        return report(dataset, table, List.of(column), AnomalyMethod.ZSCORE, outliers, mean - reach, mean + reach,
                config.zscoreThreshold(), sample.skipped);
    }

    /**
     * Fits an isolation forest on the rows complete in {@code columns} and flags rows scoring strictly
     * above the {@code 1 - contamination} quantile of all scores.
     */
    public AnomalyReport detectIsolationForest(Dataset dataset, String table, List<String> columns) {
        List<double[]> points = new ArrayList<>();
        List<Integer> rowIndices = new ArrayList<>();
        long skipped = 0;
        for (String column : columns) {
            requireColumn(dataset, column);
        }
        List<Map<String, Object>> rows = dataset.rows();
        for (int i = 0; i < rows.size(); i++) {
            double[] point = new double[columns.size()];
            boolean complete = true;
            for (int c = 0; c < columns.size() && complete; c++) {
                Double v = TypeConverter.toDouble(rows.get(i).get(columns.get(c)));
                if (v == null || v.isNaN()) {
                    complete = false;
                } else {
                    point[c] = v;
                }
            }
            if (complete) {
                points.add(point);
                rowIndices.add(i);
            } else {
                skipped++;
            }
        }
        if (points.size() < 2) {
            return empty(table, columns, AnomalyMethod.ISOLATION_FOREST, config.contamination(), skipped);
        }
        double[][] data = points.toArray(new double[0][]);
        double[] scores = new IsolationForest(config.trees(), config.seed()).fit(data).score(data);
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        double cutoff = Statistics.quantileOfSorted(sorted, 1.0 - config.contamination());
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > cutoff) {
                outliers.add(rowIndices.get(i));
            }
        }
        log.debug("[ANOMALY] table={} | isolation forest over {} | cutoff={}", table, columns, cutoff);
        return report(dataset, table, columns, AnomalyMethod.ISOLATION_FOREST, outliers, null, null,
                config.contamination(), skipped);
    }

    /**
     * Runs IQR and Z-score on each eligible numeric column and the isolation forest across the
     * eligible non-key columns. A per-table column list, when configured, replaces automatic selection.
     */
    public TableAnomalies analyzeTableAnomalies(Dataset dataset, String table) {
        List<String> configured = config.columnsFor(table);
        List<String> univariate;
        List<String> multivariate;
        if (!configured.isEmpty()) {
            univariate = configured;
            multivariate = configured;
        } else {
            univariate = eligibleColumns(dataset);
            multivariate = new ArrayList<>();
            for (String c : univariate) {
                if (!c.toLowerCase(Locale.ROOT).endsWith("_id")) {
                    multivariate.add(c);
                }
            }
        }

        List<AnomalyReport> reports = new ArrayList<>();
        for (String column : univariate) {
            reports.add(detectIqr(dataset, table, column));
            reports.add(detectZscore(dataset, table, column));
        }
        if (!multivariate.isEmpty()) {
            reports.add(detectIsolationForest(dataset, table, multivariate));
        }
        TableAnomalies anomalies = TableAnomalies.builder().table(table).reports(List.copyOf(reports)).build();
        log.info("[ANOMALY] table={} | columns={} | multivariate={} | outliers={}",
                table, univariate, multivariate, anomalies.totalOutliers());
        return anomalies;
    }

    List<String> eligibleColumns(Dataset dataset) {
        List<String> eligible = new ArrayList<>();
        for (Column column : dataset.columns()) {
            if (!column.type().isNumeric()) {
                continue;
            }
            Set<Object> distinct = new HashSet<>();
            for (Object v : dataset.columnValues(column.name())) {
                if (v != null) {
                    distinct.add(TypeConverter.valueKey(v));
                }
            }
            if (distinct.size() >= config.minDistinctValues()) {
                eligible.add(column.name());
            }
        }
        return eligible;
    }

    private static AnomalyReport report(Dataset dataset, String table, List<String> columns, AnomalyMethod method,
                                        List<Integer> outliers, Double lower, Double upper, double threshold,
                                        long skipped) {
        List<Object> samples = new ArrayList<>();
        if (columns.size() == 1) {
            for (int i = 0; i < Math.min(SAMPLE_SIZE, outliers.size()); i++) {
                samples.add(dataset.rows().get(outliers.get(i)).get(columns.get(0)));
            }
        }
        int total = dataset.rowCount();
        return AnomalyReport.builder()
                .table(table)
                .columns(List.copyOf(columns))
                .method(method)
                .outlierCount(outliers.size())
                .outlierPercentage(total == 0 ? 0.0 : outliers.size() * 100.0 / total)
                .outlierRowIndices(List.copyOf(outliers))
                .sampleValues(List.copyOf(samples))
                .lowerBound(lower)
                .upperBound(upper)
                .threshold(threshold)
                .skippedRowCount(skipped)
                .build();
    }

    private static AnomalyReport empty(String table, List<String> columns, AnomalyMethod method, double threshold,
                                       long skipped) {
        return AnomalyReport.builder()
                .table(table)
                .columns(List.copyOf(columns))
                .method(method)
                .outlierCount(0)
                .outlierPercentage(0.0)
                .outlierRowIndices(List.of())
                .sampleValues(List.of())
                .threshold(threshold)
                .skippedRowCount(skipped)
                .build();
    }

    private static void requireColumn(Dataset dataset, String column) {
        if (!dataset.hasColumn(column)) {
            throw new IllegalArgumentException("Column '" + column + "' not found");
        }
    }

    /** Non-null numeric values of one column with their row indices. */
    private static final class Sample {
        final double[] values;
        final int[] rowIndices;
        final long skipped;

        private Sample(double[] values, int[] rowIndices, long skipped) {
            this.values = values;
            this.rowIndices = rowIndices;
            this.skipped = skipped;
        }

        static Sample of(Dataset dataset, String column) {
            requireColumn(dataset, column);
            List<Object> raw = dataset.columnValues(column);
            double[] values = new double[raw.size()];
            int[] indices = new int[raw.size()];
            int n = 0;
            for (int i = 0; i < raw.size(); i++) {
                Double v = TypeConverter.toDouble(raw.get(i));
                if (v != null && !v.isNaN()) {
                    values[n] = v;
                    indices[n] = i;
                    n++;
                }
            }
            return new Sample(Arrays.copyOf(values, n), Arrays.copyOf(indices, n), raw.size() - n);
        }
    }
}
