package com.di.qualitygate.anomaly;

import java.util.List;
import java.util.Map;

/**
 * Detector settings.
 *
 * @param columnsByTable optional per-table column lists that replace automatic column selection
 */
public record AnomalyConfig(double iqrMultiplier,
                            double zscoreThreshold,
                            long seed,
                            int trees,
                            double contamination,
                            int minDistinctValues,
                            Map<String, List<String>> columnsByTable) {

    public AnomalyConfig {
        if (iqrMultiplier <= 0 || zscoreThreshold <= 0) {
            throw new IllegalArgumentException("IQR multiplier and z-score threshold must be positive");
        }
        if (trees < 1) {
            throw new IllegalArgumentException("Isolation forest needs at least one tree");
        }
        if (contamination <= 0 || contamination >= 0.5) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5): " + contamination);
        }
        columnsByTable = columnsByTable == null ? Map.of() : Map.copyOf(columnsByTable);
    }

    public static AnomalyConfig defaults() {
        return new AnomalyConfig(1.5, 3.0, 42L, 100, 0.1, 2, Map.of());
    }

    public List<String> columnsFor(String table) {
        return columnsByTable.getOrDefault(table, List.of());
    }
}
