package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TableAnomalies {

    String table;
    List<AnomalyReport> reports;

    public long totalOutliers() {
        return reports.stream().mapToLong(AnomalyReport::getOutlierCount).sum();
    }
}
