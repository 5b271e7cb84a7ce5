package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TableProfile {

    String tableName;
    long rowCount;
    int columnCount;
    long memoryEstimateBytes;
    long duplicateRowCount;
    List<ColumnProfile> columns;
}
