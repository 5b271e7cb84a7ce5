package com.di.qualitygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outliers found by one method over one column (or, for the multivariate method, a set of columns).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyReport {

    String table;
    List<String> columns;
    AnomalyMethod method;
    long outlierCount;
    double outlierPercentage;
    List<Integer> outlierRowIndices;
    /** First ten outlier values, in row order. Empty for the multivariate method. */
    List<Object> sampleValues;
    Double lowerBound;
    Double upperBound;
    double threshold;
    /** Rows left out of the analysis because a required value was null. */
    long skippedRowCount;
}
