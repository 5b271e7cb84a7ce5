package com.di.qualitygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Descriptive statistics for one column. Statistics that are undefined for the data at hand
 * (too few values, zero variance, all nulls) are {@code null}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnProfile {

    String column;
    ColumnKind kind;
    ColumnType dataType;
    long count;
    long nullCount;
    double nullPercentage;

    // numeric
    Double mean;
    Double median;
    Double std;
    Double min;
    Double max;
    Double q1;
    Double q3;
    Double skewness;
    Double kurtosis;

    // categorical
    Long distinctCount;
    String topValue;
    Long topFrequency;
    Map<String, Long> valueDistribution;

    // temporal
    LocalDate minDate;
    LocalDate maxDate;
    Long rangeDays;
}
