package com.di.qualitygate.model;

/** Statistical family a column is profiled as. */
public enum ColumnKind {
    NUMERIC,
    CATEGORICAL,
    TEMPORAL
}
