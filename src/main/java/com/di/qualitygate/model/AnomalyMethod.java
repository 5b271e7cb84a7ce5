package com.di.qualitygate.model;

public enum AnomalyMethod {
    IQR,
    ZSCORE,
    ISOLATION_FOREST
}
