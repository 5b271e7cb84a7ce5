package com.di.qualitygate.model;

public enum RuleType {
    UNIQUENESS,
    COMPLETENESS,
    VALIDITY,
    CONSISTENCY
}
