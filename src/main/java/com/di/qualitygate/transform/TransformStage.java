package com.di.qualitygate.transform;

/** Transform stages in the fixed order they run. */
public enum TransformStage {
    NULL_HANDLING,
    DEDUPLICATION,
    DATE_STANDARDIZATION,
    DERIVED_COLUMNS,
    BUSINESS_RULES
}
