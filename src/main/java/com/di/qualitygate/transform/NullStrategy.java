package com.di.qualitygate.transform;

public enum NullStrategy {
    /** Leave nulls in place. */
    NONE,
    DROP_ROW,
    FILL_CONSTANT,
    FILL_MEAN,
    FILL_MEDIAN,
    FILL_MODE,
    /** Carry the previous non-null value down; leading nulls stay null. */
    FORWARD_FILL
}
