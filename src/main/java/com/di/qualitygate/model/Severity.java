package com.di.qualitygate.model;

/**
 * Severity of a failed quality check. {@link #CRITICAL} failures may gate the load, {@link #WARNING}s never do.
 */
public enum Severity {
    WARNING,
    CRITICAL
}
