package com.di.qualitygate.config;

/**
 * What the reject-on-critical policy rejects when a CRITICAL check fails.
 */
public enum CriticalRejectMode {
    /** The whole table fails at validation; none of its rows are loaded. */
    TABLE,
    /** Only rows failing a CRITICAL rule are removed; the rest are loaded. */
    ROWS
}
