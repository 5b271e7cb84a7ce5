package com.di.qualitygate.model;

public enum LoadOutcome {
    /** Every batch committed. */
    FULL,
    /** Some batches committed, some rolled back. */
    PARTIAL,
    /** Nothing committed. */
    NONE,
    /** Load disabled or never reached. */
    SKIPPED
}
