package com.di.qualitygate.load;

/** How rows already in the destination are treated. */
public enum LoadMode {
    /** Keep existing rows and insert after them. */
    APPEND,
    /** Delete existing rows, in a transaction of its own, before the first batch. */
    REPLACE
}
