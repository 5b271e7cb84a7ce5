package com.di.qualitygate.transform;

/** Which occurrence of a duplicate group survives deduplication. */
public enum DuplicateKeep {
    FIRST,
    LAST
}
