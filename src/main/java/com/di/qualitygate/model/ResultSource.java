package com.di.qualitygate.model;

/** Where a validation result came from: the built-in validator or a registered rule. */
public enum ResultSource {
    BUILT_IN,
    RULE
}
