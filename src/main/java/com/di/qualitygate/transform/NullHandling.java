package com.di.qualitygate.transform;

import java.util.Objects;

/**
 * Null strategy for one column, with the constant used by {@link NullStrategy#FILL_CONSTANT}.
 */
public record NullHandling(NullStrategy strategy, Object fillValue) {

    public NullHandling {
        Objects.requireNonNull(strategy, "strategy");
        if (strategy == NullStrategy.FILL_CONSTANT && fillValue == null) {
            throw new IllegalArgumentException("FILL_CONSTANT requires a fill value");
        }
    }

    public static NullHandling of(NullStrategy strategy) {
        return new NullHandling(strategy, null);
    }

    public static NullHandling constant(Object value) {
        return new NullHandling(NullStrategy.FILL_CONSTANT, value);
    }
}
