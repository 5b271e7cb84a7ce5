package com.di.qualitygate.rules;

import com.di.qualitygate.model.Dataset;

import java.util.List;

/**
 * The predicate part of a {@link ValidationRule}. Produces one pass flag per row; a rule fails when
 * {@link #passes(boolean[])} says so (by default, when any row fails).
 * <p>
 * Implementations must not modify the dataset and must throw (rather than guess) when a column they
 * need is missing; the engine turns that into a failed CRITICAL result.
 */
public interface RuleCheck {

    /** Pass mask: {@code true} where the row satisfies the check. */
    boolean[] evaluate(Dataset dataset);

    /** Columns the check reads. */
    List<String> columns();

    default boolean passes(boolean[] mask) {
        for (boolean ok : mask) {
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    /** Short human-readable form, e.g. {@code reliability_score in [0, 100]}. */
    String describe();
}
