package com.di.qualitygate.load;

import com.di.qualitygate.exception.ErrorCategory;

/**
 * A row that did not reach the destination.
 *
 * @param rowIndex      index of the row in the dataset handed to the loader
 * @param rowIdentifier key column values, or {@code row#<index>} without keys
 * @param batchIndex    1-based number of the batch the row belonged to
 */
public record RowFailure(int rowIndex, String rowIdentifier, int batchIndex, String reason, ErrorCategory category) {
}
