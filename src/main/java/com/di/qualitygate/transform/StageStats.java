package com.di.qualitygate.transform;

/**
 * What one transform stage did to a dataset.
 *
 * @param rowsModified rows with at least one changed value
 * @param rowsDropped  rows removed
 * @param valuesNulled values replaced by null (unparsable dates)
 */
public record StageStats(TransformStage stage, long rowsModified, long rowsDropped, long valuesNulled) {

    public static StageStats skipped(TransformStage stage) {
        return new StageStats(stage, 0, 0, 0);
    }

    /** Totals of two runs of the same stage. */
    public StageStats plus(StageStats other) {
        return new StageStats(stage, rowsModified + other.rowsModified, rowsDropped + other.rowsDropped,
                valuesNulled + other.valuesNulled);
    }

    public boolean changedAnything() {
        return rowsModified > 0 || rowsDropped > 0 || valuesNulled > 0;
    }
}
