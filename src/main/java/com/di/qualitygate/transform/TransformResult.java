package com.di.qualitygate.transform;

import com.di.qualitygate.model.Dataset;

import java.util.List;

/**
 * Output of a full transform pass: the new dataset and one {@link StageStats} per stage, in stage order.
 */
public record TransformResult(Dataset dataset, List<StageStats> stageStats) {

    public TransformResult {
        stageStats = List.copyOf(stageStats);
    }

    public long rowsDropped() {
        return stageStats.stream().mapToLong(StageStats::rowsDropped).sum();
    }

    public long rowsModified() {
        return stageStats.stream().mapToLong(StageStats::rowsModified).sum();
    }

    public long valuesNulled() {
        return stageStats.stream().mapToLong(StageStats::valuesNulled).sum();
    }
}
