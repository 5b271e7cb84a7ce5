package com.di.qualitygate.load;

import com.di.qualitygate.model.LoadOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LoadResult {

    String destination;
    long rowsLoaded;
    long rowsFailed;
    int batchesCommitted;
    int batchesFailed;
    @Builder.Default
    List<RowFailure> rowFailures = List.of();
    /** Name of the backup table, or null when no backup was taken. */
    String backupTable;
    /** Why the backup failed, or null. */
    String backupError;
    long durationMs;

    public LoadOutcome outcome() {
        if (batchesFailed == 0) {
            return LoadOutcome.FULL;
        }
        return batchesCommitted == 0 ? LoadOutcome.NONE : LoadOutcome.PARTIAL;
    }
}
