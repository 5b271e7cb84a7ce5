package com.di.qualitygate.transform;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-table transform configuration.
 * <p>
 * Columns without an entry in {@code nullStrategies} get {@link NullStrategy#DROP_ROW} when declared
 * non-nullable, otherwise {@code defaultNullStrategy}. A {@code null} {@code dateColumns} list means
 * auto-detection (temporal columns and string columns whose name contains "date").
 */
@Value
@Builder(toBuilder = true)
public class TableTransformSpec {

    String table;
    @Builder.Default
    Map<String, NullHandling> nullStrategies = Map.of();
    @Builder.Default
    NullStrategy defaultNullStrategy = NullStrategy.NONE;
    /** Empty means the whole row is the duplicate key. */
    @Builder.Default
    List<String> dedupKeys = List.of();
    @Builder.Default
    DuplicateKeep keep = DuplicateKeep.FIRST;
    List<String> dateColumns;
    @Builder.Default
    List<DerivedColumn> derivedColumns = List.of();
    @Builder.Default
    List<BusinessRuleTransform> businessRules = List.of();
    @Builder.Default
    Set<TransformStage> enabledStages = EnumSet.allOf(TransformStage.class);

    public static TableTransformSpec defaults(String table) {
        return TableTransformSpec.builder().table(table).build();
    }

    public boolean isEnabled(TransformStage stage) {
        return enabledStages.contains(stage);
    }
}
