package com.di.qualitygate.validate;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structural expectations for a table checked by the built-in validator.
 * An empty {@code primaryKey} falls back to the key columns the extractor discovered.
 */
@Value
@Builder
public class TableValidationSpec {

    String table;
    @Builder.Default
    List<String> requiredColumns = List.of();
    @Builder.Default
    List<String> primaryKey = List.of();
    @Builder.Default
    List<ForeignKey> foreignKeys = List.of();

    public static TableValidationSpec empty(String table) {
        return TableValidationSpec.builder().table(table).build();
    }
}
