package com.di.qualitygate.validate;

/**
 * A child column whose values must exist in a parent table's key column.
 */
public record ForeignKey(String column, String parentTable, String parentColumn) {

    public static ForeignKey to(String column, String parentTable) {
        return new ForeignKey(column, parentTable, column);
    }

    public String referenceKey() {
        return parentTable + "." + parentColumn;
    }
}
