package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;

/**
 * Base of all pipeline errors. Carries the error kind, and where known the table and stage it was raised in.
 */
public class EtlException extends RuntimeException {

    private final ErrorKind kind;
    private final String table;
    private final EtlStage stage;

    public EtlException(ErrorKind kind, String table, EtlStage stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.table = table;
        this.stage = stage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getTable() {
        return table;
    }

    public EtlStage getStage() {
        return stage;
    }

    public ErrorCategory getCategory() {
        return ErrorCategory.categorize(getCause() != null ? getCause() : this);
    }
}
