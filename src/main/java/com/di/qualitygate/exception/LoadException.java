package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;

public class LoadException extends EtlException {

    public LoadException(String table, String message, Throwable cause) {
        super(ErrorKind.LOAD_ERROR, table, EtlStage.LOAD, message, cause);
    }

    public LoadException(String table, String message) {
        this(table, message, null);
    }
}
