package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;

public class ExtractionException extends EtlException {

    public ExtractionException(String table, String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_ERROR, table, EtlStage.EXTRACT, message, cause);
    }

    public ExtractionException(String table, String message) {
        this(table, message, null);
    }
}
