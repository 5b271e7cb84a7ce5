package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;

public class ReportingException extends EtlException {

    public ReportingException(String message, Throwable cause) {
        super(ErrorKind.REPORTING_ERROR, null, EtlStage.REPORT, message, cause);
    }
}
