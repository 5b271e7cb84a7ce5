package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.transform.TransformStage;

/**
 * A transform stage failed. {@link #getTransformStage()} names which one.
 */
public class TransformationException extends EtlException {

    private final TransformStage transformStage;

    public TransformationException(String table, TransformStage transformStage, String message, Throwable cause) {
        super(ErrorKind.TRANSFORMATION_ERROR, table, EtlStage.TRANSFORM,
                "[" + transformStage + "] " + message, cause);
        this.transformStage = transformStage;
    }

    public TransformationException(String table, TransformStage transformStage, String message) {
        this(table, transformStage, message, null);
    }

    public TransformStage getTransformStage() {
        return transformStage;
    }
}
