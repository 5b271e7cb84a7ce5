package com.di.qualitygate.exception;

/**
 * Pipeline error kinds. Fatality is decided by the orchestrator: connection errors are retried
 * first, validation failures only gate a table under the reject-on-critical policy, and
 * reporting errors never fail a run.
 */
public enum ErrorKind {
    CONNECTION_ERROR,
    EXTRACTION_ERROR,
    TRANSFORMATION_ERROR,
    VALIDATION_FAILURE,
    LOAD_ERROR,
    REPORTING_ERROR
}
