package com.di.qualitygate.model;

/**
 * Pipeline stages, used for failure attribution, MDC and log prefixes.
 */
public enum EtlStage {
    CONNECT("[POOL]"),
    EXTRACT("[EXTRACT]"),
    TRANSFORM("[TRANSFORM]"),
    VALIDATE("[VALIDATE]"),
    PROFILE("[PROFILE]"),
    ANOMALY("[ANOMALY]"),
    LOAD("[LOAD]"),
    REPORT("[REPORT]");

    private final String logTag;

    EtlStage(String logTag) {
        this.logTag = logTag;
    }

    public String logTag() {
        return logTag;
    }
}
