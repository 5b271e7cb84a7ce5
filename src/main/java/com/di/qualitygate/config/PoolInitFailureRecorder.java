package com.di.qualitygate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool creation failures seen at startup, by pool key, so the pool endpoint can report why no pool exists.
 */
public class PoolInitFailureRecorder {

    private final Map<String, String> failuresByPool = new ConcurrentHashMap<>();

    public void record(String poolKey, String message) {
        if (poolKey != null && message != null) {
            failuresByPool.put(poolKey, message);
        }
    }

    public boolean hasFailures() {
        return !failuresByPool.isEmpty();
    }

    public Map<String, String> getAllFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failuresByPool));
    }
}
