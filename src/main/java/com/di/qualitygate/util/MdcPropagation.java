package com.di.qualitygate.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * MDC keys used by the pipeline and helpers to carry them onto worker threads.
 * <p>
 * MDC is thread-local: when tables are processed on an executor, wrap each task with
 * {@link #wrapCallable(Callable)} so its log lines keep the submitting run's {@code runId}.
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String TABLE = "table";
    public static final String STAGE = "stage";
    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_PATH = "requestPath";

    private MdcPropagation() {
    }

    /**
     * Captures the current MDC and returns a Callable that installs it for the duration of the task,
     * then removes those keys.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Sets a key for the lifetime of the returned scope, restoring the previous value on close.
     * <pre>{@code
     * try (MdcPropagation.AutoCloseableMdc ignored = MdcPropagation.scoped(MdcPropagation.STAGE, "LOAD")) { ... }
     * }</pre>
     */
    public static AutoCloseableMdc scoped(String key, String value) {
        String previous = MDC.get(key);
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return () -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        };
    }

    /** Copy of the current MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    /** An {@link AutoCloseable} whose close never throws. */
    @FunctionalInterface
    public interface AutoCloseableMdc extends AutoCloseable {
        @Override
        void close();
    }
}
