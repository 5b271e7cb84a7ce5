package com.di.qualitygate.util;

import com.di.qualitygate.model.EtlStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Emits one structured JSON line per pipeline milestone (run started/finished, stage started/completed/failed).
 * <p>
 * Correlation comes from MDC ({@code runId}, {@code table}); each event also records the thread so
 * parallel table processing can be untangled from a single log file.
 */
@Slf4j
@Component
public class StageEventLogger {

    public static final String RUN_STARTED = "RUN_STARTED";
    public static final String RUN_COMPLETED = "RUN_COMPLETED";
    public static final String STAGE_STARTED = "STAGE_STARTED";
    public static final String STAGE_COMPLETED = "STAGE_COMPLETED";
    public static final String STAGE_FAILED = "STAGE_FAILED";
    public static final String STAGE_WARNING = "STAGE_WARNING";

    private static final int STACK_SUMMARY_LINES = 5;

    private final String applicationId;
    private final ObjectMapper objectMapper;

    public StageEventLogger(@Value("${spring.application.name:qualitygate-etl}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void stageStarted(EtlStage stage, Map<String, Object> context) {
        logEvent(STAGE_STARTED, stage, context, null);
    }

    public void stageCompleted(EtlStage stage, Map<String, Object> context) {
        logEvent(STAGE_COMPLETED, stage, context, null);
    }

    public void stageFailed(EtlStage stage, Map<String, Object> context, Throwable error) {
        logEvent(STAGE_FAILED, stage, context, error);
    }

    public void stageWarning(EtlStage stage, Map<String, Object> context, Throwable error) {
        logEvent(STAGE_WARNING, stage, context, error);
    }

    /**
     * Builds the event and writes it as a single {@code [EVENT]} line. Returns the JSON for callers that need it.
     */
    public String logEvent(String eventType, EtlStage stage, Map<String, Object> context, Throwable error) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now());
        event.put("applicationId", applicationId);
        event.put("runId", MDC.get(MdcPropagation.RUN_ID));
        event.put("table", MDC.get(MdcPropagation.TABLE));
        if (stage != null) {
            event.put("stage", stage.name());
        }
        event.put("threadName", Thread.currentThread().getName());
        if (context != null && !context.isEmpty()) {
            event.put("context", context);
        }
        if (error != null) {
            event.put("errorType", error.getClass().getSimpleName());
            event.put("errorMessage", error.getMessage());
            event.put("stackTraceSummary", stackTraceSummary(error));
        }

        String json = toJson(event);
        if (STAGE_FAILED.equals(eventType)) {
            log.warn("[EVENT] {}", json);
        } else {
            log.info("[EVENT] {}", json);
        }
        return json;
    }

    private String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("Event not serializable, falling back to toString: {}", e.getMessage());
            return event.toString();
        }
    }

    private static String stackTraceSummary(Throwable error) {
        return Arrays.stream(error.getStackTrace())
                .limit(STACK_SUMMARY_LINES)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining(" | "));
    }
}
