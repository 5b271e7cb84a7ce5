package com.di.qualitygate.exception;

import com.di.qualitygate.model.EtlStage;
import com.di.qualitygate.util.MdcPropagation;
import com.di.qualitygate.util.StageEventLogger;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST endpoints to one JSON error body.
 * <p>
 * Every response carries the {@link ErrorCategory} of the exception; pipeline errors also carry their
 * {@link ErrorKind}, table and stage. Status codes:
 * <ul>
 *   <li>{@link ConnectionFailureException}: 503</li>
 *   <li>{@link ExtractionException}, {@link LoadException}: 502</li>
 *   <li>{@link ValidationFailureException}: 422</li>
 *   <li>bad input ({@link IllegalArgumentException}, unreadable body): 400</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final StageEventLogger eventLogger;

    public GlobalExceptionHandler(StageEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(EtlException.class)
    public ResponseEntity<ErrorResponse> handleEtlException(EtlException e) {
        HttpStatus status = statusFor(e.getKind());
        ErrorCategory category = e.getCategory();
        logError("ETL_EXCEPTION", category, e);
        ErrorResponse body = buildErrorResponse(category, e, status);
        body.addDetail("kind", e.getKind().name());
        if (e.getTable() != null) {
            body.addDetail("table", e.getTable());
        }
        if (e.getStage() != null) {
            body.addDetail("stage", e.getStage().name());
        }
        if (e instanceof ConnectionFailureException cfe) {
            body.addDetail("attempts", cfe.getAttempts());
        }
        if (e instanceof ValidationFailureException vfe) {
            body.addDetail("criticalFailures", vfe.getCriticalFailures().size());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<ErrorResponse> handleSqlException(SQLException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("SQL_EXCEPTION", category, e);
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        body.addDetail("sqlState", e.getSQLState());
        body.addDetail("errorCode", e.getErrorCode());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("BAD_REQUEST", category, e);
        return ResponseEntity.badRequest().body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("CONFLICT", category, e);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(buildErrorResponse(category, e, HttpStatus.CONFLICT));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case CONNECTION_ERROR:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case EXTRACTION_ERROR:
            case LOAD_ERROR:
                return HttpStatus.BAD_GATEWAY;
            case VALIDATION_FAILURE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSFORMATION_ERROR:
            case REPORTING_ERROR:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("handler", "GlobalExceptionHandler");
        context.put("handlerEvent", eventType);
        context.put("errorCategory", category.name());
        context.put("requestPath", requestPath());
        Throwable root = rootCause(exception);
        if (root != exception) {
            context.put("rootCauseType", root.getClass().getSimpleName());
            context.put("rootCauseMessage", root.getMessage());
        }
        EtlStage stage = exception instanceof EtlException etl ? etl.getStage() : null;
        eventLogger.stageFailed(stage, context, exception);
        log.error("GlobalExceptionHandler caught {} [{}]: {}",
                exception.getClass().getSimpleName(), category.getName(), exception.getMessage(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(requestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable root = rootCause(exception);
        if (root != exception) {
            response.addDetail("rootCauseType", root.getClass().getName());
            response.addDetail("rootCauseMessage", root.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String requestPath() {
        String path = MDC.get(MdcPropagation.REQUEST_PATH);
        return path != null ? path : "/unknown";
    }

    /**
     * JSON error body returned by every handler.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            details.put(key, value);
        }
    }
}
