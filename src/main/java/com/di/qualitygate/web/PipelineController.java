package com.di.qualitygate.web;

import com.di.qualitygate.config.EtlProperties;
import com.di.qualitygate.config.PoolInitFailureRecorder;
import com.di.qualitygate.connection.ConnectionManager;
import com.di.qualitygate.pipeline.EtlPipeline;
import com.di.qualitygate.pipeline.ExecutionStats;
import com.di.qualitygate.rules.DataQualityRulesEngine;
import com.di.qualitygate.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST trigger over the pipeline.
 * <ul>
 *   <li>{@code POST /api/etl/runs}: runs synchronously, returns the execution stats</li>
 *   <li>{@code POST /api/etl/runs/cancel}: stops the runs in progress before their next table</li>
 *   <li>{@code GET /api/etl/rules/{table}}: registered rules of a table</li>
 *   <li>{@code GET /api/etl/pool}: connection pool statistics and startup failures</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/etl")
@RequiredArgsConstructor
public class PipelineController {

    private final EtlPipeline pipeline;
    private final DataQualityRulesEngine rulesEngine;
    private final ConnectionManager connectionManager;
    private final PoolInitFailureRecorder poolInitFailureRecorder;
    private final EtlProperties properties;

    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExecutionStats> run(@RequestBody(required = false) RunRequest request) {
        List<String> tables = request != null && request.getTables() != null && !request.getTables().isEmpty()
                ? request.getTables() : properties.getTables();
        tables.forEach(InputValidator::validateTableName);
        boolean validation = request != null && request.getEnableValidation() != null
                ? request.getEnableValidation() : properties.isEnableValidation();
        boolean transformation = request != null && request.getEnableTransformation() != null
                ? request.getEnableTransformation() : properties.isEnableTransformation();
        log.info("[PIPELINE] Run requested over REST | tables={} | validation={} | transformation={}",
                tables, validation, transformation);
        return ResponseEntity.ok(pipeline.runFullPipeline(tables, validation, transformation));
    }

    @PostMapping(value = "/runs/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> cancel() {
        int signalled = pipeline.requestCancellation();
        return ResponseEntity.accepted().body(Map.of("cancellationRequested", true, "runsSignalled", signalled));
    }

    @GetMapping(value = "/rules/{table}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RuleView>> rules(@PathVariable("table") String table) {
        InputValidator.validateTableName(table);
        return ResponseEntity.ok(rulesEngine.getRules(table).stream().map(RuleView::of).toList());
    }

    @GetMapping(value = "/pool", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> pool() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stats", connectionManager.poolStats());
        if (poolInitFailureRecorder.hasFailures()) {
            body.put("initFailures", poolInitFailureRecorder.getAllFailures());
        }
        return ResponseEntity.ok(body);
    }
}
