package com.di.qualitygate.config;

import com.di.qualitygate.anomaly.AnomalyConfig;
import com.di.qualitygate.anomaly.AnomalyDetector;
import com.di.qualitygate.connection.ConnectionManager;
import com.di.qualitygate.extract.DataExtractor;
import com.di.qualitygate.load.DataLoader;
import com.di.qualitygate.pipeline.EtlPipeline;
import com.di.qualitygate.profile.DataProfiler;
import com.di.qualitygate.report.DataQualityReporter;
import com.di.qualitygate.rules.DataQualityRulesEngine;
import com.di.qualitygate.transform.DataTransformer;
import com.di.qualitygate.util.EtlMetricsCollector;
import com.di.qualitygate.util.StageEventLogger;
import com.di.qualitygate.validate.DataQualityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pipeline components from {@link EtlProperties}. Each component gets its settings through its
 * constructor; the connection pool lives and dies with this context.
 */
@Slf4j
@Configuration
public class EtlConfiguration {

    static final String SOURCE_POOL = "source";

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PoolInitFailureRecorder poolInitFailureRecorder() {
        return new PoolInitFailureRecorder();
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(EtlProperties properties, EtlMetricsCollector metrics,
                                               PoolInitFailureRecorder failureRecorder) {
        ConnectionManager manager = new ConnectionManager(properties.toDbConfigSnapshot(), properties.toRetryPolicy())
                .onRetry(metrics::recordConnectionRetry);
        if (manager.getInitFailure() != null) {
            failureRecorder.record(SOURCE_POOL, manager.getInitFailure());
            log.error("[POOL] Connection pool unavailable: {}", manager.getInitFailure());
        }
        return manager;
    }

    @Bean
    public DataExtractor dataExtractor(ConnectionManager connectionManager) {
        return new DataExtractor(connectionManager);
    }

    @Bean
    public DataTransformer dataTransformer() {
        return new DataTransformer();
    }

    @Bean
    public DataQualityValidator dataQualityValidator(EtlProperties properties, Clock clock) {
        return new DataQualityValidator(properties.getNullThreshold(), properties.getDuplicateThreshold(), clock);
    }

    @Bean
    public DataQualityRulesEngine dataQualityRulesEngine(Clock clock) {
        DataQualityRulesEngine engine = new DataQualityRulesEngine(clock);
        engine.defineStandardRules();
        return engine;
    }

    @Bean
    public DataProfiler dataProfiler() {
        return new DataProfiler();
    }

    @Bean
    public AnomalyDetector anomalyDetector(EtlProperties properties) {
        return new AnomalyDetector(toAnomalyConfig(properties));
    }

    @Bean
    public DataLoader dataLoader(EtlProperties properties, ConnectionManager connectionManager, Clock clock) {
        return new DataLoader(connectionManager, properties.getBatchSize(), properties.isBackupBeforeLoad(),
                properties.isBackupMandatory(), properties.getLoadMode(), clock);
    }

    @Bean
    public DataQualityReporter dataQualityReporter(Clock clock) {
        return new DataQualityReporter(clock);
    }

    @Bean
    public EtlPipeline etlPipeline(EtlProperties properties, DataExtractor extractor, DataTransformer transformer,
                                   DataQualityValidator validator, DataQualityRulesEngine rulesEngine,
                                   DataProfiler profiler, AnomalyDetector anomalyDetector, DataLoader loader,
                                   DataQualityReporter reporter, StageEventLogger eventLogger,
                                   EtlMetricsCollector metrics, Clock clock) {
        return new EtlPipeline(properties, extractor, transformer, validator, rulesEngine, profiler,
                anomalyDetector, loader, reporter, eventLogger, metrics, clock);
    }

    static AnomalyConfig toAnomalyConfig(EtlProperties properties) {
        return new AnomalyConfig(properties.getIqrMultiplier(), properties.getZscoreThreshold(),
                properties.getIsolationForestSeed(), properties.getIsolationForestTrees(),
                properties.getContamination(), properties.getMinDistinctValues(), properties.getAnomalyColumns());
    }
}
