package com.di.qualitygate;

import com.di.qualitygate.config.EtlProperties;
import com.di.qualitygate.pipeline.EtlPipeline;
import com.di.qualitygate.pipeline.ExecutionStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class QualityGateApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(QualityGateApplication.class, args);
        EtlProperties properties = ctx.getBean(EtlProperties.class);
        // Otherwise runs are triggered through POST /api/etl/runs
        if (properties.isRunOnStartup()) {
            ExecutionStats stats = ctx.getBean(EtlPipeline.class).runFullPipeline();
            log.info("[PIPELINE] Startup run complete: {}", stats);
        }
    }
}
