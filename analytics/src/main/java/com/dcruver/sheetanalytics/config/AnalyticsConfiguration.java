package com.dcruver.sheetanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for concurrent per-sheet analysis in workspace rollups.
 */
@Configuration
@Slf4j
public class AnalyticsConfiguration {

    @Value("${analytics.workspace.parallelism:4}")
    private int parallelism;

    @Bean
    public ThreadPoolTaskExecutor sheetAnalysisExecutor() {
        log.info("Creating sheet analysis executor with {} threads", parallelism);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("sheet-analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
