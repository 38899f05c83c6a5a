package com.dcruver.sheetanalytics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Sheet Analytics.
 *
 * Derives read-only analytical views (summary, Gantt timeline, dependency map,
 * health report and workspace overview) from Smartsheet sheets on demand.
 * Nothing is written back to the source and no view is persisted.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class SheetAnalyticsApplication {

    public static void main(String[] args) {
        log.info("Starting Sheet Analytics...");
        SpringApplication.run(SheetAnalyticsApplication.class, args);
    }
}
