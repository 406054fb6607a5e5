package com.silentrisk.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Analysis API Service Application
 *
 * Verifies wallet ownership, serves cached assessments by commitment and
 * queues new risk analysis and strategy validation tasks for the workers.
 */
@SpringBootApplication(scanBasePackages = {"com.silentrisk.api", "com.silentrisk.common"})
public class AnalysisApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisApiApplication.class, args);
    }
}
