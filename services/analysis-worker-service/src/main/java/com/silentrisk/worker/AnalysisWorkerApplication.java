package com.silentrisk.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Analysis Worker Service Application
 *
 * Consumes risk analysis and strategy validation requests, runs the staged
 * pipelines and reports progress through the commitment cache.
 */
@EnableKafka
@SpringBootApplication(scanBasePackages = {"com.silentrisk.worker", "com.silentrisk.common"})
public class AnalysisWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisWorkerApplication.class, args);
    }
}
