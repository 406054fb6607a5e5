package com.silentrisk.worker.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Anonymous pipeline metrics. Tags carry the pipeline name and the outcome,
 * never a task id, commitment or score.
 */
@Component
@RequiredArgsConstructor
public class PipelineMetrics {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String REDELIVERED = "redelivered";
    public static final String SKIPPED = "skipped";
    public static final String DEAD_LETTERED = "dead_lettered";

    private final MeterRegistry meterRegistry;

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    public void stop(Timer.Sample sample, String pipeline, String outcome) {
        sample.stop(Timer.builder("silentrisk.pipeline.duration")
                .description("Pipeline execution time")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(meterRegistry));
        record(pipeline, outcome);
    }

    public void record(String pipeline, String outcome) {
        Counter.builder("silentrisk.pipeline.tasks")
                .description("Pipeline executions by outcome")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void resultPublishFailed(String pipeline) {
        Counter.builder("silentrisk.pipeline.result_publish_failures")
                .description("Results that exhausted publish retries")
                .tag("pipeline", pipeline)
                .register(meterRegistry)
                .increment();
    }

    public void passportFailed() {
        Counter.builder("silentrisk.pipeline.passport_failures")
                .description("Risk analyses completed without passport metadata")
                .register(meterRegistry)
                .increment();
    }
}
