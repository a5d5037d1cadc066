package com.qqsuccubus.egress.node.metrics;

import com.qqsuccubus.egress.core.metrics.MetricsNames;
import com.qqsuccubus.egress.core.metrics.MetricsTags;
import com.qqsuccubus.egress.core.model.EgressStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;

/**
 * Counters and timers of an egress node.
 * <p>
 * CPU and per-type request gauges live in the admission controller, which owns the state they read.
 * </p>
 */
public class MetricsService {

    private final Counter admissionAccepted;
    private final Counter admissionRejected;
    private final Counter jobsStarted;
    private final Counter jobsComplete;
    private final Counter jobsAborted;

    private final Timer requestLatency;
    private final Timer kafkaPublishLatency;

    public MetricsService(MeterRegistry registry) {

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        admissionAccepted = Counter.builder(MetricsNames.ADMISSION_TOTAL)
            .tag(MetricsTags.RESULT, "accepted")
            .description("Start requests admitted")
            .register(registry);

        admissionRejected = Counter.builder(MetricsNames.ADMISSION_TOTAL)
            .tag(MetricsTags.RESULT, "rejected")
            .description("Start requests rejected for lack of cpu")
            .register(registry);

        jobsStarted = Counter.builder(MetricsNames.JOBS_TOTAL)
            .tag(MetricsTags.OUTCOME, "started")
            .register(registry);

        jobsComplete = Counter.builder(MetricsNames.JOBS_TOTAL)
            .tag(MetricsTags.OUTCOME, "complete")
            .register(registry);

        jobsAborted = Counter.builder(MetricsNames.JOBS_TOTAL)
            .tag(MetricsTags.OUTCOME, "aborted")
            .register(registry);

        requestLatency = Timer.builder(MetricsNames.REQUEST_LATENCY)
            .description("Time from request receipt to response publish")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofMillis(1000)
            )
            .register(registry);

        kafkaPublishLatency = Timer.builder(MetricsNames.KAFKA_PUBLISH_LATENCY)
            .tag(MetricsTags.TOPIC, "egress.updates")
            .description("Kafka update publish latency")
            .publishPercentileHistogram()
            .register(registry);
    }

    public void recordAdmission(boolean accepted) {
        if (accepted) {
            admissionAccepted.increment();
            jobsStarted.increment();
        } else {
            admissionRejected.increment();
        }
    }

    /**
     * @param status terminal status the job reached
     */
    public void recordJobEnded(EgressStatus status) {
        if (status == EgressStatus.COMPLETE) {
            jobsComplete.increment();
        } else if (status == EgressStatus.ABORTED) {
            jobsAborted.increment();
        }
    }

    public void recordRequestLatency(long startNanos) {
        requestLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordKafkaPublishLatency(long startNanos) {
        kafkaPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public double getAdmittedCount() {
        return admissionAccepted.count();
    }

    public double getRejectedCount() {
        return admissionRejected.count();
    }

    public double getCompletedCount() {
        return jobsComplete.count();
    }

    public double getAbortedCount() {
        return jobsAborted.count();
    }
}
