package com.fantasy.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeAlertCount;
    private final AtomicInteger unresolvedAlertCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeAlertCount = registry.gauge("anomaly.alerts.active", new AtomicInteger(0));
        this.unresolvedAlertCount = registry.gauge("anomaly.alerts.unresolved", new AtomicInteger(0));
    }

    public void recordAnomalyDetected(String type, String severity, double confidence) {
        Counter.builder("anomaly.detected.count")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();

        DistributionSummary.builder("anomaly.detected.confidence")
                .tag("type", type)
                .register(registry)
                .record(confidence);
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("anomaly.detector.failure.count")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    public void recordSubjectFailure(String stage) {
        Counter.builder("anomaly.subject.failure.count")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordCycle(int subjects, int anomalies, int failedSubjects, Duration elapsed) {
        Timer.builder("anomaly.cycle.duration")
                .register(registry)
                .record(elapsed);

        DistributionSummary.builder("anomaly.cycle.anomalies")
                .register(registry)
                .record(anomalies);

        Counter.builder("anomaly.cycle.subjects.count")
                .tag("outcome", "processed")
                .register(registry)
                .increment(subjects - failedSubjects);

        Counter.builder("anomaly.cycle.subjects.count")
                .tag("outcome", "failed")
                .register(registry)
                .increment(failedSubjects);
    }

    public void recordCycleSkipped() {
        Counter.builder("anomaly.cycle.skipped.count")
                .register(registry)
                .increment();
    }

    public void recordAlertResolved(String resolvedBy) {
        Counter.builder("anomaly.alert.resolved.count")
                .tag("resolved_by", resolvedBy)
                .register(registry)
                .increment();
    }

    public void recordAlertsPurged(int count) {
        Counter.builder("anomaly.alert.purged.count")
                .register(registry)
                .increment(count);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateAlertCounts(int active, int unresolved) {
        activeAlertCount.set(active);
        unresolvedAlertCount.set(unresolved);
    }
}
