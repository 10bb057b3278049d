package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.config.MonitorProperties;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.DetectionEngine;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyBatch;
import com.fantasy.anomaly.model.DetectedAnomaly;
import com.fantasy.anomaly.model.DetectionConfig;
import com.fantasy.anomaly.model.MonitorStatus;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.sink.AlertSink;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives monitoring cycles on a fixed delay.
 *
 * Each cycle fans per-subject detection out on a bounded worker pool, waits for
 * every subject, then on the loop thread canonicalizes ids, correlates, updates
 * the alert store, reconciles, purges and publishes the batch. A cycle never
 * overlaps another; a tick that arrives while one is running is skipped.
 */
@Service
public class MonitoringLoopService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringLoopService.class);

    private final SubjectDetectionService subjectDetectionService;
    private final AlertLifecycleService alertLifecycleService;
    private final AnomalyCorrelator correlator;
    private final DetectionEngine detectionEngine;
    private final AlertSink alertSink;
    private final MonitorProperties properties;
    private final MetricsConfig metricsConfig;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong(0);
    private final AtomicLong skippedTicks = new AtomicLong(0);
    private final AtomicReference<AnomalyBatch> latestBatch = new AtomicReference<>();

    private volatile List<Subject> subjects = List.of();
    private volatile DetectionConfig config;
    private volatile ScheduledFuture<?> scheduledCycle;
    private volatile long startedAt;

    public MonitoringLoopService(SubjectDetectionService subjectDetectionService,
                                 AlertLifecycleService alertLifecycleService,
                                 AnomalyCorrelator correlator,
                                 DetectionEngine detectionEngine,
                                 @Qualifier("anomalyBatchChannel") AlertSink alertSink,
                                 MonitorProperties properties,
                                 MetricsConfig metricsConfig) {
        this.subjectDetectionService = subjectDetectionService;
        this.alertLifecycleService = alertLifecycleService;
        this.correlator = correlator;
        this.detectionEngine = detectionEngine;
        this.alertSink = alertSink;
        this.properties = properties;
        this.metricsConfig = metricsConfig;

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anomaly-monitor-loop");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "anomaly-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (!properties.isAutoStart()) {
            log.info("Monitoring loop auto-start disabled");
            return;
        }
        try {
            start(properties.getSubjects(), properties.toDetectionConfig());
        } catch (MonitorConfigurationException e) {
            log.error("Monitoring loop not started: {}", e.getMessage());
        }
    }

    /**
     * Validate the configuration and schedule cycles every {@code updateFrequencyMinutes},
     * the first one immediately. Starting a running loop replaces its subjects and
     * configuration.
     *
     * @throws MonitorConfigurationException if the configuration cannot be run
     */
    public synchronized void start(List<Subject> subjects, DetectionConfig config) {
        validate(config);

        if (scheduledCycle != null) {
            scheduledCycle.cancel(false);
            log.info("Monitoring loop restarting with new configuration");
        }

        this.subjects = subjects == null ? List.of() : List.copyOf(subjects);
        this.config = config;
        this.startedAt = System.currentTimeMillis();
        this.scheduledCycle = scheduler.scheduleWithFixedDelay(this::scheduledTick,
                0, config.getUpdateFrequencyMinutes(), TimeUnit.MINUTES);

        log.info("Monitoring loop started: subjects={}, every {} min, window={} days, sensitivity={}, types={}",
                this.subjects.size(), config.getUpdateFrequencyMinutes(), config.getWindowSizeDays(),
                config.getSensitivity(), config.getEnabledTypes());
    }

    /**
     * Stop scheduling cycles. A cycle already running completes and publishes its batch.
     */
    public synchronized void stop() {
        if (scheduledCycle == null) {
            return;
        }
        scheduledCycle.cancel(false);
        scheduledCycle = null;
        log.info("Monitoring loop stopped after {} cycles", cycleCounter.get());
    }

    public boolean isRunning() {
        return scheduledCycle != null;
    }

    /**
     * Run one cycle now on the loop thread and wait for it.
     *
     * @return the published batch, or empty if a cycle was already running
     */
    public Optional<AnomalyBatch> runCycleNow() {
        if (cycleInProgress.get()) {
            recordSkippedTick();
            return Optional.empty();
        }
        List<Subject> cycleSubjects = config != null ? subjects : List.copyOf(properties.getSubjects());
        DetectionConfig cycleConfig = config != null ? config : properties.toDetectionConfig();
        validate(cycleConfig);

        try {
            return scheduler.submit(() -> runCycle(cycleSubjects, cycleConfig)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Monitoring cycle failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    public Optional<AnomalyBatch> getLatestBatch() {
        return Optional.ofNullable(latestBatch.get());
    }

    public MonitorStatus getStatus() {
        return MonitorStatus.builder()
                .running(isRunning())
                .cycleInProgress(cycleInProgress.get())
                .subjectCount(subjects.size())
                .config(config)
                .cyclesCompleted(cycleCounter.get())
                .skippedTicks(skippedTicks.get())
                .startedAt(startedAt)
                .lastBatch(latestBatch.get())
                .build();
    }

    // Exceptions must not escape: they would cancel the scheduled task.
    private void scheduledTick() {
        try {
            runCycle(subjects, config);
        } catch (Exception e) {
            log.error("Monitoring cycle failed: {}", e.getMessage(), e);
        }
    }

    Optional<AnomalyBatch> runCycle(List<Subject> cycleSubjects, DetectionConfig cycleConfig) {
        if (!cycleInProgress.compareAndSet(false, true)) {
            recordSkippedTick();
            return Optional.empty();
        }
        try {
            return Optional.of(executeCycle(cycleSubjects, cycleConfig));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Monitoring cycle interrupted");
            return Optional.empty();
        } finally {
            cycleInProgress.set(false);
        }
    }

    private AnomalyBatch executeCycle(List<Subject> cycleSubjects, DetectionConfig cycleConfig)
            throws InterruptedException {
        Instant started = Instant.now();
        long cycleId = cycleCounter.incrementAndGet();

        // 1. Fan out per-subject detection
        List<Callable<SubjectDetection>> tasks = new ArrayList<>(cycleSubjects.size());
        for (Subject subject : cycleSubjects) {
            tasks.add(() -> subjectDetectionService.detect(subject, cycleConfig, started));
        }
        List<Future<SubjectDetection>> futures = workers.invokeAll(tasks);

        List<DetectedAnomaly> detected = new ArrayList<>();
        Map<String, DetectionContext> contexts = new HashMap<>();
        List<String> failedSubjects = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            Subject subject = cycleSubjects.get(i);
            try {
                SubjectDetection outcome = futures.get(i).get();
                detected.addAll(outcome.getResult().getAnomalies());
                contexts.put(subject.getId(), outcome.getContext());
                if (outcome.isDegraded()) {
                    failedSubjects.add(subject.getId());
                }
            } catch (ExecutionException e) {
                metricsConfig.recordSubjectFailure("cycle");
                failedSubjects.add(subject.getId());
                log.error("Detection failed for subject {}: {}", subject.getId(),
                        e.getCause().getMessage(), e.getCause());
            }
        }

        // 2. Stable ids, then correlation over the whole batch
        List<DetectedAnomaly> canonical = alertLifecycleService.canonicalize(detected);
        List<DetectedAnomaly> correlated = correlator.correlateDetected(canonical);

        // 3. Lifecycle
        alertLifecycleService.upsert(correlated, started);
        Set<String> detectedKeys = new HashSet<>();
        for (DetectedAnomaly d : correlated) {
            detectedKeys.add(d.alertKey());
        }
        List<String> resolvedKeys = alertLifecycleService.reconcile(contexts, detectedKeys, started);
        int purged = alertLifecycleService.purge(started);

        // 4. Publish
        List<Anomaly> anomalies = new ArrayList<>(correlated.size());
        for (DetectedAnomaly d : correlated) {
            anomalies.add(d.getAnomaly());
        }
        Instant completed = Instant.now();
        AnomalyBatch batch = AnomalyBatch.builder()
                .cycleId(cycleId)
                .startedAt(started.toEpochMilli())
                .completedAt(completed.toEpochMilli())
                .subjectCount(cycleSubjects.size())
                .anomalies(anomalies)
                .failedSubjects(failedSubjects)
                .resolvedAlertKeys(resolvedKeys)
                .purgedCount(purged)
                .build();

        latestBatch.set(batch);
        metricsConfig.recordCycle(cycleSubjects.size(), anomalies.size(), failedSubjects.size(),
                Duration.between(started, completed));
        log.info("Cycle {} complete: subjects={}, anomalies={}, failed={}, resolved={}, purged={}, took={}ms",
                cycleId, cycleSubjects.size(), anomalies.size(), failedSubjects.size(),
                resolvedKeys.size(), purged, Duration.between(started, completed).toMillis());

        try {
            alertSink.publish(batch);
        } catch (Exception e) {
            log.error("Failed to publish batch for cycle {}: {}", cycleId, e.getMessage(), e);
        }
        return batch;
    }

    private void validate(DetectionConfig config) {
        if (config == null) {
            throw new MonitorConfigurationException("Detection config is required");
        }
        if (config.getUpdateFrequencyMinutes() <= 0) {
            throw new MonitorConfigurationException(
                    "updateFrequencyMinutes must be positive, got " + config.getUpdateFrequencyMinutes());
        }
        if (config.getWindowSizeDays() <= 0) {
            throw new MonitorConfigurationException(
                    "windowSizeDays must be positive, got " + config.getWindowSizeDays());
        }
        if (!detectionEngine.supportsAny(config.getEnabledTypes())) {
            throw new MonitorConfigurationException(
                    "No detector available for enabled types " + config.getEnabledTypes()
                            + "; supported: " + detectionEngine.supportedTypes());
        }
    }

    private void recordSkippedTick() {
        skippedTicks.incrementAndGet();
        metricsConfig.recordCycleSkipped();
        log.warn("Monitoring tick skipped: previous cycle still in progress");
    }

    @PreDestroy
    public void shutdown() {
        stop();
        scheduler.shutdownNow();
        workers.shutdownNow();
    }
}
