package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.DetectionEngine;
import com.fantasy.anomaly.engine.DetectionResult;
import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.model.DetectionConfig;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.HealthData;
import com.fantasy.anomaly.model.MarketData;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.SubjectMetrics;
import com.fantasy.anomaly.provider.HealthDataProvider;
import com.fantasy.anomaly.provider.MarketDataProvider;
import com.fantasy.anomaly.provider.MetricsProvider;
import com.fantasy.anomaly.provider.ProviderFetchException;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs one subject through the pipeline: fetch provider data, apply the window,
 * resolve the baseline and run every enabled detector.
 *
 * A failed provider only disables the detectors that need its data. The subject
 * is then reported as degraded, but whatever the remaining detectors found is kept.
 */
@Service
public class SubjectDetectionService {

    private static final Logger log = LoggerFactory.getLogger(SubjectDetectionService.class);

    private final MetricsProvider metricsProvider;
    private final MarketDataProvider marketDataProvider;
    private final HealthDataProvider healthDataProvider;
    private final BaselineService baselineService;
    private final DetectionEngine detectionEngine;
    private final MetricsConfig metricsConfig;

    public SubjectDetectionService(MetricsProvider metricsProvider,
                                   MarketDataProvider marketDataProvider,
                                   HealthDataProvider healthDataProvider,
                                   BaselineService baselineService,
                                   DetectionEngine detectionEngine,
                                   MetricsConfig metricsConfig) {
        this.metricsProvider = metricsProvider;
        this.marketDataProvider = marketDataProvider;
        this.healthDataProvider = healthDataProvider;
        this.baselineService = baselineService;
        this.detectionEngine = detectionEngine;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "subject.detect", contextualName = "detect-subject-anomalies")
    public SubjectDetection detect(Subject subject, DetectionConfig config, Instant now) {
        List<String> errors = new ArrayList<>();
        boolean needsMetrics = DetectorKind.STATISTICAL.isEnabled(config.getEnabledTypes())
                || DetectorKind.TREND.isEnabled(config.getEnabledTypes())
                || DetectorKind.PATTERN.isEnabled(config.getEnabledTypes());

        SubjectMetrics metrics = needsMetrics
                ? fetch("metrics", subject, metricsProvider::get, errors)
                : null;
        MarketData marketData = DetectorKind.MARKET.isEnabled(config.getEnabledTypes())
                ? fetch("market", subject, marketDataProvider::get, errors)
                : null;
        HealthData healthData = DetectorKind.INJURY_RISK.isEnabled(config.getEnabledTypes())
                ? fetch("health", subject, healthDataProvider::get, errors)
                : null;

        SubjectMetrics windowed = metrics == null ? null : metrics.window(config.getWindowSizeDays());
        Baseline baseline = windowed == null
                ? null
                : baselineService.getOrCreate(subject.getId(), windowed).orElse(null);

        DetectionContext context = DetectionContext.builder()
                .subject(subject)
                .metrics(windowed)
                .baseline(baseline)
                .marketData(marketData)
                .healthData(healthData)
                .config(config)
                .detectedAt(now)
                .build();

        DetectionResult result = detectionEngine.detectAll(context);
        if (!result.isSuccess()) {
            metricsConfig.recordSubjectFailure("detector");
            errors.addAll(result.getErrorMessages());
        }

        return SubjectDetection.builder()
                .subject(subject)
                .context(context)
                .result(result)
                .errors(errors)
                .build();
    }

    private <T> T fetch(String provider, Subject subject, Function<String, T> call, List<String> errors) {
        try {
            return call.apply(subject.getId());
        } catch (Exception e) {
            ProviderFetchException failure = e instanceof ProviderFetchException pfe
                    ? pfe
                    : new ProviderFetchException(provider, subject.getId(), e);
            metricsConfig.recordSubjectFailure(provider);
            log.error("Provider {} failed for subject {}: {}", provider, subject.getId(), failure.getMessage(), failure);
            errors.add(failure.getMessage());
            return null;
        }
    }
}
