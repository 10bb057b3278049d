package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.config.SeverityThresholds;
import com.fantasy.anomaly.engine.AnomalyDetector;
import com.fantasy.anomaly.engine.AnomalyIds;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.SeriesStats;
import com.fantasy.anomaly.engine.TrackedMetric;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyDetails;
import com.fantasy.anomaly.model.AnomalyImpact;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.RecommendedAction;
import com.fantasy.anomaly.model.SensitivityLevel;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.Urgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags a single metric whose latest value deviates from the subject's baseline.
 *
 * Logic: z = |latest - mean| / std. If z exceeds the type's "low" threshold the
 * metric is anomalous; severity comes from the type's severity table.
 *
 * Example: fantasy points [10, 10, 10, 10, 40] against mean=16, std=12 gives
 * z=2.0, above the 1.5 trigger and below the 2.5 medium cut-off, so LOW.
 */
@Component
public class StatisticalDeviationDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDeviationDetector.class);

    private final AnomalyThresholdConfig config;

    public StatisticalDeviationDetector(AnomalyThresholdConfig config) {
        this.config = config;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        Baseline baseline = context.getBaseline();
        if (baseline == null || context.getMetrics() == null) {
            log.debug("No baseline for subject {}, skipping statistical detection", context.getSubjectId());
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            if (!context.getConfig().isEnabled(metric.getType())) {
                continue;
            }
            anomalies.addAll(detect(context.getSubject(),
                    context.getMetrics().series(metric.getSlot()),
                    baseline.meanAt(metric.getSlot()),
                    baseline.stdAt(metric.getSlot()),
                    metric.getType(),
                    metric.getDisplayName(),
                    context.getConfig().getSensitivity(),
                    context.getDetectedAt()));
        }
        return anomalies;
    }

    public List<Anomaly> detect(Subject subject, List<Double> values, double mean, double std,
                                AnomalyType type, String metricName) {
        return detect(subject, values, mean, std, type, metricName, SensitivityLevel.MEDIUM, Instant.now());
    }

    public List<Anomaly> detect(Subject subject, List<Double> values, double mean, double std,
                                AnomalyType type, String metricName,
                                SensitivityLevel sensitivity, Instant now) {
        if (values == null || values.size() < config.getStatistical().getMinSamples()) {
            return List.of();
        }

        double recentValue = SeriesStats.last(values);
        double zScore = zScore(recentValue, mean, std);
        SeverityThresholds thresholds = thresholds(type, sensitivity);

        if (zScore <= thresholds.getLow()) {
            return List.of();
        }

        Severity severity = thresholds.classify(zScore);
        boolean isPositive = recentValue > mean;
        double weight = type == AnomalyType.PERFORMANCE
                ? config.getStatistical().getPerformanceWeight()
                : config.getStatistical().getOtherWeight();

        Anomaly anomaly = Anomaly.builder()
                .id(AnomalyIds.generate(type, subject.getId(), metricName, now))
                .type(type)
                .severity(severity)
                .confidence(Math.min(zScore / config.getStatistical().getConfidenceScale(), 1.0))
                .subjectId(subject.getId())
                .subjectName(subject.getName())
                .teamId(subject.getTeamId())
                .description((isPositive ? "Exceptional " : "Poor ") + metricName)
                .details(AnomalyDetails.builder()
                        .metric(metricName)
                        .expectedValue(mean)
                        .actualValue(recentValue)
                        .deviation(zScore)
                        .historicalContext(String.format("%.1f standard deviations from average", zScore))
                        .build())
                .impact(AnomalyImpact.builder()
                        .projectionDelta((recentValue - mean) * weight)
                        .recommendedAction(recommendedAction(type, severity, isPositive))
                        .urgency(Urgency.forSeverity(severity))
                        .build())
                .timestamp(now)
                .build();
        return List.of(anomaly);
    }

    @Override
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        TrackedMetric metric = TrackedMetric.fromDisplayName(alert.getAnomaly().getDetails().getMetric());
        Baseline baseline = context.getBaseline();
        if (metric == null || baseline == null || context.getMetrics() == null) {
            return false;
        }
        List<Double> values = context.getMetrics().series(metric.getSlot());
        if (values == null || values.size() < config.getStatistical().getMinSamples()) {
            return false;
        }

        double zScore = zScore(SeriesStats.last(values), baseline.meanAt(metric.getSlot()), baseline.stdAt(metric.getSlot()));
        double warning = thresholds(metric.getType(), context.getConfig().getSensitivity()).getLow()
                * config.getLifecycle().getResolutionHysteresis();
        return zScore < warning;
    }

    static RecommendedAction recommendedAction(AnomalyType type, Severity severity, boolean isPositive) {
        switch (type) {
            case PERFORMANCE:
                if (isPositive) {
                    return severity == Severity.CRITICAL ? RecommendedAction.START : RecommendedAction.HOLD;
                }
                return severity == Severity.CRITICAL ? RecommendedAction.BENCH : RecommendedAction.MONITOR;
            case USAGE:
                if (!isPositive && severity != Severity.LOW) {
                    return RecommendedAction.TRADE;
                }
                return RecommendedAction.MONITOR;
            case INJURY:
                return severity == Severity.CRITICAL ? RecommendedAction.BENCH : RecommendedAction.MONITOR;
            default:
                return RecommendedAction.MONITOR;
        }
    }

    private SeverityThresholds thresholds(AnomalyType type, SensitivityLevel sensitivity) {
        SeverityThresholds table = config.thresholdsFor(type);
        return sensitivity == null ? table : table.scaled(sensitivity.getThresholdMultiplier());
    }

    private static double zScore(double value, double mean, double std) {
        double safeStd = std > 0 ? std : 1.0;
        return Math.abs(value - mean) / safeStd;
    }
}
