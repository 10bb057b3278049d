package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
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
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.RecommendedAction;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.Urgency;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects a sustained directional run over the most recent samples.
 *
 * Logic: with at least 5 samples, the last 3 must be strictly increasing or strictly
 * decreasing (any tie aborts). changeRate = |last - first| / first over that window;
 * the run is flagged when changeRate >= 0.3, MEDIUM above 0.5, otherwise LOW.
 */
@Component
public class TrendDetector implements AnomalyDetector {

    static final String TREND_SUFFIX = " Trend";

    private final AnomalyThresholdConfig config;

    public TrendDetector(AnomalyThresholdConfig config) {
        this.config = config;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.TREND;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        if (context.getMetrics() == null) {
            return List.of();
        }
        List<Anomaly> anomalies = new ArrayList<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            if (!context.getConfig().isEnabled(metric.getType())) {
                continue;
            }
            detectTrend(context.getSubject(), context.getMetrics().series(metric.getSlot()),
                    metric.getDisplayName(), context.getDetectedAt())
                    .ifPresent(anomalies::add);
        }
        return anomalies;
    }

    public Optional<Anomaly> detectTrend(List<Double> values) {
        return detectTrend(Subject.builder().build(), values, TrackedMetric.FANTASY_POINTS.getDisplayName(), Instant.now());
    }

    public Optional<Anomaly> detectTrend(Subject subject, List<Double> values, String sourceMetric, Instant now) {
        AnomalyThresholdConfig.Trend trend = config.getTrend();
        if (values == null || values.size() < trend.getMinSamples()) {
            return Optional.empty();
        }

        List<Double> window = SeriesStats.lastN(values, trend.getWindow());
        int direction = direction(window);
        if (direction == 0) {
            return Optional.empty();
        }

        double first = window.get(0);
        double last = window.get(window.size() - 1);
        if (first == 0) {
            return Optional.empty();
        }
        double changeRate = Math.abs((last - first) / first);
        if (changeRate < trend.getMinChangeRate()) {
            return Optional.empty();
        }

        boolean increasing = direction > 0;
        String metricName = sourceMetric + TREND_SUFFIX;
        String subjectId = subject.getId();

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.generate(AnomalyType.PERFORMANCE, subjectId == null ? "unknown" : subjectId, metricName, now))
                .type(AnomalyType.PERFORMANCE)
                .severity(changeRate > trend.getMediumChangeRate() ? Severity.MEDIUM : Severity.LOW)
                .confidence(trend.getConfidence())
                .subjectId(subjectId)
                .subjectName(subject.getName())
                .teamId(subject.getTeamId())
                .description((increasing ? "Upward" : "Downward") + " trend detected in " + sourceMetric)
                .details(AnomalyDetails.builder()
                        .metric(metricName)
                        .expectedValue(first)
                        .actualValue(last)
                        .deviation(changeRate)
                        .historicalContext(String.format("%.0f%% change over %d periods",
                                changeRate * 100, window.size()))
                        .build())
                .impact(AnomalyImpact.builder()
                        .projectionDelta((increasing ? 1 : -1) * changeRate * trend.getProjectionMultiplier())
                        .recommendedAction(increasing ? RecommendedAction.START : RecommendedAction.MONITOR)
                        .urgency(Urgency.THIS_WEEK)
                        .build())
                .timestamp(now)
                .build());
    }

    @Override
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        String metricName = alert.getAnomaly().getDetails().getMetric();
        if (context.getMetrics() == null || !metricName.endsWith(TREND_SUFFIX)) {
            return false;
        }
        TrackedMetric source = TrackedMetric.fromDisplayName(
                metricName.substring(0, metricName.length() - TREND_SUFFIX.length()));
        if (source == null) {
            return false;
        }

        AnomalyThresholdConfig.Trend trend = config.getTrend();
        List<Double> values = context.getMetrics().series(source.getSlot());
        if (values == null || values.size() < trend.getMinSamples()) {
            return false;
        }

        List<Double> window = SeriesStats.lastN(values, trend.getWindow());
        AnomalyDetails details = alert.getAnomaly().getDetails();
        int alertDirection = details.getActualValue() > details.getExpectedValue() ? 1 : -1;
        if (direction(window) != alertDirection) {
            return true;
        }

        double first = window.get(0);
        if (first == 0) {
            return false;
        }
        double changeRate = Math.abs((window.get(window.size() - 1) - first) / first);
        return changeRate < trend.getMinChangeRate() * config.getLifecycle().getResolutionHysteresis();
    }

    // 1 for strictly increasing, -1 for strictly decreasing, 0 otherwise
    private static int direction(List<Double> window) {
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < window.size(); i++) {
            if (window.get(i) <= window.get(i - 1)) increasing = false;
            if (window.get(i) >= window.get(i - 1)) decreasing = false;
        }
        if (increasing) return 1;
        if (decreasing) return -1;
        return 0;
    }
}
