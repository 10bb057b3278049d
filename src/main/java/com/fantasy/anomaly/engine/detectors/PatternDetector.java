package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.engine.AnomalyDetector;
import com.fantasy.anomaly.engine.AnomalyIds;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.model.FeatureExtractor;
import com.fantasy.anomaly.engine.model.ModelInferenceException;
import com.fantasy.anomaly.engine.model.ReconstructionModel;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyDetails;
import com.fantasy.anomaly.model.AnomalyImpact;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.RecommendedAction;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.SubjectMetrics;
import com.fantasy.anomaly.model.Urgency;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Multi-metric detector built on a reconstruction model.
 *
 * The pattern detector catches anomalies where each metric is individually
 * borderline-normal but the combination does not fit the learned shape.
 * This complements the statistical detector which checks single metrics.
 *
 * Scoring:
 *   error = MSE(features, encodeDecode(features)).
 *   error > 0.3 flags MEDIUM with confidence = error; error > 0.5 flags HIGH
 *   with confidence capped at 1.0.
 */
@Component
public class PatternDetector implements AnomalyDetector {

    public static final String METRIC_NAME = "Performance Pattern";

    private final ReconstructionModel model;
    private final AnomalyThresholdConfig config;

    public PatternDetector(ReconstructionModel model, AnomalyThresholdConfig config) {
        this.model = model;
        this.config = config;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.PATTERN;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        if (context.getMetrics() == null) {
            return List.of();
        }
        return detectComplex(context.getSubject(), context.getMetrics(), context.getDetectedAt())
                .map(List::of)
                .orElse(List.of());
    }

    public Optional<Anomaly> detectComplex(Subject subject, SubjectMetrics metrics, Instant now) {
        AnomalyThresholdConfig.Pattern pattern = config.getPattern();
        double error = reconstructionError(metrics);

        if (error <= pattern.getTriggerError()) {
            return Optional.empty();
        }

        Severity severity = error > pattern.getHighError() ? Severity.HIGH : Severity.MEDIUM;

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.generate(AnomalyType.PERFORMANCE, subject.getId(), METRIC_NAME, now))
                .type(AnomalyType.PERFORMANCE)
                .severity(severity)
                .confidence(Math.min(error, 1.0))
                .subjectId(subject.getId())
                .subjectName(subject.getName())
                .teamId(subject.getTeamId())
                .description("Unusual performance pattern detected")
                .details(AnomalyDetails.builder()
                        .metric(METRIC_NAME)
                        .expectedValue(pattern.getExpectedError())
                        .actualValue(error)
                        .deviation(error - pattern.getExpectedError())
                        .historicalContext("Multiple metrics showing unusual correlation")
                        .build())
                .impact(AnomalyImpact.builder()
                        .projectionDelta(-error * pattern.getProjectionMultiplier())
                        .recommendedAction(RecommendedAction.MONITOR)
                        .urgency(Urgency.THIS_WEEK)
                        .build())
                .timestamp(now)
                .build());
    }

    @Override
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        if (context.getMetrics() == null) {
            return false;
        }
        double error = reconstructionError(context.getMetrics());
        return error < config.getPattern().getTriggerError() * config.getLifecycle().getResolutionHysteresis();
    }

    double reconstructionError(SubjectMetrics metrics) {
        AnomalyThresholdConfig.Pattern pattern = config.getPattern();
        double[] features = FeatureExtractor.patternFeatures(metrics, pattern.getRecentSamples(), pattern.getFeatureLength());

        double[] reconstructed;
        try {
            reconstructed = model.encodeDecode(features);
        } catch (ModelInferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInferenceException("Reconstruction model failed: " + e.getMessage(), e);
        }

        if (reconstructed == null || reconstructed.length != features.length) {
            throw new ModelInferenceException(String.format(
                    "Reconstruction model returned %s values, expected %d",
                    reconstructed == null ? "no" : String.valueOf(reconstructed.length), features.length));
        }

        double error = FeatureExtractor.reconstructionError(features, reconstructed);
        if (!Double.isFinite(error)) {
            throw new ModelInferenceException("Reconstruction error is not finite: " + error);
        }
        return error;
    }
}
