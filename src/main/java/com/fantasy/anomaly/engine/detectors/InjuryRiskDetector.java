package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.engine.AnomalyDetector;
import com.fantasy.anomaly.engine.AnomalyIds;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.model.FeatureExtractor;
import com.fantasy.anomaly.engine.model.ModelInferenceException;
import com.fantasy.anomaly.engine.model.SequenceRiskModel;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyDetails;
import com.fantasy.anomaly.model.AnomalyImpact;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.HealthData;
import com.fantasy.anomaly.model.PracticeParticipation;
import com.fantasy.anomaly.model.RecommendedAction;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.Urgency;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Converts the risk model's score for a subject's health history into an
 * injury anomaly. Only scores classified above LOW on the injury table are
 * reported.
 */
@Component
public class InjuryRiskDetector implements AnomalyDetector {

    public static final String METRIC_NAME = "Injury Risk Score";

    private final SequenceRiskModel model;
    private final AnomalyThresholdConfig config;

    public InjuryRiskDetector(SequenceRiskModel model, AnomalyThresholdConfig config) {
        this.model = model;
        this.config = config;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.INJURY_RISK;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        if (context.getHealthData() == null) {
            return List.of();
        }
        return detectInjuryRisk(context.getSubject(), context.getHealthData(), context.getDetectedAt())
                .map(List::of)
                .orElse(List.of());
    }

    public Optional<Anomaly> detectInjuryRisk(Subject subject, HealthData health, Instant now) {
        double riskScore = riskScore(health);
        Severity severity = config.getInjury().classify(riskScore);
        if (severity == Severity.LOW) {
            return Optional.empty();
        }

        AnomalyThresholdConfig.Injury injury = config.getInjuryDetector();
        boolean critical = severity == Severity.CRITICAL;

        return Optional.of(Anomaly.builder()
                .id(AnomalyIds.generate(AnomalyType.INJURY, subject.getId(), METRIC_NAME, now))
                .type(AnomalyType.INJURY)
                .severity(severity)
                .confidence(riskScore)
                .subjectId(subject.getId())
                .subjectName(subject.getName())
                .teamId(subject.getTeamId())
                .description("Elevated injury risk detected")
                .details(AnomalyDetails.builder()
                        .metric(METRIC_NAME)
                        .expectedValue(injury.getExpectedRisk())
                        .actualValue(riskScore)
                        .deviation(riskScore - injury.getExpectedRisk())
                        .historicalContext(injuryContext(health))
                        .build())
                .impact(AnomalyImpact.builder()
                        .projectionDelta(-riskScore * injury.getProjectionMultiplier())
                        .recommendedAction(critical ? RecommendedAction.BENCH : RecommendedAction.MONITOR)
                        .urgency(critical ? Urgency.IMMEDIATE : Urgency.THIS_WEEK)
                        .build())
                .timestamp(now)
                .build());
    }

    @Override
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        if (context.getHealthData() == null) {
            return false;
        }
        return riskScore(context.getHealthData()) < config.getInjury().getLow();
    }

    String injuryContext(HealthData health) {
        PracticeParticipation recentPractice = health.latestPractice();
        int injuryCount = health.getInjuryReports() == null ? 0 : health.getInjuryReports().size();

        if (recentPractice == PracticeParticipation.NONE && injuryCount > 0) {
            return "Did not practice with injury designation";
        } else if (recentPractice == PracticeParticipation.LIMITED) {
            return "Limited practice participation";
        } else if (health.getDaysRest() < config.getInjuryDetector().getShortRestDays()) {
            return "Short rest between games";
        }
        return "Multiple risk factors present";
    }

    private double riskScore(HealthData health) {
        double[] features = FeatureExtractor.healthFeatures(health);
        double score;
        try {
            score = model.score(features);
        } catch (ModelInferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInferenceException("Risk model failed: " + e.getMessage(), e);
        }
        if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
            throw new ModelInferenceException("Risk score out of range [0, 1]: " + score);
        }
        return score;
    }
}
