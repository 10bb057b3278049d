package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.DetectedAnomaly;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Links related anomalies within one batch. Two anomalies are related when they
 * share a subject, share a team, or were detected within the correlation window
 * of each other. Links are always bidirectional.
 */
@Component
public class AnomalyCorrelator {

    private final AnomalyThresholdConfig config;

    public AnomalyCorrelator(AnomalyThresholdConfig config) {
        this.config = config;
    }

    public List<Anomaly> correlate(List<Anomaly> anomalies) {
        List<Set<String>> related = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            related.add(new LinkedHashSet<>(anomaly.getRelatedAnomalyIds()));
        }

        for (int i = 0; i < anomalies.size(); i++) {
            for (int j = i + 1; j < anomalies.size(); j++) {
                Anomaly a1 = anomalies.get(i);
                Anomaly a2 = anomalies.get(j);
                if (areRelated(a1, a2) && !Objects.equals(a1.getId(), a2.getId())) {
                    related.get(i).add(a2.getId());
                    related.get(j).add(a1.getId());
                }
            }
        }

        List<Anomaly> correlated = new ArrayList<>(anomalies.size());
        for (int i = 0; i < anomalies.size(); i++) {
            correlated.add(anomalies.get(i).toBuilder()
                    .relatedAnomalyIds(List.copyOf(related.get(i)))
                    .build());
        }
        return correlated;
    }

    /**
     * Same as {@link #correlate(List)}, keeping each anomaly paired with its detector.
     */
    public List<DetectedAnomaly> correlateDetected(List<DetectedAnomaly> detected) {
        List<Anomaly> anomalies = new ArrayList<>(detected.size());
        for (DetectedAnomaly d : detected) {
            anomalies.add(d.getAnomaly());
        }
        List<Anomaly> correlated = correlate(anomalies);

        List<DetectedAnomaly> result = new ArrayList<>(detected.size());
        for (int i = 0; i < detected.size(); i++) {
            result.add(new DetectedAnomaly(detected.get(i).getDetector(), correlated.get(i)));
        }
        return result;
    }

    public boolean areRelated(Anomaly a1, Anomaly a2) {
        // Same subject
        if (a1.getSubjectId() != null && a1.getSubjectId().equals(a2.getSubjectId())) return true;

        // Same team
        if (a1.getTeamId() != null && a1.getTeamId().equals(a2.getTeamId())) return true;

        // Close in time
        if (a1.getTimestamp() != null && a2.getTimestamp() != null) {
            Duration gap = Duration.between(a1.getTimestamp(), a2.getTimestamp()).abs();
            return gap.compareTo(Duration.ofMinutes(config.getLifecycle().getCorrelationWindowMinutes())) < 0;
        }
        return false;
    }
}
