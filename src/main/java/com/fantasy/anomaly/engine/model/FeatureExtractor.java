package com.fantasy.anomaly.engine.model;

import com.fantasy.anomaly.engine.SeriesStats;
import com.fantasy.anomaly.model.HealthData;
import com.fantasy.anomaly.model.PracticeParticipation;
import com.fantasy.anomaly.model.SubjectMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the model input vectors.
 *
 * Pattern features (25): the last 5 samples of fantasy points, snap percentage,
 * targets, touches and efficiency, each z-normalized against its own recent mean
 * and std, concatenated and zero padded.
 *
 * Health features (4):
 *   [0] Practice score: full=1.0, limited=0.5, none=0.0, averaged
 *   [1] Injury report mentions
 *   [2] Average workload
 *   [3] Rest score: min(daysRest / 7, 1)
 */
public final class FeatureExtractor {

    public static final int PATTERN_FEATURE_COUNT = 25;
    public static final int PATTERN_RECENT_SAMPLES = 5;

    public static final String[] PATTERN_METRIC_NAMES = {
            "Fantasy Points",
            "Snap Percentage",
            "Targets",
            "Touches",
            "Efficiency"
    };

    public static final String[] HEALTH_FEATURE_NAMES = {
            "Practice Score",
            "Injury Mentions",
            "Average Workload",
            "Rest Score"
    };

    private FeatureExtractor() {}

    public static double[] patternFeatures(SubjectMetrics metrics, int recentSamples, int featureLength) {
        List<List<Double>> series = List.of(
                nullSafe(metrics.getFantasyPoints()),
                nullSafe(metrics.getSnapPercentage()),
                nullSafe(metrics.getTargets()),
                nullSafe(metrics.getTouches()),
                nullSafe(metrics.getEfficiency()));

        List<Double> features = new ArrayList<>(featureLength);
        for (List<Double> values : series) {
            features.addAll(normalize(SeriesStats.lastN(values, recentSamples)));
        }

        double[] vector = new double[featureLength];
        for (int i = 0; i < featureLength && i < features.size(); i++) {
            vector[i] = features.get(i);
        }
        return vector;
    }

    public static double[] patternFeatures(SubjectMetrics metrics) {
        return patternFeatures(metrics, PATTERN_RECENT_SAMPLES, PATTERN_FEATURE_COUNT);
    }

    public static double[] healthFeatures(HealthData health) {
        double[] features = new double[HEALTH_FEATURE_NAMES.length];

        List<PracticeParticipation> practice = health.getPracticeParticipation();
        if (practice != null && !practice.isEmpty()) {
            double total = 0.0;
            for (PracticeParticipation p : practice) {
                total += p.getScore();
            }
            features[0] = total / practice.size();
        }

        features[1] = health.getInjuryReports() == null ? 0 : health.getInjuryReports().size();
        features[2] = SeriesStats.mean(health.getWorkload());
        features[3] = Math.min(health.getDaysRest() / 7.0, 1.0);
        return features;
    }

    /**
     * Mean squared error between an input and its reconstruction.
     */
    public static double reconstructionError(double[] original, double[] reconstructed) {
        double sum = 0.0;
        for (int i = 0; i < original.length; i++) {
            double diff = original[i] - reconstructed[i];
            sum += diff * diff;
        }
        return sum / original.length;
    }

    private static List<Double> normalize(List<Double> values) {
        double mean = SeriesStats.mean(values);
        double std = SeriesStats.std(values);
        List<Double> normalized = new ArrayList<>(values.size());
        for (double v : values) {
            normalized.add(std == 0 ? 0.0 : (v - mean) / std);
        }
        return normalized;
    }

    private static List<Double> nullSafe(List<Double> values) {
        return values == null ? List.of() : values;
    }
}
