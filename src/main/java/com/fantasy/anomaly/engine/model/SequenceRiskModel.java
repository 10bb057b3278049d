package com.fantasy.anomaly.engine.model;

/**
 * Scores injury / availability risk from a health feature vector.
 */
public interface SequenceRiskModel {

    /**
     * @param features {@link FeatureExtractor#HEALTH_FEATURE_NAMES} in order
     * @return risk score in [0, 1]
     */
    double score(double[] features);
}
