package com.fantasy.anomaly.engine.model;

/**
 * Encode-then-decode model used by the pattern detector. A well-fitting input is
 * reconstructed closely; a large reconstruction error marks an unusual pattern.
 */
public interface ReconstructionModel {

    /**
     * @param features feature vector of {@link FeatureExtractor#PATTERN_FEATURE_COUNT} values
     * @return the reconstruction, same length as the input
     */
    double[] encodeDecode(double[] features);
}
