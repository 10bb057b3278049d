package com.fantasy.anomaly.engine.model;

import org.springframework.stereotype.Component;

/**
 * Default reconstruction model. Each block of {@code blockSize} consecutive features
 * (one metric's recent samples) is encoded as its 3-point moving average and decoded
 * as a blend of the input and that average:
 * {@code out = x + smoothing * (movingAverage - x)}.
 *
 * The residual is therefore {@code smoothing} times the distance from the moving
 * average. Ordinary game-to-game noise stays well under the pattern trigger; only
 * metrics swinging back and forth together reconstruct poorly.
 *
 * Replace with a trained autoencoder by registering another {@link ReconstructionModel} bean.
 */
@Component
public class SmoothingReconstructionModel implements ReconstructionModel {

    static final double DEFAULT_SMOOTHING = 0.5;

    private final int blockSize;
    private final double smoothing;

    public SmoothingReconstructionModel() {
        this(FeatureExtractor.PATTERN_RECENT_SAMPLES, DEFAULT_SMOOTHING);
    }

    public SmoothingReconstructionModel(int blockSize, double smoothing) {
        this.blockSize = blockSize;
        this.smoothing = smoothing;
    }

    @Override
    public double[] encodeDecode(double[] features) {
        double[] out = new double[features.length];
        for (int start = 0; start < features.length; start += blockSize) {
            int end = Math.min(start + blockSize, features.length);
            for (int i = start; i < end; i++) {
                double sum = features[i];
                int n = 1;
                if (i - 1 >= start) {
                    sum += features[i - 1];
                    n++;
                }
                if (i + 1 < end) {
                    sum += features[i + 1];
                    n++;
                }
                double movingAverage = sum / n;
                out[i] = features[i] + smoothing * (movingAverage - features[i]);
            }
        }
        return out;
    }
}
