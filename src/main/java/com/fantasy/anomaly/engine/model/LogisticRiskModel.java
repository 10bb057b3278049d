package com.fantasy.anomaly.engine.model;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default risk model: logistic regression over the health feature vector with
 * coefficients from {@code anomaly.injury-detector.*}. Swap in a sequence model by
 * registering another {@link SequenceRiskModel} bean.
 */
@Component
public class LogisticRiskModel implements SequenceRiskModel {

    private final AnomalyThresholdConfig config;

    public LogisticRiskModel(AnomalyThresholdConfig config) {
        this.config = config;
    }

    @Override
    public double score(double[] features) {
        AnomalyThresholdConfig.Injury injury = config.getInjuryDetector();
        List<Double> weights = injury.getModelWeights();
        if (weights.size() != features.length) {
            throw new ModelInferenceException(String.format(
                    "Risk model expects %d features, got %d", weights.size(), features.length));
        }

        double logit = injury.getModelIntercept();
        for (int i = 0; i < features.length; i++) {
            logit += weights.get(i) * features[i];
        }
        return 1.0 / (1.0 + Math.exp(-logit));
    }
}
