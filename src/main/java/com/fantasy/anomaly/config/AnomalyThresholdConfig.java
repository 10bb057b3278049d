package com.fantasy.anomaly.config;

import com.fantasy.anomaly.model.AnomalyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyThresholdConfig {

    // Severity tables per anomaly type (z-score units for performance,
    // risk score for injury, fraction for usage, rate of change for market).
    private SeverityThresholds performance = new SeverityThresholds(1.5, 2.5, 3.5, 5.0);
    private SeverityThresholds injury = new SeverityThresholds(0.6, 0.7, 0.8, 0.9);
    private SeverityThresholds usage = new SeverityThresholds(0.3, 0.5, 0.7, 0.9);
    private SeverityThresholds market = new SeverityThresholds(2.0, 3.0, 4.0, 5.0);

    // Baseline computation
    private int minBaselineSamples = 3;
    private int seasonalPeriod = 17;

    private Statistical statistical = new Statistical();
    private Trend trend = new Trend();
    private Pattern pattern = new Pattern();
    private Market marketDetector = new Market();
    private Injury injuryDetector = new Injury();
    private Lifecycle lifecycle = new Lifecycle();

    public SeverityThresholds thresholdsFor(AnomalyType type) {
        return switch (type) {
            case PERFORMANCE -> performance;
            case INJURY -> injury;
            case USAGE -> usage;
            case MARKET -> market;
            default -> throw new IllegalArgumentException("No severity table for type " + type);
        };
    }

    @Data
    public static class Statistical {
        private int minSamples = 3;
        private double performanceWeight = 1.0;
        private double otherWeight = 0.5;
        // z-score that maps to full confidence
        private double confidenceScale = 5.0;
    }

    @Data
    public static class Trend {
        private int minSamples = 5;
        private int window = 3;
        private double minChangeRate = 0.3;
        private double mediumChangeRate = 0.5;
        private double confidence = 0.7;
        private double projectionMultiplier = 2.0;
    }

    @Data
    public static class Pattern {
        private int recentSamples = 5;
        private int featureLength = 25;
        private double triggerError = 0.3;
        private double highError = 0.5;
        private double expectedError = 0.1;
        private double projectionMultiplier = 3.0;
    }

    @Data
    public static class Market {
        // Rate reported when the previous ownership sample is zero
        private double zeroBaselineRate = 10.0;
        private double ownershipConfidence = 0.85;
        private int volumeWindow = 7;
        private double volumeSpikeMultiplier = 3.0;
        private double volumeConfidence = 0.8;
    }

    @Data
    public static class Injury {
        private double expectedRisk = 0.3;
        private double projectionMultiplier = 5.0;
        private int shortRestDays = 4;
        // Logistic risk model: practice score, injury mentions, avg workload, rest score
        private double modelIntercept = 1.0;
        private List<Double> modelWeights = List.of(-3.0, 0.9, 0.02, -2.0);
    }

    @Data
    public static class Lifecycle {
        private int retentionDays = 7;
        private int correlationWindowMinutes = 60;
        // Fraction of the trigger threshold a measure must fall under to resolve
        private double resolutionHysteresis = 0.8;
    }
}
