package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.config.SeverityThresholds;
import com.fantasy.anomaly.engine.AnomalyDetector;
import com.fantasy.anomaly.engine.AnomalyIds;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.SeriesStats;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyDetails;
import com.fantasy.anomaly.model.AnomalyImpact;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.MarketData;
import com.fantasy.anomaly.model.RecommendedAction;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.model.Subject;
import com.fantasy.anomaly.model.Urgency;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects unusual ownership movement and trade-activity spikes.
 *
 * Checks (independent):
 *   1. Ownership rate of change (last - prev) / prev. Flagged when |rate| reaches
 *      the market table's medium cut-off (3.0). A zero previous sample reports 10.0
 *      if ownership appeared, 0 otherwise.
 *   2. Trade volume. The trailing average is the sum of the last 7 samples divided
 *      by 7; the latest sample is flagged when it exceeds 3x that average.
 */
@Component
public class MarketDetector implements AnomalyDetector {

    public static final String OWNERSHIP_METRIC = "Ownership %";
    public static final String TRADE_VOLUME_METRIC = "Trade Volume";

    private final AnomalyThresholdConfig config;

    public MarketDetector(AnomalyThresholdConfig config) {
        this.config = config;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.MARKET;
    }

    @Override
    public List<Anomaly> detect(DetectionContext context) {
        MarketData market = context.getMarketData();
        if (market == null) {
            return List.of();
        }
        return detectMarket(context.getSubject(), market.getOwnership(), market.getTradeVolume(), context.getDetectedAt());
    }

    public List<Anomaly> detectMarket(Subject subject, List<Double> ownership, List<Double> tradeVolume, Instant now) {
        List<Anomaly> anomalies = new ArrayList<>();
        AnomalyThresholdConfig.Market settings = config.getMarketDetector();
        SeverityThresholds thresholds = config.getMarket();

        // 1. Ownership rate of change
        if (ownership != null && ownership.size() >= 2) {
            double rate = rateOfChange(ownership);
            if (Math.abs(rate) >= thresholds.getMedium()) {
                Severity severity = thresholds.classify(Math.abs(rate));
                boolean increase = rate > 0;
                anomalies.add(Anomaly.builder()
                        .id(AnomalyIds.generate(AnomalyType.MARKET, subject.getId(), OWNERSHIP_METRIC, now))
                        .type(AnomalyType.MARKET)
                        .severity(severity)
                        .confidence(settings.getOwnershipConfidence())
                        .subjectId(subject.getId())
                        .subjectName(subject.getName())
                        .teamId(subject.getTeamId())
                        .description("Unusual " + (increase ? "increase" : "decrease") + " in ownership")
                        .details(AnomalyDetails.builder()
                                .metric(OWNERSHIP_METRIC)
                                .expectedValue(ownership.get(ownership.size() - 2))
                                .actualValue(SeriesStats.last(ownership))
                                .deviation(rate)
                                .historicalContext("Significant change compared to typical ownership patterns")
                                .build())
                        .impact(AnomalyImpact.builder()
                                .projectionDelta(0)
                                .recommendedAction(increase ? RecommendedAction.MONITOR : RecommendedAction.PICKUP)
                                .urgency(Urgency.forSeverity(severity))
                                .build())
                        .timestamp(now)
                        .build());
            }
        }

        // 2. Trade volume spike
        if (tradeVolume != null && !tradeVolume.isEmpty()) {
            double avgVolume = trailingAverage(tradeVolume);
            double currentVolume = SeriesStats.last(tradeVolume);
            if (avgVolume > 0 && currentVolume > avgVolume * settings.getVolumeSpikeMultiplier()) {
                anomalies.add(Anomaly.builder()
                        .id(AnomalyIds.generate(AnomalyType.MARKET, subject.getId(), TRADE_VOLUME_METRIC, now))
                        .type(AnomalyType.MARKET)
                        .severity(Severity.MEDIUM)
                        .confidence(settings.getVolumeConfidence())
                        .subjectId(subject.getId())
                        .subjectName(subject.getName())
                        .teamId(subject.getTeamId())
                        .description("Unusually high trade activity")
                        .details(AnomalyDetails.builder()
                                .metric(TRADE_VOLUME_METRIC)
                                .expectedValue(avgVolume)
                                .actualValue(currentVolume)
                                .deviation((currentVolume - avgVolume) / avgVolume)
                                .historicalContext(String.format("Trade volume significantly above %d-sample average",
                                        settings.getVolumeWindow()))
                                .build())
                        .impact(AnomalyImpact.builder()
                                .projectionDelta(0)
                                .recommendedAction(RecommendedAction.MONITOR)
                                .urgency(Urgency.THIS_WEEK)
                                .build())
                        .timestamp(now)
                        .build());
            }
        }

        return anomalies;
    }

    @Override
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        MarketData market = context.getMarketData();
        if (market == null) {
            return false;
        }
        String metric = alert.getAnomaly().getDetails().getMetric();

        if (OWNERSHIP_METRIC.equals(metric)) {
            List<Double> ownership = market.getOwnership();
            if (ownership == null || ownership.size() < 2) {
                return false;
            }
            return Math.abs(rateOfChange(ownership)) < config.getMarket().getLow();
        }

        if (TRADE_VOLUME_METRIC.equals(metric)) {
            List<Double> volume = market.getTradeVolume();
            if (volume == null || volume.isEmpty()) {
                return false;
            }
            double warning = trailingAverage(volume) * config.getMarketDetector().getVolumeSpikeMultiplier()
                    * config.getLifecycle().getResolutionHysteresis();
            return SeriesStats.last(volume) <= warning;
        }
        return false;
    }

    double rateOfChange(List<Double> values) {
        if (values.size() < 2) return 0;
        double recent = values.get(values.size() - 1);
        double previous = values.get(values.size() - 2);
        if (previous == 0) {
            return recent > 0 ? config.getMarketDetector().getZeroBaselineRate() : 0;
        }
        return (recent - previous) / previous;
    }

    // Divides by the full window length even when fewer samples exist.
    double trailingAverage(List<Double> values) {
        int window = config.getMarketDetector().getVolumeWindow();
        double sum = 0.0;
        for (double v : SeriesStats.lastN(values, window)) {
            sum += v;
        }
        return sum / window;
    }
}
