package com.fantasy.anomaly.seeder;

import com.fantasy.anomaly.model.HealthData;
import com.fantasy.anomaly.model.MarketData;
import com.fantasy.anomaly.model.PracticeParticipation;
import com.fantasy.anomaly.model.SubjectMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Synthetic metric, market and health data for local runs, exposed as the
 * three provider beans by {@link SyntheticProviderConfig}. Active unless
 * {@code anomaly.seed.enabled=false}; disable it when real providers are registered.
 *
 * Every subject gets {@value #HISTORY_DAYS} daily samples generated from a
 * fixed seed, so the same subject always yields the same history:
 *   - regular subjects: consistent production, stable ownership, healthy
 *   - subjects listed in {@code anomaly.seed.anomalous-subjects}: the same
 *     history with injected anomalies on the latest sample (points spike,
 *     snap share drop, ownership surge, trade-volume spike, limited/no
 *     practice with an injury designation)
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyntheticSubjectData {

    private static final Logger log = LoggerFactory.getLogger(SyntheticSubjectData.class);

    static final int HISTORY_DAYS = 20;
    private static final long SEED = 42; // fixed seed for reproducibility

    private final Set<String> anomalousSubjects;
    private final Instant anchor;
    private final ConcurrentHashMap<String, SyntheticHistory> histories = new ConcurrentHashMap<>();

    @Autowired
    public SyntheticSubjectData(@Value("${anomaly.seed.anomalous-subjects:}") List<String> anomalousSubjects) {
        this(anomalousSubjects, Instant.now().truncatedTo(ChronoUnit.DAYS));
    }

    SyntheticSubjectData(List<String> anomalousSubjects, Instant anchor) {
        this.anomalousSubjects = new HashSet<>(anomalousSubjects);
        this.anchor = anchor;
        log.info("Synthetic subject data enabled, anomalous subjects: {}", this.anomalousSubjects);
    }

    public SubjectMetrics metrics(String subjectId) {
        return history(subjectId).metrics;
    }

    public MarketData market(String subjectId) {
        return history(subjectId).market;
    }

    public HealthData health(String subjectId) {
        return history(subjectId).health;
    }

    private SyntheticHistory history(String subjectId) {
        return histories.computeIfAbsent(subjectId, this::generate);
    }

    private SyntheticHistory generate(String subjectId) {
        Random random = new Random(SEED + subjectId.hashCode());
        boolean anomalous = anomalousSubjects.contains(subjectId);

        // Player profile
        double avgPoints = 10 + random.nextDouble() * 12;   // 10-22 points per game
        double avgSnaps = 55 + random.nextDouble() * 30;    // 55-85 % of snaps
        double avgTargets = 3 + random.nextDouble() * 6;
        double avgTouches = 8 + random.nextDouble() * 12;
        double baseOwnership = 20 + random.nextDouble() * 60;
        double baseVolume = 40 + random.nextDouble() * 80;

        List<Instant> timestamps = new ArrayList<>(HISTORY_DAYS);
        List<Double> points = new ArrayList<>(HISTORY_DAYS);
        List<Double> snaps = new ArrayList<>(HISTORY_DAYS);
        List<Double> targets = new ArrayList<>(HISTORY_DAYS);
        List<Double> touches = new ArrayList<>(HISTORY_DAYS);
        List<Double> redZone = new ArrayList<>(HISTORY_DAYS);
        List<Double> efficiency = new ArrayList<>(HISTORY_DAYS);
        List<Double> ownership = new ArrayList<>(HISTORY_DAYS);
        List<Double> volume = new ArrayList<>(HISTORY_DAYS);
        List<Double> sentiment = new ArrayList<>(HISTORY_DAYS);
        List<Double> workload = new ArrayList<>(HISTORY_DAYS);

        for (int day = HISTORY_DAYS - 1; day >= 0; day--) {
            timestamps.add(anchor.minus(day, ChronoUnit.DAYS));
            points.add(round(Math.max(0, avgPoints + random.nextGaussian() * avgPoints * 0.2)));
            snaps.add(round(clamp(avgSnaps + random.nextGaussian() * 4, 0, 100)));
            targets.add(round(Math.max(0, avgTargets + random.nextGaussian())));
            touches.add(round(Math.max(0, avgTouches + random.nextGaussian() * 2)));
            redZone.add(round(Math.max(0, 1.5 + random.nextGaussian() * 0.8)));
            efficiency.add(round(1.0 + random.nextGaussian() * 0.1));
            ownership.add(round(clamp(baseOwnership + random.nextGaussian(), 0.5, 100)));
            volume.add(round(Math.max(1, baseVolume + random.nextGaussian() * baseVolume * 0.1)));
            sentiment.add(round(clamp(random.nextGaussian() * 0.2, -1, 1)));
            workload.add(round(62 + random.nextGaussian() * 3));
        }

        List<PracticeParticipation> practice = new ArrayList<>(List.of(
                PracticeParticipation.FULL, PracticeParticipation.FULL, PracticeParticipation.FULL));
        List<String> injuryReports = new ArrayList<>();
        int daysRest = 7;

        if (anomalous) {
            int last = HISTORY_DAYS - 1;
            points.set(last, round(avgPoints * 3));
            snaps.set(last, round(avgSnaps * 0.5));
            ownership.set(last - 1, round(baseOwnership / 5));
            ownership.set(last, round(baseOwnership));
            volume.set(last, round(baseVolume * 5));
            for (int i = HISTORY_DAYS - 3; i < HISTORY_DAYS; i++) {
                workload.set(i, round(72 + random.nextGaussian()));
            }
            practice = new ArrayList<>(List.of(
                    PracticeParticipation.FULL, PracticeParticipation.LIMITED, PracticeParticipation.NONE));
            injuryReports.add("hamstring - questionable");
            daysRest = 2;
        }

        log.debug("Generated {} days of synthetic history for subject {} (anomalous={})",
                HISTORY_DAYS, subjectId, anomalous);

        SubjectMetrics metrics = SubjectMetrics.builder()
                .subjectId(subjectId)
                .fantasyPoints(points)
                .snapPercentage(snaps)
                .targets(targets)
                .touches(touches)
                .redZoneUsage(redZone)
                .efficiency(efficiency)
                .timestamps(timestamps)
                .build();
        MarketData market = MarketData.builder()
                .subjectId(subjectId)
                .ownership(ownership)
                .tradeVolume(volume)
                .sentiment(sentiment)
                .timestamps(new ArrayList<>(timestamps))
                .build();
        HealthData health = HealthData.builder()
                .subjectId(subjectId)
                .practiceParticipation(practice)
                .injuryReports(injuryReports)
                .workload(new ArrayList<>(workload.subList(HISTORY_DAYS - 3, HISTORY_DAYS)))
                .daysRest(daysRest)
                .build();
        return new SyntheticHistory(metrics, market, health);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static final class SyntheticHistory {
        final SubjectMetrics metrics;
        final MarketData market;
        final HealthData health;

        SyntheticHistory(SubjectMetrics metrics, MarketData market, HealthData health) {
            this.metrics = metrics;
            this.market = market;
            this.health = health;
        }
    }
}
