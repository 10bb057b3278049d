package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.engine.SeriesStats;
import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.model.SubjectMetrics;
import com.fantasy.anomaly.repository.BaselineStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily computes and caches one baseline per subject. A cached baseline is
 * never recomputed until {@link #invalidate(String)} is called for the subject.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final BaselineStore baselineStore;
    private final AnomalyThresholdConfig config;

    // Serializes creation per subject; cached reads never take the lock.
    private final ConcurrentHashMap<String, Object> creationLocks = new ConcurrentHashMap<>();

    public BaselineService(BaselineStore baselineStore, AnomalyThresholdConfig config) {
        this.baselineStore = baselineStore;
        this.config = config;
    }

    /**
     * Return the cached baseline, computing it from {@code metrics} on first use.
     *
     * @return empty while the subject has fewer than the minimum fantasy-point samples
     */
    @Observed(name = "baseline.get_or_create", contextualName = "load-subject-baseline")
    public Optional<Baseline> getOrCreate(String subjectId, SubjectMetrics metrics) {
        Optional<Baseline> cached = baselineStore.find(subjectId);
        if (cached.isPresent()) {
            return cached;
        }

        if (metrics == null || metrics.getFantasyPoints() == null
                || metrics.getFantasyPoints().size() < config.getMinBaselineSamples()) {
            log.debug("Insufficient data for baseline of subject {}", subjectId);
            return Optional.empty();
        }

        Object lock = creationLocks.computeIfAbsent(subjectId, id -> new Object());
        synchronized (lock) {
            cached = baselineStore.find(subjectId);
            if (cached.isPresent()) {
                return cached;
            }
            Baseline baseline = compute(subjectId, metrics);
            baselineStore.save(baseline);
            log.info("Baseline created for subject {}: samples={}, fantasyPoints mean={} std={}",
                    subjectId, baseline.getSampleCount(),
                    String.format("%.2f", baseline.meanAt(Baseline.SLOT_FANTASY_POINTS)),
                    String.format("%.2f", baseline.stdAt(Baseline.SLOT_FANTASY_POINTS)));
            return Optional.of(baseline);
        }
    }

    public Optional<Baseline> find(String subjectId) {
        return baselineStore.find(subjectId);
    }

    /**
     * Drop the cached baseline so the next observation recomputes it.
     */
    public boolean invalidate(String subjectId) {
        boolean removed = baselineStore.delete(subjectId);
        if (removed) {
            log.info("Baseline invalidated for subject {}", subjectId);
        }
        return removed;
    }

    Baseline compute(String subjectId, SubjectMetrics metrics) {
        double[] mean = new double[Baseline.TRACKED_METRICS];
        double[] std = new double[Baseline.TRACKED_METRICS];

        for (int slot = 0; slot < Baseline.TRACKED_METRICS; slot++) {
            List<Double> values = metrics.series(slot);
            mean[slot] = SeriesStats.mean(values);
            double s = SeriesStats.std(values);
            std[slot] = s == 0 ? 1.0 : s;
        }

        return Baseline.builder()
                .subjectId(subjectId)
                .mean(mean)
                .std(std)
                .seasonalPattern(seasonalPattern(metrics.getFantasyPoints(), config.getSeasonalPeriod()))
                .sampleCount(metrics.getFantasyPoints().size())
                .createdAt(System.currentTimeMillis())
                .build();
    }

    /**
     * Mean of the samples at each offset of the period. Empty when the history
     * is shorter than one period.
     */
    static double[] seasonalPattern(List<Double> values, int period) {
        if (period <= 0 || values.size() < period) {
            return new double[0];
        }
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < values.size(); i++) {
            sums[i % period] += values.get(i);
            counts[i % period]++;
        }
        double[] pattern = new double[period];
        for (int i = 0; i < period; i++) {
            pattern[i] = sums[i] / counts[i];
        }
        return pattern;
    }
}
