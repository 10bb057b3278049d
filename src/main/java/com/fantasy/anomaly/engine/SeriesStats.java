package com.fantasy.anomaly.engine;

import java.util.List;

/**
 * Arithmetic helpers over metric series. Standard deviation is the population
 * form; a series shorter than two samples reports 1 so callers can divide safely.
 */
public final class SeriesStats {

    private SeriesStats() {}

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public static double std(List<Double> values) {
        if (values == null || values.size() < 2) return 1.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.size());
    }

    public static List<Double> lastN(List<Double> values, int n) {
        if (values == null) return List.of();
        return values.subList(Math.max(0, values.size() - n), values.size());
    }

    public static double last(List<Double> values) {
        return values.get(values.size() - 1);
    }
}
