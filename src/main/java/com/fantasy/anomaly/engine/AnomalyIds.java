package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.model.AnomalyType;

import java.time.Instant;
import java.util.Locale;

public final class AnomalyIds {

    private AnomalyIds() {}

    /**
     * Builds an id of the form {@code <type>_<subjectId>_<metric-slug>_<epochMillis>}.
     */
    public static String generate(AnomalyType type, String subjectId, String metric, Instant at) {
        String slug = metric.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return type.getValue() + "_" + subjectId + "_" + slug + "_" + at.toEpochMilli();
    }
}
