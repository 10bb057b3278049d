package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.model.*;
import com.fantasy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class AnomalyCorrelatorTest {

    private AnomalyCorrelator correlator;

    @BeforeEach
    void setUp() {
        correlator = new AnomalyCorrelator(new AnomalyThresholdConfig());
    }

    @Test
    void correlate_tenMinutesApart_linkedBothWays() {
        Anomaly a1 = anomaly("a-1", "P-1001", "MIN", NOW);
        Anomaly a2 = anomaly("a-2", "P-2002", "KC", NOW.plus(Duration.ofMinutes(10)));

        List<Anomaly> result = correlator.correlate(List.of(a1, a2));

        assertThat(result.get(0).getRelatedAnomalyIds()).containsExactly("a-2");
        assertThat(result.get(1).getRelatedAnomalyIds()).containsExactly("a-1");
    }

    @Test
    void correlate_unrelated_noLinks() {
        Anomaly a1 = anomaly("a-1", "P-1001", "MIN", NOW);
        Anomaly a2 = anomaly("a-2", "P-2002", "KC", NOW.plus(Duration.ofHours(2)));

        List<Anomaly> result = correlator.correlate(List.of(a1, a2));

        assertThat(result.get(0).getRelatedAnomalyIds()).isEmpty();
        assertThat(result.get(1).getRelatedAnomalyIds()).isEmpty();
    }

    @Test
    void correlate_sameTeamFarApart_linked() {
        Anomaly a1 = anomaly("a-1", "P-1001", "MIN", NOW);
        Anomaly a2 = anomaly("a-2", "P-1002", "MIN", NOW.plus(Duration.ofDays(1)));

        assertThat(correlator.areRelated(a1, a2)).isTrue();
        assertThat(correlator.areRelated(a2, a1)).isTrue();
    }

    @Test
    void correlate_exactlyAtWindow_notRelated() {
        Anomaly a1 = anomaly("a-1", "P-1001", "MIN", NOW);
        Anomaly a2 = anomaly("a-2", "P-2002", "KC", NOW.plus(Duration.ofMinutes(60)));

        assertThat(correlator.areRelated(a1, a2)).isFalse();
    }

    @Test
    void correlate_existingLinksNotDuplicated_noSelfLinks() {
        Anomaly a1 = anomaly("a-1", "P-1001", "MIN", NOW).toBuilder()
                .relatedAnomalyIds(List.of("a-2"))
                .build();
        Anomaly a2 = anomaly("a-2", "P-1001", "MIN", NOW);
        Anomaly sameId = anomaly("a-1", "P-1001", "MIN", NOW);

        List<Anomaly> result = correlator.correlate(List.of(a1, a2, sameId));

        assertThat(result.get(0).getRelatedAnomalyIds()).containsExactly("a-2");
        assertThat(result.get(1).getRelatedAnomalyIds()).containsExactly("a-1");
        assertThat(result.get(2).getRelatedAnomalyIds()).containsExactly("a-2");
    }

    @Test
    void correlateDetected_keepsDetectorPairing() {
        DetectedAnomaly d1 = new DetectedAnomaly(DetectorKind.MARKET, anomaly("a-1", "P-1001", "MIN", NOW));
        DetectedAnomaly d2 = new DetectedAnomaly(DetectorKind.INJURY_RISK, anomaly("a-2", "P-1001", "MIN", NOW));

        List<DetectedAnomaly> result = correlator.correlateDetected(List.of(d1, d2));

        assertThat(result).extracting(DetectedAnomaly::getDetector)
                .containsExactly(DetectorKind.MARKET, DetectorKind.INJURY_RISK);
        assertThat(result.get(0).getAnomaly().getRelatedAnomalyIds()).containsExactly("a-2");
    }

    private static Anomaly anomaly(String id, String subjectId, String teamId, Instant at) {
        return TestDataFactory.createAnomaly(id, subjectId, teamId, AnomalyType.PERFORMANCE,
                Severity.LOW, "Fantasy Points", at);
    }
}
