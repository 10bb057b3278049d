package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.model.Baseline;
import com.fantasy.anomaly.model.SubjectMetrics;
import com.fantasy.anomaly.repository.InMemoryBaselineStore;
import com.fantasy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BaselineServiceTest {

    private InMemoryBaselineStore store;
    private BaselineService baselineService;

    @BeforeEach
    void setUp() {
        store = new InMemoryBaselineStore();
        baselineService = new BaselineService(store, new AnomalyThresholdConfig());
    }

    @Test
    void getOrCreate_insufficientHistory_empty() {
        SubjectMetrics metrics = TestDataFactory.createMetrics("P-1001", List.of(10.0, 12.0));

        assertThat(baselineService.getOrCreate("P-1001", metrics)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void getOrCreate_computesMeanAndPopulationStd() {
        SubjectMetrics metrics = TestDataFactory.createMetrics("P-1001", List.of(10.0, 20.0, 30.0));

        Optional<Baseline> baseline = baselineService.getOrCreate("P-1001", metrics);

        assertThat(baseline).isPresent();
        assertThat(baseline.get().meanAt(Baseline.SLOT_FANTASY_POINTS)).isCloseTo(20.0, within(1e-9));
        assertThat(baseline.get().stdAt(Baseline.SLOT_FANTASY_POINTS)).isCloseTo(Math.sqrt(200.0 / 3), within(1e-9));
        assertThat(baseline.get().getSampleCount()).isEqualTo(3);
    }

    @Test
    void getOrCreate_constantSeries_stdFlooredToOne() {
        SubjectMetrics metrics = TestDataFactory.createMetrics("P-1001", List.of(15.0, 15.0, 15.0, 15.0));

        Baseline baseline = baselineService.getOrCreate("P-1001", metrics).orElseThrow();

        assertThat(baseline.getStd()).containsOnly(1.0);
    }

    @Test
    void getOrCreate_cachedUntilInvalidated() {
        Baseline first = baselineService.getOrCreate("P-1001",
                TestDataFactory.createMetrics("P-1001", List.of(10.0, 20.0, 30.0))).orElseThrow();

        Baseline cached = baselineService.getOrCreate("P-1001",
                TestDataFactory.createMetrics("P-1001", List.of(100.0, 200.0, 300.0))).orElseThrow();
        assertThat(cached).isSameAs(first);

        assertThat(baselineService.invalidate("P-1001")).isTrue();
        assertThat(baselineService.invalidate("P-1001")).isFalse();

        Baseline recomputed = baselineService.getOrCreate("P-1001",
                TestDataFactory.createMetrics("P-1001", List.of(100.0, 200.0, 300.0))).orElseThrow();
        assertThat(recomputed.meanAt(Baseline.SLOT_FANTASY_POINTS)).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void getOrCreate_cachedBaselineCannotBeChangedThroughItsArrays() {
        Baseline baseline = baselineService.getOrCreate("P-1001",
                TestDataFactory.createMetrics("P-1001", List.of(10.0, 20.0, 30.0))).orElseThrow();

        baseline.getMean()[Baseline.SLOT_FANTASY_POINTS] = 999.0;
        baseline.getStd()[Baseline.SLOT_FANTASY_POINTS] = 0.0;

        Baseline cached = baselineService.find("P-1001").orElseThrow();
        assertThat(cached.meanAt(Baseline.SLOT_FANTASY_POINTS)).isCloseTo(20.0, within(1e-9));
        assertThat(cached.stdAt(Baseline.SLOT_FANTASY_POINTS)).isCloseTo(Math.sqrt(200.0 / 3), within(1e-9));
    }

    @Test
    void builder_copiesInputArrays() {
        double[] mean = {16.0, 70.0, 6.0, 14.0};
        Baseline baseline = Baseline.builder().subjectId("P-1001").mean(mean).std(new double[]{1, 1, 1, 1}).build();

        mean[Baseline.SLOT_FANTASY_POINTS] = -1.0;

        assertThat(baseline.meanAt(Baseline.SLOT_FANTASY_POINTS)).isEqualTo(16.0);
    }

    @Test
    void getOrCreate_concurrentCallers_shareOneBaseline() throws Exception {
        SubjectMetrics metrics = TestDataFactory.createMetrics("P-1001", List.of(10.0, 20.0, 30.0, 40.0));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Baseline>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> baselineService.getOrCreate("P-1001", metrics).orElseThrow());
            }
            List<Future<Baseline>> results = pool.invokeAll(calls);

            Baseline stored = store.find("P-1001").orElseThrow();
            for (Future<Baseline> result : results) {
                assertThat(result.get()).isSameAs(stored);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void seasonalPattern_meanPerOffset() {
        double[] pattern = BaselineService.seasonalPattern(List.of(1.0, 10.0, 3.0, 20.0), 2);

        assertThat(pattern).containsExactly(2.0, 15.0);
    }

    @Test
    void seasonalPattern_historyShorterThanPeriod_empty() {
        assertThat(BaselineService.seasonalPattern(List.of(1.0, 2.0, 3.0), 17)).isEmpty();
    }
}
