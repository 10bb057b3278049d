package com.fantasy.anomaly.repository;

import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectorKind;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryActiveAnomalyStoreTest {

    private static final String KEY = "P-1001:performance:STATISTICAL";

    private InMemoryActiveAnomalyStore store;
    private ActiveAlert alert;

    @BeforeEach
    void setUp() {
        store = new InMemoryActiveAnomalyStore();
        alert = TestDataFactory.createActiveAlert(TestDataFactory.createAnomaly("a-1", "P-1001", "MIN",
                AnomalyType.PERFORMANCE, Severity.LOW, "Fantasy Points", NOW), DetectorKind.STATISTICAL, false);
        store.save(alert);
    }

    @Test
    void findAll_returnedAlertsAreDetached() {
        store.findAll().get(0).setResolved(true);
        store.findByKey(KEY).orElseThrow().setOccurrences(42);
        store.findById("a-1").orElseThrow().setResolvedBy("someone");

        ActiveAlert stored = store.findByKey(KEY).orElseThrow();
        assertThat(stored.isResolved()).isFalse();
        assertThat(stored.getOccurrences()).isEqualTo(1);
        assertThat(stored.getResolvedBy()).isNull();
    }

    @Test
    void save_laterChangesToCallerInstanceNotStored() {
        alert.setResolved(true);

        assertThat(store.findByKey(KEY).orElseThrow().isResolved()).isFalse();
    }

    @Test
    void save_sameKeyReplacesEntry() {
        store.save(alert.toBuilder().occurrences(2).build());

        assertThat(store.findAll()).hasSize(1);
        assertThat(store.findByKey(KEY).orElseThrow().getOccurrences()).isEqualTo(2);
    }

    @Test
    void delete_removesEntry() {
        store.delete(KEY);

        assertThat(store.findAll()).isEmpty();
        assertThat(store.findById("a-1")).isEmpty();
    }
}
