package com.fantasy.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fantasy.anomaly.config.AerospikeConfig;
import com.fantasy.anomaly.model.*;
import com.fantasy.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AerospikeActiveAnomalyStoreTest {

    private static final String NAMESPACE = "fantasy";

    @Mock
    private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final Policy readPolicy = new Policy();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AerospikeActiveAnomalyStore store;
    private Anomaly anomaly;

    @BeforeEach
    void setUp() {
        store = new AerospikeActiveAnomalyStore(client, NAMESPACE, writePolicy, readPolicy);
        anomaly = TestDataFactory.createAnomaly("a-1", "P-1001", "MIN", AnomalyType.PERFORMANCE,
                Severity.LOW, "Fantasy Points", NOW).toBuilder()
                .relatedAnomalyIds(List.of("a-2"))
                .build();
    }

    @Test
    void findByKey_mapsAllBins() throws Exception {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(record(true));

        Optional<ActiveAlert> result = store.findByKey("P-1001:performance:STATISTICAL");

        assertThat(result).isPresent();
        ActiveAlert alert = result.get();
        assertThat(alert.getAlertKey()).isEqualTo("P-1001:performance:STATISTICAL");
        assertThat(alert.getDetector()).isEqualTo(DetectorKind.STATISTICAL);
        assertThat(alert.getAnomaly()).isEqualTo(anomaly);
        assertThat(alert.isResolved()).isTrue();
        assertThat(alert.getOccurrences()).isEqualTo(3);
        assertThat(alert.getResolvedBy()).isEqualTo("reconciliation");
    }

    @Test
    void findByKey_missing_empty() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(store.findByKey("P-9999:market:MARKET")).isEmpty();
    }

    @Test
    void findById_scansSet() throws Exception {
        Record record = record(false);
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(new Key(NAMESPACE, AerospikeConfig.SET_ACTIVE_ALERTS, "k"), record);
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_ACTIVE_ALERTS),
                any(ScanCallback.class));

        assertThat(store.findById("a-1")).hasValueSatisfying(a -> assertThat(a.isResolved()).isFalse());
        assertThat(store.findById("a-404")).isEmpty();
    }

    @Test
    void findAll_callbacksFromSeveralNodes_keepsEveryRecord() throws Exception {
        Record record = record(false);
        int nodes = 4;
        int recordsPerNode = 500;
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            ExecutorService nodeThreads = Executors.newFixedThreadPool(nodes);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> scans = new ArrayList<>();
            for (int n = 0; n < nodes; n++) {
                scans.add(nodeThreads.submit(() -> {
                    start.await();
                    for (int i = 0; i < recordsPerNode; i++) {
                        callback.scanCallback(new Key(NAMESPACE, AerospikeConfig.SET_ACTIVE_ALERTS, "k" + i), record);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> scan : scans) {
                scan.get(10, TimeUnit.SECONDS);
            }
            nodeThreads.shutdown();
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq(NAMESPACE), eq(AerospikeConfig.SET_ACTIVE_ALERTS),
                any(ScanCallback.class));

        List<ActiveAlert> alerts = store.findAll();

        assertThat(alerts).hasSize(nodes * recordsPerNode).doesNotContainNull();
    }

    @Test
    void save_writesUnderAlertKey() {
        ActiveAlert alert = TestDataFactory.createActiveAlert(anomaly, DetectorKind.STATISTICAL, false);

        store.save(alert);

        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        verify(client).put(eq(writePolicy), keyCaptor.capture(), any(Bin[].class));
        assertThat(keyCaptor.getValue().namespace).isEqualTo(NAMESPACE);
        assertThat(keyCaptor.getValue().setName).isEqualTo(AerospikeConfig.SET_ACTIVE_ALERTS);
        assertThat(keyCaptor.getValue().userKey.toString()).isEqualTo("P-1001:performance:STATISTICAL");
    }

    @Test
    void delete_removesRecord() {
        store.delete("P-1001:performance:STATISTICAL");

        verify(client).delete(eq(writePolicy), any(Key.class));
    }

    private Record record(boolean resolved) throws Exception {
        Map<String, Object> bins = new HashMap<>();
        bins.put("alertKey", "P-1001:performance:STATISTICAL");
        bins.put("detector", "STATISTICAL");
        bins.put("anomaly", objectMapper.writeValueAsString(anomaly));
        bins.put("resolved", resolved ? 1L : 0L);
        bins.put("firstDetected", NOW.toEpochMilli());
        bins.put("resolvedAt", resolved ? NOW.toEpochMilli() : 0L);
        bins.put("occurrences", 3L);
        bins.put("resolvedBy", resolved ? "reconciliation" : null);
        return new Record(bins, 1, 0);
    }
}
