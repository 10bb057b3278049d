package com.fantasy.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fantasy.anomaly.config.AerospikeConfig;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.DetectorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Active-alert table persisted in Aerospike. The anomaly itself is stored as a
 * JSON bin; lifecycle fields get their own bins.
 */
@Repository
@ConditionalOnProperty(prefix = "anomaly.store", name = "type", havingValue = "aerospike")
public class AerospikeActiveAnomalyStore implements ActiveAnomalyStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeActiveAnomalyStore.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeActiveAnomalyStore(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Optional<ActiveAlert> findByKey(String alertKey) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACTIVE_ALERTS, alertKey);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapRecordToAlert(record));
    }

    @Override
    public Optional<ActiveAlert> findById(String anomalyId) {
        return findAll().stream()
                .filter(alert -> anomalyId.equals(alert.getAnomaly().getId()))
                .findFirst();
    }

    @Override
    public List<ActiveAlert> findAll() {
        List<ActiveAlert> alerts = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACTIVE_ALERTS,
                (key, record) -> {
                    try {
                        ActiveAlert alert = mapRecordToAlert(record);
                        // Callbacks arrive on one thread per node
                        synchronized (alerts) {
                            alerts.add(alert);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize active alert record: {}", e.getMessage());
                    }
                });
        return alerts;
    }

    @Override
    public void save(ActiveAlert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACTIVE_ALERTS, alert.getAlertKey());

        client.put(writePolicy, key,
                new Bin("alertKey", alert.getAlertKey()),
                new Bin("detector", alert.getDetector().name()),
                new Bin("anomaly", serializeAnomaly(alert.getAnomaly())),
                new Bin("resolved", alert.isResolved() ? 1 : 0),
                new Bin("firstDetected", alert.getFirstDetectedAt()),
                new Bin("resolvedAt", alert.getResolvedAt()),
                new Bin("occurrences", alert.getOccurrences()),
                new Bin("resolvedBy", alert.getResolvedBy()));
    }

    @Override
    public void delete(String alertKey) {
        Key key = new Key(namespace, AerospikeConfig.SET_ACTIVE_ALERTS, alertKey);
        client.delete(writePolicy, key);
    }

    private ActiveAlert mapRecordToAlert(Record record) {
        return ActiveAlert.builder()
                .alertKey(record.getString("alertKey"))
                .detector(DetectorKind.valueOf(record.getString("detector")))
                .anomaly(deserializeAnomaly(record.getString("anomaly")))
                .resolved(record.getInt("resolved") == 1)
                .firstDetectedAt(record.getLong("firstDetected"))
                .resolvedAt(record.getLong("resolvedAt"))
                .occurrences(record.getInt("occurrences"))
                .resolvedBy(record.getString("resolvedBy"))
                .build();
    }

    private String serializeAnomaly(Anomaly anomaly) {
        try {
            return objectMapper.writeValueAsString(anomaly);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly " + anomaly.getId(), e);
        }
    }

    private Anomaly deserializeAnomaly(String json) {
        try {
            return objectMapper.readValue(json, Anomaly.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize anomaly", e);
        }
    }
}
