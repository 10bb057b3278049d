package com.fantasy.anomaly.service;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.DetectionEngine;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectedAnomaly;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.repository.ActiveAnomalyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Owns the active-anomaly store: deduplication, reconciliation, purge and
 * manual resolution. Every mutation goes through a synchronized method so the
 * store has a single writer at a time.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    public static final String RESOLVED_BY_RECONCILIATION = "reconciliation";

    private final ActiveAnomalyStore store;
    private final DetectionEngine detectionEngine;
    private final AnomalyThresholdConfig config;
    private final MetricsConfig metricsConfig;
    private final List<AlertLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public AlertLifecycleService(ActiveAnomalyStore store,
                                 DetectionEngine detectionEngine,
                                 AnomalyThresholdConfig config,
                                 MetricsConfig metricsConfig,
                                 ObjectProvider<AlertLifecycleListener> listenerBeans) {
        this.store = store;
        this.detectionEngine = detectionEngine;
        this.config = config;
        this.metricsConfig = metricsConfig;
        listenerBeans.orderedStream().forEach(this::addListener);
    }

    public void addListener(AlertLifecycleListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AlertLifecycleListener listener) {
        listeners.remove(listener);
    }

    /**
     * Collapse detections sharing an alert key into one, keeping the most severe
     * (then the most confident), and re-use the id of an already active alert for
     * that key so correlation links and REST lookups stay stable across cycles.
     */
    public synchronized List<DetectedAnomaly> canonicalize(List<DetectedAnomaly> detected) {
        Map<String, DetectedAnomaly> strongest = new LinkedHashMap<>();
        for (DetectedAnomaly d : detected) {
            strongest.merge(d.alertKey(), d, AlertLifecycleService::stronger);
        }

        List<DetectedAnomaly> result = new ArrayList<>(strongest.size());
        for (Map.Entry<String, DetectedAnomaly> entry : strongest.entrySet()) {
            DetectedAnomaly d = entry.getValue();
            Optional<ActiveAlert> existing = store.findByKey(entry.getKey());
            if (existing.isPresent() && !existing.get().getAnomaly().getId().equals(d.getAnomaly().getId())) {
                Anomaly renamed = d.getAnomaly().toBuilder()
                        .id(existing.get().getAnomaly().getId())
                        .build();
                result.add(new DetectedAnomaly(d.getDetector(), renamed));
            } else {
                result.add(d);
            }
        }
        if (result.size() < detected.size()) {
            log.debug("Collapsed {} detections into {} alerts", detected.size(), result.size());
        }
        return result;
    }

    private static DetectedAnomaly stronger(DetectedAnomaly current, DetectedAnomaly candidate) {
        int bySeverity = candidate.getAnomaly().getSeverity().compareTo(current.getAnomaly().getSeverity());
        if (bySeverity != 0) {
            return bySeverity > 0 ? candidate : current;
        }
        return candidate.getAnomaly().getConfidence() > current.getAnomaly().getConfidence() ? candidate : current;
    }

    /**
     * Insert new alerts and refresh re-detected ones. Detections are keyed by subject,
     * type and detector; a detection whose key is already stored updates that entry:
     * it keeps its id, takes the new details and timestamp, and becomes unresolved again.
     */
    public synchronized List<ActiveAlert> upsert(List<DetectedAnomaly> detected, Instant now) {
        List<ActiveAlert> saved = new ArrayList<>(detected.size());

        for (DetectedAnomaly d : detected) {
            String alertKey = d.alertKey();
            Optional<ActiveAlert> existing = store.findByKey(alertKey);

            ActiveAlert alert;
            if (existing.isPresent()) {
                ActiveAlert previous = existing.get();
                Anomaly anomaly = d.getAnomaly().toBuilder()
                        .id(previous.getAnomaly().getId())
                        .build();
                alert = previous.toBuilder()
                        .detector(d.getDetector())
                        .anomaly(anomaly)
                        .resolved(false)
                        .resolvedAt(0)
                        .resolvedBy(null)
                        .occurrences(previous.getOccurrences() + 1)
                        .build();
                store.save(alert);
                log.debug("Alert refreshed: {} (occurrences={})", alertKey, alert.getOccurrences());
            } else {
                alert = ActiveAlert.builder()
                        .alertKey(alertKey)
                        .detector(d.getDetector())
                        .anomaly(d.getAnomaly())
                        .resolved(false)
                        .firstDetectedAt(now.toEpochMilli())
                        .build();
                store.save(alert);
                log.warn("ANOMALY DETECTED: {} - {} {} (confidence={})",
                        alertKey, d.getAnomaly().getSeverity().getValue(),
                        d.getAnomaly().getDescription(),
                        String.format("%.2f", d.getAnomaly().getConfidence()));
                notifyListeners(l -> l.onAlertRaised(copy(alert)));
            }
            saved.add(alert);
        }

        updateGauges();
        return saved;
    }

    /**
     * Re-run the producing detector's check for every unresolved alert whose subject
     * has a context this cycle. Alerts re-detected this cycle and alerts of subjects
     * without data are left untouched.
     *
     * @return alert keys resolved by this pass
     */
    public synchronized List<String> reconcile(Map<String, DetectionContext> contextsBySubject,
                                               Set<String> detectedKeys, Instant now) {
        List<String> resolvedKeys = new ArrayList<>();

        for (ActiveAlert alert : store.findAll()) {
            if (alert.isResolved() || detectedKeys.contains(alert.getAlertKey())) {
                continue;
            }
            DetectionContext context = contextsBySubject.get(alert.getAnomaly().getSubjectId());
            if (context == null) {
                continue;
            }

            if (detectionEngine.isConditionResolved(alert, context)) {
                ActiveAlert resolved = markResolved(alert, RESOLVED_BY_RECONCILIATION, now);
                resolvedKeys.add(resolved.getAlertKey());
                log.info("ANOMALY RESOLVED: {} - condition cleared", alert.getAlertKey());
            }
        }

        if (!resolvedKeys.isEmpty()) {
            updateGauges();
        }
        return resolvedKeys;
    }

    /**
     * Remove every alert whose anomaly is older than the retention window, whether or
     * not it has been resolved.
     *
     * @return number of alerts removed
     */
    public synchronized int purge(Instant now) {
        Duration retention = Duration.ofDays(config.getLifecycle().getRetentionDays());
        int purged = 0;

        for (ActiveAlert alert : store.findAll()) {
            Instant timestamp = alert.getAnomaly().getTimestamp();
            if (timestamp != null && Duration.between(timestamp, now).compareTo(retention) > 0) {
                store.delete(alert.getAlertKey());
                purged++;
                notifyListeners(l -> l.onAlertPurged(copy(alert)));
            }
        }

        if (purged > 0) {
            metricsConfig.recordAlertsPurged(purged);
            log.info("Purged {} alerts older than {} days", purged, retention.toDays());
        }
        updateGauges();
        return purged;
    }

    /**
     * Resolve an alert by anomaly id on behalf of an operator.
     *
     * @return the updated alert, or empty if no alert has that id
     */
    public synchronized Optional<ActiveAlert> resolve(String anomalyId, String resolvedBy) {
        Optional<ActiveAlert> existing = store.findById(anomalyId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        ActiveAlert alert = existing.get();
        if (alert.isResolved()) {
            return Optional.of(alert);
        }
        ActiveAlert resolved = markResolved(alert, resolvedBy, Instant.now());
        log.info("ANOMALY RESOLVED: {} - resolved by {}", alert.getAlertKey(), resolvedBy);
        updateGauges();
        return Optional.of(resolved);
    }

    public Optional<ActiveAlert> findById(String anomalyId) {
        return store.findById(anomalyId);
    }

    /**
     * Active-store listing, newest first. Null filters match everything.
     */
    public List<ActiveAlert> query(AnomalyType type, Severity severity, Boolean resolved,
                                   String subjectId, int limit) {
        return store.findAll().stream()
                .filter(a -> type == null || a.getAnomaly().getType() == type)
                .filter(a -> severity == null || a.getAnomaly().getSeverity() == severity)
                .filter(a -> resolved == null || a.isResolved() == resolved)
                .filter(a -> subjectId == null || subjectId.equals(a.getAnomaly().getSubjectId()))
                .sorted(Comparator.comparing((ActiveAlert a) -> a.getAnomaly().getTimestamp(),
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    public AlertSummary summary() {
        List<ActiveAlert> all = store.findAll();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        int resolved = 0;

        for (ActiveAlert alert : all) {
            if (alert.isResolved()) {
                resolved++;
            }
            bySeverity.merge(alert.getAnomaly().getSeverity().getValue(), 1, Integer::sum);
            byType.merge(alert.getAnomaly().getType().getValue(), 1, Integer::sum);
        }

        return AlertSummary.builder()
                .total(all.size())
                .resolved(resolved)
                .unresolved(all.size() - resolved)
                .bySeverity(bySeverity)
                .byType(byType)
                .build();
    }

    private ActiveAlert markResolved(ActiveAlert alert, String resolvedBy, Instant now) {
        ActiveAlert resolved = alert.toBuilder()
                .resolved(true)
                .resolvedAt(now.toEpochMilli())
                .resolvedBy(resolvedBy)
                .build();
        store.save(resolved);
        metricsConfig.recordAlertResolved(resolvedBy);
        notifyListeners(l -> l.onAlertResolved(copy(resolved)));
        return resolved;
    }

    private void notifyListeners(Consumer<AlertLifecycleListener> event) {
        for (AlertLifecycleListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.error("Alert lifecycle listener {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    // Listeners get their own copy so they cannot mutate stored state.
    private static ActiveAlert copy(ActiveAlert alert) {
        return alert.toBuilder().build();
    }

    private void updateGauges() {
        List<ActiveAlert> all = store.findAll();
        int unresolved = (int) all.stream().filter(a -> !a.isResolved()).count();
        metricsConfig.updateAlertCounts(all.size(), unresolved);
    }
}
