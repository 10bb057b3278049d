package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectedAnomaly;
import com.fantasy.anomaly.model.DetectorKind;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every enabled detector against one subject's context.
 * Uses the Strategy pattern: each DetectorKind is handled by a registered AnomalyDetector.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<DetectorKind, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(DetectorKind.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getKind(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getKind(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors enabled by the context's configuration.
     *
     * @param context the subject's data for this cycle
     * @return anomalies from every detector that succeeded; failures are recorded in the result
     */
    @Observed(name = "anomaly.detect_all", contextualName = "detect-all-anomalies")
    public DetectionResult detectAll(DetectionContext context) {
        DetectionResult result = new DetectionResult();
        Set<AnomalyType> enabledTypes = context.getConfig().getEnabledTypes();

        for (Map.Entry<DetectorKind, AnomalyDetector> entry : detectorMap.entrySet()) {
            DetectorKind kind = entry.getKey();
            if (!kind.isEnabled(enabledTypes)) {
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("detector.run." + kind)
                    .tag("detector.kind", kind.name())
                    .tag("subject.id", context.getSubjectId())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<Anomaly> anomalies = entry.getValue().detect(context);
                span.tag("detector.anomalies", String.valueOf(anomalies.size()));

                for (Anomaly anomaly : anomalies) {
                    result.getAnomalies().add(new DetectedAnomaly(kind, anomaly));
                    metricsConfig.recordAnomalyDetected(anomaly.getType().getValue(),
                            anomaly.getSeverity().getValue(), anomaly.getConfidence());
                    log.debug("Anomaly detected: {} for subject {} - severity={}, metric={}",
                            kind, context.getSubjectId(), anomaly.getSeverity(), anomaly.getDetails().getMetric());
                }
            } catch (Exception e) {
                span.error(e);
                metricsConfig.recordDetectorFailure(kind.name());
                log.error("Error running detector {} for subject {}: {}",
                        kind, context.getSubjectId(), e.getMessage(), e);
                result.fail(kind + ": " + e.getMessage());
            } finally {
                span.end();
            }
        }

        return result;
    }

    /**
     * Re-run the check behind an active alert. A detector failure leaves the alert active.
     */
    public boolean isConditionResolved(ActiveAlert alert, DetectionContext context) {
        AnomalyDetector detector = detectorMap.get(alert.getDetector());
        if (detector == null) {
            log.warn("No detector registered for alert {} ({})", alert.getAlertKey(), alert.getDetector());
            return false;
        }
        try {
            return detector.isConditionResolved(alert, context);
        } catch (Exception e) {
            metricsConfig.recordDetectorFailure(alert.getDetector().name());
            log.error("Error reconciling alert {}: {}", alert.getAlertKey(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Anomaly types covered by at least one registered detector.
     */
    public Set<AnomalyType> supportedTypes() {
        Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        for (DetectorKind kind : detectorMap.keySet()) {
            types.addAll(kind.getTypes());
        }
        return Collections.unmodifiableSet(types);
    }

    public boolean supportsAny(Set<AnomalyType> enabledTypes) {
        if (enabledTypes == null) {
            return false;
        }
        Set<AnomalyType> supported = supportedTypes();
        return enabledTypes.stream().anyMatch(supported::contains);
    }
}
