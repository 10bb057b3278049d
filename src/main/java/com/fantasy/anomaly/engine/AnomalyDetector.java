package com.fantasy.anomaly.engine;

import com.fantasy.anomaly.model.ActiveAlert;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.DetectorKind;

import java.util.List;

/**
 * Interface for all anomaly detectors. Each implementation handles one DetectorKind.
 */
public interface AnomalyDetector {

    /**
     * The detector kind this implementation handles.
     */
    DetectorKind getKind();

    /**
     * Run the detector against one subject's data.
     *
     * @param context subject, windowed metrics, baseline and provider data for this cycle
     * @return zero or more anomalies; empty when data is insufficient
     */
    List<Anomaly> detect(DetectionContext context);

    /**
     * Re-run the check that raised {@code alert} against the subject's current data.
     *
     * @return true when the measure has fallen back under the warning threshold;
     *         false when the condition still holds or cannot be evaluated
     */
    boolean isConditionResolved(ActiveAlert alert, DetectionContext context);
}
