package com.fantasy.anomaly.sink;

import com.fantasy.anomaly.model.AnomalyBatch;

/**
 * Receives each completed monitoring cycle. Called from the loop thread; a sink
 * that blocks delays the next cycle.
 */
public interface AlertSink {

    void publish(AnomalyBatch batch);
}
