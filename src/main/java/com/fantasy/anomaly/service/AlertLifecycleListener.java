package com.fantasy.anomaly.service;

import com.fantasy.anomaly.model.ActiveAlert;

/**
 * Receives alert lifecycle transitions. Beans implementing this interface are
 * registered automatically; others can be added with
 * {@link AlertLifecycleService#addListener(AlertLifecycleListener)}.
 */
public interface AlertLifecycleListener {

    default void onAlertRaised(ActiveAlert alert) {
    }

    void onAlertResolved(ActiveAlert alert);

    default void onAlertPurged(ActiveAlert alert) {
    }
}
