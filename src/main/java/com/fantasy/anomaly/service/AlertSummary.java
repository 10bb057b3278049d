package com.fantasy.anomaly.service;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AlertSummary {
    int total;
    int resolved;
    int unresolved;
    Map<String, Integer> bySeverity;
    Map<String, Integer> byType;
}
