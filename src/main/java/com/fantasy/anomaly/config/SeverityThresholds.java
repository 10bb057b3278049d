package com.fantasy.anomaly.config;

import com.fantasy.anomaly.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ordered severity cut-offs for one anomaly type. A value at or above a cut-off
 * takes that level; the highest matching level wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeverityThresholds {

    private double low;
    private double medium;
    private double high;
    private double critical;

    public Severity classify(double value) {
        if (value >= critical) return Severity.CRITICAL;
        if (value >= high) return Severity.HIGH;
        if (value >= medium) return Severity.MEDIUM;
        return Severity.LOW;
    }

    public SeverityThresholds scaled(double multiplier) {
        return new SeverityThresholds(low * multiplier, medium * multiplier,
                high * multiplier, critical * multiplier);
    }
}
