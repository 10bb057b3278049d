package com.fantasy.anomaly.config;

import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.DetectionConfig;
import com.fantasy.anomaly.model.SensitivityLevel;
import com.fantasy.anomaly.model.Subject;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.monitor")
public class MonitorProperties {

    // Start the loop with the configured subjects once the application is ready.
    private boolean autoStart = false;

    private SensitivityLevel sensitivityLevel = SensitivityLevel.MEDIUM;
    private int windowSize = 30;            // days
    private int updateFrequency = 15;       // minutes
    private Set<AnomalyType> enabledTypes = EnumSet.of(
            AnomalyType.PERFORMANCE, AnomalyType.USAGE, AnomalyType.MARKET, AnomalyType.INJURY);

    // Bounded fan-out for per-subject detection
    private int workerThreads = 4;

    // Capacity of the in-process batch channel; producers block when full.
    private int channelCapacity = 16;

    private List<Subject> subjects = new ArrayList<>();

    public DetectionConfig toDetectionConfig() {
        return DetectionConfig.builder()
                .sensitivity(sensitivityLevel)
                .windowSizeDays(windowSize)
                .updateFrequencyMinutes(updateFrequency)
                .enabledTypes(enabledTypes.isEmpty() ? EnumSet.noneOf(AnomalyType.class) : EnumSet.copyOf(enabledTypes))
                .build();
    }
}
