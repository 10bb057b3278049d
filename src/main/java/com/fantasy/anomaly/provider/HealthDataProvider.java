package com.fantasy.anomaly.provider;

import com.fantasy.anomaly.model.HealthData;

public interface HealthDataProvider {

    HealthData get(String subjectId);
}
