package com.fantasy.anomaly.service;

import com.fantasy.anomaly.engine.DetectionContext;
import com.fantasy.anomaly.engine.DetectionResult;
import com.fantasy.anomaly.model.Subject;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of detection for one subject in one cycle.
 */
@Value
@Builder
public class SubjectDetection {
    Subject subject;

    // Null when the subject failed before a context could be built
    DetectionContext context;

    DetectionResult result;

    // Provider or detector failures; the subject is reported in the batch's failedSubjects
    List<String> errors;

    public boolean isDegraded() {
        return !errors.isEmpty();
    }
}
