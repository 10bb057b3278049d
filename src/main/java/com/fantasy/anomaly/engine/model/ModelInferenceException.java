package com.fantasy.anomaly.engine.model;

/**
 * A model call threw or returned unusable output. The detector's contribution to
 * the cycle is dropped; other detectors are unaffected.
 */
public class ModelInferenceException extends RuntimeException {

    public ModelInferenceException(String message) {
        super(message);
    }

    public ModelInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
