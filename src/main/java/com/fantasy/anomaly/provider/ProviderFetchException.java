package com.fantasy.anomaly.provider;

/**
 * A data provider call failed for one subject. Recoverable: the monitoring cycle
 * skips the detectors that need the missing data and continues.
 */
public class ProviderFetchException extends RuntimeException {

    private final String provider;
    private final String subjectId;

    public ProviderFetchException(String provider, String subjectId, Throwable cause) {
        super("Failed to fetch " + provider + " data for subject " + subjectId + ": " + cause.getMessage(), cause);
        this.provider = provider;
        this.subjectId = subjectId;
    }

    public String getProvider() {
        return provider;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
