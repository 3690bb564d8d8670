package com.rovertrend.core.model;

import java.io.Serializable;

/**
 * Lifetime counters of one drift detector.
 *
 * @since 1.0.0
 */
public final class DriftStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long samplesProcessed;
    private final long driftsDetected;
    private final long warningsIssued;

    public DriftStatistics(long samplesProcessed, long driftsDetected, long warningsIssued) {
        this.samplesProcessed = samplesProcessed;
        this.driftsDetected = driftsDetected;
        this.warningsIssued = warningsIssued;
    }

    public long getSamplesProcessed() {
        return samplesProcessed;
    }

    public long getDriftsDetected() {
        return driftsDetected;
    }

    public long getWarningsIssued() {
        return warningsIssued;
    }

    @Override
    public String toString() {
        return "DriftStatistics{" +
                "samplesProcessed=" + samplesProcessed +
                ", driftsDetected=" + driftsDetected +
                ", warningsIssued=" + warningsIssued +
                '}';
    }
}
