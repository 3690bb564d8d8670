package com.rovertrend.core.drift;

import java.util.Objects;

/**
 * Output of {@link DriftMethodStrategy#step}: the successor state plus the
 * test outcome for the sample just consumed.
 *
 * @since 1.0.0
 */
public final class DriftStep {

    private final DriftMethodState state;
    private final DriftSignal signal;
    private final double statistic;
    private final double threshold;
    private final Double pValue;
    private final double confidence;

    /**
     * @param state      successor state
     * @param signal     verdict
     * @param statistic  current test statistic
     * @param threshold  drift threshold in the units of {@code statistic}
     * @param pValue     p-value, or {@code null} when the method has none
     * @param confidence confidence in {@code [0,1]}
     */
    public DriftStep(DriftMethodState state, DriftSignal signal, double statistic, double threshold,
            Double pValue, double confidence) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.statistic = statistic;
        this.threshold = threshold;
        this.pValue = pValue;
        this.confidence = confidence;
    }

    public DriftMethodState getState() {
        return state;
    }

    public DriftSignal getSignal() {
        return signal;
    }

    public double getStatistic() {
        return statistic;
    }

    public double getThreshold() {
        return threshold;
    }

    public Double getPValue() {
        return pValue;
    }

    public double getConfidence() {
        return confidence;
    }
}
