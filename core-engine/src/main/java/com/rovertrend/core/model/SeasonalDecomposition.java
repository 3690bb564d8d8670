package com.rovertrend.core.model;

import java.io.Serializable;

/**
 * Result of seasonal period detection and classical additive decomposition.
 *
 * <p>
 * When {@link #isDetected()} is {@code false} the period is {@code 0}, the
 * strengths are {@code 0} and the component arrays are empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposition implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final double[] EMPTY = new double[0];

    private final boolean detected;
    private final int period;
    private final double strength;
    private final double trendStrength;
    private final double autocorrelation;
    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;

    public SeasonalDecomposition(boolean detected, int period, double strength, double trendStrength,
            double autocorrelation, double[] trend, double[] seasonal, double[] residual) {
        this.detected = detected;
        this.period = period;
        this.strength = strength;
        this.trendStrength = trendStrength;
        this.autocorrelation = autocorrelation;
        this.trend = trend != null ? trend.clone() : EMPTY;
        this.seasonal = seasonal != null ? seasonal.clone() : EMPTY;
        this.residual = residual != null ? residual.clone() : EMPTY;
    }

    /**
     * @param autocorrelation strongest autocorrelation seen during the search
     * @return a result reporting that no seasonality was found
     */
    public static SeasonalDecomposition notDetected(double autocorrelation) {
        return new SeasonalDecomposition(false, 0, 0, 0, autocorrelation, null, null, null);
    }

    public boolean isDetected() {
        return detected;
    }

    public int getPeriod() {
        return period;
    }

    /** @return {@code 1 - Var(residual)/Var(detrended)}, clamped to {@code [0,1]} */
    public double getStrength() {
        return strength;
    }

    /** @return {@code 1 - Var(residual)/Var(deseasonalized)}, clamped to {@code [0,1]} */
    public double getTrendStrength() {
        return trendStrength;
    }

    /** @return autocorrelation at the detected period (or the best candidate lag) */
    public double getAutocorrelation() {
        return autocorrelation;
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResidual() {
        return residual.clone();
    }

    @Override
    public String toString() {
        return "SeasonalDecomposition{" +
                "detected=" + detected +
                ", period=" + period +
                ", strength=" + strength +
                ", trendStrength=" + trendStrength +
                '}';
    }
}
