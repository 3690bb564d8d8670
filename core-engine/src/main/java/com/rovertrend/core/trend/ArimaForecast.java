package com.rovertrend.core.trend;

/**
 * Point forecasts and their standard errors from a fitted ARIMA model.
 *
 * @since 1.0.0
 */
public final class ArimaForecast {

    private final double[] mean;
    private final double[] standardErrors;

    ArimaForecast(double[] mean, double[] standardErrors) {
        this.mean = mean;
        this.standardErrors = standardErrors;
    }

    public double[] getMean() {
        return mean.clone();
    }

    /** @return forecast standard error per step, non-decreasing with the horizon */
    public double[] getStandardErrors() {
        return standardErrors.clone();
    }

    public int getHorizon() {
        return mean.length;
    }
}
