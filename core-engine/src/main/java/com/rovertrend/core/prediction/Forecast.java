package com.rovertrend.core.prediction;

/**
 * Raw output of a {@link Forecaster}.
 *
 * @since 1.0.0
 */
public final class Forecast {

    private final double[] mean;
    private final double[] standardErrors;
    private final double residualVariance;

    /**
     * @param mean             point forecasts
     * @param standardErrors   standard error of each point forecast
     * @param residualVariance in-sample one-step error variance
     */
    public Forecast(double[] mean, double[] standardErrors, double residualVariance) {
        if (mean.length != standardErrors.length) {
            throw new IllegalArgumentException("Forecast and standard errors differ in length");
        }
        this.mean = mean.clone();
        this.standardErrors = standardErrors.clone();
        this.residualVariance = residualVariance;
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getStandardErrors() {
        return standardErrors.clone();
    }

    public double getResidualVariance() {
        return residualVariance;
    }

    public int getHorizon() {
        return mean.length;
    }
}
