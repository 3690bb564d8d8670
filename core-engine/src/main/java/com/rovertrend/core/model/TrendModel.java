package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable fitted trend model.
 *
 * <p>
 * {@link #getDetrended()} holds the fitted trend values, i.e. the series with
 * the residual noise removed. Residuals are derived from it, so
 * {@code residuals[i] == original[i] - detrended[i]} holds exactly for every
 * index.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendModel implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Floor applied to the mean squared error before taking its logarithm. */
    private static final double MIN_MSE = 1e-300;

    private final TrendType type;
    private final double[] coefficients;
    private final String equation;
    private final double r2;
    private final double rmse;
    private final double mae;
    private final double aic;
    private final double[] residuals;
    private final double[] detrended;

    private TrendModel(TrendType type, double[] coefficients, String equation, double r2,
            double rmse, double mae, double aic, double[] residuals, double[] detrended) {
        this.type = type;
        this.coefficients = coefficients;
        this.equation = equation;
        this.r2 = r2;
        this.rmse = rmse;
        this.mae = mae;
        this.aic = aic;
        this.residuals = residuals;
        this.detrended = detrended;
    }

    /**
     * Build a model from its fitted values, deriving residuals and goodness-of-fit.
     *
     * @param type         functional form
     * @param coefficients fitted parameters; their count is the model's
     *                     complexity in the AIC penalty
     * @param equation     human-readable equation
     * @param original     the series the model was fitted to
     * @param fitted       fitted trend values, same length as {@code original}
     * @return the model
     * @throws IllegalArgumentException if the lengths differ
     */
    public static TrendModel of(TrendType type, double[] coefficients, String equation,
            double[] original, double[] fitted) {
        Objects.requireNonNull(type, "Trend type must not be null");
        Objects.requireNonNull(coefficients, "Coefficients must not be null");
        Objects.requireNonNull(original, "Original series must not be null");
        Objects.requireNonNull(fitted, "Fitted values must not be null");
        if (original.length != fitted.length) {
            throw new IllegalArgumentException("Fitted values length " + fitted.length
                    + " does not match series length " + original.length);
        }

        int n = original.length;
        double[] detrended = fitted.clone();
        double[] residuals = new double[n];
        double sum = 0;
        for (int i = 0; i < n; i++) {
            residuals[i] = original[i] - detrended[i];
            sum += original[i];
        }
        if (n == 0) {
            return new TrendModel(type, coefficients.clone(), equation, 0, 0, 0, 0,
                    residuals, detrended);
        }

        double mean = sum / n;
        double ssRes = 0;
        double ssTot = 0;
        double absSum = 0;
        for (int i = 0; i < n; i++) {
            ssRes += residuals[i] * residuals[i];
            absSum += Math.abs(residuals[i]);
            double d = original[i] - mean;
            ssTot += d * d;
        }

        double r2;
        if (ssTot == 0) {
            r2 = ssRes == 0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - ssRes / ssTot;
        }
        double mse = ssRes / n;
        double aic = n * Math.log(Math.max(mse, MIN_MSE)) + 2.0 * coefficients.length;

        return new TrendModel(type, coefficients.clone(), equation, r2, Math.sqrt(mse),
                absSum / n, aic, residuals, detrended);
    }

    public TrendType getType() {
        return type;
    }

    /**
     * @return a copy of the fitted parameters, in the order of {@link #getEquation()}
     */
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public int getParameterCount() {
        return coefficients.length;
    }

    public String getEquation() {
        return equation;
    }

    public double getR2() {
        return r2;
    }

    public double getRmse() {
        return rmse;
    }

    public double getMae() {
        return mae;
    }

    /**
     * Gaussian AIC, {@code n ln(SSE/n) + 2k}. Comparable between models fitted
     * to the same series.
     *
     * @return Akaike information criterion
     */
    public double getAic() {
        return aic;
    }

    public double[] getResiduals() {
        return residuals.clone();
    }

    public double[] getDetrended() {
        return detrended.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendModel that))
            return false;
        return type == that.type
                && Arrays.equals(coefficients, that.coefficients)
                && Arrays.equals(detrended, that.detrended);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type) * 31 + Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        return "TrendModel{" +
                "type=" + type +
                ", equation='" + equation + '\'' +
                ", r2=" + r2 +
                ", rmse=" + rmse +
                ", mae=" + mae +
                '}';
    }
}
