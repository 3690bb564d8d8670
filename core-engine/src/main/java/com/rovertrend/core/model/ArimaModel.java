package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A fitted ARIMA model.
 *
 * <p>
 * The model is expressed on the {@code d}-times differenced series {@code w}:
 * </p>
 *
 * <pre>
 *   w[t] = c + Σ ar[i]·w[t-1-i] + e[t] + Σ ma[j]·e[t-1-j]
 * </pre>
 *
 * <p>
 * {@link #getResiduals()} are the conditional one-step errors {@code e} on
 * that differenced scale. {@link #getTrendModel()} re-expresses the one-step
 * fit on the original scale, with the same length as the input series.
 * </p>
 *
 * @since 1.0.0
 */
public final class ArimaModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ArimaOrder order;
    private final double constant;
    private final double[] arCoefficients;
    private final double[] maCoefficients;
    private final double sigma2;
    private final double logLikelihood;
    private final double aic;
    private final double bic;
    private final double[] residuals;
    private final TrendModel trendModel;

    private ArimaModel(Builder b) {
        this.order = Objects.requireNonNull(b.order, "order must not be null");
        this.constant = b.constant;
        this.arCoefficients = b.arCoefficients != null ? b.arCoefficients.clone() : new double[0];
        this.maCoefficients = b.maCoefficients != null ? b.maCoefficients.clone() : new double[0];
        this.sigma2 = b.sigma2;
        this.logLikelihood = b.logLikelihood;
        this.aic = b.aic;
        this.bic = b.bic;
        this.residuals = b.residuals != null ? b.residuals.clone() : new double[0];
        this.trendModel = Objects.requireNonNull(b.trendModel, "trendModel must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ArimaModel}. {@code order} and
     * {@code trendModel} are required.
     */
    public static class Builder {
        private ArimaOrder order;
        private double constant;
        private double[] arCoefficients;
        private double[] maCoefficients;
        private double sigma2;
        private double logLikelihood;
        private double aic;
        private double bic;
        private double[] residuals;
        private TrendModel trendModel;

        public Builder order(ArimaOrder order) {
            this.order = order;
            return this;
        }

        public Builder constant(double constant) {
            this.constant = constant;
            return this;
        }

        public Builder arCoefficients(double[] arCoefficients) {
            this.arCoefficients = arCoefficients;
            return this;
        }

        public Builder maCoefficients(double[] maCoefficients) {
            this.maCoefficients = maCoefficients;
            return this;
        }

        public Builder sigma2(double sigma2) {
            this.sigma2 = sigma2;
            return this;
        }

        public Builder logLikelihood(double logLikelihood) {
            this.logLikelihood = logLikelihood;
            return this;
        }

        public Builder aic(double aic) {
            this.aic = aic;
            return this;
        }

        public Builder bic(double bic) {
            this.bic = bic;
            return this;
        }

        public Builder residuals(double[] residuals) {
            this.residuals = residuals;
            return this;
        }

        public Builder trendModel(TrendModel trendModel) {
            this.trendModel = trendModel;
            return this;
        }

        public ArimaModel build() {
            return new ArimaModel(this);
        }
    }

    public ArimaOrder getOrder() {
        return order;
    }

    public double getConstant() {
        return constant;
    }

    public double[] getArCoefficients() {
        return arCoefficients.clone();
    }

    public double[] getMaCoefficients() {
        return maCoefficients.clone();
    }

    /** @return innovation variance estimate */
    public double getSigma2() {
        return sigma2;
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    public double getAic() {
        return aic;
    }

    public double getBic() {
        return bic;
    }

    /**
     * @return one-step innovations on the {@code d}-times differenced scale,
     *         zero before the first AR lag is available
     */
    public double[] getResiduals() {
        return residuals.clone();
    }

    public TrendModel getTrendModel() {
        return trendModel;
    }

    @Override
    public String toString() {
        return "ArimaModel{" +
                "order=" + order +
                ", aic=" + aic +
                ", bic=" + bic +
                ", sigma2=" + sigma2 +
                '}';
    }
}
