package com.rovertrend.core.model;

import java.io.Serializable;

/**
 * Backtested forecast accuracy.
 *
 * <p>
 * MAPE and sMAPE are percentages. A metric is {@code NaN} when it is undefined
 * for the held-out data (all-zero actuals for MAPE, a constant training
 * window for MASE).
 * </p>
 *
 * @since 1.0.0
 */
public final class AccuracyMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double mape;
    private final double smape;
    private final double mase;
    private final double rmse;
    private final int holdout;

    public AccuracyMetrics(double mape, double smape, double mase, double rmse, int holdout) {
        this.mape = mape;
        this.smape = smape;
        this.mase = mase;
        this.rmse = rmse;
        this.holdout = holdout;
    }

    public double getMape() {
        return mape;
    }

    public double getSmape() {
        return smape;
    }

    public double getMase() {
        return mase;
    }

    public double getRmse() {
        return rmse;
    }

    /** @return number of held-out samples the metrics were computed on */
    public int getHoldout() {
        return holdout;
    }

    @Override
    public String toString() {
        return "AccuracyMetrics{" +
                "mape=" + mape +
                ", smape=" + smape +
                ", mase=" + mase +
                ", rmse=" + rmse +
                ", holdout=" + holdout +
                '}';
    }
}
