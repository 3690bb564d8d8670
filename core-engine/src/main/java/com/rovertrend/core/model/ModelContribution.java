package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * One member of an {@link EnsemblePrediction}.
 *
 * @since 1.0.0
 */
public final class ModelContribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ForecastMethod method;
    private final double[] predictions;
    private final double weight;
    private final double performance;
    private final double backtestRmse;

    /**
     * @param method       member forecaster
     * @param predictions  member forecast over the horizon
     * @param weight       normalized weight in {@code [0,1]}
     * @param performance  backtest score in {@code [0,1]}, 1 being the best member
     * @param backtestRmse RMSE on the held-out window
     */
    public ModelContribution(ForecastMethod method, double[] predictions, double weight,
            double performance, double backtestRmse) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.predictions = Objects.requireNonNull(predictions, "predictions must not be null").clone();
        this.weight = weight;
        this.performance = performance;
        this.backtestRmse = backtestRmse;
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public String getName() {
        return method.name().toLowerCase(Locale.ROOT);
    }

    public double[] getPredictions() {
        return predictions.clone();
    }

    public double getWeight() {
        return weight;
    }

    public double getPerformance() {
        return performance;
    }

    public double getBacktestRmse() {
        return backtestRmse;
    }

    @Override
    public String toString() {
        return "ModelContribution{" +
                "method=" + method +
                ", weight=" + weight +
                ", performance=" + performance +
                ", backtestRmse=" + backtestRmse +
                '}';
    }
}
