package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;

import java.util.Arrays;
import java.util.Optional;

/**
 * Simple exponential smoothing.
 *
 * <p>
 * The smoothing weight is chosen from {@code 0.05, 0.10, ..., 0.95} by
 * minimum one-step squared error. Forecasts are flat at the final level with
 * standard error {@code σ·sqrt(1 + (h-1)α²)}.
 * </p>
 *
 * @since 1.0.0
 */
public class ExponentialSmoothingForecaster implements Forecaster {

    static final int MIN_LENGTH = 3;

    @Override
    public ForecastMethod method() {
        return ForecastMethod.EXPONENTIAL_SMOOTHING;
    }

    @Override
    public Optional<Forecast> forecast(double[] series, int horizon) {
        int n = series.length;
        if (n < MIN_LENGTH) {
            return Optional.empty();
        }
        double bestAlpha = 0.5;
        double bestSse = Double.POSITIVE_INFINITY;
        double bestLevel = series[0];
        for (int step = 1; step <= 19; step++) {
            double alpha = step * 0.05;
            double level = series[0];
            double sse = 0;
            for (int t = 1; t < n; t++) {
                double error = series[t] - level;
                sse += error * error;
                level += alpha * error;
            }
            if (sse < bestSse) {
                bestSse = sse;
                bestAlpha = alpha;
                bestLevel = level;
            }
        }

        double variance = bestSse / (n - 1);
        double[] mean = new double[horizon];
        Arrays.fill(mean, bestLevel);
        double[] se = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            se[h - 1] = Math.sqrt(variance * (1.0 + (h - 1) * bestAlpha * bestAlpha));
        }
        return Optional.of(new Forecast(mean, se, variance));
    }
}
