package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;

import java.util.Arrays;
import java.util.Optional;

/**
 * Persistence forecast: every future value equals the last observation.
 *
 * <p>
 * The one-step error variance is the mean squared first difference; the
 * standard error grows with {@code sqrt(h)} as for a random walk.
 * </p>
 *
 * @since 1.0.0
 */
public class NaiveForecaster implements Forecaster {

    @Override
    public ForecastMethod method() {
        return ForecastMethod.NAIVE;
    }

    @Override
    public Optional<Forecast> forecast(double[] series, int horizon) {
        int n = series.length;
        if (n == 0) {
            return Optional.empty();
        }
        double variance = 0;
        for (int i = 1; i < n; i++) {
            double d = series[i] - series[i - 1];
            variance += d * d;
        }
        variance = n > 1 ? variance / (n - 1) : 0.0;

        double[] mean = new double[horizon];
        Arrays.fill(mean, series[n - 1]);
        double[] se = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            se[h - 1] = Math.sqrt(variance * h);
        }
        return Optional.of(new Forecast(mean, se, variance));
    }
}
