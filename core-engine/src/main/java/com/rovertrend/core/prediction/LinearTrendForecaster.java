package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.trend.TrendModelFitter;

import java.util.Objects;
import java.util.Optional;

/**
 * Extrapolates the least-squares line.
 *
 * <p>
 * Standard errors are those of the regression line at the future index,
 * {@code s·sqrt(1/n + (x0 - x̄)²/Sxx)}, which widen with the distance from
 * the data.
 * </p>
 *
 * @since 1.0.0
 */
public class LinearTrendForecaster implements Forecaster {

    private final TrendModelFitter fitter;

    public LinearTrendForecaster(TrendModelFitter fitter) {
        this.fitter = Objects.requireNonNull(fitter, "Trend fitter must not be null");
    }

    @Override
    public ForecastMethod method() {
        return ForecastMethod.LINEAR_TREND;
    }

    @Override
    public Optional<Forecast> forecast(double[] series, int horizon) {
        int n = series.length;
        if (n < 2) {
            return Optional.empty();
        }
        TrendModel line = fitter.fitLinear(series);
        double[] coefficients = line.getCoefficients();
        double intercept = coefficients[0];
        double slope = coefficients[1];

        double sse = 0;
        for (double r : line.getResiduals()) {
            sse += r * r;
        }
        double variance = n > 2 ? sse / (n - 2) : 0.0;
        double xBar = (n - 1) / 2.0;
        double sxx = n * ((double) n * n - 1) / 12.0;

        double[] mean = new double[horizon];
        double[] se = new double[horizon];
        for (int h = 1; h <= horizon; h++) {
            double x0 = n - 1 + h;
            mean[h - 1] = intercept + slope * x0;
            se[h - 1] = Math.sqrt(variance * (1.0 / n + (x0 - xBar) * (x0 - xBar) / sxx));
        }
        return Optional.of(new Forecast(mean, se, variance));
    }
}
