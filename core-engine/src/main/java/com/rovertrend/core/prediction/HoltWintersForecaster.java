package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;

import java.util.Optional;

/**
 * Additive Holt-Winters (level, trend and seasonal smoothing).
 *
 * <p>
 * The smoothing weights are chosen from a small grid by minimum one-step
 * squared error. Initial level and trend come from the first two seasons and
 * the initial seasonal indices from the first season. Needs at least two
 * full seasons plus two samples.
 * </p>
 *
 * @since 1.0.0
 */
public class HoltWintersForecaster implements Forecaster {

    private static final double[] ALPHAS = { 0.2, 0.4, 0.6, 0.8 };
    private static final double[] BETAS = { 0.05, 0.1, 0.2 };
    private static final double[] GAMMAS = { 0.1, 0.3, 0.5 };

    private final int period;

    /**
     * @param period season length, at least 2
     */
    public HoltWintersForecaster(int period) {
        if (period < 2) {
            throw new IllegalArgumentException("Season length must be >= 2, got: " + period);
        }
        this.period = period;
    }

    @Override
    public ForecastMethod method() {
        return ForecastMethod.HOLT_WINTERS;
    }

    public int getPeriod() {
        return period;
    }

    @Override
    public Optional<Forecast> forecast(double[] series, int horizon) {
        int n = series.length;
        if (n < 2 * period + 2) {
            return Optional.empty();
        }

        Fit best = null;
        for (double alpha : ALPHAS) {
            for (double beta : BETAS) {
                for (double gamma : GAMMAS) {
                    Fit fit = run(series, alpha, beta, gamma);
                    if (best == null || fit.sse < best.sse) {
                        best = fit;
                    }
                }
            }
        }

        double variance = best.sse / (n - period);
        double[] mean = new double[horizon];
        double[] se = new double[horizon];
        double cumulative = 1.0;
        for (int h = 1; h <= horizon; h++) {
            mean[h - 1] = best.level + h * best.trend + best.seasonal[(n + h - 1) % period];
            if (h > 1) {
                int j = h - 1;
                double c = best.alpha * (1 + j * best.beta) + (j % period == 0 ? best.gamma : 0.0);
                cumulative += c * c;
            }
            se[h - 1] = Math.sqrt(variance * cumulative);
        }
        return Optional.of(new Forecast(mean, se, variance));
    }

    private Fit run(double[] x, double alpha, double beta, double gamma) {
        double first = 0;
        double second = 0;
        for (int i = 0; i < period; i++) {
            first += x[i];
            second += x[period + i];
        }
        first /= period;
        second /= period;

        double level = first;
        double trend = (second - first) / period;
        // seasonal[k] is the index for time steps t with t % period == k
        double[] seasonal = new double[period];
        for (int i = 0; i < period; i++) {
            seasonal[i] = x[i] - first;
        }

        double sse = 0;
        for (int t = period; t < x.length; t++) {
            int k = t % period;
            double predicted = level + trend + seasonal[k];
            double error = x[t] - predicted;
            sse += error * error;
            double previousLevel = level;
            level = alpha * (x[t] - seasonal[k]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            seasonal[k] = gamma * (x[t] - level) + (1 - gamma) * seasonal[k];
        }
        return new Fit(alpha, beta, gamma, level, trend, seasonal, sse);
    }

    private static final class Fit {
        private final double alpha;
        private final double beta;
        private final double gamma;
        private final double level;
        private final double trend;
        private final double[] seasonal;
        private final double sse;

        private Fit(double alpha, double beta, double gamma, double level, double trend, double[] seasonal,
                double sse) {
            this.alpha = alpha;
            this.beta = beta;
            this.gamma = gamma;
            this.level = level;
            this.trend = trend;
            this.seasonal = seasonal;
            this.sse = sse;
        }
    }
}
