package com.rovertrend.core.prediction;

import com.rovertrend.core.model.AccuracyMetrics;

/**
 * Forecast accuracy measures.
 *
 * <ul>
 * <li>MAPE: mean {@code |a - f|/|a|} in percent over non-zero actuals</li>
 * <li>sMAPE: mean {@code 2|a - f|/(|a| + |f|)} in percent, a term with
 * {@code a = f = 0} counting as zero</li>
 * <li>MASE: forecast MAE over the in-sample MAE of the one-step naive
 * forecast</li>
 * </ul>
 *
 * <p>
 * Undefined values are {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastMetrics {

    private ForecastMetrics() {
    }

    public static double mape(double[] actual, double[] forecast) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0.0) {
                sum += Math.abs(actual[i] - forecast[i]) / Math.abs(actual[i]);
                count++;
            }
        }
        return count == 0 ? Double.NaN : 100.0 * sum / count;
    }

    public static double smape(double[] actual, double[] forecast) {
        if (actual.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double denominator = Math.abs(actual[i]) + Math.abs(forecast[i]);
            if (denominator > 0) {
                sum += 2.0 * Math.abs(actual[i] - forecast[i]) / denominator;
            }
        }
        return 100.0 * sum / actual.length;
    }

    /**
     * @param training the history the forecast was made from
     */
    public static double mase(double[] actual, double[] forecast, double[] training) {
        if (training.length < 2 || actual.length == 0) {
            return Double.NaN;
        }
        double naive = 0;
        for (int i = 1; i < training.length; i++) {
            naive += Math.abs(training[i] - training[i - 1]);
        }
        naive /= training.length - 1;
        if (naive == 0.0) {
            return Double.NaN;
        }
        double mae = 0;
        for (int i = 0; i < actual.length; i++) {
            mae += Math.abs(actual[i] - forecast[i]);
        }
        return (mae / actual.length) / naive;
    }

    public static double rmse(double[] actual, double[] forecast) {
        if (actual.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double e = actual[i] - forecast[i];
            sum += e * e;
        }
        return Math.sqrt(sum / actual.length);
    }

    public static AccuracyMetrics evaluate(double[] actual, double[] forecast, double[] training) {
        if (actual.length != forecast.length) {
            throw new IllegalArgumentException("Actual and forecast differ in length");
        }
        return new AccuracyMetrics(mape(actual, forecast), smape(actual, forecast),
                mase(actual, forecast, training), rmse(actual, forecast), actual.length);
    }
}
