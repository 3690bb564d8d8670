package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;

import java.util.Optional;

/**
 * Contract for a single forecasting model.
 *
 * <p>
 * Implementations fit themselves to the series passed to
 * {@link #forecast(double[], int)} and keep no state between calls, so the
 * engine can call them on the full series and on a backtest training prefix
 * alike.
 * </p>
 *
 * @since 1.0.0
 */
public interface Forecaster {

    ForecastMethod method();

    /**
     * @param series  history, oldest first
     * @param horizon steps ahead, at least 1
     * @return the forecast, or empty if the model cannot be fitted to this series
     */
    Optional<Forecast> forecast(double[] series, int horizon);
}
