/**
 * Forecasting.
 *
 * <p>
 * {@link com.rovertrend.core.prediction.PredictionEngine} runs a single
 * {@link com.rovertrend.core.prediction.Forecaster} or a
 * performance-weighted ensemble of them, and backtests the result on the
 * trailing part of the series.
 * </p>
 *
 * @since 1.0.0
 */
package com.rovertrend.core.prediction;
