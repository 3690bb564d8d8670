/**
 * Trend model fitting and selection.
 *
 * <p>
 * {@link com.rovertrend.core.trend.TrendModelFitter} is the entry point. It
 * fits linear, non-linear and ARIMA models and forecasts with a fitted ARIMA
 * model.
 * </p>
 *
 * @since 1.0.0
 */
package com.rovertrend.core.trend;
