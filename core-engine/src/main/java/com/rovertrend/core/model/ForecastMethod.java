package com.rovertrend.core.model;

import java.util.Locale;

/**
 * Forecasting methods offered by the prediction engine.
 *
 * @since 1.0.0
 */
public enum ForecastMethod {
    NAIVE,
    LINEAR_TREND,
    EXPONENTIAL_SMOOTHING,
    ARIMA,
    HOLT_WINTERS,
    ENSEMBLE;

    /**
     * Lenient lookup accepting any case and {@code -} in place of {@code _}.
     *
     * @param value method name
     * @return the matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ForecastMethod fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Forecast method must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ForecastMethod method : values()) {
            if (method.name().equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown forecast method: '" + value + "'");
    }
}
