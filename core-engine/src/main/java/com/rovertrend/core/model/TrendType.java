package com.rovertrend.core.model;

/**
 * Functional form of a fitted {@link TrendModel}.
 *
 * @since 1.0.0
 */
public enum TrendType {
    LINEAR,
    POLYNOMIAL,
    EXPONENTIAL,
    LOGARITHMIC,
    POWER,
    ARIMA
}
