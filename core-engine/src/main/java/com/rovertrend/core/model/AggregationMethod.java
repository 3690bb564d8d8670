package com.rovertrend.core.model;

/**
 * How ensemble member forecasts are combined.
 *
 * @since 1.0.0
 */
public enum AggregationMethod {
    /** Weights proportional to each member's backtest performance. */
    PERFORMANCE_WEIGHTED,
    /** Every member weighted {@code 1/m}. */
    EQUAL_WEIGHTED
}
