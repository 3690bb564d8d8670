package com.rovertrend.core.model;

/**
 * Drift detector state machine: {@code STABLE -> WARNING -> DRIFT}, back to
 * {@code STABLE} after a reset.
 *
 * @since 1.0.0
 */
public enum DriftStatus {
    STABLE,
    WARNING,
    DRIFT
}
