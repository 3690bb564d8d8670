package com.rovertrend.core.drift;

/**
 * Verdict of a single strategy step.
 *
 * @since 1.0.0
 */
public enum DriftSignal {
    NONE,
    WARNING,
    DRIFT
}
