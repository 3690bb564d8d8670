package com.rovertrend.core.drift;

/**
 * Status transitions that are announced to listeners.
 *
 * @since 1.0.0
 */
public enum DriftEventType {
    /** The detector entered the warning zone. */
    WARNING,
    /** The detector reported drift. */
    DRIFT_DETECTED
}
