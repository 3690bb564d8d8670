package com.rovertrend.core.drift;

/**
 * Receives warning and drift transitions.
 *
 * <p>
 * Called synchronously on the thread that fed the sample, while the
 * detector's lock is held. Implementations should hand the event off rather
 * than block. Exceptions are logged and do not affect detection.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DriftEventListener {

    void onDriftEvent(DriftEvent event);
}
