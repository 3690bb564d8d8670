package com.rovertrend.core.drift;

import com.rovertrend.core.model.DriftMethod;

/**
 * Contract for the drift test run by a {@link DriftDetector}.
 *
 * <p>
 * Strategies are <strong>stateless</strong>: all test state lives in the
 * {@link DriftMethodState} passed in and returned by {@link #step}, so a
 * single strategy instance can serve any number of detectors and a detector
 * state can be snapshotted and restored.
 * </p>
 *
 * @since 1.0.0
 */
public interface DriftMethodStrategy {

    DriftMethod method();

    /**
     * @return state of a freshly started test
     */
    DriftMethodState initialState();

    /**
     * Whether the test consumes standardized values and so needs a
     * reference baseline before the first step.
     */
    boolean requiresBaseline();

    /**
     * @return drift threshold, reported while the baseline is still warming up
     */
    double threshold();

    /**
     * Consume one sample.
     *
     * @param state current state; must have been produced by this strategy
     * @param value raw sample
     * @param z     sample standardized against the reference baseline, or
     *              {@code 0} when the strategy needs no baseline and none exists
     * @return successor state and verdict
     */
    DriftStep step(DriftMethodState state, double value, double z);

    /**
     * State to continue with after a drift has been reported and the detector
     * resets automatically.
     */
    default DriftMethodState afterDrift(DriftMethodState state) {
        return initialState();
    }

    /**
     * Samples that should seed the new reference baseline after a reset, or
     * {@code null} to rebuild the baseline from fresh samples.
     */
    default double[] retainedValues(DriftMethodState state) {
        return null;
    }
}
