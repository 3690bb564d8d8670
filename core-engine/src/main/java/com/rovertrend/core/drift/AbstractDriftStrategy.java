package com.rovertrend.core.drift;

import com.rovertrend.core.model.DriftMethod;

import java.util.Objects;

/**
 * Base class binding a strategy to its concrete state type.
 *
 * @param <S> state type
 * @since 1.0.0
 */
public abstract class AbstractDriftStrategy<S extends DriftMethodState> implements DriftMethodStrategy {

    /** Fraction of the drift threshold that raises a warning for methods without a native warning zone. */
    static final double WARNING_FRACTION = 0.6;

    private final DriftMethod method;
    private final Class<S> stateType;
    protected final double sensitivity;

    protected AbstractDriftStrategy(DriftMethod method, Class<S> stateType, double sensitivity) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.stateType = Objects.requireNonNull(stateType, "stateType must not be null");
        if (!(sensitivity > 0 && sensitivity <= 1)) {
            throw new IllegalArgumentException("Sensitivity must be in (0,1], got: " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    @Override
    public final DriftMethod method() {
        return method;
    }

    @Override
    public final DriftStep step(DriftMethodState state, double value, double z) {
        if (!stateType.isInstance(state)) {
            throw new IllegalArgumentException(method + " cannot step state of type "
                    + (state == null ? "null" : state.getClass().getSimpleName()));
        }
        return doStep(stateType.cast(state), value, z);
    }

    protected abstract DriftStep doStep(S state, double value, double z);

    /**
     * Classify a statistic that grows with evidence of drift.
     */
    protected static DriftSignal classify(double statistic, double threshold, double warningThreshold) {
        if (statistic > threshold) {
            return DriftSignal.DRIFT;
        }
        if (statistic > warningThreshold) {
            return DriftSignal.WARNING;
        }
        return DriftSignal.NONE;
    }

    /**
     * Continuous confidence: {@code 0.5 · stat/threshold} below the threshold,
     * rising from {@code 0.5} to {@code 1} as the statistic reaches twice
     * the threshold.
     */
    protected static double confidence(double statistic, double threshold) {
        if (!(threshold > 0) || !Double.isFinite(statistic)) {
            return statistic > 0 ? 1.0 : 0.0;
        }
        double ratio = Math.max(0.0, statistic / threshold);
        return ratio >= 1.0 ? Math.min(1.0, 0.5 + 0.5 * (ratio - 1.0)) : 0.5 * ratio;
    }

    /**
     * The shared {@code 5 + 10(1 - s)} threshold of the cumulative-sum tests.
     */
    protected double cumulativeThreshold() {
        return 5.0 + 10.0 * (1.0 - sensitivity);
    }
}
