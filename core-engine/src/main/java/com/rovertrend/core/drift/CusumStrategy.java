package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;

/**
 * Two-sided tabular CUSUM on standardized values.
 *
 * <p>
 * {@code S+ = max(0, S+ + z - k)} and {@code S- = max(0, S- - z - k)} with
 * allowance {@code k = 0.5}. Drift when either sum exceeds
 * {@code h = 5 + 10(1 - sensitivity)}.
 * </p>
 *
 * @since 1.0.0
 */
public class CusumStrategy extends AbstractDriftStrategy<CusumStrategy.State> {

    static final double ALLOWANCE = 0.5;

    private final double threshold;

    public CusumStrategy(double sensitivity) {
        super(DriftMethod.CUSUM, State.class, sensitivity);
        this.threshold = cumulativeThreshold();
    }

    @Override
    public DriftMethodState initialState() {
        return new State(0.0, 0.0);
    }

    @Override
    public boolean requiresBaseline() {
        return true;
    }

    @Override
    public double threshold() {
        return threshold;
    }

    @Override
    protected DriftStep doStep(State state, double value, double z) {
        double up = Math.max(0.0, state.up + z - ALLOWANCE);
        double down = Math.max(0.0, state.down - z - ALLOWANCE);
        double statistic = Math.max(up, down);
        return new DriftStep(new State(up, down),
                classify(statistic, threshold, WARNING_FRACTION * threshold),
                statistic, threshold, null, confidence(statistic, threshold));
    }

    /**
     * Upper and lower cumulative sums.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final double up;
        private final double down;

        @JsonCreator
        public State(@JsonProperty("up") double up, @JsonProperty("down") double down) {
            this.up = up;
            this.down = down;
        }

        public double getUp() {
            return up;
        }

        public double getDown() {
            return down;
        }
    }
}
