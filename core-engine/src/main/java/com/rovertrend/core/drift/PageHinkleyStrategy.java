package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;

/**
 * Two-sided Page-Hinkley test on standardized values.
 *
 * <p>
 * For increases, {@code m = Σ (z - z̄ - δ)} is tracked with its running
 * minimum; drift when {@code m - min(m)} exceeds {@code λ}. Decreases are
 * tracked symmetrically. {@code δ = 0.5}, {@code λ = 5 + 10(1 - sensitivity)}.
 * </p>
 *
 * @since 1.0.0
 */
public class PageHinkleyStrategy extends AbstractDriftStrategy<PageHinkleyStrategy.State> {

    static final double DELTA = 0.5;

    private final double lambda;

    public PageHinkleyStrategy(double sensitivity) {
        super(DriftMethod.PAGE_HINKLEY, State.class, sensitivity);
        this.lambda = cumulativeThreshold();
    }

    @Override
    public DriftMethodState initialState() {
        return new State(0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    @Override
    public boolean requiresBaseline() {
        return true;
    }

    @Override
    public double threshold() {
        return lambda;
    }

    @Override
    protected DriftStep doStep(State s, double value, double z) {
        long n = s.count + 1;
        double mean = s.mean + (z - s.mean) / n;

        double up = s.up + z - mean - DELTA;
        double upMin = Math.min(s.upMin, up);
        double down = s.down + z - mean + DELTA;
        double downMax = Math.max(s.downMax, down);

        double statistic = Math.max(up - upMin, downMax - down);
        State next = new State(n, mean, up, upMin, down, downMax);
        return new DriftStep(next, classify(statistic, lambda, WARNING_FRACTION * lambda),
                statistic, lambda, null, confidence(statistic, lambda));
    }

    /**
     * Running mean and the two cumulative deviation sums with their extrema.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final long count;
        private final double mean;
        private final double up;
        private final double upMin;
        private final double down;
        private final double downMax;

        @JsonCreator
        public State(@JsonProperty("count") long count,
                @JsonProperty("mean") double mean,
                @JsonProperty("up") double up,
                @JsonProperty("upMin") double upMin,
                @JsonProperty("down") double down,
                @JsonProperty("downMax") double downMax) {
            this.count = count;
            this.mean = mean;
            this.up = up;
            this.upMin = upMin;
            this.down = down;
            this.downMax = downMax;
        }

        public long getCount() {
            return count;
        }

        public double getMean() {
            return mean;
        }

        public double getUp() {
            return up;
        }

        public double getUpMin() {
            return upMin;
        }

        public double getDown() {
            return down;
        }

        public double getDownMax() {
            return downMax;
        }
    }
}
