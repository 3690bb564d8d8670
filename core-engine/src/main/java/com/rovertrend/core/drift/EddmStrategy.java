package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;

/**
 * Early Drift Detection Method (Baena-García et al.).
 *
 * <p>
 * A sample counts as an error when {@code |z| > 2}. EDDM follows the
 * distance between consecutive errors: its mean {@code d̄} and standard
 * deviation {@code s}, and the historical maximum of {@code d̄ + 2s}. The
 * errors bunch together when the stream drifts, so the ratio
 * {@code (d̄ + 2s)/max} falls.
 * </p>
 *
 * <p>
 * The statistic is {@code 1 - ratio}. Drift when the ratio falls below
 * {@code β = 0.85 + 0.1·sensitivity}, warning below
 * {@code α = min(0.99, β + 0.05)}. The test is evaluated once
 * {@value #MIN_ERRORS} errors have been observed and is updated only when an
 * error occurs.
 * </p>
 *
 * @since 1.0.0
 */
public class EddmStrategy extends AbstractDriftStrategy<EddmStrategy.State> {

    static final int MIN_ERRORS = 30;

    static final double ERROR_Z = 2.0;

    private final double driftThreshold;
    private final double warningThreshold;

    public EddmStrategy(double sensitivity) {
        super(DriftMethod.EDDM, State.class, sensitivity);
        double beta = 0.85 + 0.1 * sensitivity;
        double alpha = Math.min(0.99, beta + 0.05);
        this.driftThreshold = 1.0 - beta;
        this.warningThreshold = 1.0 - alpha;
    }

    @Override
    public DriftMethodState initialState() {
        return new State(0, 0, -1, 0.0, 0.0, 0.0, 0.0);
    }

    @Override
    public boolean requiresBaseline() {
        return true;
    }

    @Override
    public double threshold() {
        return driftThreshold;
    }

    @Override
    protected DriftStep doStep(State s, double value, double z) {
        long n = s.count + 1;
        if (Math.abs(z) <= ERROR_Z) {
            State next = new State(n, s.errors, s.lastError, s.meanDistance, s.m2Distance, s.maxLevel, s.statistic);
            return outcome(next);
        }

        long errors = s.errors + 1;
        double mean = s.meanDistance;
        double m2 = s.m2Distance;
        long distances = s.lastError >= 0 ? errors - 1 : 0;
        if (s.lastError >= 0) {
            double distance = n - s.lastError;
            double d = distance - mean;
            mean += d / distances;
            m2 += d * (distance - mean);
        }

        double maxLevel = s.maxLevel;
        double statistic = s.statistic;
        if (errors >= MIN_ERRORS && distances >= 2) {
            double level = mean + 2.0 * Math.sqrt(m2 / distances);
            if (level > maxLevel) {
                maxLevel = level;
            }
            statistic = maxLevel > 0 ? 1.0 - level / maxLevel : 0.0;
        }
        return outcome(new State(n, errors, n, mean, m2, maxLevel, statistic));
    }

    private DriftStep outcome(State state) {
        double statistic = state.statistic;
        return new DriftStep(state, classify(statistic, driftThreshold, warningThreshold),
                statistic, driftThreshold, null, confidence(statistic, driftThreshold));
    }

    /**
     * Error bookkeeping and the Welford moments of the inter-error distance.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final long count;
        private final long errors;
        private final long lastError;
        private final double meanDistance;
        private final double m2Distance;
        private final double maxLevel;
        private final double statistic;

        @JsonCreator
        public State(@JsonProperty("count") long count,
                @JsonProperty("errors") long errors,
                @JsonProperty("lastError") long lastError,
                @JsonProperty("meanDistance") double meanDistance,
                @JsonProperty("m2Distance") double m2Distance,
                @JsonProperty("maxLevel") double maxLevel,
                @JsonProperty("statistic") double statistic) {
            this.count = count;
            this.errors = errors;
            this.lastError = lastError;
            this.meanDistance = meanDistance;
            this.m2Distance = m2Distance;
            this.maxLevel = maxLevel;
            this.statistic = statistic;
        }

        public long getCount() {
            return count;
        }

        public long getErrors() {
            return errors;
        }

        public long getLastError() {
            return lastError;
        }

        public double getMeanDistance() {
            return meanDistance;
        }

        public double getM2Distance() {
            return m2Distance;
        }

        public double getMaxLevel() {
            return maxLevel;
        }

        public double getStatistic() {
            return statistic;
        }
    }
}
