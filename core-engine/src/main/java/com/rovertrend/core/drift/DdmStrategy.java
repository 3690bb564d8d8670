package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;

/**
 * Drift Detection Method (Gama et al.) on a deviation-based error signal.
 *
 * <p>
 * A sample counts as an error when {@code |z| > 2}. The error rate is
 * Laplace smoothed, {@code p = (e + 1)/(n + 2)}, with
 * {@code s = sqrt(p(1 - p)/n)}. Once {@value #MIN_SAMPLES} samples have been
 * seen, the historical minimum of {@code p + s} is tracked and the statistic
 * is {@code (p + s - p_min)/s_min}. Drift when it exceeds
 * {@code L = 2 + 2(1 - sensitivity)}; warning above {@code L - 1}.
 * </p>
 *
 * @since 1.0.0
 */
public class DdmStrategy extends AbstractDriftStrategy<DdmStrategy.State> {

    static final int MIN_SAMPLES = 30;

    static final double ERROR_Z = 2.0;

    private final double driftLevel;

    public DdmStrategy(double sensitivity) {
        super(DriftMethod.DDM, State.class, sensitivity);
        this.driftLevel = 2.0 + 2.0 * (1.0 - sensitivity);
    }

    @Override
    public DriftMethodState initialState() {
        return new State(0, 0, Double.MAX_VALUE, Double.MAX_VALUE);
    }

    @Override
    public boolean requiresBaseline() {
        return true;
    }

    @Override
    public double threshold() {
        return driftLevel;
    }

    @Override
    protected DriftStep doStep(State s, double value, double z) {
        long n = s.count + 1;
        long errors = s.errors + (Math.abs(z) > ERROR_Z ? 1 : 0);
        double p = (errors + 1.0) / (n + 2.0);
        double sd = Math.sqrt(p * (1.0 - p) / n);

        double pMin = s.pMin;
        double sMin = s.sMin;
        if (n < MIN_SAMPLES) {
            return new DriftStep(new State(n, errors, pMin, sMin), DriftSignal.NONE, 0.0, driftLevel, null, 0.0);
        }
        if (p + sd < pMin + sMin) {
            pMin = p;
            sMin = sd;
        }
        double statistic = sMin > 0 ? (p + sd - pMin) / sMin : 0.0;
        return new DriftStep(new State(n, errors, pMin, sMin),
                classify(statistic, driftLevel, driftLevel - 1.0),
                statistic, driftLevel, null, confidence(statistic, driftLevel));
    }

    /**
     * Sample and error counts with the minimum of {@code p + s}.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final long count;
        private final long errors;
        private final double pMin;
        private final double sMin;

        @JsonCreator
        public State(@JsonProperty("count") long count,
                @JsonProperty("errors") long errors,
                @JsonProperty("pMin") double pMin,
                @JsonProperty("sMin") double sMin) {
            this.count = count;
            this.errors = errors;
            this.pMin = pMin;
            this.sMin = sMin;
        }

        public long getCount() {
            return count;
        }

        public long getErrors() {
            return errors;
        }

        @JsonProperty("pMin")
        public double getPMin() {
            return pMin;
        }

        @JsonProperty("sMin")
        public double getSMin() {
            return sMin;
        }
    }
}
