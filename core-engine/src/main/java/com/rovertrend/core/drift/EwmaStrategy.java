package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * EWMA control chart on standardized values.
 *
 * <p>
 * {@code E_t = λz + (1-λ)E_{t-1}} with {@code λ = 0.2}. The sample variance
 * is smoothed exponentially (weight {@value #VARIANCE_WEIGHT}, floor
 * {@value #MIN_VARIANCE}) and gives the time-varying control limit
 * </p>
 *
 * <pre>
 * σ_E = sqrt(var · λ/(2-λ) · (1 - (1-λ)^(2t)))
 * </pre>
 *
 * <p>
 * With {@code L = 2.5 + 2(1 - sensitivity)}, drift is raised when either
 * </p>
 * <ul>
 * <li>the raw value lies further than {@code L·sqrt(var)} from the previous
 * EWMA, or</li>
 * <li>the EWMA itself leaves its control band, {@code |E_t| > L·σ_E}.</li>
 * </ul>
 * <p>
 * The reported statistic is the larger of the two ratios. A warning is
 * raised while {@code |E_t|/σ_E} is above {@value AbstractDriftStrategy#WARNING_FRACTION} of
 * {@code L}. The p-value is the two-sided normal tail of the statistic.
 * </p>
 *
 * @since 1.0.0
 */
public class EwmaStrategy extends AbstractDriftStrategy<EwmaStrategy.State> {

    static final double LAMBDA = 0.2;

    static final double VARIANCE_WEIGHT = 0.05;

    static final double MIN_VARIANCE = 0.25;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double limit;

    public EwmaStrategy(double sensitivity) {
        super(DriftMethod.EWMA, State.class, sensitivity);
        this.limit = 2.5 + 2.0 * (1.0 - sensitivity);
    }

    @Override
    public DriftMethodState initialState() {
        return new State(0, 0.0, 1.0);
    }

    @Override
    public boolean requiresBaseline() {
        return true;
    }

    @Override
    public double threshold() {
        return limit;
    }

    @Override
    protected DriftStep doStep(State s, double value, double z) {
        long t = s.count + 1;
        double deviation = z - s.ewma;
        double ewma = LAMBDA * z + (1.0 - LAMBDA) * s.ewma;
        double variance = Math.max(MIN_VARIANCE,
                (1.0 - VARIANCE_WEIGHT) * s.variance + VARIANCE_WEIGHT * deviation * deviation);

        double decay = 1.0 - Math.pow(1.0 - LAMBDA, 2.0 * t);
        double sigma = Math.sqrt(variance * LAMBDA / (2.0 - LAMBDA) * decay);
        double ewmaRatio = Math.abs(ewma) / sigma;
        double deviationRatio = Math.abs(deviation) / Math.sqrt(s.variance);
        double statistic = Math.max(ewmaRatio, deviationRatio);
        double pValue = 2.0 * (1.0 - STANDARD_NORMAL.cumulativeProbability(statistic));

        DriftSignal signal;
        if (statistic > limit) {
            signal = DriftSignal.DRIFT;
        } else if (ewmaRatio > WARNING_FRACTION * limit) {
            signal = DriftSignal.WARNING;
        } else {
            signal = DriftSignal.NONE;
        }
        return new DriftStep(new State(t, ewma, variance), signal, statistic, limit, pValue,
                confidence(statistic, limit));
    }

    /**
     * Step count, EWMA and smoothed variance.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final long count;
        private final double ewma;
        private final double variance;

        @JsonCreator
        public State(@JsonProperty("count") long count,
                @JsonProperty("ewma") double ewma,
                @JsonProperty("variance") double variance) {
            this.count = count;
            this.ewma = ewma;
            this.variance = variance;
        }

        public long getCount() {
            return count;
        }

        public double getEwma() {
            return ewma;
        }

        public double getVariance() {
            return variance;
        }
    }
}
