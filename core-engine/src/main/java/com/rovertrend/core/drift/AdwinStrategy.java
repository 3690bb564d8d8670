package com.rovertrend.core.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rovertrend.core.model.DriftMethod;

import java.util.Arrays;

/**
 * ADWIN: adaptive windowing over raw values.
 *
 * <p>
 * Keeps up to {@code 10 × windowSize} recent values. After every sample,
 * each split of the window into an older and a newer part (both at least
 * {@value #MIN_SUB_WINDOW} long) is tested. The split is significant when
 * the difference of the part means exceeds the Hoeffding-style bound
 * </p>
 *
 * <pre>
 * ε = σ_W · ( sqrt((2/m) · ln(2/δ')) + (2/(3m)) · ln(2/δ') )
 * </pre>
 *
 * <p>
 * where {@code m = 1/(1/n0 + 1/n1)}, {@code δ' = δ/n}, {@code σ_W} is the
 * window standard deviation and {@code δ = 0.008 · sensitivity²}. The
 * statistic is the largest {@code |μ0 - μ1| / ε}; drift when it exceeds
 * {@code 1}, in which case the older part is dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class AdwinStrategy extends AbstractDriftStrategy<AdwinStrategy.State> {

    static final int MIN_SUB_WINDOW = 5;

    private static final double THRESHOLD = 1.0;

    private final double delta;
    private final int maxWindow;

    public AdwinStrategy(double sensitivity, int windowSize) {
        super(DriftMethod.ADWIN, State.class, sensitivity);
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be > 0, got: " + windowSize);
        }
        this.delta = 0.008 * sensitivity * sensitivity;
        this.maxWindow = Math.max(2 * MIN_SUB_WINDOW, 10 * windowSize);
    }

    @Override
    public DriftMethodState initialState() {
        return new State(new double[0]);
    }

    @Override
    public boolean requiresBaseline() {
        return false;
    }

    @Override
    public double threshold() {
        return THRESHOLD;
    }

    @Override
    protected DriftStep doStep(State s, double value, double z) {
        double[] window = append(s.window, value, maxWindow);
        int n = window.length;
        if (n < 2 * MIN_SUB_WINDOW) {
            return new DriftStep(new State(window), DriftSignal.NONE, 0.0, THRESHOLD, null, 0.0);
        }

        double[] prefix = new double[n + 1];
        double sumSq = 0;
        for (int i = 0; i < n; i++) {
            prefix[i + 1] = prefix[i] + window[i];
            sumSq += window[i] * window[i];
        }
        double mean = prefix[n] / n;
        double sigma = Math.sqrt(Math.max(0.0, sumSq / n - mean * mean));
        if (sigma == 0.0) {
            return new DriftStep(new State(window), DriftSignal.NONE, 0.0, THRESHOLD, null, 0.0);
        }

        double logTerm = Math.log(2.0 * n / delta);
        double statistic = 0;
        int cut = -1;
        for (int split = MIN_SUB_WINDOW; split <= n - MIN_SUB_WINDOW; split++) {
            int n0 = split;
            int n1 = n - split;
            double mu0 = prefix[split] / n0;
            double mu1 = (prefix[n] - prefix[split]) / n1;
            double m = 1.0 / (1.0 / n0 + 1.0 / n1);
            double epsilon = sigma * (Math.sqrt(2.0 / m * logTerm) + 2.0 / (3.0 * m) * logTerm);
            double ratio = Math.abs(mu0 - mu1) / epsilon;
            if (ratio > statistic) {
                statistic = ratio;
                cut = split;
            }
        }

        DriftSignal signal = classify(statistic, THRESHOLD, WARNING_FRACTION * THRESHOLD);
        double[] kept = signal == DriftSignal.DRIFT ? Arrays.copyOfRange(window, cut, n) : window;
        return new DriftStep(new State(kept), signal, statistic, THRESHOLD, null,
                confidence(statistic, THRESHOLD));
    }

    /** The window was already shrunk by the drifting step. */
    @Override
    public DriftMethodState afterDrift(DriftMethodState state) {
        return state;
    }

    /** The newer sub-window becomes the reference. */
    @Override
    public double[] retainedValues(DriftMethodState state) {
        return ((State) state).getWindow();
    }

    private static double[] append(double[] window, double value, int max) {
        int keep = Math.min(window.length, max - 1);
        double[] next = new double[keep + 1];
        System.arraycopy(window, window.length - keep, next, 0, keep);
        next[keep] = value;
        return next;
    }

    /**
     * The adaptive window, oldest value first.
     */
    public static final class State implements DriftMethodState {

        private static final long serialVersionUID = 1L;

        private final double[] window;

        @JsonCreator
        public State(@JsonProperty("window") double[] window) {
            this.window = window != null ? window.clone() : new double[0];
        }

        public double[] getWindow() {
            return window.clone();
        }

        public int size() {
            return window.length;
        }
    }
}
