package com.rovertrend.core.stationarity;

import com.rovertrend.core.model.StationarityResult;
import com.rovertrend.core.util.SeriesMath;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Augmented Dickey-Fuller unit-root test with a constant term.
 *
 * <p>
 * Regresses {@code Δy[t]} on an intercept, the lagged level {@code y[t-1]}
 * and {@code k} lagged differences, with {@code k = floor(cbrt(n - 1))}. The
 * t-statistic of the lagged-level coefficient is the ADF statistic. The
 * p-value uses MacKinnon's (1994) normal-quantile approximation, and the
 * reported critical values are MacKinnon's (2010) finite-sample response
 * surfaces.
 * </p>
 *
 * <h3>Degenerate input</h3>
 * <ul>
 * <li>fewer than {@value #MIN_OBSERVATIONS} samples: not stationary,
 * p-value 1, statistic {@code NaN}</li>
 * <li>constant series: stationary, p-value 0, statistic {@code -Infinity}</li>
 * <li>constant first differences (a noiseless line): not stationary,
 * statistic {@code NaN}</li>
 * <li>singular regression: retried without lagged differences</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class StationarityTester {

    private static final Logger LOG = LoggerFactory.getLogger(StationarityTester.class);

    public static final int MIN_OBSERVATIONS = 8;

    public static final double DEFAULT_SIGNIFICANCE = 0.05;

    // MacKinnon (1994), constant-only model, one series.
    private static final double TAU_MAX = 2.74;
    private static final double TAU_MIN = -18.83;
    private static final double TAU_STAR = -1.61;
    private static final double[] SMALL_P = { 2.1659, 1.4412, 0.038269 };
    private static final double[] LARGE_P = { 1.7339, 0.93202, -0.12745, -0.010368 };

    // MacKinnon (2010) critical value response surfaces: b0 + b1/T + b2/T^2 + b3/T^3.
    private static final double[] CRIT_1 = { -3.43035, -6.5393, -16.786, -79.433 };
    private static final double[] CRIT_5 = { -2.86154, -2.8903, -4.234, -40.040 };
    private static final double[] CRIT_10 = { -2.56677, -1.5384, -2.809, 0.0 };

    /** Rank threshold for the QR decomposition. */
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private static final double EXACT_FIT = 1e-20;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double significanceLevel;

    public StationarityTester() {
        this(DEFAULT_SIGNIFICANCE);
    }

    /**
     * @param significanceLevel p-value below which the unit root is rejected
     * @throws IllegalArgumentException if not in {@code (0,1)}
     */
    public StationarityTester(double significanceLevel) {
        if (!(significanceLevel > 0 && significanceLevel < 1)) {
            throw new IllegalArgumentException("Significance level must be in (0,1), got: " + significanceLevel);
        }
        this.significanceLevel = significanceLevel;
    }

    /**
     * Test {@code series} for stationarity.
     *
     * @param series values in time order; must not be {@code null}
     * @return the test outcome, never {@code null}
     */
    public StationarityResult test(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length;
        if (n < MIN_OBSERVATIONS) {
            LOG.debug("ADF skipped: {} observations, need {}", n, MIN_OBSERVATIONS);
            return new StationarityResult(false, Double.NaN, 1.0, 0, n, Map.of());
        }
        if (SeriesMath.variance(series) == 0.0) {
            return new StationarityResult(true, Double.NEGATIVE_INFINITY, 0.0, 0, n - 1,
                    criticalValues(n - 1));
        }

        double[] firstDiff = SeriesMath.difference(series, 1);
        if (SeriesMath.variance(firstDiff) <= EXACT_FIT * Math.max(1.0, SeriesMath.variance(series))) {
            // deterministic linear path: the regression has no noise to test against
            return new StationarityResult(false, Double.NaN, 1.0, 0, n - 1, criticalValues(n - 1));
        }

        int lags = Math.min((int) Math.floor(Math.cbrt(n - 1)), (n - 5) / 2);
        double tStat;
        try {
            tStat = adfStatistic(series, lags);
        } catch (MathIllegalArgumentException e) {
            LOG.debug("ADF regression with {} lag(s) is singular, retrying without lags", lags);
            lags = 0;
            try {
                tStat = adfStatistic(series, 0);
            } catch (MathIllegalArgumentException retry) {
                LOG.debug("ADF regression singular without lags: {}", retry.getMessage());
                tStat = Double.NaN;
            }
        }

        int observations = n - 1 - lags;
        Map<String, Double> critical = criticalValues(observations);
        if (Double.isNaN(tStat)) {
            return new StationarityResult(false, tStat, 1.0, lags, observations, critical);
        }

        double pValue = pValue(tStat);
        boolean stationary = pValue < significanceLevel;
        LOG.debug("ADF statistic={} p={} lags={} stationary={}", tStat, pValue, lags, stationary);
        return new StationarityResult(stationary, tStat, pValue, lags, observations, critical);
    }

    public double getSignificanceLevel() {
        return significanceLevel;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double adfStatistic(double[] y, int lags) {
        int n = y.length;
        double[] dy = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            dy[i] = y[i + 1] - y[i];
        }

        int rows = dy.length - lags;
        double[] response = new double[rows];
        double[][] design = new double[rows][1 + lags];
        for (int r = 0; r < rows; r++) {
            int t = r + lags;
            response[r] = dy[t];
            design[r][0] = y[t];
            for (int j = 1; j <= lags; j++) {
                design[r][j] = dy[t - j];
            }
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        ols.newSampleData(response, design);
        double[] beta = ols.estimateRegressionParameters();
        double[] se = ols.estimateRegressionParametersStandardErrors();
        // index 0 is the intercept
        double gamma = beta[1];
        if (se[1] == 0.0) {
            if (gamma == 0.0) {
                return Double.NaN;
            }
            return gamma < 0 ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return gamma / se[1];
    }

    /**
     * MacKinnon approximate p-value for the constant-only ADF statistic.
     */
    static double pValue(double tStat) {
        if (tStat > TAU_MAX) {
            return 1.0;
        }
        if (tStat < TAU_MIN) {
            return 0.0;
        }
        double[] coef = tStat <= TAU_STAR ? SMALL_P : LARGE_P;
        double z = 0;
        double power = 1;
        for (double c : coef) {
            z += c * power;
            power *= tStat;
        }
        return STANDARD_NORMAL.cumulativeProbability(z);
    }

    static Map<String, Double> criticalValues(int observations) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("1%", surface(CRIT_1, observations));
        values.put("5%", surface(CRIT_5, observations));
        values.put("10%", surface(CRIT_10, observations));
        return values;
    }

    private static double surface(double[] b, int t) {
        double inv = 1.0 / Math.max(t, 1);
        return b[0] + b[1] * inv + b[2] * inv * inv + b[3] * inv * inv * inv;
    }
}
