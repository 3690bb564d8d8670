package com.rovertrend.core.trend;

import com.rovertrend.core.config.AnalysisConfig;
import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.model.ArimaOrder;
import com.rovertrend.core.model.StationarityResult;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.model.TrendType;
import com.rovertrend.core.stationarity.StationarityTester;
import com.rovertrend.core.util.AnalysisDeadline;
import com.rovertrend.core.util.SeriesMath;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fits trend models to a series and picks the most appropriate one.
 *
 * <p>
 * The independent variable is the sample index {@code x = 0, 1, ..., n-1}.
 * </p>
 *
 * <h3>Candidate forms</h3>
 * <ul>
 * <li>linear: {@code a + b·x}, ordinary least squares</li>
 * <li>polynomial: degree 2 up to the configured maximum, least squares on a
 * rescaled index</li>
 * <li>exponential: {@code a·e^(b·x)}, log-linearized</li>
 * <li>logarithmic: {@code a + b·ln(x+1)}</li>
 * <li>power: {@code a·(x+1)^b}, log-log linearized</li>
 * <li>ARIMA(p,d,q): grid search over the configured orders</li>
 * </ul>
 *
 * <p>
 * Before taking logarithms of the values, non-positive samples are clamped
 * to {@value #LOG_EPSILON}. Non-linear candidates are compared by AIC so that
 * higher-degree polynomials pay for their extra parameters.
 * </p>
 *
 * <p>
 * Stateless apart from configuration, and therefore thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendModelFitter {

    private static final Logger LOG = LoggerFactory.getLogger(TrendModelFitter.class);

    static final double LOG_EPSILON = 1e-10;

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    /** Smallest series the non-linear forms are fitted to. */
    private static final int MIN_NON_LINEAR = 4;

    private final int maxPolynomialDegree;
    private final double parsimonyTolerance;
    private final int maxP;
    private final int maxQ;
    private final int maxDifferencing;
    private final StationarityTester stationarityTester;

    public TrendModelFitter() {
        this(new AnalysisConfig());
    }

    /**
     * @param config analysis settings; validated here
     * @throws IllegalStateException if the configuration is invalid
     */
    public TrendModelFitter(AnalysisConfig config) {
        Objects.requireNonNull(config, "Analysis config must not be null");
        config.validate();
        this.maxPolynomialDegree = config.getMaxPolynomialDegree();
        this.parsimonyTolerance = config.getParsimonyTolerance();
        this.maxP = config.getMaxArimaP();
        this.maxQ = config.getMaxArimaQ();
        this.maxDifferencing = config.getMaxDifferencing();
        this.stationarityTester = new StationarityTester(config.getSignificanceLevel());
    }

    // ---------------------------------------------------------------
    // Linear
    // ---------------------------------------------------------------

    /**
     * Ordinary least-squares line through {@code (i, series[i])}.
     *
     * <p>
     * Always succeeds: an empty series yields zero coefficients and a single
     * sample yields a flat line through it.
     * </p>
     *
     * @param series values in time order
     * @return coefficients {@code [intercept, slope]}
     */
    public TrendModel fitLinear(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length;
        double intercept;
        double slope;
        if (n == 0) {
            intercept = 0;
            slope = 0;
        } else if (n == 1) {
            intercept = series[0];
            slope = 0;
        } else {
            SimpleRegression regression = new SimpleRegression();
            for (int i = 0; i < n; i++) {
                regression.addData(i, series[i]);
            }
            intercept = regression.getIntercept();
            slope = regression.getSlope();
        }

        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            fitted[i] = intercept + slope * i;
        }
        String equation = String.format(Locale.ROOT, "y = %.6f·x %+.6f", slope, intercept);
        return TrendModel.of(TrendType.LINEAR, new double[] { intercept, slope }, equation, series, fitted);
    }

    // ---------------------------------------------------------------
    // Non-linear
    // ---------------------------------------------------------------

    /**
     * Fit every non-linear form and return the one with the lowest AIC.
     *
     * @param series values in time order
     * @return the best non-linear model, or empty if the series is too short
     *         or no candidate could be fitted
     */
    public Optional<TrendModel> fitNonLinear(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        if (series.length < MIN_NON_LINEAR) {
            return Optional.empty();
        }

        List<TrendModel> candidates = new ArrayList<>();
        for (int degree = 2; degree <= maxPolynomialDegree; degree++) {
            fitPolynomial(series, degree).ifPresent(candidates::add);
        }
        fitExponential(series).ifPresent(candidates::add);
        fitLogarithmic(series).ifPresent(candidates::add);
        fitPower(series).ifPresent(candidates::add);

        Optional<TrendModel> best = candidates.stream()
                .filter(m -> Double.isFinite(m.getAic()) && Double.isFinite(m.getR2()))
                .min(Comparator.comparingDouble(TrendModel::getAic));
        best.ifPresent(m -> LOG.debug("Best non-linear form: {} (r2={}, aic={})", m.getType(), m.getR2(), m.getAic()));
        return best;
    }

    /**
     * Least-squares polynomial of the given degree.
     *
     * @return coefficients {@code [a0, a1, ..., a_degree]} for powers of
     *         {@code x}, or empty if the series has too few points or the
     *         design is singular
     */
    public Optional<TrendModel> fitPolynomial(double[] series, int degree) {
        int n = series.length;
        if (degree < 1 || n < degree + 2) {
            return Optional.empty();
        }
        // u = x / (n-1) keeps the design matrix well conditioned
        double scale = n - 1;
        double[][] design = new double[n][degree];
        for (int i = 0; i < n; i++) {
            double u = i / scale;
            double power = 1;
            for (int k = 0; k < degree; k++) {
                power *= u;
                design[i][k] = power;
            }
        }

        double[] beta;
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(series.clone(), design);
            beta = ols.estimateRegressionParameters();
        } catch (MathIllegalArgumentException e) {
            LOG.debug("Polynomial degree {} not fittable: {}", degree, e.getMessage());
            return Optional.empty();
        }

        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            double u = i / scale;
            double value = 0;
            for (int k = degree; k >= 0; k--) {
                value = value * u + beta[k];
            }
            fitted[i] = value;
        }
        double[] coefficients = new double[degree + 1];
        for (int k = 0; k <= degree; k++) {
            coefficients[k] = beta[k] / Math.pow(scale, k);
        }
        if (!SeriesMath.allFinite(coefficients)) {
            return Optional.empty();
        }

        StringBuilder equation = new StringBuilder("y = ").append(format(coefficients[0]));
        for (int k = 1; k <= degree; k++) {
            equation.append(String.format(Locale.ROOT, " %+.6g·x^%d", coefficients[k], k));
        }
        return Optional.of(TrendModel.of(TrendType.POLYNOMIAL, coefficients, equation.toString(), series, fitted));
    }

    private Optional<TrendModel> fitExponential(double[] series) {
        int n = series.length;
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(i, Math.log(Math.max(series[i], LOG_EPSILON)));
        }
        double a = Math.exp(regression.getIntercept());
        double b = regression.getSlope();
        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            fitted[i] = a * Math.exp(b * i);
        }
        return finite(TrendModel.of(TrendType.EXPONENTIAL, new double[] { a, b },
                String.format(Locale.ROOT, "y = %.6g·e^(%.6g·x)", a, b), series, fitted));
    }

    private Optional<TrendModel> fitLogarithmic(double[] series) {
        int n = series.length;
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(Math.log(i + 1.0), series[i]);
        }
        double a = regression.getIntercept();
        double b = regression.getSlope();
        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            fitted[i] = a + b * Math.log(i + 1.0);
        }
        return finite(TrendModel.of(TrendType.LOGARITHMIC, new double[] { a, b },
                String.format(Locale.ROOT, "y = %.6g %+.6g·ln(x+1)", a, b), series, fitted));
    }

    private Optional<TrendModel> fitPower(double[] series) {
        int n = series.length;
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(Math.log(i + 1.0), Math.log(Math.max(series[i], LOG_EPSILON)));
        }
        double a = Math.exp(regression.getIntercept());
        double b = regression.getSlope();
        double[] fitted = new double[n];
        for (int i = 0; i < n; i++) {
            fitted[i] = a * Math.pow(i + 1.0, b);
        }
        return finite(TrendModel.of(TrendType.POWER, new double[] { a, b },
                String.format(Locale.ROOT, "y = %.6g·(x+1)^%.6g", a, b), series, fitted));
    }

    // ---------------------------------------------------------------
    // ARIMA
    // ---------------------------------------------------------------

    /**
     * {@link #fitArima(double[], StationarityResult, AnalysisDeadline)} without a deadline.
     */
    public Optional<ArimaModel> fitArima(double[] series, StationarityResult stationarity) {
        return fitArima(series, stationarity, AnalysisDeadline.none());
    }

    /**
     * Select and fit an ARIMA model.
     *
     * <p>
     * The differencing order is 0 for a stationary series; otherwise the
     * series is differenced and re-tested until it is stationary or the
     * configured cap is reached. Every {@code (p, q)} pair in the grid is then
     * fitted and the lowest AIC wins, ties going to the lower BIC and then the
     * lower total order.
     * </p>
     *
     * @param series       level series
     * @param stationarity stationarity of {@code series}
     * @param deadline     checked before every candidate
     * @return the selected model, or empty if the differenced series is too
     *         short for every candidate
     * @throws java.util.concurrent.CancellationException if the deadline expires
     */
    public Optional<ArimaModel> fitArima(double[] series, StationarityResult stationarity,
            AnalysisDeadline deadline) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(stationarity, "Stationarity result must not be null");
        Objects.requireNonNull(deadline, "Deadline must not be null");

        int d = differencingOrder(series, stationarity);
        ArimaModel best = null;
        for (int p = 0; p <= maxP; p++) {
            for (int q = 0; q <= maxQ; q++) {
                deadline.checkpoint("ARIMA(" + p + "," + d + "," + q + ")");
                Optional<ArimaModel> candidate = ArimaEstimator.fit(series, new ArimaOrder(p, d, q), maxP);
                if (candidate.isPresent() && isFinite(candidate.get())
                        && (best == null || ARIMA_ORDERING.compare(candidate.get(), best) < 0)) {
                    best = candidate.get();
                }
            }
        }

        if (best == null) {
            LOG.debug("No ARIMA candidate fittable for {} samples with d={}", series.length, d);
            return Optional.empty();
        }
        LOG.debug("Selected {} (aic={}, bic={})", best.getOrder(), best.getAic(), best.getBic());
        return Optional.of(best);
    }

    /**
     * Refit a known order, e.g. on the training part of a backtest.
     *
     * @return the model, or empty if not fittable
     */
    public Optional<ArimaModel> fitArimaOrder(double[] series, ArimaOrder order) {
        Objects.requireNonNull(series, "Series must not be null");
        Objects.requireNonNull(order, "Order must not be null");
        return ArimaEstimator.fit(series, order, order.getP()).filter(TrendModelFitter::isFinite);
    }

    /**
     * Forecast {@code horizon} steps past the end of the series {@code model}
     * was fitted to.
     *
     * @throws IllegalArgumentException if {@code series} is not the fitted series
     */
    public ArimaForecast forecastArima(ArimaModel model, double[] series, int horizon) {
        Objects.requireNonNull(model, "Model must not be null");
        if (horizon <= 0) {
            throw new IllegalArgumentException("Horizon must be > 0, got: " + horizon);
        }
        return ArimaEstimator.forecast(model, series, horizon);
    }

    private int differencingOrder(double[] series, StationarityResult stationarity) {
        if (stationarity.isStationary()) {
            return 0;
        }
        int d = 0;
        double[] current = series;
        while (d < maxDifferencing) {
            d++;
            current = SeriesMath.difference(current, 1);
            if (current.length < StationarityTester.MIN_OBSERVATIONS
                    || stationarityTester.test(current).isStationary()) {
                break;
            }
        }
        return d;
    }

    private static final Comparator<ArimaModel> ARIMA_ORDERING = Comparator
            .comparingDouble(ArimaModel::getAic)
            .thenComparingDouble(ArimaModel::getBic)
            .thenComparingInt(m -> m.getOrder().getP() + m.getOrder().getQ());

    private static boolean isFinite(ArimaModel model) {
        return Double.isFinite(model.getAic()) && Double.isFinite(model.getBic())
                && Double.isFinite(model.getSigma2());
    }

    // ---------------------------------------------------------------
    // Selection
    // ---------------------------------------------------------------

    /**
     * Choose the most appropriate model.
     *
     * <p>
     * The highest R² wins unless a model with fewer parameters comes within
     * the parsimony tolerance of it, in which case the simplest such model is
     * chosen (higher R² breaking ties).
     * </p>
     *
     * @param models candidates; {@code null} entries are ignored
     * @return the selected model
     * @throws IllegalArgumentException if there is no candidate
     */
    public TrendModel selectBest(List<TrendModel> models) {
        Objects.requireNonNull(models, "Models must not be null");
        List<TrendModel> usable = new ArrayList<>();
        for (TrendModel model : models) {
            if (model != null && Double.isFinite(model.getR2())) {
                usable.add(model);
            }
        }
        if (usable.isEmpty()) {
            throw new IllegalArgumentException("No trend model to select from");
        }

        double bestR2 = usable.stream().mapToDouble(TrendModel::getR2).max().getAsDouble();
        TrendModel chosen = usable.stream()
                .filter(m -> m.getR2() >= bestR2 - parsimonyTolerance)
                .min(Comparator.comparingInt(TrendModel::getParameterCount)
                        .thenComparing(Comparator.comparingDouble(TrendModel::getR2).reversed()))
                .get();
        LOG.debug("Selected {} trend (r2={}) among {} candidate(s)", chosen.getType(), chosen.getR2(), usable.size());
        return chosen;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Optional<TrendModel> finite(TrendModel model) {
        if (!SeriesMath.allFinite(model.getCoefficients()) || !SeriesMath.allFinite(model.getDetrended())) {
            return Optional.empty();
        }
        return Optional.of(model);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.6g", value);
    }
}
