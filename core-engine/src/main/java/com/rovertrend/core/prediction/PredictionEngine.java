package com.rovertrend.core.prediction;

import com.rovertrend.core.config.PredictionConfig;
import com.rovertrend.core.model.AccuracyMetrics;
import com.rovertrend.core.model.AggregationMethod;
import com.rovertrend.core.model.EnsemblePrediction;
import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.model.ModelContribution;
import com.rovertrend.core.model.PredictionInterval;
import com.rovertrend.core.model.PredictionResult;
import com.rovertrend.core.model.TelemetryStream;
import com.rovertrend.core.stationarity.StationarityTester;
import com.rovertrend.core.trend.TrendModelFitter;
import com.rovertrend.core.util.SeriesMath;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Multi-step forecasting with backtested accuracy and uncertainty intervals.
 *
 * <h3>Single methods</h3>
 * <p>
 * The requested forecaster runs on the full series. If it cannot (ARIMA not
 * fittable, Holt-Winters without a seasonal period, series too short) the
 * persistence forecast is used instead and the result is marked as a
 * fallback.
 * </p>
 *
 * <h3>Ensemble</h3>
 * <p>
 * Every applicable forecaster (naive, linear trend, ARIMA, exponential
 * smoothing, and Holt-Winters when a season is known) is backtested on the
 * trailing {@code clamp(horizon, 1, n/4)} samples. Its performance is
 * {@code (minRmse + ε)/(rmse + ε)}, so the best member scores 1. Weights are
 * the normalized performances, or {@code 1/m} with
 * {@link AggregationMethod#EQUAL_WEIGHTED}. When the series is too short to
 * backtest, all members are weighted equally.
 * </p>
 *
 * <h3>History</h3>
 * <p>
 * Every result is kept in a {@link PredictionHistory} under its stream id, so
 * forecasts can be scored once the actual values arrive
 * ({@link #updateModelPerformance(String, double[])}).
 * </p>
 *
 * <h3>Intervals</h3>
 * <ul>
 * <li>confidence: {@code ± z·se}, with the ensemble {@code se²} being the
 * weighted mixture variance {@code Σ w(se_i² + (f_i - f)²)}</li>
 * <li>prediction: {@code ± z·sqrt(se² + σ²)}, {@code σ²} being the backtest
 * mean squared error (in-sample error variance without a backtest)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PredictionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionEngine.class);

    static final double WEIGHT_EPSILON = 1e-9;

    /** Shortest training prefix a backtest is run on. */
    static final int MIN_TRAINING = 3;

    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final TrendModelFitter fitter;
    private final StationarityTester stationarityTester;
    private final PredictionHistory history;
    private final NaiveForecaster naive = new NaiveForecaster();

    public PredictionEngine() {
        this(new TrendModelFitter(), new StationarityTester());
    }

    public PredictionEngine(TrendModelFitter fitter, StationarityTester stationarityTester) {
        this(fitter, stationarityTester, new PredictionHistory());
    }

    /**
     * @param history where results are kept; may be shared between engines
     */
    public PredictionEngine(TrendModelFitter fitter, StationarityTester stationarityTester,
            PredictionHistory history) {
        this.fitter = Objects.requireNonNull(fitter, "Trend fitter must not be null");
        this.stationarityTester = Objects.requireNonNull(stationarityTester, "Stationarity tester must not be null");
        this.history = Objects.requireNonNull(history, "Prediction history must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public PredictionResult predict(TelemetryStream stream, PredictionConfig config) {
        return predict(stream, config, ForecastContext.empty());
    }

    /**
     * Forecast {@code config.getHorizon()} steps past the end of the stream.
     *
     * @param stream  history; must not be empty
     * @param config  forecast options
     * @param context models already fitted to {@code stream}
     * @return a {@link PredictionResult}, or an {@link EnsemblePrediction} for
     *         {@link ForecastMethod#ENSEMBLE}
     * @throws IllegalArgumentException if the stream is empty
     * @throws IllegalStateException    if the configuration is invalid
     * @throws java.util.concurrent.CancellationException if the context deadline expires
     */
    public PredictionResult predict(TelemetryStream stream, PredictionConfig config, ForecastContext context) {
        Objects.requireNonNull(stream, "Stream must not be null");
        Objects.requireNonNull(config, "Prediction config must not be null");
        Objects.requireNonNull(context, "Forecast context must not be null");
        config.validate();
        if (stream.isEmpty()) {
            throw new IllegalArgumentException("Cannot forecast empty stream '" + stream.getId() + "'");
        }

        double[] data = stream.getData();
        List<Instant> future = futureTimestamps(stream.getTimestamps(), config.getHorizon());
        double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + config.getConfidenceLevel() / 2.0);

        PredictionResult result = config.getMethod() == ForecastMethod.ENSEMBLE
                ? ensemble(data, future, z, config, context)
                : single(data, future, z, config, context);
        LOG.debug("Stream '{}': {}", stream.getId(), result);
        history.record(stream.getId(), result);
        return result;
    }

    /**
     * Score the kept forecasts of a stream against values observed after them.
     *
     * @return number of forecasts scored
     * @see PredictionHistory#updateModelPerformance(String, double[])
     */
    public int updateModelPerformance(String streamId, double[] actual) {
        return history.updateModelPerformance(streamId, actual);
    }

    /** @return the current score of every forecasting method, in {@code [0,1]} */
    public Map<ForecastMethod, Double> getModelPerformance() {
        return history.getModelPerformance();
    }

    /** @return forecasts kept for a stream, oldest first */
    public List<PredictionResult> getPredictionHistory(String streamId) {
        return history.getHistory(streamId);
    }

    public void clearHistory() {
        history.clear();
    }

    // ---------------------------------------------------------------
    // Single method
    // ---------------------------------------------------------------

    private PredictionResult single(double[] data, List<Instant> future, double z, PredictionConfig config,
            ForecastContext context) {
        int horizon = config.getHorizon();
        ForecastMethod requested = config.getMethod();
        Forecaster forecaster = forecasterFor(requested, data, context);

        context.getDeadline().checkpoint(requested + " forecast");
        Optional<Forecast> forecast = forecaster != null ? forecaster.forecast(data, horizon) : Optional.empty();
        String fallbackReason = null;
        if (forecast.isEmpty()) {
            fallbackReason = requested + " model unavailable for " + data.length + " samples"
                    + (requested == ForecastMethod.HOLT_WINTERS && context.getSeasonalPeriod() < 2
                            ? " without a seasonal period" : "");
            LOG.warn("{}, falling back to naive forecast", fallbackReason);
            forecaster = naive;
            forecast = naive.forecast(data, horizon);
        }

        context.getDeadline().checkpoint(forecaster.method() + " backtest");
        Backtest backtest = backtest(forecaster, data, horizon).orElse(null);
        Forecast f = forecast.get();
        double outOfSample = backtest != null ? backtest.mse() : f.getResidualVariance();
        return assemble(forecaster.method(), requested, fallbackReason, f.getMean(), f.getStandardErrors(),
                outOfSample, future, z, config, backtest != null ? backtest.metrics() : null);
    }

    private Forecaster forecasterFor(ForecastMethod method, double[] data, ForecastContext context) {
        return switch (method) {
            case NAIVE -> naive;
            case LINEAR_TREND -> new LinearTrendForecaster(fitter);
            case ARIMA -> arimaForecaster(data, context);
            case EXPONENTIAL_SMOOTHING -> new ExponentialSmoothingForecaster();
            case HOLT_WINTERS -> context.getSeasonalPeriod() >= 2
                    ? new HoltWintersForecaster(context.getSeasonalPeriod())
                    : null;
            case ENSEMBLE -> throw new IllegalArgumentException("Ensemble is not a single forecaster");
        };
    }

    private ArimaForecaster arimaForecaster(double[] data, ForecastContext context) {
        return new ArimaForecaster(fitter, stationarityTester, context.getArima(), data.length,
                context.getDeadline());
    }

    // ---------------------------------------------------------------
    // Ensemble
    // ---------------------------------------------------------------

    private static final class Member {
        private final ForecastMethod method;
        private final Forecast forecast;
        private final Backtest backtest;
        private double performance = 1.0;
        private double weight;

        private Member(ForecastMethod method, Forecast forecast, Backtest backtest) {
            this.method = method;
            this.forecast = forecast;
            this.backtest = backtest;
        }
    }

    private PredictionResult ensemble(double[] data, List<Instant> future, double z, PredictionConfig config,
            ForecastContext context) {
        int horizon = config.getHorizon();
        List<Forecaster> candidates = new ArrayList<>(List.of(naive, new LinearTrendForecaster(fitter),
                arimaForecaster(data, context), new ExponentialSmoothingForecaster()));
        if (context.getSeasonalPeriod() >= 2) {
            candidates.add(new HoltWintersForecaster(context.getSeasonalPeriod()));
        }

        List<Member> members = new ArrayList<>();
        for (Forecaster candidate : candidates) {
            context.getDeadline().checkpoint(candidate.method() + " ensemble member");
            Optional<Forecast> forecast = candidate.forecast(data, horizon);
            if (forecast.isEmpty()) {
                LOG.debug("Ensemble member {} not applicable to {} samples", candidate.method(), data.length);
                continue;
            }
            members.add(new Member(candidate.method(), forecast.get(),
                    backtest(candidate, data, horizon).orElse(null)));
        }

        boolean scored = members.stream().anyMatch(m -> m.backtest != null);
        List<Member> pool = new ArrayList<>();
        for (Member member : members) {
            if (!scored || member.backtest != null) {
                pool.add(member);
            }
        }
        weigh(pool, scored, config.getAggregationMethod());

        double[] mean = new double[horizon];
        double[] variance = new double[horizon];
        double residualVariance = 0;
        for (Member member : pool) {
            double[] f = member.forecast.getMean();
            for (int h = 0; h < horizon; h++) {
                mean[h] += member.weight * f[h];
            }
            residualVariance += member.weight * member.forecast.getResidualVariance();
        }
        for (Member member : pool) {
            double[] f = member.forecast.getMean();
            double[] se = member.forecast.getStandardErrors();
            for (int h = 0; h < horizon; h++) {
                double spread = f[h] - mean[h];
                variance[h] += member.weight * (se[h] * se[h] + spread * spread);
            }
        }
        double[] se = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            se[h] = Math.sqrt(variance[h]);
        }

        Backtest combined = scored ? combine(pool) : null;
        double outOfSample = combined != null ? combined.mse() : residualVariance;
        PredictionResult base = assemble(ForecastMethod.ENSEMBLE, ForecastMethod.ENSEMBLE, null, mean, se,
                outOfSample, future, z, config, combined != null ? combined.metrics() : null);

        List<ModelContribution> contributions = new ArrayList<>();
        for (Member member : pool) {
            contributions.add(new ModelContribution(member.method, member.forecast.getMean(), member.weight,
                    member.performance, member.backtest != null ? member.backtest.rmse() : Double.NaN));
        }
        LOG.debug("Ensemble of {} member(s), scored={}", pool.size(), scored);
        return new EnsemblePrediction(base, contributions, config.getAggregationMethod());
    }

    private static void weigh(List<Member> pool, boolean scored, AggregationMethod aggregation) {
        if (scored) {
            double minRmse = pool.stream().mapToDouble(m -> m.backtest.rmse()).min().orElse(0.0);
            for (Member member : pool) {
                member.performance = (minRmse + WEIGHT_EPSILON) / (member.backtest.rmse() + WEIGHT_EPSILON);
            }
        }
        double total = 0;
        for (Member member : pool) {
            total += aggregation == AggregationMethod.EQUAL_WEIGHTED ? 1.0 : member.performance;
        }
        for (Member member : pool) {
            double raw = aggregation == AggregationMethod.EQUAL_WEIGHTED ? 1.0 : member.performance;
            member.weight = raw / total;
        }
    }

    private static Backtest combine(List<Member> pool) {
        Backtest first = pool.get(0).backtest;
        double[] predictions = new double[first.actual.length];
        for (Member member : pool) {
            for (int i = 0; i < predictions.length; i++) {
                predictions[i] += member.weight * member.backtest.predictions[i];
            }
        }
        return new Backtest(first.actual, predictions, first.training);
    }

    // ---------------------------------------------------------------
    // Backtesting
    // ---------------------------------------------------------------

    private static final class Backtest {
        private final double[] actual;
        private final double[] predictions;
        private final double[] training;

        private Backtest(double[] actual, double[] predictions, double[] training) {
            this.actual = actual;
            this.predictions = predictions;
            this.training = training;
        }

        private double rmse() {
            return ForecastMetrics.rmse(actual, predictions);
        }

        private double mse() {
            double r = rmse();
            return r * r;
        }

        private AccuracyMetrics metrics() {
            return ForecastMetrics.evaluate(actual, predictions, training);
        }
    }

    /**
     * Forecast the trailing holdout from the preceding samples.
     */
    private static Optional<Backtest> backtest(Forecaster forecaster, double[] data, int horizon) {
        int n = data.length;
        if (n / 4 < 1) {
            return Optional.empty();
        }
        int holdout = SeriesMath.clamp(horizon, 1, n / 4);
        if (n - holdout < MIN_TRAINING) {
            return Optional.empty();
        }
        double[] training = Arrays.copyOfRange(data, 0, n - holdout);
        double[] actual = Arrays.copyOfRange(data, n - holdout, n);
        return forecaster.forecast(training, holdout)
                .filter(f -> SeriesMath.allFinite(f.getMean()))
                .map(f -> new Backtest(actual, f.getMean(), training));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static PredictionResult assemble(ForecastMethod method, ForecastMethod requested, String fallbackReason,
            double[] mean, double[] se, double outOfSampleVariance, List<Instant> future, double z,
            PredictionConfig config, AccuracyMetrics metrics) {
        int horizon = mean.length;
        double[] ciLower = new double[horizon];
        double[] ciUpper = new double[horizon];
        double[] piLower = new double[horizon];
        double[] piUpper = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double ci = z * se[h];
            double pi = z * Math.sqrt(se[h] * se[h] + outOfSampleVariance);
            ciLower[h] = mean[h] - ci;
            ciUpper[h] = mean[h] + ci;
            piLower[h] = mean[h] - pi;
            piUpper[h] = mean[h] + pi;
        }
        double level = config.getConfidenceLevel();
        return PredictionResult.builder()
                .method(method)
                .requestedMethod(requested)
                .fallbackReason(fallbackReason)
                .predictions(mean)
                .timestamps(future)
                .confidenceIntervals(new PredictionInterval(ciLower, ciUpper, level))
                .predictionIntervals(config.isIncludePredictionIntervals()
                        ? new PredictionInterval(piLower, piUpper, level)
                        : null)
                .metrics(metrics)
                .build();
    }

    static List<Instant> futureTimestamps(List<Instant> timestamps, int horizon) {
        int n = timestamps.size();
        Instant last = timestamps.get(n - 1);
        Duration step = n >= 2
                ? Duration.between(timestamps.get(0), last).dividedBy(n - 1)
                : DEFAULT_INTERVAL;
        if (step.isZero()) {
            step = DEFAULT_INTERVAL;
        }
        List<Instant> future = new ArrayList<>(horizon);
        for (int h = 1; h <= horizon; h++) {
            future.add(last.plus(step.multipliedBy(h)));
        }
        return future;
    }
}
