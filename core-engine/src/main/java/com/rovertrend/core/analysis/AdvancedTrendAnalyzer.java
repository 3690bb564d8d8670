package com.rovertrend.core.analysis;

import com.rovertrend.core.changepoint.ChangePointDetector;
import com.rovertrend.core.config.AnalysisConfig;
import com.rovertrend.core.config.EngineConfig;
import com.rovertrend.core.drift.DriftDetector;
import com.rovertrend.core.drift.DriftMonitorRegistry;
import com.rovertrend.core.model.AdvancedTrendAnalysis;
import com.rovertrend.core.model.ArimaModel;
import com.rovertrend.core.model.ChangePoint;
import com.rovertrend.core.model.DriftResult;
import com.rovertrend.core.model.PredictionResult;
import com.rovertrend.core.model.SeasonalDecomposition;
import com.rovertrend.core.model.StationarityResult;
import com.rovertrend.core.model.TelemetryStream;
import com.rovertrend.core.model.TimeSeriesValidation;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.model.TrendSummary;
import com.rovertrend.core.prediction.ForecastContext;
import com.rovertrend.core.prediction.PredictionEngine;
import com.rovertrend.core.prediction.PredictionHistory;
import com.rovertrend.core.seasonal.SeasonalDecomposer;
import com.rovertrend.core.stationarity.StationarityTester;
import com.rovertrend.core.trend.TrendModelFitter;
import com.rovertrend.core.util.AnalysisDeadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs every enabled analysis over a telemetry stream and assembles an
 * {@link AdvancedTrendAnalysis}.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>validation; missing samples are interpolated</li>
 * <li>linear and non-linear trend fits, best model selection</li>
 * <li>stationarity (ADF), then ARIMA order search</li>
 * <li>change points</li>
 * <li>seasonal decomposition</li>
 * <li>drift: the latest verdict of the stream's live monitor when one is
 * registered, otherwise a replay of the series through a fresh detector</li>
 * <li>prediction, reusing the fitted ARIMA model and detected season</li>
 * </ol>
 *
 * <h3>Failure handling</h3>
 * <p>
 * Each optional stage is isolated: if it throws, the failure is logged, the
 * sub-result is left {@code null} and a diagnostic is recorded. Only a
 * {@link CancellationException} (timeout or interruption) aborts the whole
 * analysis.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Analyses of distinct streams may run concurrently. Each call builds its
 * own fitters and result. The latest-result cache, the listener list and the
 * prediction history are shared and safe for concurrent use. The default
 * configuration can be swapped with {@link #updateConfig(EngineConfig)}; a
 * running analysis keeps the configuration it started with.
 * </p>
 *
 * @since 1.0.0
 */
public class AdvancedTrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(AdvancedTrendAnalyzer.class);

    private volatile EngineConfig config;
    private final DriftMonitorRegistry driftMonitors;
    private final PredictionHistory predictionHistory = new PredictionHistory();
    private final TimeSeriesValidator validator = new TimeSeriesValidator();
    private final Map<String, AdvancedTrendAnalysis> latest = new ConcurrentHashMap<>();
    private final List<AnalysisListener> listeners = new CopyOnWriteArrayList<>();

    public AdvancedTrendAnalyzer() {
        this(new EngineConfig());
    }

    public AdvancedTrendAnalyzer(EngineConfig config) {
        this(config, new DriftMonitorRegistry(Objects.requireNonNull(config, "Engine config must not be null")
                .getDrift()));
    }

    /**
     * @param config        default configuration for {@link #analyzeStream(TelemetryStream)}
     * @param driftMonitors live drift monitors whose verdicts are included in analyses
     * @throws IllegalStateException if the configuration is invalid
     */
    public AdvancedTrendAnalyzer(EngineConfig config, DriftMonitorRegistry driftMonitors) {
        this.config = Objects.requireNonNull(config, "Engine config must not be null");
        this.driftMonitors = Objects.requireNonNull(driftMonitors, "Drift monitor registry must not be null");
        config.validate();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public AdvancedTrendAnalysis analyzeStream(TelemetryStream stream) {
        return analyzeStream(stream, config);
    }

    /**
     * Analyze a stream with an explicit configuration.
     *
     * @param stream       the series to analyze
     * @param engineConfig configuration for this call only
     * @return a new composite result
     * @throws IllegalStateException if the configuration is invalid
     * @throws CancellationException if the configured timeout expires or the
     *                               thread is interrupted
     */
    public AdvancedTrendAnalysis analyzeStream(TelemetryStream stream, EngineConfig engineConfig) {
        Objects.requireNonNull(stream, "Stream must not be null");
        Objects.requireNonNull(engineConfig, "Engine config must not be null");
        engineConfig.validate();

        long startNanos = System.nanoTime();
        notifyListeners(l -> l.onAnalysisStarted(stream.getId(), stream.size()));
        AdvancedTrendAnalysis analysis;
        try {
            analysis = run(stream, engineConfig);
        } catch (RuntimeException e) {
            LOG.warn("Analysis of stream '{}' abandoned: {}", stream.getId(), e.getMessage());
            notifyListeners(l -> l.onAnalysisFailed(stream.getId(), e));
            throw e;
        }

        latest.put(stream.getId(), analysis);
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info("Analyzed stream '{}': {} point(s), best trend {}, {} change point(s), {} diagnostic(s) in {} ms",
                stream.getId(), stream.size(), analysis.getTrends().getBest().getType(),
                analysis.getChangePoints().size(), analysis.getDiagnostics().size(), durationMs);
        notifyListeners(l -> l.onAnalysisCompleted(analysis));
        return analysis;
    }

    /** @return the most recent analysis of the stream made by this analyzer */
    public Optional<AdvancedTrendAnalysis> getLatestAnalysis(String streamId) {
        return Optional.ofNullable(latest.get(streamId));
    }

    public void clearCache() {
        latest.clear();
    }

    public void addListener(AnalysisListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must not be null"));
    }

    public void removeListener(AnalysisListener listener) {
        listeners.remove(listener);
    }

    public DriftMonitorRegistry getDriftMonitors() {
        return driftMonitors;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Replace the default configuration used by {@link #analyzeStream(TelemetryStream)}.
     * Drift monitors already started keep their own settings.
     *
     * @throws IllegalStateException if the configuration is invalid; the
     *                               current one is kept
     */
    public void updateConfig(EngineConfig config) {
        Objects.requireNonNull(config, "Engine config must not be null");
        config.validate();
        this.config = config;
        LOG.info("Engine configuration updated");
    }

    /** @return forecasts made by this analyzer, with per-method scores */
    public PredictionHistory getPredictionHistory() {
        return predictionHistory;
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    private AdvancedTrendAnalysis run(TelemetryStream stream, EngineConfig engineConfig) {
        AnalysisConfig settings = engineConfig.getAnalysis();
        AnalysisDeadline deadline = AnalysisDeadline.afterMillis(settings.getTimeoutMillis());
        String id = stream.getId();
        AdvancedTrendAnalysis.Builder result = AdvancedTrendAnalysis.builder()
                .streamId(id)
                .analyzedAt(Instant.now())
                .dataPoints(stream.size());

        TimeSeriesValidation validation = validator.validate(stream);
        result.validation(validation);
        TelemetryStream clean = stream;
        if (validation.getMissingValues() > 0) {
            clean = new TelemetryStream(id, stream.getName(), stream.getUnit(),
                    TimeSeriesValidator.interpolateMissing(stream.getData()), stream.getTimestamps());
            result.diagnostic("Interpolated " + validation.getMissingValues() + " missing value(s)");
        }
        if (!validation.getOutlierIndices().isEmpty()) {
            result.diagnostic(validation.getOutlierIndices().size() + " outlier(s) beyond "
                    + TimeSeriesValidator.OUTLIER_SIGMA + " sigma kept in the series");
        }
        double[] data = clean.getData();

        TrendModelFitter fitter = new TrendModelFitter(settings);
        StationarityTester tester = new StationarityTester(settings.getSignificanceLevel());

        // trends
        deadline.checkpoint("trend fitting");
        TrendModel linear = fitter.fitLinear(data);
        TrendModel nonLinear = null;
        if (settings.isEnableNonLinear()) {
            nonLinear = isolate(result, id, "Non-linear fit", () -> fitter.fitNonLinear(data).orElse(null));
            if (nonLinear == null) {
                result.diagnostic("Non-linear fit not applicable, linear trend used");
            }
        }
        List<TrendModel> candidates = new ArrayList<>();
        candidates.add(linear);
        candidates.add(nonLinear);
        TrendModel best = fitter.selectBest(candidates);
        result.trends(new TrendSummary(best, linear, nonLinear));
        notifyListeners(l -> l.onModelFitted(id, best));

        // stationarity and ARIMA
        deadline.checkpoint("stationarity test");
        StationarityResult stationarity = tester.test(data);
        result.stationarity(stationarity);
        if (data.length < StationarityTester.MIN_OBSERVATIONS) {
            result.diagnostic("Stationarity test needs " + StationarityTester.MIN_OBSERVATIONS
                    + " observations, got " + data.length);
        }

        ArimaModel arima = null;
        if (settings.isEnableArima()) {
            arima = isolate(result, id, "ARIMA fit", () -> fitter.fitArima(data, stationarity, deadline).orElse(null));
            if (arima == null) {
                result.diagnostic("No ARIMA model could be fitted");
            }
            result.arima(arima);
        }

        // change points
        if (settings.isEnableChangePoints()) {
            deadline.checkpoint("change point detection");
            TelemetryStream input = clean;
            List<ChangePoint> changePoints = isolate(result, id, "Change point detection",
                    () -> new ChangePointDetector(settings.getChangePointWindow())
                            .detect(input, settings.getChangePointSensitivity()));
            if (changePoints != null) {
                result.changePoints(changePoints);
                changePoints.forEach(cp -> notifyListeners(l -> l.onChangePointDetected(id, cp)));
            }
        }

        // seasonality
        SeasonalDecomposition seasonality = null;
        if (settings.isEnableSeasonal()) {
            deadline.checkpoint("seasonal decomposition");
            seasonality = isolate(result, id, "Seasonal decomposition",
                    () -> new SeasonalDecomposer(settings.getSeasonalThreshold()).decompose(data));
            result.seasonality(seasonality);
        }

        // drift
        if (settings.isEnableDriftDetection()) {
            deadline.checkpoint("drift detection");
            TelemetryStream input = clean;
            result.drift(isolate(result, id, "Drift detection", () -> drift(input, engineConfig)));
        }

        // prediction
        if (settings.isEnablePrediction()) {
            if (data.length == 0) {
                result.diagnostic("Prediction skipped: stream has no samples");
            } else {
                int period = seasonality != null && seasonality.isDetected() ? seasonality.getPeriod() : 0;
                ForecastContext context = new ForecastContext(arima, period, deadline);
                PredictionEngine engine = new PredictionEngine(fitter, tester, predictionHistory);
                TelemetryStream input = clean;
                PredictionResult prediction = isolate(result, id, "Prediction",
                        () -> engine.predict(input, engineConfig.getPrediction(), context));
                if (prediction != null && prediction.isFallback()) {
                    result.diagnostic("Prediction fell back to " + prediction.getMethod() + ": "
                            + prediction.getFallbackReason());
                }
                result.prediction(prediction);
            }
        }
        return result.build();
    }

    private DriftResult drift(TelemetryStream stream, EngineConfig engineConfig) {
        Optional<DriftResult> live = driftMonitors.latestResult(stream.getId());
        if (live.isPresent()) {
            return live.get();
        }
        if (stream.isEmpty()) {
            return null;
        }
        // replay through a detector nobody else sees; report the last drift if any occurred
        DriftDetector replay = new DriftDetector(stream.getId(), engineConfig.getDrift());
        double[] data = stream.getData();
        List<Instant> timestamps = stream.getTimestamps();
        DriftResult last = null;
        DriftResult lastDrift = null;
        for (int i = 0; i < data.length; i++) {
            last = replay.processDataPoint(data[i], timestamps.get(i));
            if (last.isDetected()) {
                lastDrift = last;
            }
        }
        return lastDrift != null ? lastDrift : last;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static <T> T isolate(AdvancedTrendAnalysis.Builder result, String streamId, String stage,
            Supplier<T> task) {
        try {
            return task.get();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("{} failed for stream '{}', omitting it from the analysis", stage, streamId, e);
            result.diagnostic(stage + " failed: " + e.getMessage());
            return null;
        }
    }

    private void notifyListeners(Consumer<AnalysisListener> callback) {
        for (AnalysisListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Analysis listener {} threw an exception, continuing", listener, e);
            }
        }
    }
}
