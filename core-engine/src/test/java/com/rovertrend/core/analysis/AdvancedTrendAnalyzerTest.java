package com.rovertrend.core.analysis;

import com.rovertrend.core.config.EngineConfig;
import com.rovertrend.core.drift.DriftMonitorRegistry;
import com.rovertrend.core.model.AdvancedTrendAnalysis;
import com.rovertrend.core.model.ChangePoint;
import com.rovertrend.core.model.DriftMethod;
import com.rovertrend.core.model.DriftResult;
import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.model.TelemetryStream;
import com.rovertrend.core.model.TrendModel;
import com.rovertrend.core.prediction.PredictionHistory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AdvancedTrendAnalyzer}.
 */
class AdvancedTrendAnalyzerTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private AdvancedTrendAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new AdvancedTrendAnalyzer();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should run every stage on a seasonal series with trend")
    void shouldRunFullPipeline() {
        TelemetryStream stream = stream("rover.mast.temperature", seasonal(new Random(42), 120));

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream);

        assertThat(analysis.getStreamId()).isEqualTo("rover.mast.temperature");
        assertThat(analysis.getDataPoints()).isEqualTo(120);
        assertThat(analysis.getTrends().getLinear()).isNotNull();
        assertThat(analysis.getTrends().getBest()).isNotNull();
        assertThat(analysis.getStationarity()).isNotNull();
        assertThat(analysis.getSeasonality().isDetected()).isTrue();
        assertThat(analysis.getSeasonality().getPeriod()).isEqualTo(12);
        assertThat(analysis.getDrift()).isNotNull();
        assertThat(analysis.getDrift().getMethod()).isEqualTo(DriftMethod.CUSUM);
        assertThat(analysis.getPrediction()).isNotNull();
        assertThat(analysis.getPrediction().getMethod()).isEqualTo(ForecastMethod.ENSEMBLE);
        assertThat(analysis.getPrediction().getPredictions()).hasSize(10);
        assertThat(analysis.getValidation().getMissingValues()).isZero();
    }

    @Test
    @DisplayName("Should skip disabled stages")
    void shouldHonourFeatureSwitches() {
        EngineConfig config = new EngineConfig();
        config.getAnalysis().setEnableArima(false);
        config.getAnalysis().setEnableNonLinear(false);
        config.getAnalysis().setEnableChangePoints(false);
        config.getAnalysis().setEnableSeasonal(false);
        config.getAnalysis().setEnableDriftDetection(false);
        config.getAnalysis().setEnablePrediction(false);

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", step(new Random(42), 200)), config);

        assertThat(analysis.getArima()).isNull();
        assertThat(analysis.getTrends().getNonLinear()).isNull();
        assertThat(analysis.getTrends().getBest()).isSameAs(analysis.getTrends().getLinear());
        assertThat(analysis.getChangePoints()).isEmpty();
        assertThat(analysis.getSeasonality()).isNull();
        assertThat(analysis.getDrift()).isNull();
        assertThat(analysis.getPrediction()).isNull();
    }

    @Test
    @DisplayName("Should report a level shift as a change point")
    void shouldDetectChangePoints() {
        EngineConfig config = lightweight();
        config.getAnalysis().setEnableChangePoints(true);
        config.getAnalysis().setChangePointSensitivity(0.8);

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", step(new Random(42), 200)), config);

        assertThat(analysis.getChangePoints()).isNotEmpty();
        assertThat(analysis.getChangePoints()).anySatisfy(cp -> assertThat(cp.getIndex()).isBetween(95, 105));
    }

    @Test
    @DisplayName("Should interpolate missing samples and record a diagnostic")
    void shouldInterpolateMissingSamples() {
        double[] data = new double[60];
        for (int i = 0; i < data.length; i++) {
            data[i] = 0.5 * i;
        }
        data[10] = Double.NaN;
        data[11] = Double.NaN;

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", data), lightweight());

        assertThat(analysis.getValidation().getMissingValues()).isEqualTo(2);
        assertThat(analysis.getDiagnostics()).contains("Interpolated 2 missing value(s)");
        TrendModel linear = analysis.getTrends().getLinear();
        assertThat(linear.getCoefficients()[1]).isCloseTo(0.5, within(1e-9));
        assertThat(linear.getR2()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should record a diagnostic when the prediction falls back")
    void shouldRecordPredictionFallback() {
        EngineConfig config = lightweight();
        config.getAnalysis().setEnablePrediction(true);
        config.getPrediction().setMethod(ForecastMethod.HOLT_WINTERS);

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", step(new Random(42), 200)), config);

        assertThat(analysis.getPrediction().isFallback()).isTrue();
        assertThat(analysis.getDiagnostics()).anySatisfy(d -> assertThat(d).startsWith("Prediction fell back to NAIVE"));
    }

    @Test
    @DisplayName("Should analyze a very short stream with diagnostics instead of failing")
    void shouldDegradeOnShortStream() {
        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", new double[] { 3, 4, 3, 5, 4 }));

        assertThat(analysis.getDataPoints()).isEqualTo(5);
        assertThat(analysis.getStationarity().isStationary()).isFalse();
        assertThat(analysis.getDiagnostics()).anySatisfy(d -> assertThat(d).contains("Stationarity test needs 8"));
        assertThat(analysis.getSeasonality().isDetected()).isFalse();
        assertThat(analysis.getChangePoints()).isEmpty();
        assertThat(analysis.getPrediction().getPredictions()).hasSize(10);
    }

    @Test
    @DisplayName("Should report the latest verdict of a live drift monitor")
    void shouldUseLiveDriftMonitor() {
        DriftMonitorRegistry registry = new DriftMonitorRegistry(new EngineConfig().getDrift());
        AdvancedTrendAnalyzer withMonitors = new AdvancedTrendAnalyzer(lightweightWithDrift(), registry);
        registry.start("s");
        double[] data = step(new Random(42), 200);
        for (int i = 0; i < 80; i++) {
            registry.process("s", data[i], START.plusSeconds(i));
        }

        AdvancedTrendAnalysis analysis = withMonitors.analyzeStream(stream("s", data));

        DriftResult live = registry.latestResult("s").orElseThrow();
        assertThat(analysis.getDrift().getTimestamp()).isEqualTo(START.plusSeconds(79));
        assertThat(analysis.getDrift().getTimestamp()).isEqualTo(live.getTimestamp());
        assertThat(withMonitors.getDriftMonitors()).isSameAs(registry);
    }

    @Test
    @DisplayName("Should replay the series through a fresh detector when no monitor is running")
    void shouldReplayDrift() {
        Random random = new Random(42);
        double[] data = new double[400];
        for (int i = 0; i < data.length; i++) {
            data[i] = 10.0 + random.nextGaussian() + (i >= 300 ? 5.0 : 0.0);
        }

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", data), lightweightWithDrift());

        assertThat(analysis.getDrift().isDetected()).isTrue();
        assertThat(analysis.getDrift().getTimestamp()).isAfterOrEqualTo(START.plusSeconds(300));
        assertThat(analyzer.getDriftMonitors().isMonitoring("s")).isFalse();
    }

    @Test
    @DisplayName("Should cache the latest analysis per stream until cleared")
    void shouldCacheLatestAnalysis() {
        AdvancedTrendAnalysis first = analyzer.analyzeStream(stream("a", step(new Random(1), 100)), lightweight());
        AdvancedTrendAnalysis second = analyzer.analyzeStream(stream("a", step(new Random(2), 100)), lightweight());

        assertThat(analyzer.getLatestAnalysis("a")).containsSame(second);
        assertThat(analyzer.getLatestAnalysis("a")).get().isNotSameAs(first);
        assertThat(analyzer.getLatestAnalysis("b")).isEmpty();

        analyzer.clearCache();

        assertThat(analyzer.getLatestAnalysis("a")).isEmpty();
    }

    @Test
    @DisplayName("Should notify listeners in pipeline order and survive a failing listener")
    void shouldNotifyListeners() {
        List<String> calls = new ArrayList<>();
        analyzer.addListener(new AnalysisListener() {
            @Override
            public void onAnalysisStarted(String streamId, int dataPoints) {
                throw new IllegalStateException("listener failure");
            }
        });
        analyzer.addListener(new AnalysisListener() {
            @Override
            public void onAnalysisStarted(String streamId, int dataPoints) {
                calls.add("started:" + dataPoints);
            }

            @Override
            public void onModelFitted(String streamId, TrendModel model) {
                calls.add("fitted");
            }

            @Override
            public void onChangePointDetected(String streamId, ChangePoint changePoint) {
                calls.add("changePoint");
            }

            @Override
            public void onAnalysisCompleted(AdvancedTrendAnalysis analysis) {
                calls.add("completed:" + analysis.getStreamId());
            }
        });
        EngineConfig config = lightweight();
        config.getAnalysis().setEnableChangePoints(true);
        config.getAnalysis().setChangePointSensitivity(0.8);

        analyzer.analyzeStream(stream("s", step(new Random(42), 200)), config);

        assertThat(calls).startsWith("started:200", "fitted").endsWith("completed:s").contains("changePoint");
    }

    @Test
    @DisplayName("Should stop listening after a listener is removed")
    void shouldRemoveListener() {
        List<String> calls = new ArrayList<>();
        AnalysisListener listener = new AnalysisListener() {
            @Override
            public void onAnalysisCompleted(AdvancedTrendAnalysis analysis) {
                calls.add(analysis.getStreamId());
            }
        };
        analyzer.addListener(listener);
        analyzer.analyzeStream(stream("a", step(new Random(1), 50)), lightweight());

        analyzer.removeListener(listener);
        analyzer.analyzeStream(stream("b", step(new Random(1), 50)), lightweight());

        assertThat(calls).containsExactly("a");
    }

    @Test
    @DisplayName("Should abandon the analysis and notify listeners when interrupted")
    void shouldAbortOnInterrupt() {
        List<RuntimeException> failures = new ArrayList<>();
        analyzer.addListener(new AnalysisListener() {
            @Override
            public void onAnalysisFailed(String streamId, RuntimeException cause) {
                failures.add(cause);
            }
        });
        TelemetryStream stream = stream("s", step(new Random(42), 200));
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> analyzer.analyzeStream(stream))
                .isInstanceOf(CancellationException.class);
        assertThat(failures).hasSize(1).first().isInstanceOf(CancellationException.class);
        assertThat(analyzer.getLatestAnalysis("s")).isEmpty();
    }

    @Test
    @DisplayName("Should reject an invalid configuration")
    void shouldRejectInvalidConfig() {
        EngineConfig config = new EngineConfig();
        config.getAnalysis().setChangePointSensitivity(2.0);
        config.getPrediction().setHorizon(0);

        assertThatThrownBy(() -> new AdvancedTrendAnalyzer(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("changePointSensitivity")
                .hasMessageContaining("horizon");
        assertThatThrownBy(() -> analyzer.analyzeStream(stream("s", new double[] { 1, 2 }), config))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should analyze with a replaced default configuration and keep it when the update is invalid")
    void shouldUpdateConfig() {
        EngineConfig updated = lightweight();
        analyzer.updateConfig(updated);

        AdvancedTrendAnalysis analysis = analyzer.analyzeStream(stream("s", step(new Random(42), 200)));

        assertThat(analyzer.getConfig()).isSameAs(updated);
        assertThat(analysis.getPrediction()).isNull();
        assertThat(analysis.getDrift()).isNull();

        EngineConfig invalid = new EngineConfig();
        invalid.getPrediction().setHorizon(0);
        assertThatThrownBy(() -> analyzer.updateConfig(invalid))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("horizon");
        assertThat(analyzer.getConfig()).isSameAs(updated);
    }

    @Test
    @DisplayName("Should keep forecasts of every analysis and score them against later actuals")
    void shouldTrackPredictionHistory() {
        EngineConfig config = lightweight();
        config.getAnalysis().setEnablePrediction(true);
        config.getPrediction().setMethod(ForecastMethod.NAIVE);
        config.getPrediction().setHorizon(3);
        double[] data = { 8, 9, 10, 9, 10, 9, 10, 9, 10, 10 };

        analyzer.analyzeStream(stream("battery.voltage", data), config);
        analyzer.analyzeStream(stream("battery.voltage", data), config);

        PredictionHistory history = analyzer.getPredictionHistory();
        assertThat(history.getHistory("battery.voltage")).hasSize(2);
        assertThat(history.updateModelPerformance("battery.voltage", new double[] { 10, 10, 10 })).isEqualTo(2);
        assertThat(history.getModelPerformance().get(ForecastMethod.NAIVE)).isCloseTo(1.0, within(1e-12));
    }

    // ---- Helpers ----

    private static TelemetryStream stream(String id, double[] data) {
        return TelemetryStream.regular(id, data, START, 1000);
    }

    /** Only the trend fits and stationarity test. */
    private static EngineConfig lightweight() {
        EngineConfig config = new EngineConfig();
        config.getAnalysis().setEnableArima(false);
        config.getAnalysis().setEnableChangePoints(false);
        config.getAnalysis().setEnableSeasonal(false);
        config.getAnalysis().setEnableDriftDetection(false);
        config.getAnalysis().setEnablePrediction(false);
        return config;
    }

    private static EngineConfig lightweightWithDrift() {
        EngineConfig config = lightweight();
        config.getAnalysis().setEnableDriftDetection(true);
        return config;
    }

    private static double[] seasonal(Random random, int n) {
        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = 10.0 + 0.05 * i + 3.0 * Math.sin(2 * Math.PI * i / 12) + 0.3 * random.nextGaussian();
        }
        return series;
    }

    /** Mean 0 then 10 from the midpoint, noise 0.5. */
    private static double[] step(Random random, int n) {
        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = (i >= n / 2 ? 10.0 : 0.0) + 0.5 * random.nextGaussian();
        }
        return series;
    }
}
