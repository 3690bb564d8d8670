package com.rovertrend.core.prediction;

import com.rovertrend.core.model.ForecastMethod;
import com.rovertrend.core.model.PredictionInterval;
import com.rovertrend.core.model.PredictionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictionHistory}.
 */
class PredictionHistoryTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final PredictionHistory history = new PredictionHistory();

    @Test
    @DisplayName("Should drop the oldest forecast once a stream holds a hundred")
    void shouldEvictOldest() {
        for (int i = 0; i <= PredictionHistory.MAX_HISTORY; i++) {
            history.record("wheel.fl.current", result(ForecastMethod.NAIVE, i));
        }
        history.record("mast.temp", result(ForecastMethod.ARIMA, 1.0));

        List<PredictionResult> kept = history.getHistory("wheel.fl.current");

        assertThat(kept).hasSize(PredictionHistory.MAX_HISTORY);
        assertThat(kept.get(0).getPredictions()[0]).isEqualTo(1.0);
        assertThat(kept.get(kept.size() - 1).getPredictions()[0]).isEqualTo(100.0);
        assertThat(history.getHistory("mast.temp")).hasSize(1);
    }

    @Test
    @DisplayName("Should score each kept forecast over the overlap with the actuals")
    void shouldScoreEachMethod() {
        history.record("s", result(ForecastMethod.LINEAR_TREND, 9.0, 18.0));
        history.record("s", result(ForecastMethod.EXPONENTIAL_SMOOTHING, 50.0, 50.0));

        int scored = history.updateModelPerformance("s", new double[] { 10.0 });

        assertThat(scored).isEqualTo(2);
        assertThat(history.getModelPerformance().get(ForecastMethod.LINEAR_TREND)).isCloseTo(0.9, within(1e-12));
        // 400% off is floored at zero
        assertThat(history.getModelPerformance().get(ForecastMethod.EXPONENTIAL_SMOOTHING)).isZero();
        assertThat(history.getModelPerformance().get(ForecastMethod.HOLT_WINTERS))
                .isEqualTo(PredictionHistory.DEFAULT_PERFORMANCE);
    }

    @Test
    @DisplayName("Should skip scoring when every actual is zero or none arrived")
    void shouldSkipUnscorableActuals() {
        history.record("s", result(ForecastMethod.NAIVE, 1.0, 1.0));

        assertThat(history.updateModelPerformance("s", new double[] { 0.0, 0.0 })).isZero();
        assertThat(history.updateModelPerformance("s", new double[0])).isZero();
        assertThat(history.getModelPerformance().get(ForecastMethod.NAIVE))
                .isEqualTo(PredictionHistory.DEFAULT_PERFORMANCE);
    }

    @Test
    @DisplayName("Should forget forecasts but keep method scores on clear")
    void shouldClearHistoryOnly() {
        history.record("s", result(ForecastMethod.NAIVE, 10.0));
        history.updateModelPerformance("s", new double[] { 10.0 });

        history.clear();

        assertThat(history.getHistory("s")).isEmpty();
        assertThat(history.updateModelPerformance("s", new double[] { 10.0 })).isZero();
        assertThat(history.getModelPerformance().get(ForecastMethod.NAIVE)).isEqualTo(1.0);
    }

    // ---- Helpers ----

    private static PredictionResult result(ForecastMethod method, double... predictions) {
        List<Instant> timestamps = new ArrayList<>();
        for (int h = 1; h <= predictions.length; h++) {
            timestamps.add(START.plusSeconds(h));
        }
        return PredictionResult.builder()
                .method(method)
                .predictions(predictions)
                .timestamps(timestamps)
                .confidenceIntervals(new PredictionInterval(predictions, predictions, 0.95))
                .build();
    }
}
