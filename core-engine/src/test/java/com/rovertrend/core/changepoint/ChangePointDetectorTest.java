package com.rovertrend.core.changepoint;

import com.rovertrend.core.model.ChangeDirection;
import com.rovertrend.core.model.ChangePoint;
import com.rovertrend.core.model.ChangeType;
import com.rovertrend.core.model.TelemetryStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChangePointDetector}.
 */
class ChangePointDetectorTest {

    private final ChangePointDetector detector = new ChangePointDetector();

    @Test
    @DisplayName("Should find a single upward mean shift at the step")
    void shouldDetectUpwardStep() {
        double[] series = step(new Random(42), 100, 50, 0.0, 10.0, 0.5);

        List<ChangePoint> points = detector.detect(series, 0.8);

        assertThat(points).hasSize(1);
        ChangePoint point = points.get(0);
        assertThat(point.getIndex()).isBetween(48, 52);
        assertThat(point.getType()).isEqualTo(ChangeType.MEAN);
        assertThat(point.getDirection()).isEqualTo(ChangeDirection.INCREASE);
        assertThat(point.getMagnitude()).isGreaterThan(1.0);
        assertThat(point.getConfidence()).isBetween(0.0, 1.0);
        assertThat(point.getTimestamp()).isNull();
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.01, 0.1, 0.5, 1.0 })
    @DisplayName("Should find exactly one increase at the step for every noise seed")
    void shouldDetectSingleStepAcrossSeeds(double noise) {
        for (int seed = 0; seed < 20; seed++) {
            double[] series = step(new Random(seed), 100, 50, 0.0, 10.0, noise);
            for (double sensitivity : new double[] { 0.5, 0.8 }) {
                List<ChangePoint> points = detector.detect(series, sensitivity);

                assertThat(points).as("seed %d, sensitivity %s", seed, sensitivity).hasSize(1);
                ChangePoint point = points.get(0);
                assertThat(point.getIndex()).as("seed %d, sensitivity %s", seed, sensitivity).isBetween(48, 52);
                assertThat(point.getType()).isEqualTo(ChangeType.MEAN);
                assertThat(point.getDirection()).isEqualTo(ChangeDirection.INCREASE);
            }
        }
    }

    @Test
    @DisplayName("Should wait for a full window after a split before judging it")
    void shouldNotJudgeSplitNearEdge() {
        // seed 3 raises a noise alarm whose window closes just before the step
        double[] series = step(new Random(3), 100, 50, 0.0, 10.0, 0.1);

        List<ChangePoint> points = detector.detect(series, 0.5);

        assertThat(points).extracting(ChangePoint::getIndex).containsExactly(50);
    }

    @Test
    @DisplayName("Should report a downward shift as a decrease")
    void shouldDetectDownwardStep() {
        double[] series = step(new Random(42), 100, 50, 20.0, 12.0, 0.5);

        List<ChangePoint> points = detector.detect(series, 0.8);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).getIndex()).isBetween(48, 52);
        assertThat(points.get(0).getDirection()).isEqualTo(ChangeDirection.DECREASE);
        assertThat(points.get(0).getMagnitude()).isNegative();
    }

    @Test
    @DisplayName("Should find consecutive shifts in index order")
    void shouldDetectTwoShifts() {
        Random random = new Random(42);
        double[] series = new double[180];
        for (int i = 0; i < series.length; i++) {
            double level = i < 60 ? 0.0 : i < 120 ? 8.0 : 2.0;
            series[i] = level + 0.5 * random.nextGaussian();
        }

        List<ChangePoint> points = detector.detect(series, 0.8);

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getIndex()).isBetween(58, 62);
        assertThat(points.get(0).getDirection()).isEqualTo(ChangeDirection.INCREASE);
        assertThat(points.get(1).getIndex()).isBetween(118, 122);
        assertThat(points.get(1).getDirection()).isEqualTo(ChangeDirection.DECREASE);
    }

    @Test
    @DisplayName("Should classify a widening spread as a variance change")
    void shouldDetectVarianceChange() {
        Random random = new Random(42);
        double[] series = new double[200];
        for (int i = 0; i < series.length; i++) {
            series[i] = (i < 100 ? 1.0 : 4.0) * random.nextGaussian();
        }

        List<ChangePoint> points = detector.detect(series, 0.8);

        assertThat(points).isNotEmpty();
        assertThat(points.get(0).getType()).isEqualTo(ChangeType.VARIANCE);
        assertThat(points.get(0).getIndex()).isBetween(95, 105);
        assertThat(points.get(0).getDirection()).isEqualTo(ChangeDirection.INCREASE);
    }

    @Test
    @DisplayName("Should flag the onset of a ramp close to where it starts")
    void shouldDetectRampOnset() {
        Random random = new Random(42);
        double[] series = new double[200];
        for (int i = 0; i < series.length; i++) {
            series[i] = (i < 100 ? 0.0 : 0.3 * (i - 100)) + 0.2 * random.nextGaussian();
        }

        List<ChangePoint> points = detector.detect(series, 0.8);

        assertThat(points).isNotEmpty();
        assertThat(points.get(0).getIndex()).isBetween(100, 106);
        assertThat(points).allSatisfy(p -> assertThat(p.getDirection()).isEqualTo(ChangeDirection.INCREASE));
    }

    @Test
    @DisplayName("Should stay quiet on stationary noise at low sensitivity")
    void shouldIgnoreNoise() {
        Random random = new Random(42);
        double[] series = new double[200];
        for (int i = 0; i < series.length; i++) {
            series[i] = 5.0 + random.nextGaussian();
        }

        assertThat(detector.detect(series, 0.3)).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing for a flat series")
    void shouldIgnoreConstantSeries() {
        double[] series = new double[100];
        Arrays.fill(series, 3.0);

        assertThat(detector.detect(series, 1.0)).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing when the series is shorter than a window")
    void shouldHandleShortSeries() {
        double[] series = { 1, 2, 3, 50, 51, 52, 53, 54, 55, 56, 57, 58, 59, 60, 61 };

        assertThat(detector.detect(series, 1.0)).isEmpty();
        assertThat(detector.detect(new double[0], 0.5)).isEmpty();
    }

    @Test
    @DisplayName("Should stamp change points with the stream's sample instants")
    void shouldStampTimestamps() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        double[] series = step(new Random(42), 100, 50, 0.0, 10.0, 0.5);
        TelemetryStream stream = TelemetryStream.regular("motor.temp", series, start, 1000);

        List<ChangePoint> points = detector.detect(stream, 0.8);

        assertThat(points).hasSize(1);
        int index = points.get(0).getIndex();
        assertThat(points.get(0).getTimestamp()).isEqualTo(start.plusSeconds(index));
    }

    @Test
    @DisplayName("Should reject sensitivity outside (0, 1]")
    void shouldRejectBadSensitivity() {
        double[] series = new double[50];

        assertThatThrownBy(() -> detector.detect(series, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sensitivity");
        assertThatThrownBy(() -> detector.detect(series, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.detect(series, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a minimum window below three samples")
    void shouldRejectTinyWindow() {
        assertThatThrownBy(() -> new ChangePointDetector(2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");
    }

    @Test
    @DisplayName("Should place the split where the segment likelihood peaks")
    void shouldLocateSplit() {
        double[] series = { 0, 0.1, -0.1, 0.05, 0, 5, 5.1, 4.9, 5.05, 5 };

        assertThat(ChangePointDetector.locate(series, 0, series.length)).isEqualTo(5);
        assertThat(ChangePointDetector.locate(series, 0, 3)).isEqualTo(-1);
    }

    // ---- Helpers ----

    private static double[] step(Random random, int n, int at, double before, double after, double noise) {
        double[] series = new double[n];
        for (int i = 0; i < n; i++) {
            series[i] = (i < at ? before : after) + noise * random.nextGaussian();
        }
        return series;
    }
}
