package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;
import com.rovertrend.core.model.DriftMethod;
import com.rovertrend.core.model.DriftStatistics;
import com.rovertrend.core.model.DriftStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriftMonitorRegistry}.
 */
class DriftMonitorRegistryTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private DriftMonitorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DriftMonitorRegistry(new DriftDetectorConfig(DriftMethod.CUSUM, 0.5, 50));
    }

    @Test
    @DisplayName("Should keep one detector per stream")
    void shouldStartOncePerStream() {
        DriftDetector first = registry.start("wheel.fl.current");
        DriftDetector again = registry.start("wheel.fl.current",
                new DriftDetectorConfig(DriftMethod.EWMA, 0.9, 10));
        registry.start("mast.temp", new DriftDetectorConfig(DriftMethod.ADWIN, 0.5, 20));

        assertThat(again).isSameAs(first);
        assertThat(first.getConfig().getMethod()).isEqualTo(DriftMethod.CUSUM);
        assertThat(registry.monitoredStreams()).containsExactlyInAnyOrder("wheel.fl.current", "mast.temp");
        assertThat(registry.detector("mast.temp")).get()
                .extracting(d -> d.getConfig().getMethod()).isEqualTo(DriftMethod.ADWIN);
    }

    @Test
    @DisplayName("Should route samples and expose results and statistics per stream")
    void shouldProcessPerStream() {
        registry.start("wheel.fl.current");
        registry.start("wheel.fr.current");

        feed("wheel.fl.current", new Random(42), 5.0, 400);

        assertThat(registry.latestResult("wheel.fl.current")).isPresent();
        assertThat(registry.latestResult("wheel.fr.current")).isEmpty();
        DriftStatistics statistics = registry.statistics("wheel.fl.current").orElseThrow();
        assertThat(statistics.getSamplesProcessed()).isEqualTo(400);
        assertThat(statistics.getDriftsDetected()).isEqualTo(1);
        assertThat(registry.statistics("wheel.fr.current").orElseThrow().getSamplesProcessed()).isZero();
        assertThat(registry.statistics("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should fan events out to registry listeners, including for later streams")
    void shouldAttachListenersToAllDetectors() {
        List<DriftEvent> events = new ArrayList<>();
        registry.start("wheel.fl.current");
        registry.addListener(events::add);
        registry.start("wheel.rl.current");

        feed("wheel.fl.current", new Random(42), 5.0, 400);
        feed("wheel.rl.current", new Random(42), 5.0, 400);

        assertThat(events)
                .filteredOn(e -> e.getType() == DriftEventType.DRIFT_DETECTED)
                .extracting(DriftEvent::getStreamId)
                .containsExactly("wheel.fl.current", "wheel.rl.current");
    }

    @Test
    @DisplayName("Should fail when feeding a stream that is not monitored")
    void shouldRejectUnknownStream() {
        assertThatThrownBy(() -> registry.process("ghost", 1.0, START))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ghost");
        assertThatThrownBy(() -> registry.reset("ghost"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should discard the detector when monitoring stops")
    void shouldStopMonitoring() {
        registry.start("wheel.fl.current");

        assertThat(registry.stop("wheel.fl.current")).isTrue();
        assertThat(registry.stop("wheel.fl.current")).isFalse();
        assertThat(registry.isMonitoring("wheel.fl.current")).isFalse();
        assertThat(registry.latestResult("wheel.fl.current")).isEmpty();
    }

    @Test
    @DisplayName("Should reset a stream's detector on request")
    void shouldResetStream() {
        DriftDetectorConfig config = new DriftDetectorConfig(DriftMethod.CUSUM, 0.5, 50);
        config.setAutoReset(false);
        registry.start("wheel.fl.current", config);
        feed("wheel.fl.current", new Random(42), 5.0, 400);
        assertThat(registry.detector("wheel.fl.current").orElseThrow().getStatus()).isEqualTo(DriftStatus.DRIFT);

        registry.reset("wheel.fl.current");

        assertThat(registry.detector("wheel.fl.current").orElseThrow().getStatus()).isEqualTo(DriftStatus.STABLE);
    }

    @Test
    @DisplayName("Should snapshot a stream and restore it under another id")
    void shouldSnapshotAndRestore() {
        registry.start("wheel.fl.current");
        feed("wheel.fl.current", new Random(42), 0.0, 120);

        String snapshot = registry.snapshot("wheel.fl.current");
        DriftDetector restored = registry.restore("wheel.fl.current.replay",
                new DriftDetectorConfig(DriftMethod.CUSUM, 0.5, 50), snapshot);

        assertThat(restored.getDriftStatistics().getSamplesProcessed()).isEqualTo(120);
        assertThat(registry.isMonitoring("wheel.fl.current.replay")).isTrue();
        assertThatThrownBy(() -> registry.restore("other",
                new DriftDetectorConfig(DriftMethod.DDM, 0.5, 50), snapshot))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should validate the default configuration up front")
    void shouldValidateDefaultConfig() {
        assertThatThrownBy(() -> new DriftMonitorRegistry(new DriftDetectorConfig(DriftMethod.CUSUM, 0.5, -1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSize");
    }

    // ---- Helpers ----

    private void feed(String streamId, Random random, double shift, int length) {
        for (int i = 0; i < length; i++) {
            double value = 10.0 + random.nextGaussian() + (i >= 300 ? shift : 0.0);
            registry.process(streamId, value, START.plusSeconds(i));
        }
    }
}
