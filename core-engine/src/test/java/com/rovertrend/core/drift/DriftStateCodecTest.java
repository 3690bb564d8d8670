package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;
import com.rovertrend.core.model.DriftMethod;
import com.rovertrend.core.model.DriftResult;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DriftStateCodec}.
 */
class DriftStateCodecTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @ParameterizedTest
    @EnumSource(DriftMethod.class)
    @DisplayName("Should resume from a JSON snapshot exactly where the detector left off")
    void shouldResumeFromSnapshot(DriftMethod method) {
        DriftDetectorConfig config = new DriftDetectorConfig(method, 0.5, 30);
        DriftDetector original = new DriftDetector("rover.battery", config);
        Random random = new Random(7);
        for (int i = 0; i < 150; i++) {
            original.processDataPoint(20.0 + random.nextGaussian(), START.plusSeconds(i));
        }

        String json = DriftStateCodec.toJson(original.getState());
        DriftDetector resumed = new DriftDetector("rover.battery", config);
        resumed.restore(DriftStateCodec.fromJson(json));

        assertThat(resumed.getDriftStatistics().getSamplesProcessed()).isEqualTo(150);
        for (int i = 150; i < 250; i++) {
            double value = 20.0 + random.nextGaussian() + (i >= 200 ? 4.0 : 0.0);
            DriftResult expected = original.processDataPoint(value, START.plusSeconds(i));
            DriftResult actual = resumed.processDataPoint(value, START.plusSeconds(i));
            assertThat(actual.getStatus()).isEqualTo(expected.getStatus());
            assertThat(actual.getStatistics().getTestStatistic())
                    .isEqualTo(expected.getStatistics().getTestStatistic());
        }
        assertThat(resumed.getDriftStatistics().getDriftsDetected())
                .isEqualTo(original.getDriftStatistics().getDriftsDetected());
    }

    @Test
    @DisplayName("Should write instants as ISO-8601 and tag the method state")
    void shouldWriteReadableJson() {
        DriftDetector detector = new DriftDetector(new DriftDetectorConfig(DriftMethod.PAGE_HINKLEY, 0.5, 10));
        for (int i = 0; i < 12; i++) {
            detector.processDataPoint(i % 3, START.plusSeconds(i));
        }

        String json = DriftStateCodec.toJson(detector.getState());

        assertThat(json).contains("\"lastTimestamp\":\"2024-03-01T00:00:11Z\"");
        assertThat(json).contains("\"method\":\"PAGE_HINKLEY\"");
        assertThat(json).contains("\"samplesProcessed\":12");
    }

    @Test
    @DisplayName("Should reject malformed snapshots")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> DriftStateCodec.fromJson("{\"method\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid drift detector state");
        assertThatThrownBy(() -> DriftStateCodec.fromJson("{\"method\":\"CUSUM\",\"status\":\"STABLE\"}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
