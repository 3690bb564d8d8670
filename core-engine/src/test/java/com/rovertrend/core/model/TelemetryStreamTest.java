package com.rovertrend.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TelemetryStream}.
 */
class TelemetryStreamTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("Should stamp a regular stream at a fixed interval")
    void shouldBuildRegularStream() {
        TelemetryStream stream = TelemetryStream.regular("rover.battery.voltage", new double[] { 28.1, 28.0, 27.9 },
                START, 2000);

        assertThat(stream.getTimestamps()).containsExactly(START, START.plusSeconds(2), START.plusSeconds(4));
        assertThat(stream.getName()).isEqualTo("rover.battery.voltage");
        assertThat(stream.size()).isEqualTo(3);
        assertThat(stream.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should hand out copies of the sample values")
    void shouldCopyData() {
        double[] data = { 1, 2, 3 };
        TelemetryStream stream = TelemetryStream.regular("s", data, START, 1000);

        data[0] = 99;
        stream.getData()[1] = 99;

        assertThat(stream.getData()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should reject values and timestamps of different lengths")
    void shouldRejectLengthMismatch() {
        assertThatThrownBy(() -> new TelemetryStream("s", null, null, new double[] { 1, 2 }, List.of(START)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 values but 1 timestamps");
    }

    @Test
    @DisplayName("Should reject timestamps that do not strictly increase")
    void shouldRejectUnorderedTimestamps() {
        assertThatThrownBy(() -> new TelemetryStream("s", null, null, new double[] { 1, 2 },
                List.of(START, START)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
        assertThatThrownBy(() -> TelemetryStream.regular("s", new double[] { 1 }, START, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should read a stream from ingestion JSON")
    void shouldDeserializeFromJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        String json = "{\"id\":\"rover.wheel.current\",\"unit\":\"A\",\"data\":[1.5,1.75],"
                + "\"timestamps\":[\"2024-03-01T00:00:00Z\",\"2024-03-01T00:00:01Z\"],\"source\":\"rt-bus\"}";

        TelemetryStream stream = mapper.readValue(json, TelemetryStream.class);

        assertThat(stream.getId()).isEqualTo("rover.wheel.current");
        assertThat(stream.getName()).isEqualTo("rover.wheel.current");
        assertThat(stream.getUnit()).isEqualTo("A");
        assertThat(stream.getData()).containsExactly(1.5, 1.75);
        assertThat(stream).isEqualTo(TelemetryStream.regular("rover.wheel.current", new double[] { 1.5, 1.75 },
                START, 1000));
    }
}
