package com.rovertrend.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered series of numeric telemetry samples with their timestamps.
 *
 * <p>
 * Streams are produced by the ingestion layer and are read-only to the
 * engine. {@code data[i]} was sampled at {@code timestamps[i]}.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code data} and {@code timestamps} have the same length</li>
 * <li>timestamps are strictly increasing</li>
 * </ul>
 * <p>
 * Both are checked at construction; a violation throws
 * {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TelemetryStream implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String unit;
    private final double[] data;
    private final List<Instant> timestamps;

    /**
     * @param id         stream identifier; must not be {@code null}
     * @param name       display name (defaults to the id when {@code null})
     * @param unit       measurement unit, may be {@code null}
     * @param data       sample values; must not be {@code null}
     * @param timestamps sample instants; must not be {@code null}
     * @throws NullPointerException     if a required argument is {@code null}
     * @throws IllegalArgumentException if the lengths differ or timestamps are
     *                                  not strictly increasing
     */
    @JsonCreator
    public TelemetryStream(@JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("unit") String unit,
            @JsonProperty("data") double[] data,
            @JsonProperty("timestamps") List<Instant> timestamps) {
        this.id = Objects.requireNonNull(id, "Stream id must not be null");
        this.name = name != null ? name : id;
        this.unit = unit;
        Objects.requireNonNull(data, "Stream data must not be null");
        Objects.requireNonNull(timestamps, "Stream timestamps must not be null");

        if (data.length != timestamps.size()) {
            throw new IllegalArgumentException("Stream '" + id + "' has " + data.length
                    + " values but " + timestamps.size() + " timestamps");
        }
        for (int i = 0; i < timestamps.size(); i++) {
            Instant current = Objects.requireNonNull(timestamps.get(i),
                    "Timestamp at index " + i + " is null");
            if (i > 0 && !current.isAfter(timestamps.get(i - 1))) {
                throw new IllegalArgumentException("Stream '" + id
                        + "' timestamps must be strictly increasing (index " + i + ")");
            }
        }

        this.data = data.clone();
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
    }

    /**
     * Build a stream sampled at a fixed interval, starting at {@code start}.
     *
     * @param id       stream identifier
     * @param data     sample values
     * @param start    instant of the first sample
     * @param interval millis between consecutive samples; must be positive
     * @return a new stream
     */
    public static TelemetryStream regular(String id, double[] data, Instant start, long interval) {
        Objects.requireNonNull(data, "Stream data must not be null");
        Objects.requireNonNull(start, "Start instant must not be null");
        if (interval <= 0) {
            throw new IllegalArgumentException("Sampling interval must be > 0, got: " + interval);
        }
        List<Instant> timestamps = new ArrayList<>(data.length);
        for (int i = 0; i < data.length; i++) {
            timestamps.add(start.plusMillis(i * interval));
        }
        return new TelemetryStream(id, id, null, data, timestamps);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * @return a copy of the sample values
     */
    public double[] getData() {
        return data.clone();
    }

    /**
     * @return unmodifiable list of sample instants
     */
    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public int size() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryStream that))
            return false;
        return id.equals(that.id)
                && Arrays.equals(data, that.data)
                && timestamps.equals(that.timestamps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamps) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TelemetryStream{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", unit='" + unit + '\'' +
                ", size=" + data.length +
                '}';
    }
}
