package com.rovertrend.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A structural break detected in a series.
 *
 * <p>
 * {@code magnitude} is signed and expressed in pooled standard deviations of
 * the segments on either side of {@code index}; its meaning depends on
 * {@link #getType()} (mean difference, spread ratio, or slope change).
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final Instant timestamp;
    private final ChangeType type;
    private final double magnitude;
    private final double confidence;
    private final ChangeDirection direction;

    /**
     * @param index      first index of the post-change segment
     * @param timestamp  instant of {@code index}, may be {@code null}
     * @param type       what changed
     * @param magnitude  standardized size of the change
     * @param confidence confidence in {@code [0, 1]}
     * @param direction  sign of the change
     */
    public ChangePoint(int index, Instant timestamp, ChangeType type, double magnitude,
            double confidence, ChangeDirection direction) {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be in [0,1], got: " + confidence);
        }
        this.index = index;
        this.timestamp = timestamp;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.magnitude = magnitude;
        this.confidence = confidence;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public int getIndex() {
        return index;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ChangeType getType() {
        return type;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public double getConfidence() {
        return confidence;
    }

    public ChangeDirection getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangePoint that))
            return false;
        return index == that.index && type == that.type && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, type, direction);
    }

    @Override
    public String toString() {
        return "ChangePoint{" +
                "index=" + index +
                ", type=" + type +
                ", magnitude=" + magnitude +
                ", confidence=" + confidence +
                ", direction=" + direction +
                '}';
    }
}
