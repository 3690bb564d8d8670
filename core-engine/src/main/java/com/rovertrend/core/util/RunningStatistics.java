package com.rovertrend.core.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Immutable running mean and variance (Welford's algorithm).
 *
 * <p>
 * {@link #add(double)} returns a new instance; the receiver is unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunningStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final RunningStatistics EMPTY = new RunningStatistics(0, 0.0, 0.0);

    private final long count;
    private final double mean;
    private final double m2;

    @JsonCreator
    public RunningStatistics(@JsonProperty("count") long count,
            @JsonProperty("mean") double mean,
            @JsonProperty("m2") double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public static RunningStatistics empty() {
        return EMPTY;
    }

    /**
     * Statistics over every value of {@code values}.
     */
    public static RunningStatistics of(double[] values) {
        RunningStatistics stats = EMPTY;
        for (double v : values) {
            stats = stats.add(v);
        }
        return stats;
    }

    public RunningStatistics add(double value) {
        long n = count + 1;
        double delta = value - mean;
        double newMean = mean + delta / n;
        return new RunningStatistics(n, newMean, m2 + delta * (value - newMean));
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getM2() {
        return m2;
    }

    /** @return population variance, 0 for fewer than two samples */
    @JsonIgnore
    public double getVariance() {
        return count < 2 ? 0.0 : m2 / count;
    }

    @JsonIgnore
    public double getStd() {
        return Math.sqrt(getVariance());
    }

    @Override
    public String toString() {
        return "RunningStatistics{count=" + count + ", mean=" + mean + ", variance=" + getVariance() + '}';
    }
}
