package com.rovertrend.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Multi-step forecast for one stream.
 *
 * <p>
 * {@link #getMethod()} is the method that actually produced the forecast. It
 * differs from {@link #getRequestedMethod()} when the requested model was
 * unavailable and the engine fell back to a persistence forecast; in that
 * case {@link #isFallback()} is {@code true}.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ForecastMethod method;
    private final ForecastMethod requestedMethod;
    private final String fallbackReason;
    private final double[] predictions;
    private final List<Instant> timestamps;
    private final PredictionInterval confidenceIntervals;
    private final PredictionInterval predictionIntervals;
    private final AccuracyMetrics metrics;

    private PredictionResult(Builder b) {
        this.method = Objects.requireNonNull(b.method, "method must not be null");
        this.requestedMethod = b.requestedMethod != null ? b.requestedMethod : b.method;
        this.fallbackReason = b.fallbackReason;
        this.predictions = Objects.requireNonNull(b.predictions, "predictions must not be null").clone();
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(b.timestamps, "timestamps must not be null")));
        this.confidenceIntervals = Objects.requireNonNull(b.confidenceIntervals,
                "confidenceIntervals must not be null");
        this.predictionIntervals = b.predictionIntervals;
        this.metrics = b.metrics;
        if (predictions.length != timestamps.size()) {
            throw new IllegalArgumentException("Predictions and timestamps differ in length");
        }
    }

    /**
     * Copy constructor for subclasses that extend a finished result.
     *
     * @param other result to copy
     */
    protected PredictionResult(PredictionResult other) {
        this.method = other.method;
        this.requestedMethod = other.requestedMethod;
        this.fallbackReason = other.fallbackReason;
        this.predictions = other.predictions;
        this.timestamps = other.timestamps;
        this.confidenceIntervals = other.confidenceIntervals;
        this.predictionIntervals = other.predictionIntervals;
        this.metrics = other.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link PredictionResult}.
     */
    public static class Builder {
        private ForecastMethod method;
        private ForecastMethod requestedMethod;
        private String fallbackReason;
        private double[] predictions;
        private List<Instant> timestamps;
        private PredictionInterval confidenceIntervals;
        private PredictionInterval predictionIntervals;
        private AccuracyMetrics metrics;

        public Builder method(ForecastMethod method) {
            this.method = method;
            return this;
        }

        public Builder requestedMethod(ForecastMethod requestedMethod) {
            this.requestedMethod = requestedMethod;
            return this;
        }

        public Builder fallbackReason(String fallbackReason) {
            this.fallbackReason = fallbackReason;
            return this;
        }

        public Builder predictions(double[] predictions) {
            this.predictions = predictions;
            return this;
        }

        public Builder timestamps(List<Instant> timestamps) {
            this.timestamps = timestamps;
            return this;
        }

        public Builder confidenceIntervals(PredictionInterval confidenceIntervals) {
            this.confidenceIntervals = confidenceIntervals;
            return this;
        }

        public Builder predictionIntervals(PredictionInterval predictionIntervals) {
            this.predictionIntervals = predictionIntervals;
            return this;
        }

        public Builder metrics(AccuracyMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public PredictionResult build() {
            return new PredictionResult(this);
        }
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public ForecastMethod getRequestedMethod() {
        return requestedMethod;
    }

    public boolean isFallback() {
        return fallbackReason != null;
    }

    /** @return why the requested method was replaced, or {@code null} */
    public String getFallbackReason() {
        return fallbackReason;
    }

    public double[] getPredictions() {
        return predictions.clone();
    }

    public int getHorizon() {
        return predictions.length;
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public PredictionInterval getConfidenceIntervals() {
        return confidenceIntervals;
    }

    /** @return prediction intervals, or {@code null} when not computed */
    public PredictionInterval getPredictionIntervals() {
        return predictionIntervals;
    }

    /** @return backtest metrics, or {@code null} when the series was too short */
    public AccuracyMetrics getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "method=" + method +
                ", requestedMethod=" + requestedMethod +
                ", horizon=" + predictions.length +
                ", fallback=" + isFallback() +
                ", metrics=" + metrics +
                '}';
    }
}
