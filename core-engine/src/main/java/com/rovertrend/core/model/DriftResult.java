package com.rovertrend.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot returned by every drift-detector update.
 *
 * <p>
 * The reference statistics describe the pre-drift baseline and the current
 * statistics describe the most recent window of samples, both in the units of
 * the monitored stream.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DriftMethod method;
    private final DriftStatus status;
    private final boolean detected;
    private final boolean warning;
    private final double confidence;
    private final Instant timestamp;
    private final Instant driftTimestamp;
    private final double currentMean;
    private final double referenceMean;
    private final double currentVariance;
    private final double referenceVariance;
    private final DriftTestStatistics statistics;

    private DriftResult(Builder b) {
        this.method = Objects.requireNonNull(b.method, "method must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.detected = b.detected;
        this.warning = b.warning;
        this.confidence = b.confidence;
        this.timestamp = b.timestamp;
        this.driftTimestamp = b.driftTimestamp;
        this.currentMean = b.currentMean;
        this.referenceMean = b.referenceMean;
        this.currentVariance = b.currentVariance;
        this.referenceVariance = b.referenceVariance;
        this.statistics = Objects.requireNonNull(b.statistics, "statistics must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DriftResult}. {@code method}, {@code status} and
     * {@code statistics} are required.
     */
    public static class Builder {
        private DriftMethod method;
        private DriftStatus status;
        private boolean detected;
        private boolean warning;
        private double confidence;
        private Instant timestamp;
        private Instant driftTimestamp;
        private double currentMean;
        private double referenceMean;
        private double currentVariance;
        private double referenceVariance;
        private DriftTestStatistics statistics;

        public Builder method(DriftMethod method) {
            this.method = method;
            return this;
        }

        public Builder status(DriftStatus status) {
            this.status = status;
            return this;
        }

        public Builder detected(boolean detected) {
            this.detected = detected;
            return this;
        }

        public Builder warning(boolean warning) {
            this.warning = warning;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder driftTimestamp(Instant driftTimestamp) {
            this.driftTimestamp = driftTimestamp;
            return this;
        }

        public Builder currentMean(double currentMean) {
            this.currentMean = currentMean;
            return this;
        }

        public Builder referenceMean(double referenceMean) {
            this.referenceMean = referenceMean;
            return this;
        }

        public Builder currentVariance(double currentVariance) {
            this.currentVariance = currentVariance;
            return this;
        }

        public Builder referenceVariance(double referenceVariance) {
            this.referenceVariance = referenceVariance;
            return this;
        }

        public Builder statistics(DriftTestStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public DriftResult build() {
            return new DriftResult(this);
        }
    }

    public DriftMethod getMethod() {
        return method;
    }

    public DriftStatus getStatus() {
        return status;
    }

    public boolean isDetected() {
        return detected;
    }

    public boolean isWarning() {
        return warning;
    }

    /** @return how close the statistic is to the drift threshold, in {@code [0,1]} */
    public double getConfidence() {
        return confidence;
    }

    /** @return instant of the sample that produced this result */
    public Instant getTimestamp() {
        return timestamp;
    }

    /** @return instant of the most recent detected drift, or {@code null} */
    public Instant getDriftTimestamp() {
        return driftTimestamp;
    }

    public double getCurrentMean() {
        return currentMean;
    }

    public double getReferenceMean() {
        return referenceMean;
    }

    public double getCurrentVariance() {
        return currentVariance;
    }

    public double getReferenceVariance() {
        return referenceVariance;
    }

    public DriftTestStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return "DriftResult{" +
                "method=" + method +
                ", status=" + status +
                ", detected=" + detected +
                ", warning=" + warning +
                ", confidence=" + confidence +
                ", referenceMean=" + referenceMean +
                ", currentMean=" + currentMean +
                ", statistics=" + statistics +
                '}';
    }
}
