package com.rovertrend.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Composite result of analyzing one telemetry stream.
 *
 * <p>
 * Produced fresh by every analysis call and never mutated afterwards. A
 * {@code null} sub-result means the analysis was disabled or not applicable
 * (for example ARIMA on a series too short to fit); the reason is recorded in
 * {@link #getDiagnostics()}.
 * </p>
 *
 * <h3>Always present</h3>
 * <ul>
 * <li>{@link #getTrends()}</li>
 * <li>{@link #getStationarity()}</li>
 * <li>{@link #getChangePoints()} (empty when detection is disabled)</li>
 * <li>{@link #getValidation()}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AdvancedTrendAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String streamId;
    private final Instant analyzedAt;
    private final int dataPoints;
    private final TrendSummary trends;
    private final ArimaModel arima;
    private final StationarityResult stationarity;
    private final List<ChangePoint> changePoints;
    private final SeasonalDecomposition seasonality;
    private final DriftResult drift;
    private final PredictionResult prediction;
    private final TimeSeriesValidation validation;
    private final List<String> diagnostics;

    private AdvancedTrendAnalysis(Builder b) {
        this.streamId = Objects.requireNonNull(b.streamId, "streamId must not be null");
        this.analyzedAt = Objects.requireNonNull(b.analyzedAt, "analyzedAt must not be null");
        this.dataPoints = b.dataPoints;
        this.trends = Objects.requireNonNull(b.trends, "trends must not be null");
        this.arima = b.arima;
        this.stationarity = Objects.requireNonNull(b.stationarity, "stationarity must not be null");
        this.changePoints = Collections.unmodifiableList(new ArrayList<>(b.changePoints));
        this.seasonality = b.seasonality;
        this.drift = b.drift;
        this.prediction = b.prediction;
        this.validation = Objects.requireNonNull(b.validation, "validation must not be null");
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(b.diagnostics));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AdvancedTrendAnalysis}.
     */
    public static class Builder {
        private String streamId;
        private Instant analyzedAt;
        private int dataPoints;
        private TrendSummary trends;
        private ArimaModel arima;
        private StationarityResult stationarity;
        private List<ChangePoint> changePoints = Collections.emptyList();
        private SeasonalDecomposition seasonality;
        private DriftResult drift;
        private PredictionResult prediction;
        private TimeSeriesValidation validation;
        private final List<String> diagnostics = new ArrayList<>();

        public Builder streamId(String streamId) {
            this.streamId = streamId;
            return this;
        }

        public Builder analyzedAt(Instant analyzedAt) {
            this.analyzedAt = analyzedAt;
            return this;
        }

        public Builder dataPoints(int dataPoints) {
            this.dataPoints = dataPoints;
            return this;
        }

        public Builder trends(TrendSummary trends) {
            this.trends = trends;
            return this;
        }

        public Builder arima(ArimaModel arima) {
            this.arima = arima;
            return this;
        }

        public Builder stationarity(StationarityResult stationarity) {
            this.stationarity = stationarity;
            return this;
        }

        public Builder changePoints(List<ChangePoint> changePoints) {
            this.changePoints = Objects.requireNonNull(changePoints, "changePoints must not be null");
            return this;
        }

        public Builder seasonality(SeasonalDecomposition seasonality) {
            this.seasonality = seasonality;
            return this;
        }

        public Builder drift(DriftResult drift) {
            this.drift = drift;
            return this;
        }

        public Builder prediction(PredictionResult prediction) {
            this.prediction = prediction;
            return this;
        }

        public Builder validation(TimeSeriesValidation validation) {
            this.validation = validation;
            return this;
        }

        public Builder diagnostic(String message) {
            this.diagnostics.add(message);
            return this;
        }

        public AdvancedTrendAnalysis build() {
            return new AdvancedTrendAnalysis(this);
        }
    }

    public String getStreamId() {
        return streamId;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    public TrendSummary getTrends() {
        return trends;
    }

    public ArimaModel getArima() {
        return arima;
    }

    public StationarityResult getStationarity() {
        return stationarity;
    }

    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public SeasonalDecomposition getSeasonality() {
        return seasonality;
    }

    public DriftResult getDrift() {
        return drift;
    }

    public PredictionResult getPrediction() {
        return prediction;
    }

    public TimeSeriesValidation getValidation() {
        return validation;
    }

    /**
     * @return notes on omitted sub-analyses, fallbacks and data repairs
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "AdvancedTrendAnalysis{" +
                "streamId='" + streamId + '\'' +
                ", dataPoints=" + dataPoints +
                ", best=" + trends.getBest().getType() +
                ", arima=" + (arima != null ? arima.getOrder() : null) +
                ", stationary=" + stationarity.isStationary() +
                ", changePoints=" + changePoints.size() +
                ", diagnostics=" + diagnostics.size() +
                '}';
    }
}
