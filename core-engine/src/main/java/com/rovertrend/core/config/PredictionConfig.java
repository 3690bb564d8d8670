package com.rovertrend.core.config;

import com.rovertrend.core.model.AggregationMethod;
import com.rovertrend.core.model.ForecastMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Forecast request options.
 *
 * @since 1.0.0
 */
public class PredictionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int horizon = 10;
    private double confidenceLevel = 0.95;
    private ForecastMethod method = ForecastMethod.ENSEMBLE;
    private AggregationMethod aggregationMethod = AggregationMethod.PERFORMANCE_WEIGHTED;
    private boolean includePredictionIntervals = true;

    public PredictionConfig() {
    }

    public PredictionConfig(int horizon, double confidenceLevel, ForecastMethod method) {
        this.horizon = horizon;
        this.confidenceLevel = confidenceLevel;
        this.method = method;
    }

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (horizon <= 0) {
            errors.add("'horizon' must be > 0, got " + horizon);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            errors.add("'confidenceLevel' must be in (0,1), got " + confidenceLevel);
        }
        if (method == null) {
            errors.add("'method' is required");
        }
        if (aggregationMethod == null) {
            errors.add("'aggregationMethod' is required");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid prediction config: " + String.join("; ", errors));
        }
    }

    public int getHorizon() {
        return horizon;
    }

    public void setHorizon(int horizon) {
        this.horizon = horizon;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public void setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
    }

    public ForecastMethod getMethod() {
        return method;
    }

    public void setMethod(ForecastMethod method) {
        this.method = method;
    }

    public AggregationMethod getAggregationMethod() {
        return aggregationMethod;
    }

    public void setAggregationMethod(AggregationMethod aggregationMethod) {
        this.aggregationMethod = aggregationMethod;
    }

    public boolean isIncludePredictionIntervals() {
        return includePredictionIntervals;
    }

    public void setIncludePredictionIntervals(boolean includePredictionIntervals) {
        this.includePredictionIntervals = includePredictionIntervals;
    }

    @Override
    public String toString() {
        return "PredictionConfig{" +
                "horizon=" + horizon +
                ", confidenceLevel=" + confidenceLevel +
                ", method=" + method +
                ", aggregationMethod=" + aggregationMethod +
                '}';
    }
}
