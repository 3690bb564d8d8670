package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an augmented Dickey-Fuller unit-root test.
 *
 * @since 1.0.0
 */
public final class StationarityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean stationary;
    private final double adfStatistic;
    private final double pValue;
    private final int lags;
    private final int observations;
    private final Map<String, Double> criticalValues;

    public StationarityResult(boolean stationary, double adfStatistic, double pValue, int lags,
            int observations, Map<String, Double> criticalValues) {
        this.stationary = stationary;
        this.adfStatistic = adfStatistic;
        this.pValue = pValue;
        this.lags = lags;
        this.observations = observations;
        this.criticalValues = criticalValues != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(criticalValues))
                : Collections.emptyMap();
    }

    public boolean isStationary() {
        return stationary;
    }

    public double getAdfStatistic() {
        return adfStatistic;
    }

    public double getPValue() {
        return pValue;
    }

    /** @return number of lagged differences in the test regression */
    public int getLags() {
        return lags;
    }

    /** @return number of rows in the test regression */
    public int getObservations() {
        return observations;
    }

    /**
     * @return critical values keyed by significance ({@code "1%"}, {@code "5%"},
     *         {@code "10%"}); empty when the test could not run
     */
    public Map<String, Double> getCriticalValues() {
        return criticalValues;
    }

    @Override
    public String toString() {
        return "StationarityResult{" +
                "stationary=" + stationary +
                ", adfStatistic=" + adfStatistic +
                ", pValue=" + pValue +
                ", lags=" + lags +
                '}';
    }
}
