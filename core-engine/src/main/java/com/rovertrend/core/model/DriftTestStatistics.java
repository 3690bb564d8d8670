package com.rovertrend.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * The statistic a drift method compares against its threshold.
 *
 * @since 1.0.0
 */
public final class DriftTestStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double testStatistic;
    private final double threshold;
    private final Double pValue;

    /**
     * @param testStatistic current value of the method's statistic
     * @param threshold     value at which drift is declared
     * @param pValue        p-value when the method defines one, else {@code null}
     */
    @JsonCreator
    public DriftTestStatistics(@JsonProperty("testStatistic") double testStatistic,
            @JsonProperty("threshold") double threshold,
            @JsonProperty("pValue") Double pValue) {
        this.testStatistic = testStatistic;
        this.threshold = threshold;
        this.pValue = pValue;
    }

    public double getTestStatistic() {
        return testStatistic;
    }

    public double getThreshold() {
        return threshold;
    }

    /** @return p-value, or {@code null} when the method has none */
    public Double getPValue() {
        return pValue;
    }

    @Override
    public String toString() {
        return "DriftTestStatistics{" +
                "testStatistic=" + testStatistic +
                ", threshold=" + threshold +
                ", pValue=" + pValue +
                '}';
    }
}
