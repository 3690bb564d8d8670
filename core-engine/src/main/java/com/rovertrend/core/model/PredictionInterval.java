package com.rovertrend.core.model;

import java.io.Serializable;

/**
 * Per-step lower and upper bounds at a given coverage level.
 *
 * @since 1.0.0
 */
public final class PredictionInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] lower;
    private final double[] upper;
    private final double level;

    /**
     * @throws IllegalArgumentException if the bound arrays differ in length
     */
    public PredictionInterval(double[] lower, double[] upper, double level) {
        if (lower.length != upper.length) {
            throw new IllegalArgumentException("Interval bounds differ in length: "
                    + lower.length + " vs " + upper.length);
        }
        this.lower = lower.clone();
        this.upper = upper.clone();
        this.level = level;
    }

    public double[] getLower() {
        return lower.clone();
    }

    public double[] getUpper() {
        return upper.clone();
    }

    public double getLevel() {
        return level;
    }

    /** @return {@code upper[step] - lower[step]} */
    public double width(int step) {
        return upper[step] - lower[step];
    }
}
