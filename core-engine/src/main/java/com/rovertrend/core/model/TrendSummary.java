package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * The trend models fitted during one analysis.
 *
 * @since 1.0.0
 */
public final class TrendSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TrendModel best;
    private final TrendModel linear;
    private final TrendModel nonLinear;

    /**
     * @param best      the selected model; must not be {@code null}
     * @param linear    the linear fit; must not be {@code null}
     * @param nonLinear the best non-linear candidate, or {@code null} when
     *                  disabled or not fittable
     */
    public TrendSummary(TrendModel best, TrendModel linear, TrendModel nonLinear) {
        this.best = Objects.requireNonNull(best, "best must not be null");
        this.linear = Objects.requireNonNull(linear, "linear must not be null");
        this.nonLinear = nonLinear;
    }

    public TrendModel getBest() {
        return best;
    }

    public TrendModel getLinear() {
        return linear;
    }

    public TrendModel getNonLinear() {
        return nonLinear;
    }

    @Override
    public String toString() {
        return "TrendSummary{" +
                "best=" + best.getType() +
                ", linear=" + linear.getEquation() +
                ", nonLinear=" + (nonLinear != null ? nonLinear.getType() : null) +
                '}';
    }
}
