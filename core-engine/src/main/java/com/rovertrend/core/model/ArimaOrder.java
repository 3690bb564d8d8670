package com.rovertrend.core.model;

import java.io.Serializable;

/**
 * ARIMA order {@code (p, d, q)}.
 *
 * @since 1.0.0
 */
public final class ArimaOrder implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int p;
    private final int d;
    private final int q;

    /**
     * @throws IllegalArgumentException if any order is negative
     */
    public ArimaOrder(int p, int d, int q) {
        if (p < 0 || d < 0 || q < 0) {
            throw new IllegalArgumentException(
                    "ARIMA orders must be >= 0, got (" + p + "," + d + "," + q + ")");
        }
        this.p = p;
        this.d = d;
        this.q = q;
    }

    public int getP() {
        return p;
    }

    public int getD() {
        return d;
    }

    public int getQ() {
        return q;
    }

    /** @return {@code p + q}, used as the final tie-break in order selection */
    public int totalOrder() {
        return p + q;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ArimaOrder that))
            return false;
        return p == that.p && d == that.d && q == that.q;
    }

    @Override
    public int hashCode() {
        return (p * 31 + d) * 31 + q;
    }

    @Override
    public String toString() {
        return "ARIMA(" + p + "," + d + "," + q + ")";
    }
}
