package com.rovertrend.core.util;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Numeric helpers over {@code double[]} series shared by the analyzers.
 *
 * <p>
 * Variances are population variances (divide by {@code n}) unless stated
 * otherwise. Empty inputs yield {@code 0} rather than {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesMath {

    private SeriesMath() {
    }

    public static double mean(double[] x) {
        return mean(x, 0, x.length);
    }

    /**
     * Mean of {@code x[from..to)}.
     */
    public static double mean(double[] x, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += x[i];
        }
        return sum / (to - from);
    }

    public static double variance(double[] x) {
        return variance(x, 0, x.length);
    }

    /**
     * Population variance of {@code x[from..to)}.
     */
    public static double variance(double[] x, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double m = mean(x, from, to);
        double ss = 0;
        for (int i = from; i < to; i++) {
            double d = x[i] - m;
            ss += d * d;
        }
        return ss / (to - from);
    }

    public static double std(double[] x, int from, int to) {
        return Math.sqrt(variance(x, from, to));
    }

    /**
     * Apply {@code order} rounds of first differencing.
     *
     * @return a series {@code order} samples shorter (empty if too short)
     */
    public static double[] difference(double[] x, int order) {
        double[] current = x;
        for (int round = 0; round < order; round++) {
            if (current.length < 2) {
                return new double[0];
            }
            double[] next = new double[current.length - 1];
            for (int i = 1; i < current.length; i++) {
                next[i - 1] = current[i] - current[i - 1];
            }
            current = next;
        }
        return current == x ? x.clone() : current;
    }

    /**
     * Sample autocorrelation at {@code lag}, normalized by the lag-0
     * autocovariance. Returns {@code 0} for a constant series.
     */
    public static double autocorrelation(double[] x, int lag) {
        int n = x.length;
        if (lag <= 0 || lag >= n) {
            return lag == 0 ? 1.0 : 0.0;
        }
        double m = mean(x);
        double c0 = 0;
        for (double v : x) {
            c0 += (v - m) * (v - m);
        }
        if (c0 == 0) {
            return 0.0;
        }
        double ck = 0;
        for (int i = lag; i < n; i++) {
            ck += (x[i] - m) * (x[i - lag] - m);
        }
        return ck / c0;
    }

    /**
     * Remove the least-squares line fitted against the sample index.
     */
    public static double[] detrendLinear(double[] x) {
        double[] out = new double[x.length];
        if (x.length < 2) {
            return x.clone();
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(i, x[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        for (int i = 0; i < x.length; i++) {
            out[i] = x[i] - (intercept + slope * i);
        }
        return out;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static boolean allFinite(double[] x) {
        for (double v : x) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    public static double sumOfSquares(double[] x, int from) {
        double ss = 0;
        for (int i = from; i < x.length; i++) {
            ss += x[i] * x[i];
        }
        return ss;
    }
}
