package com.rovertrend.core.seasonal;

import com.rovertrend.core.model.SeasonalDecomposition;
import com.rovertrend.core.util.SeriesMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Detects a seasonal period and splits the series into trend, seasonal and
 * residual components.
 *
 * <p>
 * The period is the lag of the highest local maximum of the autocorrelation
 * function of the linearly detrended series, searched over lags
 * {@code 2..n/2}. A peak only counts if it exceeds both the configured
 * threshold and the white-noise band {@code 2/sqrt(n)}.
 * </p>
 *
 * <p>
 * Decomposition is classical and additive: the trend is a centred moving
 * average over one period ({@code 2×P} for even periods), the seasonal
 * component is the zero-centred per-phase mean of the detrended values, and
 * the residual is what remains. Edge trend values take the nearest centred
 * average.
 * </p>
 *
 * <p>
 * Strengths follow Hyndman's definitions, clamped to {@code [0, 1]}:
 * {@code 1 - Var(R)/Var(S + R)} for seasonality and
 * {@code 1 - Var(R)/Var(T + R)} for the trend.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDecomposer.class);

    public static final double DEFAULT_THRESHOLD = 0.3;

    /** Shortest series searched: two cycles of the smallest period plus margin. */
    static final int MIN_LENGTH = 8;

    private final double threshold;

    public SeasonalDecomposer() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold minimum autocorrelation of a seasonal peak, in {@code (0,1)}
     */
    public SeasonalDecomposer(double threshold) {
        if (!(threshold > 0 && threshold < 1)) {
            throw new IllegalArgumentException("Seasonal threshold must be in (0,1), got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @param series values in time order
     * @return the decomposition; {@code detected} is {@code false} when no
     *         significant period exists or the series is too short
     */
    public SeasonalDecomposition decompose(double[] series) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length;
        if (n < MIN_LENGTH) {
            return SeasonalDecomposition.notDetected(0.0);
        }

        double[] detrended = SeriesMath.detrendLinear(series);
        int maxLag = n / 2;
        double[] acf = new double[maxLag + 2];
        for (int lag = 1; lag <= Math.min(maxLag + 1, n - 1); lag++) {
            acf[lag] = SeriesMath.autocorrelation(detrended, lag);
        }

        double cutoff = Math.max(threshold, 2.0 / Math.sqrt(n));
        int period = 0;
        double best = Double.NEGATIVE_INFINITY;
        double strongest = 0.0;
        for (int lag = 2; lag <= maxLag; lag++) {
            strongest = Math.max(strongest, acf[lag]);
            boolean peak = acf[lag] > acf[lag - 1] && acf[lag] >= acf[lag + 1];
            if (peak && acf[lag] > cutoff && acf[lag] > best) {
                best = acf[lag];
                period = lag;
            }
        }
        if (period == 0) {
            LOG.debug("No seasonal period above {} (strongest autocorrelation {})", cutoff, strongest);
            return SeasonalDecomposition.notDetected(strongest);
        }

        double[] trend = centredMovingAverage(series, period);
        double[] seasonal = seasonalComponent(series, trend, period);
        double[] residual = new double[n];
        double[] seasonalPlusResidual = new double[n];
        double[] trendPlusResidual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = series[i] - trend[i] - seasonal[i];
            seasonalPlusResidual[i] = series[i] - trend[i];
            trendPlusResidual[i] = series[i] - seasonal[i];
        }
        double residualVariance = SeriesMath.variance(residual);
        double strength = strength(residualVariance, SeriesMath.variance(seasonalPlusResidual));
        double trendStrength = strength(residualVariance, SeriesMath.variance(trendPlusResidual));

        LOG.debug("Seasonal period {} (acf={}, strength={})", period, best, strength);
        return new SeasonalDecomposition(true, period, strength, trendStrength, best, trend, seasonal, residual);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static double[] centredMovingAverage(double[] x, int period) {
        int n = x.length;
        int half = period / 2;
        double[] trend = new double[n];
        int first = half;
        int last = n - 1 - half;
        for (int i = first; i <= last; i++) {
            double sum = 0;
            if (period % 2 == 1) {
                for (int j = i - half; j <= i + half; j++) {
                    sum += x[j];
                }
                trend[i] = sum / period;
            } else {
                // 2×P average: half weight on both ends
                sum += 0.5 * x[i - half] + 0.5 * x[i + half];
                for (int j = i - half + 1; j <= i + half - 1; j++) {
                    sum += x[j];
                }
                trend[i] = sum / period;
            }
        }
        for (int i = 0; i < first; i++) {
            trend[i] = trend[first];
        }
        for (int i = last + 1; i < n; i++) {
            trend[i] = trend[last];
        }
        return trend;
    }

    private static double[] seasonalComponent(double[] x, double[] trend, int period) {
        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int i = 0; i < x.length; i++) {
            phaseSum[i % period] += x[i] - trend[i];
            phaseCount[i % period]++;
        }
        double[] phaseMean = new double[period];
        double centre = 0;
        for (int k = 0; k < period; k++) {
            phaseMean[k] = phaseCount[k] > 0 ? phaseSum[k] / phaseCount[k] : 0.0;
            centre += phaseMean[k];
        }
        centre /= period;
        double[] seasonal = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            seasonal[i] = phaseMean[i % period] - centre;
        }
        return seasonal;
    }

    private static double strength(double residualVariance, double componentVariance) {
        if (componentVariance <= 0) {
            return 0.0;
        }
        return SeriesMath.clamp(1.0 - residualVariance / componentVariance, 0.0, 1.0);
    }
}
