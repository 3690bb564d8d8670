package com.rovertrend.core.analysis;

import com.rovertrend.core.model.TelemetryStream;
import com.rovertrend.core.model.TimeSeriesValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Data quality checks run before a stream is analyzed.
 *
 * <ul>
 * <li>missing samples: {@code NaN} or infinite values</li>
 * <li>outliers: finite samples more than {@value #OUTLIER_SIGMA} standard
 * deviations from the mean of the finite samples</li>
 * <li>sampling regularity: mean and variance of the timestamp spacing</li>
 * </ul>
 *
 * <p>
 * Outliers are reported only. Missing samples are repaired by
 * {@link #interpolateMissing(double[])}.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesValidator.class);

    public static final double OUTLIER_SIGMA = 3.0;

    public TimeSeriesValidation validate(TelemetryStream stream) {
        Objects.requireNonNull(stream, "Stream must not be null");
        double[] data = stream.getData();

        int missing = 0;
        double sum = 0;
        for (double v : data) {
            if (Double.isFinite(v)) {
                sum += v;
            } else {
                missing++;
            }
        }
        int finite = data.length - missing;
        List<Integer> outliers = new ArrayList<>();
        if (finite > 1) {
            double mean = sum / finite;
            double ss = 0;
            for (double v : data) {
                if (Double.isFinite(v)) {
                    ss += (v - mean) * (v - mean);
                }
            }
            double std = Math.sqrt(ss / finite);
            if (std > 0) {
                for (int i = 0; i < data.length; i++) {
                    if (Double.isFinite(data[i]) && Math.abs(data[i] - mean) > OUTLIER_SIGMA * std) {
                        outliers.add(i);
                    }
                }
            }
        }

        List<Instant> timestamps = stream.getTimestamps();
        double meanInterval = 0;
        double intervalVariance = 0;
        if (timestamps.size() > 1) {
            double[] intervals = new double[timestamps.size() - 1];
            for (int i = 1; i < timestamps.size(); i++) {
                intervals[i - 1] = Duration.between(timestamps.get(i - 1), timestamps.get(i)).toNanos() / 1e6;
                meanInterval += intervals[i - 1];
            }
            meanInterval /= intervals.length;
            for (double interval : intervals) {
                intervalVariance += (interval - meanInterval) * (interval - meanInterval);
            }
            intervalVariance /= intervals.length;
        }

        if (missing > 0 || !outliers.isEmpty()) {
            LOG.debug("Stream '{}': {} missing value(s), {} outlier(s)", stream.getId(), missing, outliers.size());
        }
        return new TimeSeriesValidation(missing, outliers, meanInterval, intervalVariance);
    }

    /**
     * Replace non-finite samples by linear interpolation between the nearest
     * finite neighbours. Leading and trailing gaps take the nearest finite
     * value; a series with no finite value at all becomes zeros.
     *
     * @param data samples; not modified
     * @return a repaired copy
     */
    public static double[] interpolateMissing(double[] data) {
        Objects.requireNonNull(data, "Data must not be null");
        double[] out = data.clone();
        int n = out.length;
        int previous = -1;
        for (int i = 0; i <= n; i++) {
            if (i < n && !Double.isFinite(out[i])) {
                continue;
            }
            if (previous + 1 < i) {
                fillGap(out, previous, i < n ? i : -1, previous + 1, i);
            }
            previous = i;
        }
        return out;
    }

    private static void fillGap(double[] out, int left, int right, int from, int to) {
        for (int k = from; k < to; k++) {
            if (left >= 0 && right >= 0) {
                double fraction = (double) (k - left) / (right - left);
                out[k] = out[left] + fraction * (out[right] - out[left]);
            } else if (left >= 0) {
                out[k] = out[left];
            } else if (right >= 0) {
                out[k] = out[right];
            } else {
                out[k] = 0.0;
            }
        }
    }
}
