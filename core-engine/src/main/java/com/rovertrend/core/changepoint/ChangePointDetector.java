package com.rovertrend.core.changepoint;

import com.rovertrend.core.model.ChangeDirection;
import com.rovertrend.core.model.ChangePoint;
import com.rovertrend.core.model.ChangeType;
import com.rovertrend.core.model.TelemetryStream;
import com.rovertrend.core.util.SeriesMath;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds structural breaks with a windowed CUSUM scan.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>The first {@code w} samples of the current segment form the reference
 * (mean and standard deviation), with {@code w = max(minWindow, n/10)}.</li>
 * <li>Subsequent samples are standardized against the reference and fed to a
 * two-sided mean CUSUM (allowance {@value #ALLOWANCE}) and a one-sided
 * variance CUSUM on {@code z² - 2}. An alarm is raised when a sum crosses
 * {@code h = 5 + 10(1 - sensitivity)} ({@code 2h} for the variance sum).</li>
 * <li>After an alarm the scan reads {@code w} more samples, then places the
 * change at the split of the segment with the highest Gaussian likelihood
 * ratio, so a false alarm shortly before a real break still lands on the
 * break. While fewer than {@code w} samples follow the split, the scan keeps
 * reading and locates again.</li>
 * <li>The samples either side of the split are compared, at least {@code w}
 * on each side. A significant mean, variance or slope difference is reported
 * and a new segment starts at the change. Otherwise the alarm is discarded
 * and the reference widens to every sample of the segment seen so far.</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetector.class);

    public static final int DEFAULT_MIN_WINDOW = 20;

    static final double ALLOWANCE = 0.5;

    /** Shortest segment on either side of a candidate split. */
    static final int MIN_SEGMENT = 2;

    private static final double MIN_EFFECT = 1.0;
    private static final double MIN_T = 5.0;
    private static final double MIN_LOG_VARIANCE_Z = 4.0;
    private static final double MAX_VARIANCE_RATIO = 4.0;

    private final int minWindow;

    public ChangePointDetector() {
        this(DEFAULT_MIN_WINDOW);
    }

    /**
     * @param minWindow smallest reference window
     * @throws IllegalArgumentException if {@code minWindow < 3}
     */
    public ChangePointDetector(int minWindow) {
        if (minWindow < 3) {
            throw new IllegalArgumentException("Minimum window must be >= 3, got: " + minWindow);
        }
        this.minWindow = minWindow;
    }

    /**
     * Detect change points in a stream, stamping each with its sample instant.
     */
    public List<ChangePoint> detect(TelemetryStream stream, double sensitivity) {
        Objects.requireNonNull(stream, "Stream must not be null");
        return detect(stream.getData(), stream.getTimestamps(), sensitivity);
    }

    /**
     * Detect change points in a bare series; timestamps are {@code null}.
     *
     * @param series      values in time order
     * @param sensitivity in {@code (0, 1]}; higher finds smaller changes
     * @return change points in index order, empty if the series is too short
     * @throws IllegalArgumentException if {@code sensitivity} is out of range
     */
    public List<ChangePoint> detect(double[] series, double sensitivity) {
        return detect(series, null, sensitivity);
    }

    private List<ChangePoint> detect(double[] x, List<Instant> timestamps, double sensitivity) {
        Objects.requireNonNull(x, "Series must not be null");
        if (!(sensitivity > 0 && sensitivity <= 1)) {
            throw new IllegalArgumentException("Sensitivity must be in (0,1], got: " + sensitivity);
        }
        int w = Math.max(minWindow, x.length / 10);
        double h = 5.0 + 10.0 * (1.0 - sensitivity);

        List<ChangePoint> found = new ArrayList<>();
        int segmentStart = 0;
        while (segmentStart + 2 * w <= x.length) {
            int next = scanSegment(x, timestamps, segmentStart, w, h, found);
            if (next < 0) {
                break;
            }
            segmentStart = next;
        }
        return found;
    }

    /**
     * Scan one segment until a change is confirmed.
     *
     * @return index of the confirmed change, or {@code -1} if the series ended first
     */
    private static int scanSegment(double[] x, List<Instant> timestamps, int start, int w, double h,
            List<ChangePoint> found) {
        int n = x.length;
        double hVar = 2.0 * h;
        double mean = SeriesMath.mean(x, start, start + w);
        double sd = floorStd(SeriesMath.std(x, start, start + w), mean);

        double up = 0;
        double down = 0;
        double var = 0;
        int due = -1;
        double excess = 0;
        for (int t = start + w; t < n; t++) {
            double z = (x[t] - mean) / sd;
            up = Math.max(0, up + z - ALLOWANCE);
            down = Math.max(0, down - z - ALLOWANCE);
            var = Math.max(0, var + z * z - 2.0);

            if (due < 0 && (up > h || down > h || var > hVar)) {
                due = Math.min(n - 1, t + w - 1);
                excess = up > h || down > h ? (Math.max(up, down) - h) / h : (var - hVar) / hVar;
            }
            if (due < 0 || t < due) {
                continue;
            }

            int end = t + 1;
            int candidate = locate(x, start, end);
            if (candidate >= 0 && end - candidate < w && end < n) {
                // split too recent to judge, read on until w samples follow it
                due = candidate + w - 1;
                continue;
            }
            if (candidate >= 0) {
                double confidence = SeriesMath.clamp(0.5 + 0.5 * excess, 0.0, 1.0);
                ChangePoint point = classify(x, timestamps, start, candidate, end, w, confidence);
                if (point != null) {
                    LOG.debug("Change point at {}: {} {} (magnitude={})", candidate, point.getType(),
                            point.getDirection(), point.getMagnitude());
                    found.add(point);
                    return candidate;
                }
            }
            up = 0;
            down = 0;
            var = 0;
            due = -1;
            mean = SeriesMath.mean(x, start, end);
            sd = floorStd(SeriesMath.std(x, start, end), mean);
        }
        return -1;
    }

    /**
     * Split of {@code x[from..to)} maximizing the Gaussian likelihood of two
     * segments with their own mean and variance.
     *
     * @return the first index of the second segment, or {@code -1} if the range is too short
     */
    static int locate(double[] x, int from, int to) {
        int m = to - from;
        if (m < 2 * MIN_SEGMENT) {
            return -1;
        }
        double[] sum = new double[m + 1];
        double[] sumSq = new double[m + 1];
        for (int i = 0; i < m; i++) {
            sum[i + 1] = sum[i] + x[from + i];
            sumSq[i + 1] = sumSq[i] + x[from + i] * x[from + i];
        }
        double floor = Math.max(segmentVariance(sum, sumSq, 0, m) * 1e-9, Double.MIN_NORMAL);

        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int k = MIN_SEGMENT; k <= m - MIN_SEGMENT; k++) {
            double score = -k * Math.log(Math.max(segmentVariance(sum, sumSq, 0, k), floor))
                    - (m - k) * Math.log(Math.max(segmentVariance(sum, sumSq, k, m), floor));
            if (score > bestScore) {
                bestScore = score;
                best = k;
            }
        }
        return from + best;
    }

    private static double segmentVariance(double[] sum, double[] sumSq, int from, int to) {
        int count = to - from;
        double mu = (sum[to] - sum[from]) / count;
        return (sumSq[to] - sumSq[from]) / count - mu * mu;
    }

    /**
     * Compare the samples either side of {@code index}, looking at most
     * {@code 2w} back and {@code w} ahead but never past {@code end}.
     *
     * @return the change point, or {@code null} if either side holds fewer than
     *         {@code w} samples or nothing changed significantly
     */
    private static ChangePoint classify(double[] x, List<Instant> timestamps, int segmentStart, int index,
            int end, int w, double confidence) {
        int preFrom = Math.max(segmentStart, index - 2 * w);
        int postTo = Math.min(end, index + w);
        int n1 = index - preFrom;
        int n2 = postTo - index;
        if (n1 < w || n2 < w) {
            return null;
        }

        double m1 = SeriesMath.mean(x, preFrom, index);
        double m2 = SeriesMath.mean(x, index, postTo);
        double v1 = SeriesMath.variance(x, preFrom, index);
        double v2 = SeriesMath.variance(x, index, postTo);
        double scale = Math.max(1.0, Math.abs(m1));
        double pooled = floorStd(Math.sqrt((v1 + v2) / 2.0), scale);
        Instant timestamp = timestamps != null ? timestamps.get(index) : null;

        double delta = m2 - m1;
        double welch = Math.abs(delta) / Math.sqrt(Math.max(v1 / n1 + v2 / n2, pooled * pooled * 1e-12));
        if (Math.abs(delta) / pooled >= MIN_EFFECT && welch >= MIN_T) {
            return point(index, timestamp, ChangeType.MEAN, delta / pooled, confidence);
        }

        double floor = pooled * pooled * 1e-6;
        double ratio = Math.max(v2, floor) / Math.max(v1, floor);
        double logRatioZ = Math.abs(Math.log(ratio)) / Math.sqrt(2.0 / (n1 - 1) + 2.0 / (n2 - 1));
        if ((ratio > MAX_VARIANCE_RATIO || ratio < 1.0 / MAX_VARIANCE_RATIO) && logRatioZ >= MIN_LOG_VARIANCE_Z) {
            return point(index, timestamp, ChangeType.VARIANCE,
                    (Math.sqrt(v2) - Math.sqrt(v1)) / pooled, confidence);
        }

        SimpleRegression pre = segmentRegression(x, preFrom, index);
        SimpleRegression post = segmentRegression(x, index, postTo);
        double slopeDelta = post.getSlope() - pre.getSlope();
        double se = Math.sqrt(square(pre.getSlopeStdErr()) + square(post.getSlopeStdErr()));
        double effect = slopeDelta * w / pooled;
        boolean significant = se > 0 ? Math.abs(slopeDelta) / se >= MIN_T : slopeDelta != 0;
        if (Double.isFinite(effect) && Math.abs(effect) >= MIN_EFFECT && significant) {
            return point(index, timestamp, ChangeType.TREND, effect, confidence);
        }
        return null;
    }

    private static ChangePoint point(int index, Instant timestamp, ChangeType type, double magnitude,
            double confidence) {
        ChangeDirection direction = magnitude >= 0 ? ChangeDirection.INCREASE : ChangeDirection.DECREASE;
        return new ChangePoint(index, timestamp, type, magnitude, confidence, direction);
    }

    private static SimpleRegression segmentRegression(double[] x, int from, int to) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = from; i < to; i++) {
            regression.addData(i, x[i]);
        }
        return regression;
    }

    private static double floorStd(double sd, double level) {
        return Math.max(sd, 1e-9 * Math.max(1.0, Math.abs(level)));
    }

    private static double square(double v) {
        return Double.isFinite(v) ? v * v : 0.0;
    }
}
