package com.rovertrend.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Data-quality report produced before a series is analyzed.
 *
 * <p>
 * Missing values are non-finite samples; they are linearly interpolated
 * before analysis and their count is reported here. Outliers are samples more
 * than three standard deviations from the mean; they are reported only.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesValidation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int missingValues;
    private final List<Integer> outlierIndices;
    private final double meanIntervalMillis;
    private final double intervalVariance;

    public TimeSeriesValidation(int missingValues, List<Integer> outlierIndices,
            double meanIntervalMillis, double intervalVariance) {
        this.missingValues = missingValues;
        this.outlierIndices = Collections.unmodifiableList(new ArrayList<>(outlierIndices));
        this.meanIntervalMillis = meanIntervalMillis;
        this.intervalVariance = intervalVariance;
    }

    public int getMissingValues() {
        return missingValues;
    }

    public List<Integer> getOutlierIndices() {
        return outlierIndices;
    }

    /** @return mean spacing between consecutive timestamps, 0 for fewer than two samples */
    public double getMeanIntervalMillis() {
        return meanIntervalMillis;
    }

    public double getIntervalVariance() {
        return intervalVariance;
    }

    /** @return {@code true} if nothing had to be repaired or flagged */
    public boolean isClean() {
        return missingValues == 0 && outlierIndices.isEmpty();
    }

    @Override
    public String toString() {
        return "TimeSeriesValidation{" +
                "missingValues=" + missingValues +
                ", outliers=" + outlierIndices.size() +
                ", meanIntervalMillis=" + meanIntervalMillis +
                '}';
    }
}
