package com.rovertrend.core.drift;

/**
 * Size of a drift, graded by the standardized mean shift
 * {@code |excursionMean - referenceMean| / referenceStd}, where the excursion
 * is the run of samples since the detector last left {@code STABLE}.
 *
 * @since 1.0.0
 */
public enum DriftSeverity {
    /** Shift below one reference standard deviation. */
    LOW,
    /** Shift of one to three standard deviations. */
    MEDIUM,
    /** Shift of three standard deviations or more. */
    HIGH;

    public static DriftSeverity fromShift(double standardizedShift) {
        double shift = Math.abs(standardizedShift);
        if (!(shift < 3.0)) {
            return HIGH;
        }
        return shift < 1.0 ? LOW : MEDIUM;
    }
}
