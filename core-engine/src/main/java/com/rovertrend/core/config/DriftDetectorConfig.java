package com.rovertrend.core.config;

import com.rovertrend.core.model.DriftMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Construction parameters of a drift detector.
 *
 * <p>
 * {@code sensitivity} runs from just above 0 (conservative, few alarms) to 1
 * (eager). Each method maps it onto its own threshold. {@code windowSize} is
 * the number of samples used to establish the reference baseline, at least
 * {@value #MIN_WINDOW_SIZE} so the baseline standard deviation is usable for
 * standardizing.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Smallest accepted baseline window. */
    public static final int MIN_WINDOW_SIZE = 10;

    private DriftMethod method = DriftMethod.CUSUM;
    private double sensitivity = 0.5;
    private int windowSize = 50;

    /** Re-baseline automatically after a drift is reported. */
    private boolean autoReset = true;

    public DriftDetectorConfig() {
    }

    public DriftDetectorConfig(DriftMethod method, double sensitivity, int windowSize) {
        this.method = method;
        this.sensitivity = sensitivity;
        this.windowSize = windowSize;
    }

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (method == null) {
            errors.add("'method' is required");
        }
        if (!(sensitivity > 0 && sensitivity <= 1)) {
            errors.add("'sensitivity' must be in (0,1], got " + sensitivity);
        }
        if (windowSize < MIN_WINDOW_SIZE) {
            errors.add("'windowSize' must be >= " + MIN_WINDOW_SIZE + ", got " + windowSize);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid drift detector config: " + String.join("; ", errors));
        }
    }

    public DriftMethod getMethod() {
        return method;
    }

    public void setMethod(DriftMethod method) {
        this.method = method;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public boolean isAutoReset() {
        return autoReset;
    }

    public void setAutoReset(boolean autoReset) {
        this.autoReset = autoReset;
    }

    /**
     * @return an independent copy
     */
    public DriftDetectorConfig copy() {
        DriftDetectorConfig copy = new DriftDetectorConfig(method, sensitivity, windowSize);
        copy.setAutoReset(autoReset);
        return copy;
    }

    @Override
    public String toString() {
        return "DriftDetectorConfig{" +
                "method=" + method +
                ", sensitivity=" + sensitivity +
                ", windowSize=" + windowSize +
                ", autoReset=" + autoReset +
                '}';
    }
}
