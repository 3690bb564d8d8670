package com.rovertrend.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Switches and tuning for a batch stream analysis.
 *
 * <p>
 * Every sub-analysis can be toggled independently. Disabled sub-analyses
 * leave their slot in the composite result empty.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Feature switches ---
    private boolean enableArima = true;
    private boolean enableNonLinear = true;
    private boolean enableDriftDetection = true;
    private boolean enableChangePoints = true;
    private boolean enableSeasonal = true;
    private boolean enablePrediction = true;

    // --- Trend fitting ---
    /** Highest polynomial degree tried by the non-linear fitter. */
    private int maxPolynomialDegree = 3;

    /** R² difference within which a simpler model is preferred. */
    private double parsimonyTolerance = 0.01;

    // --- ARIMA ---
    private int maxArimaP = 3;
    private int maxArimaQ = 3;
    private int maxDifferencing = 2;

    // --- Stationarity ---
    private double significanceLevel = 0.05;

    // --- Change points ---
    private double changePointSensitivity = 0.5;

    /** Minimum reference window; grows to a tenth of the series. */
    private int changePointWindow = 20;

    // --- Seasonality ---
    /** Minimum autocorrelation for a period to count as seasonal. */
    private double seasonalThreshold = 0.3;

    // --- Execution ---
    /** Wall-clock budget per analysis in millis; 0 disables the deadline. */
    private long timeoutMillis = 0;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (maxPolynomialDegree < 2) {
            errors.add("'maxPolynomialDegree' must be >= 2, got " + maxPolynomialDegree);
        }
        if (parsimonyTolerance < 0 || parsimonyTolerance >= 1) {
            errors.add("'parsimonyTolerance' must be in [0,1), got " + parsimonyTolerance);
        }
        if (maxArimaP < 0 || maxArimaQ < 0) {
            errors.add("'maxArimaP' and 'maxArimaQ' must be >= 0");
        }
        if (maxDifferencing < 0 || maxDifferencing > 2) {
            errors.add("'maxDifferencing' must be in [0,2], got " + maxDifferencing);
        }
        if (significanceLevel <= 0 || significanceLevel >= 1) {
            errors.add("'significanceLevel' must be in (0,1), got " + significanceLevel);
        }
        if (changePointSensitivity <= 0 || changePointSensitivity > 1) {
            errors.add("'changePointSensitivity' must be in (0,1], got " + changePointSensitivity);
        }
        if (changePointWindow < 3) {
            errors.add("'changePointWindow' must be >= 3, got " + changePointWindow);
        }
        if (seasonalThreshold <= 0 || seasonalThreshold >= 1) {
            errors.add("'seasonalThreshold' must be in (0,1), got " + seasonalThreshold);
        }
        if (timeoutMillis < 0) {
            errors.add("'timeoutMillis' must be >= 0, got " + timeoutMillis);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid analysis config: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnableArima() {
        return enableArima;
    }

    public void setEnableArima(boolean enableArima) {
        this.enableArima = enableArima;
    }

    public boolean isEnableNonLinear() {
        return enableNonLinear;
    }

    public void setEnableNonLinear(boolean enableNonLinear) {
        this.enableNonLinear = enableNonLinear;
    }

    public boolean isEnableDriftDetection() {
        return enableDriftDetection;
    }

    public void setEnableDriftDetection(boolean enableDriftDetection) {
        this.enableDriftDetection = enableDriftDetection;
    }

    public boolean isEnableChangePoints() {
        return enableChangePoints;
    }

    public void setEnableChangePoints(boolean enableChangePoints) {
        this.enableChangePoints = enableChangePoints;
    }

    public boolean isEnableSeasonal() {
        return enableSeasonal;
    }

    public void setEnableSeasonal(boolean enableSeasonal) {
        this.enableSeasonal = enableSeasonal;
    }

    public boolean isEnablePrediction() {
        return enablePrediction;
    }

    public void setEnablePrediction(boolean enablePrediction) {
        this.enablePrediction = enablePrediction;
    }

    public int getMaxPolynomialDegree() {
        return maxPolynomialDegree;
    }

    public void setMaxPolynomialDegree(int maxPolynomialDegree) {
        this.maxPolynomialDegree = maxPolynomialDegree;
    }

    public double getParsimonyTolerance() {
        return parsimonyTolerance;
    }

    public void setParsimonyTolerance(double parsimonyTolerance) {
        this.parsimonyTolerance = parsimonyTolerance;
    }

    public int getMaxArimaP() {
        return maxArimaP;
    }

    public void setMaxArimaP(int maxArimaP) {
        this.maxArimaP = maxArimaP;
    }

    public int getMaxArimaQ() {
        return maxArimaQ;
    }

    public void setMaxArimaQ(int maxArimaQ) {
        this.maxArimaQ = maxArimaQ;
    }

    public int getMaxDifferencing() {
        return maxDifferencing;
    }

    public void setMaxDifferencing(int maxDifferencing) {
        this.maxDifferencing = maxDifferencing;
    }

    public double getSignificanceLevel() {
        return significanceLevel;
    }

    public void setSignificanceLevel(double significanceLevel) {
        this.significanceLevel = significanceLevel;
    }

    public double getChangePointSensitivity() {
        return changePointSensitivity;
    }

    public void setChangePointSensitivity(double changePointSensitivity) {
        this.changePointSensitivity = changePointSensitivity;
    }

    public int getChangePointWindow() {
        return changePointWindow;
    }

    public void setChangePointWindow(int changePointWindow) {
        this.changePointWindow = changePointWindow;
    }

    public double getSeasonalThreshold() {
        return seasonalThreshold;
    }

    public void setSeasonalThreshold(double seasonalThreshold) {
        this.seasonalThreshold = seasonalThreshold;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "arima=" + enableArima +
                ", nonLinear=" + enableNonLinear +
                ", drift=" + enableDriftDetection +
                ", changePoints=" + enableChangePoints +
                ", seasonal=" + enableSeasonal +
                ", prediction=" + enablePrediction +
                ", timeoutMillis=" + timeoutMillis +
                '}';
    }
}
