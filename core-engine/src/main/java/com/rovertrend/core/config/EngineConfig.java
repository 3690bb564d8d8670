package com.rovertrend.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional):
 * </p>
 *
 * <pre>
 * analysis:
 *   enableArima: true
 *   maxPolynomialDegree: 3
 *   timeoutMillis: 5000
 * drift:
 *   method: PAGE_HINKLEY
 *   sensitivity: 0.5
 *   windowSize: 50
 * prediction:
 *   horizon: 10
 *   confidenceLevel: 0.95
 *   method: ENSEMBLE
 * </pre>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private AnalysisConfig analysis = new AnalysisConfig();
    private DriftDetectorConfig drift = new DriftDetectorConfig();
    private PredictionConfig prediction = new PredictionConfig();

    public AnalysisConfig getAnalysis() {
        return analysis;
    }

    /**
     * @param analysis section, defaults when {@code null}
     */
    public void setAnalysis(AnalysisConfig analysis) {
        this.analysis = analysis != null ? analysis : new AnalysisConfig();
    }

    public DriftDetectorConfig getDrift() {
        return drift;
    }

    public void setDrift(DriftDetectorConfig drift) {
        this.drift = drift != null ? drift : new DriftDetectorConfig();
    }

    public PredictionConfig getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionConfig prediction) {
        this.prediction = prediction != null ? prediction : new PredictionConfig();
    }

    /**
     * Validate every section, collecting all errors into one exception.
     *
     * @throws IllegalStateException if any section is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            analysis.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            drift.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            prediction.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{analysis=" + analysis + ", drift=" + drift + ", prediction=" + prediction + '}';
    }
}
